package com.nexflow.nexflow_compiler.mapping;

import com.nexflow.nexflow_compiler.config.ConverterProperties;
import com.nexflow.nexflow_compiler.model.domain.FieldContract;
import com.nexflow.nexflow_compiler.model.domain.FieldSpec;
import com.nexflow.nexflow_compiler.model.domain.FieldType;
import com.nexflow.nexflow_compiler.model.domain.FlowGraph;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.model.domain.NodeCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.nexflow.nexflow_compiler.model.domain.NodeCategory.*;

/**
 * Resolves each node's declared type to a {@link NodeCategory} and computes its
 * effective field contract. Never fails: unrecognised types become Custom with a warning.
 *
 * Resolution order:
 *   1. synonym table (separators and case ignored)
 *   2. known fully-qualified class paths
 *   3. keyword inference on the last path segment
 *   4. Custom
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategoryMapper {

    private static final Map<String, NodeCategory> SYNONYMS = new LinkedHashMap<>();
    private static final Map<String, NodeCategory> CLASS_PATHS = new LinkedHashMap<>();
    private static final Map<NodeCategory, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        for (NodeCategory category : NodeCategory.values()) {
            SYNONYMS.put(normalize(category.displayName()), category);
            SYNONYMS.put(normalize(category.name()), category);
        }
        SYNONYMS.put("chat", CHAT_MODEL);
        SYNONYMS.put("chatopenai", CHAT_MODEL);
        SYNONYMS.put("languagemodel", LLM);
        SYNONYMS.put("openai", LLM);
        SYNONYMS.put("ai", LLM);
        SYNONYMS.put("prompttemplate", PROMPT);
        SYNONYMS.put("llmchain", CHAIN);
        SYNONYMS.put("retrievalqa", CHAIN);
        SYNONYMS.put("agentexecutor", AGENT);
        SYNONYMS.put("conversationbuffermemory", MEMORY);
        SYNONYMS.put("vectordb", VECTOR_STORE);
        SYNONYMS.put("embeddings", EMBEDDING);
        SYNONYMS.put("documentloader", DOCUMENT);
        SYNONYMS.put("loader", DOCUMENT);
        SYNONYMS.put("splitter", TEXT_SPLITTER);
        SYNONYMS.put("parser", OUTPUT_PARSER);
        SYNONYMS.put("decision", ROUTER);
        SYNONYMS.put("conditionalrouter", ROUTER);
        SYNONYMS.put("switch", ROUTER);
        SYNONYMS.put("pythonfunction", UTILITY);
        SYNONYMS.put("customcomponent", CUSTOM);
        SYNONYMS.put("chatinput", CUSTOM);
        SYNONYMS.put("chatoutput", CUSTOM);
        SYNONYMS.put("textinput", CUSTOM);
        SYNONYMS.put("textoutput", CUSTOM);

        CLASS_PATHS.put("langflow.interface.llms.chatmodels", CHAT_MODEL);
        CLASS_PATHS.put("langflow.interface.llms", LLM);
        CLASS_PATHS.put("langchain.chat_models", CHAT_MODEL);
        CLASS_PATHS.put("langchain.llms", LLM);
        CLASS_PATHS.put("langchain.chains.router", ROUTER);
        CLASS_PATHS.put("langchain.chains", CHAIN);
        CLASS_PATHS.put("langflow.interface.chains", CHAIN);
        CLASS_PATHS.put("langchain.agents", AGENT);
        CLASS_PATHS.put("langflow.interface.agents", AGENT);
        CLASS_PATHS.put("langchain.tools", TOOL);
        CLASS_PATHS.put("langflow.interface.tools", TOOL);
        CLASS_PATHS.put("langchain.memory", MEMORY);
        CLASS_PATHS.put("langchain.prompts", PROMPT);
        CLASS_PATHS.put("langchain.retrievers.document_compressors", DOCUMENT_TRANSFORMER);
        CLASS_PATHS.put("langchain.retrievers", RETRIEVER);
        CLASS_PATHS.put("langchain.vectorstores", VECTOR_STORE);
        CLASS_PATHS.put("langchain.embeddings", EMBEDDING);
        CLASS_PATHS.put("langchain.document_loaders", DOCUMENT);
        CLASS_PATHS.put("langchain.text_splitter", TEXT_SPLITTER);
        CLASS_PATHS.put("langchain.output_parsers", OUTPUT_PARSER);
        CLASS_PATHS.put("langchain.document_transformers", DOCUMENT_TRANSFORMER);
        CLASS_PATHS.put("langchain.utilities", UTILITY);

        // Order matters: "chatopenai" must hit ChatModel before "openai" hits LLM
        KEYWORDS.put(CHAT_MODEL, List.of("chatmodel", "chatgpt", "chatopenai", "chatvertexai", "chatanthropic",
                "chatcohere", "chatollama", "chatpalm"));
        KEYWORDS.put(LLM, List.of("llm", "openai", "anthropic", "cohere", "huggingface", "vertexai", "palm",
                "ollama", "bedrock"));
        KEYWORDS.put(OUTPUT_PARSER, List.of("parser", "jsonoutput", "pydanticoutput", "structuredoutput"));
        KEYWORDS.put(ROUTER, List.of("router", "multiprompt"));
        KEYWORDS.put(DOCUMENT_TRANSFORMER, List.of("documentcompressor", "embeddingsfilter", "embeddingsredundant",
                "llmchainfilter", "transformer"));
        KEYWORDS.put(CHAIN, List.of("chain"));
        KEYWORDS.put(AGENT, List.of("agent", "executor"));
        KEYWORDS.put(TOOL, List.of("tool"));
        KEYWORDS.put(MEMORY, List.of("memory", "chatmessagehistory"));
        KEYWORDS.put(PROMPT, List.of("prompt", "template", "exampleselector"));
        KEYWORDS.put(RETRIEVER, List.of("retriever", "contextualcompression", "multiquery", "selfquery",
                "timeweighted", "webresearch", "ensemble", "parentdocument"));
        KEYWORDS.put(VECTOR_STORE, List.of("vectorstore", "faiss", "chroma", "pinecone", "qdrant", "redis",
                "weaviate", "milvus", "elasticsearch", "pgvector", "supabase", "mongodb"));
        KEYWORDS.put(EMBEDDING, List.of("embedding", "sentencetransformer"));
        KEYWORDS.put(DOCUMENT, List.of("document", "loader"));
        KEYWORDS.put(TEXT_SPLITTER, List.of("splitter"));
        KEYWORDS.put(UTILITY, List.of("python", "function", "apiwrapper", "serpapi", "wikipedia", "tavily",
                "googlesearch", "bingsearch", "searx", "arxiv", "openweathermap", "sqldatabase", "wolframalpha",
                "zapier", "graphql"));
    }

    private final CustomCodeInspector codeInspector;
    private final ConverterProperties properties;

    // ── Public API ────────────────────────────────────────────────────────────

    public FlowGraph mapAll(FlowGraph graph) {
        FlowGraph mapped = graph.withNodes(this::map);
        long fallbacks = mapped.getNodes().stream().filter(n -> n.getMappingWarning() != null).count();
        log.debug("Mapped {} nodes of flow '{}' ({} fell back to Custom)", mapped.nodeCount(), graph.getName(), fallbacks);
        return mapped;
    }

    public FlowNode map(FlowNode node) {
        String declared = node.getDeclaredType();
        NodeCategory category;
        String warning = null;

        if (declared == null || declared.isBlank()) {
            category = CUSTOM;
        } else {
            Optional<NodeCategory> recognised = recognise(declared);
            if (recognised.isPresent()) {
                category = recognised.get();
            } else {
                category = CUSTOM;
                warning = "Unknown node type '" + declared + "' on node '" + node.getId() + "'; treated as Custom";
                log.warn(warning);
            }
        }

        return node.toBuilder()
                .category(category)
                .contract(effectiveContract(node, category))
                .mappingWarning(warning)
                .build();
    }

    /** Category for a declared type name, empty when nothing in the tables matches. */
    public Optional<NodeCategory> recognise(String declaredType) {
        if (declaredType == null || declaredType.isBlank()) return Optional.empty();
        String trimmed = declaredType.trim();

        NodeCategory synonym = SYNONYMS.get(normalize(trimmed));
        if (synonym != null) return Optional.of(synonym);

        String lowerPath = trimmed.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, NodeCategory> entry : CLASS_PATHS.entrySet()) {
            if (lowerPath.startsWith(entry.getKey() + ".")) return Optional.of(entry.getValue());
        }

        String className = normalize(trimmed.substring(trimmed.lastIndexOf('.') + 1));
        NodeCategory bySegment = SYNONYMS.get(className);
        if (bySegment != null) return Optional.of(bySegment);

        for (Map.Entry<NodeCategory, List<String>> entry : KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(className::contains)) return Optional.of(entry.getKey());
        }
        return Optional.empty();
    }

    // ── Contracts ─────────────────────────────────────────────────────────────

    private FieldContract effectiveContract(FlowNode node, NodeCategory category) {
        FieldContract contract = category.contract().plus(node.getDeclaredInputs(), node.getDeclaredOutputs());
        if (category.isRouter()) {
            String routeField = properties.routeFieldOf(node);
            contract = contract.plus(List.of(), List.of(FieldSpec.of(routeField, FieldType.TEXT)));
        }
        if (node.hasCustomCode()) {
            contract = contract.plus(codeInspector.inspect(node.configString("code")));
        }
        return contract;
    }

    static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[_\\-\\s.]", "");
    }
}
