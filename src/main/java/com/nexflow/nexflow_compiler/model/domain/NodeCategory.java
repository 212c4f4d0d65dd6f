package com.nexflow.nexflow_compiler.model.domain;

import java.util.List;

import static com.nexflow.nexflow_compiler.model.domain.FieldType.LIST;
import static com.nexflow.nexflow_compiler.model.domain.FieldType.LIST_OF_TEXT;
import static com.nexflow.nexflow_compiler.model.domain.FieldType.MAPPING;
import static com.nexflow.nexflow_compiler.model.domain.FieldType.TEXT;

/**
 * Fixed semantic categories a flow node resolves to. Each category owns the state
 * fields its generated function reads and writes.
 */
public enum NodeCategory {
    LLM("LLM",
        reads(f("input", TEXT), f("prompt", TEXT)),
        writes(f("llm_response", TEXT))),
    CHAT_MODEL("ChatModel",
        reads(f("input", TEXT), f("messages", LIST)),
        writes(f("chat_response", TEXT))),
    CHAIN("Chain",
        reads(f("input", TEXT)),
        writes(f("chain_result", TEXT))),
    AGENT("Agent",
        reads(f("input", TEXT), f("tools", LIST)),
        writes(f("agent_result", TEXT), f("intermediate_steps", LIST))),
    TOOL("Tool",
        reads(f("input", TEXT)),
        writes(f("tool_result", TEXT))),
    MEMORY("Memory",
        reads(f("input", TEXT), f("llm_response", TEXT)),
        writes(f("history", LIST), f("chat_history", LIST))),
    PROMPT("Prompt",
        reads(f("input", TEXT)),
        writes(f("prompt", TEXT))),
    RETRIEVER("Retriever",
        reads(f("input", TEXT), f("query", TEXT)),
        writes(f("documents", LIST))),
    VECTOR_STORE("VectorStore",
        reads(f("input", TEXT), f("query", TEXT)),
        writes(f("search_results", LIST), f("documents", LIST))),
    EMBEDDING("Embedding",
        reads(f("input", TEXT)),
        writes(f("embeddings", LIST))),
    DOCUMENT("Document",
        reads(f("file_path", TEXT)),
        writes(f("document_content", TEXT), f("documents", LIST))),
    TEXT_SPLITTER("TextSplitter",
        reads(f("input", TEXT)),
        writes(f("chunks", LIST_OF_TEXT))),
    UTILITY("Utility",
        reads(f("input", TEXT)),
        writes(f("processed_input", TEXT), f("result", TEXT))),
    CUSTOM("Custom",
        reads(f("input", TEXT)),
        writes(f("output", TEXT))),
    OUTPUT_PARSER("OutputParser",
        reads(f("input", TEXT)),
        writes(f("parsed_output", MAPPING), f("format_instructions", TEXT))),
    ROUTER("Router",
        reads(f("input", TEXT)),
        writes(f("route", TEXT), f("destination", TEXT))),
    DOCUMENT_TRANSFORMER("DocumentTransformer",
        reads(f("documents", LIST)),
        writes(f("transformed_documents", LIST)));

    private final String displayName;
    private final FieldContract contract;

    NodeCategory(String displayName, List<FieldSpec> reads, List<FieldSpec> writes) {
        this.displayName = displayName;
        this.contract = FieldContract.of(reads, writes);
    }

    public String displayName() {
        return displayName;
    }

    public FieldContract contract() {
        return contract;
    }

    /** Router outputs are routed conditionally rather than followed unconditionally. */
    public boolean isRouter() {
        return this == ROUTER;
    }

    private static FieldSpec f(String name, FieldType type) {
        return FieldSpec.of(name, type);
    }

    private static List<FieldSpec> reads(FieldSpec... specs) {
        return List.of(specs);
    }

    private static List<FieldSpec> writes(FieldSpec... specs) {
        return List.of(specs);
    }
}
