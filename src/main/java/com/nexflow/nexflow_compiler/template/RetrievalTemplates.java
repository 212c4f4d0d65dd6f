package com.nexflow.nexflow_compiler.template;

import com.nexflow.nexflow_compiler.generator.CodeWriter;
import com.nexflow.nexflow_compiler.generator.PythonLiterals;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.model.domain.NodeCategory;
import org.springframework.stereotype.Component;

// Document loading, splitting, embedding and search. Results are stand-ins shaped like the real ones.

@Component
class DocumentTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.DOCUMENT; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        header(node, out, null);
        out.line("file_path = state.get(\"file_path\", %s)", PythonLiterals.quote(node.configString("file_path", "")));
        out.line("state[\"document_content\"] = f\"Content loaded from {file_path}\"");
        out.line("state[\"documents\"] = [{\"content\": state[\"document_content\"], \"metadata\": {\"source\": file_path}}]");
    }
}

@Component
class TextSplitterTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.TEXT_SPLITTER; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        String chunkSize = number(node, "chunk_size", "1000");
        header(node, out, "chunk size " + chunkSize);
        out.line("text = str(state.get(\"input\", \"\"))");
        out.line("chunk_size = int(%s)", chunkSize);
        out.line("state[\"chunks\"] = [text[i:i + chunk_size] for i in range(0, len(text), chunk_size)]");
    }
}

@Component
class EmbeddingTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.EMBEDDING; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        header(node, out, null);
        out.open("if \"input\" in state:");
        out.line("state[\"embeddings\"] = [[0.1, 0.2, 0.3]]");
        out.dedent();
    }
}

abstract class SearchTemplate extends BaseNodeTemplate {

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        String k = number(node, "k", "2");
        header(node, out, "top " + k);
        out.line("query = state.get(\"query\") or state.get(\"input\", \"\")");
        out.line("results = [{\"content\": f\"Result {i + 1} for {query}\", \"metadata\": {}} for i in range(int(%s))]", k);
        writeResults(out);
    }

    protected abstract void writeResults(CodeWriter out);
}

@Component
class RetrieverTemplate extends SearchTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.RETRIEVER; }

    @Override
    protected void writeResults(CodeWriter out) {
        out.line("state[\"documents\"] = results");
    }
}

@Component
class VectorStoreTemplate extends SearchTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.VECTOR_STORE; }

    @Override
    protected void writeResults(CodeWriter out) {
        out.line("state[\"search_results\"] = results");
        out.line("state[\"documents\"] = results");
    }
}

@Component
class DocumentTransformerTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.DOCUMENT_TRANSFORMER; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        header(node, out, null);
        out.line("transformer = %s", PythonLiterals.quote(typeName(node)));
        out.line("transformed = []");
        out.open("for doc in state.get(\"documents\") or []:");
        out.line("content = doc.get(\"content\", \"\") if isinstance(doc, dict) else str(doc)");
        out.line("transformed.append({\"content\": f\"Transformed: {content}\", \"metadata\": {\"transformer\": transformer}})");
        out.dedent();
        out.line("state[\"transformed_documents\"] = transformed");
    }
}
