package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;

/// Answers from the knowledge base using retrieval-augmented generation (`ia_rag`).
public record KnowledgeSearchPayload(String prompt) implements ActionPayload {

    @Override
    public NodeKind kind() {
        return NodeKind.IA_RAG;
    }
}
