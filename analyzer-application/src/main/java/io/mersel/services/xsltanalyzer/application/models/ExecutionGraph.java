package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.ExecutionNodeType;

import java.util.List;
import java.util.Optional;

/**
 * Analiz çalıştırması başına bir kez kurulan yürütme grafiği.
 * <p>
 * Düğümler yoğun bir listede tutulur; {@code nodes().get(i).id() == i}.
 */
public record ExecutionGraph(List<ExecutionNode> nodes) {

    public ExecutionGraph {
        nodes = List.copyOf(nodes);
    }

    public ExecutionNode node(int id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    /** Şablonun {@code template_start} düğümü. */
    public Optional<ExecutionNode> startNodeOf(String templateKey) {
        return nodes.stream()
                .filter(n -> n.nodeType() == ExecutionNodeType.TEMPLATE_START)
                .filter(n -> n.templateKey().equals(templateKey))
                .findFirst();
    }
}
