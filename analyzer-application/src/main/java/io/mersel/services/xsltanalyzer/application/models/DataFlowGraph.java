package io.mersel.services.xsltanalyzer.application.models;

import java.util.List;

/**
 * Şablon kapsamlı, kaba veri akışı grafiği.
 * <p>
 * Düğümler yoğun bir listede tutulur; kenarlar indeks çiftleridir.
 *
 * @param nodes Düğümler (indeks = kimlik)
 * @param edges Yönlü kenarlar
 */
public record DataFlowGraph(
        List<DataFlowNode> nodes,
        List<GraphEdge> edges
) {

    public DataFlowGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public List<Integer> successorsOf(int nodeId) {
        return edges.stream().filter(e -> e.from() == nodeId).map(GraphEdge::to).toList();
    }

    public List<Integer> predecessorsOf(int nodeId) {
        return edges.stream().filter(e -> e.to() == nodeId).map(GraphEdge::from).toList();
    }
}
