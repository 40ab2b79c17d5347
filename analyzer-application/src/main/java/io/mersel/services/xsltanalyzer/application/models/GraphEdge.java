package io.mersel.services.xsltanalyzer.application.models;

/**
 * Düğüm indeksleri üzerinden yönlü kenar.
 */
public record GraphEdge(int from, int to) {
}
