package io.mersel.services.xsltanalyzer.application.models;

/**
 * Yürütme yolu istatistikleri. Yol yoksa tüm sayılar sıfır, {@code mostComplexPath} {@code null}.
 */
public record PathStatistics(
        int totalPaths,
        double avgPathComplexity,
        int maxPathComplexity,
        double avgPathLength,
        int maxPathLength,
        double avgConditionsPerPath,
        int pathsWithConditions,
        String mostComplexPath,
        boolean truncated
) {
}
