package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

import java.util.List;

/**
 * Tek dosya analizinin birleşik özeti.
 *
 * @param parsingSummary         Ayrıştırma özeti
 * @param semanticSummary        Semantik analiz özeti
 * @param executionSummary       Yol istatistikleri
 * @param overallComplexity      {@code int(ortalama karmaşıklık × 10 + kalıp sayısı × 5)}
 * @param testGenerationPriority Genel test üretim önceliği
 * @param keyFindings            Öne çıkan bulgular
 */
public record AnalysisSummary(
        ParseSummary parsingSummary,
        SemanticSummary semanticSummary,
        PathStatistics executionSummary,
        int overallComplexity,
        PriorityLevel testGenerationPriority,
        List<String> keyFindings
) {
}
