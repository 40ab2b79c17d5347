package io.mersel.services.xsltanalyzer.application.models;

/**
 * Toplu analizde başarılı dosyalar üzerinden toplanmış istatistikler.
 *
 * @param analysisCompletionRate Başarılı dosya / toplam dosya × 100
 */
public record AggregatedStatistics(
        int totalTemplates,
        int totalComplexityScore,
        int totalSemanticPatterns,
        int totalExecutionPaths,
        double averageComplexityPerFile,
        double analysisCompletionRate
) {
}
