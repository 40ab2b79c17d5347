package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

import java.util.List;

/**
 * Test üretimine yönelik öneriler.
 *
 * @param testPrioritization      Skora göre azalan sırada önceliklendirilmiş şablonlar
 * @param riskAssessment          Risk kayıtları
 * @param optimizationSuggestions Optimizasyon önerileri
 * @param coverageStrategy        Kapsama stratejisi
 * @param testGenerationPriority  Tek genel test üretim önceliği
 */
public record AnalysisRecommendations(
        List<TestPrioritization> testPrioritization,
        List<RiskAssessment> riskAssessment,
        List<OptimizationSuggestion> optimizationSuggestions,
        CoverageStrategy coverageStrategy,
        PriorityLevel testGenerationPriority
) {
}
