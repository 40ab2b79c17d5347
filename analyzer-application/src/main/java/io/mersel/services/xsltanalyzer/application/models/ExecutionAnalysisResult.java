package io.mersel.services.xsltanalyzer.application.models;

import java.util.List;

/**
 * Yürütme yolu analizi aşamasının çıktısı.
 */
public record ExecutionAnalysisResult(
        ExecutionGraph executionGraph,
        List<ExecutionPath> executionPaths,
        List<String> entryPoints,
        CoverageReport coverageAnalysis,
        PathStatistics pathStatistics,
        List<TestScenario> testScenarios
) {
}
