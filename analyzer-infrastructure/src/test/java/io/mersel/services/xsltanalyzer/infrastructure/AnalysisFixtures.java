package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.interfaces.ISemanticAnalyzer;
import io.mersel.services.xsltanalyzer.infrastructure.config.AnalysisProperties;
import io.mersel.services.xsltanalyzer.infrastructure.diagnostics.AnalysisMetrics;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Testler için gerçek bileşenlerle kurulmuş koordinatör.
 */
final class AnalysisFixtures {

    private AnalysisFixtures() {
    }

    static AnalysisCoordinator coordinator(AnalysisProperties properties, MeterRegistry registry) {
        return coordinator(properties, registry, new SemanticAnalyzer());
    }

    static AnalysisCoordinator coordinator(AnalysisProperties properties, MeterRegistry registry,
                                           ISemanticAnalyzer semanticAnalyzer) {
        var metrics = new AnalysisMetrics(registry);
        var store = new InMemoryAnalysisResultStore(properties, metrics);
        store.init();
        return new AnalysisCoordinator(
                new XsltTemplateParser(),
                semanticAnalyzer,
                new ExecutionPathAnalyzer(),
                store,
                new RecommendationEngine(),
                new CrossFileAnalyzer(),
                new SaxonStylesheetVerifier(),
                new AnalysisReportWriter(),
                properties,
                metrics);
    }

    static AnalysisProperties properties() {
        var properties = new AnalysisProperties();
        properties.setVerifyCompilation(false);
        return properties;
    }
}
