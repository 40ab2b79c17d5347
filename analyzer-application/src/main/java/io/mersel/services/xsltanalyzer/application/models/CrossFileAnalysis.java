package io.mersel.services.xsltanalyzer.application.models;

import java.util.List;

/**
 * Toplu analizde başarılı dosyalar üzerinden yapılan çapraz dosya analizi.
 */
public record CrossFileAnalysis(
        int totalTemplates,
        List<CrossFileDependency> crossFileDependencies,
        List<CommonPattern> commonPatterns,
        List<IntegrationRequirement> integrationTestRequirements
) {

    public static CrossFileAnalysis empty() {
        return new CrossFileAnalysis(0, List.of(), List.of(), List.of());
    }
}
