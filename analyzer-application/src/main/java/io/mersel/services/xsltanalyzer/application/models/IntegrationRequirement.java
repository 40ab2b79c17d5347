package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

import java.util.List;

/**
 * Çapraz dosya bağımlılığı için entegrasyon testi gereksinimi.
 */
public record IntegrationRequirement(
        String requirementType,
        String description,
        List<String> involvedFiles,
        PriorityLevel complexity,
        List<String> testScenarios
) {
}
