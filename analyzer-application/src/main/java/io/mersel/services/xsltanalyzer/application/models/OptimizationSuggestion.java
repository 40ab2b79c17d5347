package io.mersel.services.xsltanalyzer.application.models;

import java.util.List;

/**
 * Optimizasyon önerisi.
 */
public record OptimizationSuggestion(
        String optimizationType,
        String description,
        List<String> affectedTemplates,
        String impact
) {
}
