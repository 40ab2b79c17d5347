package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PatternType;
import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

import java.util.List;

/**
 * Kalıp başına düzleştirilmiş test çıkarımı.
 */
public record TestImplication(
        PatternType patternType,
        List<String> templates,
        String testRequirement,
        PriorityLevel priority
) {
}
