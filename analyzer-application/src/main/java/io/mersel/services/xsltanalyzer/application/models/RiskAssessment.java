package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

import java.util.List;

/**
 * Dönüşüm riski kaydı ({@code high_complexity} veya {@code recursion}).
 */
public record RiskAssessment(
        String riskType,
        PriorityLevel severity,
        String description,
        List<String> affectedTemplates,
        String mitigation
) {
}
