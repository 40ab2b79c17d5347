package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

import java.util.List;

/**
 * Şablon bazında test önceliklendirme önerisi.
 */
public record TestPrioritization(
        String templateName,
        PriorityLevel priority,
        int priorityScore,
        List<String> reasons
) {
}
