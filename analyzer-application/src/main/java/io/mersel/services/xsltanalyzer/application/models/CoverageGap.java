package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

import java.util.List;

/**
 * Kapsama boşluğu: hiç yürütülmeyen şablonlar veya hiç test edilmeyen koşullar.
 */
public record CoverageGap(
        String gapType,
        String description,
        List<String> affectedElements,
        PriorityLevel impact
) {
}
