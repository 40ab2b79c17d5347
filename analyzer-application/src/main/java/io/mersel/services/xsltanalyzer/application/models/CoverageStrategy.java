package io.mersel.services.xsltanalyzer.application.models;

import java.util.List;
import java.util.Map;

/**
 * Önerilen kapsama hedefleri (yüzde) ve öncelik sırası.
 */
public record CoverageStrategy(
        Map<String, Integer> coverageTargets,
        List<String> coveragePriorities
) {
}
