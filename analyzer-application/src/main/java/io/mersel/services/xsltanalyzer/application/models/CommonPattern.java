package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PatternType;
import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

/**
 * Birden fazla dosyada görülen kalıp türü.
 */
public record CommonPattern(
        PatternType patternType,
        int occurrences,
        PriorityLevel commonality
) {
}
