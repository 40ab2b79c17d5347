package io.mersel.services.xsltanalyzer.application.models;

import java.time.Instant;

/**
 * Toplu analiz özeti.
 */
public record BatchSummary(
        int totalFiles,
        int successfulAnalyses,
        int failedAnalyses,
        long durationMs,
        Instant analysisTimestamp
) {
}
