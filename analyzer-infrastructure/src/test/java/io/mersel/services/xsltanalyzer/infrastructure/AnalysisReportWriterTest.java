package io.mersel.services.xsltanalyzer.infrastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AnalysisReportWriter birim testleri.
 */
@DisplayName("AnalysisReportWriter")
class AnalysisReportWriterTest {

    record SampleReport(String filePath, int totalTemplates, Instant analyzedAt, List<String> keyFindings) {
    }

    private final AnalysisReportWriter writer = new AnalysisReportWriter();

    private static SampleReport sample() {
        return new SampleReport("fatura.xslt", 3, Instant.parse("2024-05-01T10:15:30Z"), List.of("bulgu"));
    }

    @Test
    @DisplayName("Alan adları snake_case ve tarih ISO-8601 olmalı")
    void shouldSerializeSnakeCaseWithIsoDates() {
        String json = writer.toJson(sample());

        assertThat(json)
                .contains("\"file_path\" : \"fatura.xslt\"")
                .contains("\"total_templates\" : 3")
                .contains("\"analyzed_at\" : \"2024-05-01T10:15:30Z\"")
                .contains("\"key_findings\"");
    }

    @Test
    @DisplayName("Rapor eksik üst dizinler oluşturularak yazılmalı")
    void shouldWriteReportCreatingParents(@TempDir Path tempDir) throws IOException {
        Path target = tempDir.resolve("raporlar/2024/fatura.json");

        writer.write(sample(), target);

        assertThat(target).exists();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).contains("\"file_path\"");
    }
}
