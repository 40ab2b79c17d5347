package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.enums.AnalysisStage;
import io.mersel.services.xsltanalyzer.application.interfaces.AnalysisException;
import io.mersel.services.xsltanalyzer.application.interfaces.ISemanticAnalyzer;
import io.mersel.services.xsltanalyzer.application.models.AnalysisOptions;
import io.mersel.services.xsltanalyzer.application.models.AnalysisResult;
import io.mersel.services.xsltanalyzer.infrastructure.config.AnalysisProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * AnalysisCoordinator birim testleri.
 * <p>
 * Gerçek ayrıştırıcı ve analizörler ile uçtan uca çalışır; hata yolları için
 * semantik analizör Mockito ile değiştirilir.
 */
@DisplayName("AnalysisCoordinator")
class AnalysisCoordinatorTest {

    private static final String MALFORMED = """
            <xsl:stylesheet version="2.0" xmlns:xsl="http://www.w3.org/1999/XSL/Transform">
                <xsl:template name="a">
            </xsl:stylesheet>""";

    private SimpleMeterRegistry registry;
    private AnalysisProperties properties;
    private AnalysisCoordinator coordinator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = AnalysisFixtures.properties();
        coordinator = AnalysisFixtures.coordinator(properties, registry);
    }

    private double counter(String name, String tag, String value) {
        var counter = registry.find(name).tag(tag, value).counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("Tek dosya")
    class SingleFile {

        @Test
        @DisplayName("Üç aşama çalışmalı ve sonuç saklanmalı")
        void shouldRunAllStages() throws AnalysisException {
            AnalysisResult result = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, AnalysisOptions.defaults());

            assertThat(result.getFileId()).isEqualTo(AnalysisCoordinator.fileId("main.xslt")).hasSize(64);
            assertThat(result.getFilePath()).isEqualTo("main.xslt");
            assertThat(result.getContentHash()).hasSize(16);
            assertThat(result.getAnalysisId()).startsWith("analysis_" + result.getFileId() + "_");
            assertThat(result.getTemplates()).containsOnlyKeys("helperA", "mainB");
            assertThat(result.getExecutionAnalysis().entryPoints()).containsExactly("mainB");
            assertThat(result.getSummary().parsingSummary().totalTemplates()).isEqualTo(2);
            assertThat(result.getRecommendations().coverageStrategy().coverageTargets())
                    .containsEntry("template_coverage", 100);
            assertThat(result.getCompilationIssues()).isEmpty();

            assertThat(counter("xslt_analysis_total", "result", "success")).isEqualTo(1);
            assertThat(registry.find("xslt_analysis_stage_duration").tag("stage", "parse").timer()).isNotNull();
            assertThat(registry.find("xslt_analysis_stage_duration").tag("stage", "execution").timer()).isNotNull();
        }

        @Test
        @DisplayName("İçerik değişmediyse saklanan sonuç dönmeli")
        void shouldSkipUnchangedContent() throws AnalysisException {
            AnalysisResult first = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, AnalysisOptions.defaults());
            AnalysisResult second = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, AnalysisOptions.defaults());

            assertThat(second).isSameAs(first);
            assertThat(counter("xslt_analysis_total", "result", "skipped")).isEqualTo(1);
        }

        @Test
        @DisplayName("Yol sınırları değiştiyse aynı içerik yeniden analiz edilmeli")
        void shouldReanalyzeWhenPathLimitsChange() throws AnalysisException {
            AnalysisResult limited = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, new AnalysisOptions(1, null, false));
            AnalysisResult full = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, new AnalysisOptions(10_000, null, false));

            assertThat(limited.getExecutionAnalysis().executionPaths()).hasSize(1);
            assertThat(limited.getExecutionAnalysis().coverageAnalysis().truncated()).isTrue();
            assertThat(full).isNotSameAs(limited);
            assertThat(full.getExecutionAnalysis().executionPaths()).hasSize(2);
            assertThat(full.getExecutionAnalysis().coverageAnalysis().truncated()).isFalse();
            assertThat(full.getPathLimits().maxPaths()).isEqualTo(10_000);
            assertThat(counter("xslt_analysis_total", "result", "skipped")).isZero();
        }

        @Test
        @DisplayName("Zorla seçeneği veya değişen içerik yeniden analiz etmeli")
        void shouldReanalyzeWhenForcedOrChanged() throws AnalysisException {
            AnalysisResult first = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, AnalysisOptions.defaults());
            AnalysisResult forced = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, AnalysisOptions.forced());
            AnalysisResult changed = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.SELF_CALLING, AnalysisOptions.defaults());

            assertThat(forced).isNotSameAs(first);
            assertThat(changed.getTemplates()).containsOnlyKeys("loop");
            assertThat(counter("xslt_analysis_total", "result", "success")).isEqualTo(3);
        }

        @Test
        @DisplayName("İstek bazlı yol sınırı yapılandırmayı ezmeli")
        void shouldApplyRequestLimits() throws AnalysisException {
            AnalysisResult result = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, new AnalysisOptions(1, null, false));

            assertThat(result.getExecutionAnalysis().executionPaths()).hasSize(1);
            assertThat(result.getExecutionAnalysis().coverageAnalysis().truncated()).isTrue();
            assertThat(result.getSummary().keyFindings()).contains("Yol numaralandırma sınıra ulaştı, kapsama kısmidir");
            assertThat(registry.find("xslt_analysis_paths_truncated_total").counter().count()).isEqualTo(1);
        }

        @Test
        @DisplayName("Geçersiz yol sınırı reddedilmeli")
        void shouldRejectInvalidLimits() {
            assertThatThrownBy(() -> coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, new AnalysisOptions(0, null, false)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Dosyadan analiz dosya yolunu kimlik olarak kullanmalı")
        void shouldAnalyzeFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("loop.xslt");
            Files.writeString(file, XsltTemplateParserTest.SELF_CALLING, StandardCharsets.UTF_8);

            AnalysisResult result = coordinator.analyzeFile(file, AnalysisOptions.defaults());

            assertThat(result.getFilePath()).isEqualTo(file.toString());
            assertThat(result.getTemplates().get("loop").isRecursive()).isTrue();
        }
    }

    @Nested
    @DisplayName("Aşama hataları")
    class StageFailures {

        @Test
        @DisplayName("İyi biçimli olmayan XSLT ayrıştırma aşamasında başarısız olmalı")
        void shouldFailAtParseStage() {
            assertThatThrownBy(() -> coordinator.analyzeSource("broken.xslt", MALFORMED, AnalysisOptions.defaults()))
                    .isInstanceOf(AnalysisException.class)
                    .satisfies(e -> {
                        var ex = (AnalysisException) e;
                        assertThat(ex.getStage()).isEqualTo(AnalysisStage.PARSE);
                        assertThat(ex.getFilePath()).isEqualTo("broken.xslt");
                    });
            assertThat(counter("xslt_analysis_errors_total", "stage", "parse")).isEqualTo(1);
            assertThat(counter("xslt_analysis_total", "result", "failure")).isEqualTo(1);
        }

        @Test
        @DisplayName("Semantik analiz hatası aşama bilgisiyle raporlanmalı ve sonuç saklanmamalı")
        void shouldFailAtSemanticStage() {
            var failing = mock(ISemanticAnalyzer.class);
            when(failing.analyze(any(), any())).thenThrow(new IllegalStateException("beklenmeyen durum"));
            var failingCoordinator = AnalysisFixtures.coordinator(properties, registry, failing);

            assertThatThrownBy(() -> failingCoordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, AnalysisOptions.defaults()))
                    .isInstanceOf(AnalysisException.class)
                    .hasMessageContaining("beklenmeyen durum")
                    .satisfies(e -> assertThat(((AnalysisException) e).getStage()).isEqualTo(AnalysisStage.SEMANTIC));
            assertThat(counter("xslt_analysis_errors_total", "stage", "semantic")).isEqualTo(1);
        }

        @Test
        @DisplayName("Okunamayan dosya ayrıştırma aşaması hatası olmalı")
        void shouldFailForMissingFile(@TempDir Path dir) {
            assertThatThrownBy(() -> coordinator.analyzeFile(dir.resolve("yok.xslt"), AnalysisOptions.defaults()))
                    .isInstanceOf(AnalysisException.class)
                    .satisfies(e -> assertThat(((AnalysisException) e).getStage()).isEqualTo(AnalysisStage.PARSE));
        }
    }

    @Nested
    @DisplayName("Derleme kontrolü ve rapor")
    class VerificationAndReport {

        @Test
        @DisplayName("Derleme kontrolü açıkken Saxon sorunları sonuca eklenmeli")
        void shouldAttachCompilationIssues() throws AnalysisException {
            properties.setVerifyCompilation(true);
            String xslt = """
                    <xsl:stylesheet version="2.0" xmlns:xsl="http://www.w3.org/1999/XSL/Transform">
                        <xsl:template match="/">
                            <xsl:call-template name="missing"/>
                        </xsl:template>
                    </xsl:stylesheet>""";

            AnalysisResult result = coordinator.analyzeSource("dangling.xslt", xslt, AnalysisOptions.defaults());

            assertThat(result.getCompilationIssues()).isNotEmpty();
            assertThat(result.getTemplates()).containsOnlyKeys("/");
        }

        @Test
        @DisplayName("Rapor dizini tanımlıysa JSON raporu yazılmalı")
        void shouldWriteReport(@TempDir Path dir) throws Exception {
            properties.setReportDirectory(dir.toString());

            AnalysisResult result = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, AnalysisOptions.defaults());

            Path report = dir.resolve(result.getFileId() + ".json");
            assertThat(report).exists();
            assertThat(Files.readString(report)).contains("\"file_path\" : \"main.xslt\"");
        }

        @Test
        @DisplayName("Rapor yazılamazsa analiz yine de başarılı olmalı")
        void shouldSurviveReportFailure(@TempDir Path dir) throws Exception {
            Path notADirectory = Files.writeString(dir.resolve("dosya"), "x");
            properties.setReportDirectory(notADirectory.toString());

            AnalysisResult result = coordinator.analyzeSource("main.xslt",
                    XsltTemplateParserTest.HELPER_AND_MAIN, AnalysisOptions.defaults());

            assertThat(result.getTemplates()).hasSize(2);
            assertThat(counter("xslt_analysis_total", "result", "success")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Toplu analiz")
    class Batch {

        @Test
        @DisplayName("Hatalı dosya diğerlerini etkilememeli ve sıra korunmalı")
        void shouldIsolateFailures() {
            Map<String, String> sources = new LinkedHashMap<>();
            sources.put("a.xslt", XsltTemplateParserTest.HELPER_AND_MAIN);
            sources.put("broken.xslt", MALFORMED);
            sources.put("c.xslt", XsltTemplateParserTest.FOUR_CONDITIONS);

            var batch = coordinator.analyzeSources(sources, AnalysisOptions.defaults());

            assertThat(batch.fileResults()).containsOnlyKeys("a.xslt", "c.xslt");
            assertThat(batch.fileResults().keySet()).containsExactly("a.xslt", "c.xslt");
            assertThat(batch.errors()).containsOnlyKeys("broken.xslt");
            assertThat(batch.errors().get("broken.xslt")).contains("XSLT ayrıştırılamadı");
            assertThat(batch.batchSummary().totalFiles()).isEqualTo(3);
            assertThat(batch.batchSummary().successfulAnalyses()).isEqualTo(2);
            assertThat(batch.batchSummary().failedAnalyses()).isEqualTo(1);
            assertThat(batch.crossFileAnalysis().totalTemplates()).isEqualTo(3);
            assertThat(batch.aggregatedStatistics().analysisCompletionRate()).isCloseTo(66.67, within(0.01));
            assertThat(counter("xslt_analysis_batch_files_total", "result", "failure")).isEqualTo(1);
        }

        @Test
        @DisplayName("Tek başarılı dosyada çapraz analiz boş olmalı")
        void shouldSkipCrossFileForSingleSuccess() {
            var batch = coordinator.analyzeSources(Map.of("a.xslt", XsltTemplateParserTest.HELPER_AND_MAIN),
                    AnalysisOptions.defaults());

            assertThat(batch.crossFileAnalysis().crossFileDependencies()).isEmpty();
            assertThat(batch.crossFileAnalysis().totalTemplates()).isZero();
            assertThat(batch.aggregatedStatistics().totalTemplates()).isEqualTo(2);
        }

        @Test
        @DisplayName("Dosya listesi diskten okunarak analiz edilmeli")
        void shouldAnalyzeFiles(@TempDir Path dir) throws Exception {
            Path first = Files.writeString(dir.resolve("a.xslt"), XsltTemplateParserTest.HELPER_AND_MAIN);
            Path missing = dir.resolve("yok.xslt");

            var batch = coordinator.analyzeFiles(List.of(first, missing), AnalysisOptions.defaults());

            assertThat(batch.fileResults()).containsOnlyKeys(first.toString());
            assertThat(batch.errors()).containsOnlyKeys(missing.toString());
        }

        @Test
        @DisplayName("Boş toplu istek boş özet dönmeli")
        void shouldHandleEmptyBatch() {
            var batch = coordinator.analyzeSources(Map.of(), AnalysisOptions.defaults());

            assertThat(batch.batchSummary().totalFiles()).isZero();
            assertThat(batch.fileResults()).isEmpty();
            assertThat(batch.aggregatedStatistics().analysisCompletionRate()).isEqualTo(0.0);
        }
    }
}
