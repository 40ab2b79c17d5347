package io.mersel.services.xsltanalyzer.web;

import io.mersel.services.xsltanalyzer.application.enums.AnalysisStage;
import io.mersel.services.xsltanalyzer.application.interfaces.AnalysisException;
import io.mersel.services.xsltanalyzer.application.interfaces.IAnalysisCoordinator;
import io.mersel.services.xsltanalyzer.application.interfaces.IAnalysisResultStore;
import io.mersel.services.xsltanalyzer.application.models.AnalysisOptions;
import io.mersel.services.xsltanalyzer.application.models.AnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.BatchAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.BatchSummary;
import io.mersel.services.xsltanalyzer.application.models.CrossFileAnalysis;
import io.mersel.services.xsltanalyzer.web.controllers.AnalysisController;
import io.mersel.services.xsltanalyzer.web.infrastructure.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * AnalysisController birim testleri.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AnalysisController")
class AnalysisControllerTest {

    private static final String XSLT = """
            <xsl:stylesheet version="2.0" xmlns:xsl="http://www.w3.org/1999/XSL/Transform">
                <xsl:template match="/"><out/></xsl:template>
            </xsl:stylesheet>""";

    private MockMvc mockMvc;

    @Mock
    private IAnalysisCoordinator coordinator;

    @Mock
    private IAnalysisResultStore resultStore;

    @InjectMocks
    private AnalysisController analysisController;

    @BeforeEach
    void setUp() throws Exception {
        // @Value alanlarını reflection ile set et (@InjectMocks bunları inject etmez)
        var sizeField = AnalysisController.class.getDeclaredField("maxStylesheetSizeMb");
        sizeField.setAccessible(true);
        sizeField.setInt(analysisController, 1);

        mockMvc = MockMvcBuilders
                .standaloneSetup(analysisController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static MockMultipartFile stylesheet(String name, String content) {
        return new MockMultipartFile("stylesheet", name, "application/xslt+xml", content.getBytes());
    }

    private static AnalysisResult result(String filePath) {
        return AnalysisResult.builder()
                .analysisId("analysis_1")
                .fileId("f1")
                .filePath(filePath)
                .contentHash("hash")
                .analyzedAt(Instant.parse("2024-05-01T10:15:30Z"))
                .build();
    }

    @Nested
    @DisplayName("POST /v1/analyze")
    class Analyze {

        @Test
        @DisplayName("Yüklenen dosya adı ve seçeneklerle analiz yapılmalı")
        void shouldAnalyzeUploadedStylesheet() throws Exception {
            when(coordinator.analyzeSource(eq("fatura.xslt"), eq(XSLT), any())).thenReturn(result("fatura.xslt"));

            mockMvc.perform(multipart("/v1/analyze")
                            .file(stylesheet("fatura.xslt", XSLT))
                            .param("maxPaths", "50")
                            .param("forceReanalysis", "true"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.filePath").value("fatura.xslt"));

            var options = ArgumentCaptor.forClass(AnalysisOptions.class);
            verify(coordinator).analyzeSource(eq("fatura.xslt"), eq(XSLT), options.capture());
            assertThat(options.getValue().maxPaths()).isEqualTo(50);
            assertThat(options.getValue().timeoutMs()).isNull();
            assertThat(options.getValue().forceReanalysis()).isTrue();
        }

        @Test
        @DisplayName("Ayrıştırma hatası 422 ve aşama bilgisi dönmeli")
        void shouldReturn422OnParseFailure() throws Exception {
            when(coordinator.analyzeSource(anyString(), anyString(), any()))
                    .thenThrow(new AnalysisException("bozuk.xslt", AnalysisStage.PARSE,
                            "XSLT ayrıştırılamadı: satır 3", null));

            mockMvc.perform(multipart("/v1/analyze").file(stylesheet("bozuk.xslt", XSLT)))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.title").value("Ayrıştırma Başarısız"))
                    .andExpect(jsonPath("$.status").value(422))
                    .andExpect(jsonPath("$.stage").value("parse"))
                    .andExpect(jsonPath("$.detail").value(org.hamcrest.Matchers.containsString("satır 3")));
        }

        @Test
        @DisplayName("Sonraki aşamalardaki hata 500 dönmeli")
        void shouldReturn500OnLaterStageFailure() throws Exception {
            when(coordinator.analyzeSource(anyString(), anyString(), any()))
                    .thenThrow(new AnalysisException("a.xslt", AnalysisStage.EXECUTION, "Yürütme analizi başarısız",
                            new IllegalStateException("iç hata")));

            mockMvc.perform(multipart("/v1/analyze").file(stylesheet("a.xslt", XSLT)))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.title").value("Analiz Başarısız"))
                    .andExpect(jsonPath("$.stage").value("execution"));
        }

        @Test
        @DisplayName("Boş dosya 400 dönmeli")
        void shouldRejectEmptyFile() throws Exception {
            mockMvc.perform(multipart("/v1/analyze").file(stylesheet("bos.xslt", "")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Geçersiz İstek"));

            verifyNoInteractions(coordinator);
        }

        @Test
        @DisplayName("Boyut sınırını aşan dosya 400 dönmeli")
        void shouldRejectOversizedFile() throws Exception {
            String large = "x".repeat(1024 * 1024 + 1);

            mockMvc.perform(multipart("/v1/analyze").file(stylesheet("buyuk.xslt", large)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value(org.hamcrest.Matchers.containsString("çok büyük")));

            verifyNoInteractions(coordinator);
        }

        @Test
        @DisplayName("Pozitif olmayan maxPaths doğrulama hatası vermeli")
        void shouldRejectNonPositiveMaxPaths() throws Exception {
            mockMvc.perform(multipart("/v1/analyze")
                            .file(stylesheet("a.xslt", XSLT))
                            .param("maxPaths", "0"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Doğrulama Hatası"));

            verifyNoInteractions(coordinator);
        }
    }

    @Nested
    @DisplayName("POST /v1/analyze/batch")
    class Batch {

        @Test
        @DisplayName("Dosyalar yükleme sırasıyla koordinatöre verilmeli")
        void shouldAnalyzeFilesInUploadOrder() throws Exception {
            var batch = new BatchAnalysisResult(new BatchSummary(2, 2, 0, 12, null),
                    new LinkedHashMap<>(), Map.of(), CrossFileAnalysis.empty(), null);
            when(coordinator.analyzeSources(anyMap(), any())).thenReturn(batch);

            mockMvc.perform(multipart("/v1/analyze/batch")
                            .file(new MockMultipartFile("stylesheets", "b.xslt", "text/xml", XSLT.getBytes()))
                            .file(new MockMultipartFile("stylesheets", "a.xslt", "text/xml", XSLT.getBytes())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.batchSummary.totalFiles").value(2));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, String>> sources = ArgumentCaptor.forClass(Map.class);
            verify(coordinator).analyzeSources(sources.capture(), any());
            assertThat(sources.getValue().keySet()).containsExactly("b.xslt", "a.xslt");
        }

        @Test
        @DisplayName("Aynı ada sahip dosyalar 400 dönmeli")
        void shouldRejectDuplicateNames() throws Exception {
            mockMvc.perform(multipart("/v1/analyze/batch")
                            .file(new MockMultipartFile("stylesheets", "a.xslt", "text/xml", XSLT.getBytes()))
                            .file(new MockMultipartFile("stylesheets", "a.xslt", "text/xml", XSLT.getBytes())))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value(org.hamcrest.Matchers.containsString("a.xslt")));

            verify(coordinator, never()).analyzeSources(anyMap(), any());
        }
    }

    @Nested
    @DisplayName("GET /v1/analysis/{fileId}")
    class FindAnalysis {

        @Test
        @DisplayName("Saklanan sonuç dönmeli")
        void shouldReturnStoredResult() throws Exception {
            when(resultStore.find("f1")).thenReturn(Optional.of(result("fatura.xslt")));

            mockMvc.perform(get("/v1/analysis/f1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.fileId").value("f1"));
        }

        @Test
        @DisplayName("Bilinmeyen kimlik 404 dönmeli")
        void shouldReturn404ForUnknownId() throws Exception {
            when(resultStore.find("yok")).thenReturn(Optional.empty());

            mockMvc.perform(get("/v1/analysis/yok"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.title").value("Analiz Bulunamadı"));
        }
    }
}
