package io.mersel.services.xsltanalyzer.web.controllers;

import io.mersel.services.xsltanalyzer.application.interfaces.AnalysisException;
import io.mersel.services.xsltanalyzer.application.interfaces.IAnalysisCoordinator;
import io.mersel.services.xsltanalyzer.application.interfaces.IAnalysisResultStore;
import io.mersel.services.xsltanalyzer.application.models.AnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.BatchAnalysisResult;
import io.mersel.services.xsltanalyzer.web.dto.AnalysisRequestDto;
import io.mersel.services.xsltanalyzer.web.infrastructure.AnalysisNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * XSLT analiz endpoint'leri.
 * <p>
 * Yüklenen şablonların mantıksal dosya yolu, yükleme sırasındaki dosya adıdır.
 * Aynı ada sahip dosyanın sonraki yüklemelerinde içerik değişmemişse saklanan
 * sonuç döner.
 */
@RestController
@RequestMapping("/v1")
@Tag(name = "Analysis", description = "XSLT statik analiz işlemleri")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);
    private static final String DEFAULT_FILE_NAME = "stylesheet.xslt";

    @Value("${xslt-analysis.max-stylesheet-size-mb:10}")
    private int maxStylesheetSizeMb;

    private final IAnalysisCoordinator coordinator;
    private final IAnalysisResultStore resultStore;

    public AnalysisController(IAnalysisCoordinator coordinator, IAnalysisResultStore resultStore) {
        this.coordinator = coordinator;
        this.resultStore = resultStore;
    }

    @Operation(
            summary = "Tek XSLT Analizi",
            description = """
                    Yüklenen XSLT şablonunu ayrıştırır, semantik analizini yapar ve
                    yürütme yollarını çıkarır.
                    
                    `maxPaths` veya `timeoutMs` sınırına ulaşılırsa sonuç kesilmiş olarak
                    işaretlenir (`coverage_analysis.truncated=true`).
                    """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Analiz tamamlandı"),
                    @ApiResponse(responseCode = "400", description = "Geçersiz istek", content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "422", description = "XSLT ayrıştırılamadı", content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AnalysisResult> analyze(
            @RequestParam("stylesheet") MultipartFile stylesheet,
            @ModelAttribute @Valid AnalysisRequestDto requestDto) throws IOException, AnalysisException {

        String filePath = fileName(stylesheet);
        String source = readStylesheet(stylesheet, filePath);

        log.info("Analiz isteği: {} (maxPaths: {}, timeoutMs: {}, zorla: {})",
                filePath, requestDto.getMaxPaths(), requestDto.getTimeoutMs(), requestDto.getForceReanalysis());

        AnalysisResult result = coordinator.analyzeSource(filePath, source, requestDto.toOptions());
        return ResponseEntity.ok(result);
    }

    @Operation(
            summary = "Toplu XSLT Analizi",
            description = """
                    Birden fazla XSLT şablonunu bağımsız olarak analiz eder. Başarısız dosyalar
                    `errors` haritasında raporlanır, diğer dosyaları etkilemez.
                    
                    En az iki dosya başarıyla analiz edilirse dosyalar arası bağımlılıklar ve
                    ortak kalıplar `cross_file_analysis` altında döner.
                    """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Toplu analiz tamamlandı"),
                    @ApiResponse(responseCode = "400", description = "Geçersiz istek", content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping(value = "/analyze/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchAnalysisResult> analyzeBatch(
            @RequestParam("stylesheets") List<MultipartFile> stylesheets,
            @ModelAttribute @Valid AnalysisRequestDto requestDto) throws IOException {

        if (stylesheets == null || stylesheets.isEmpty()) {
            throw new IllegalArgumentException("En az bir XSLT dosyası yüklenmelidir");
        }

        Map<String, String> sources = new LinkedHashMap<>();
        for (MultipartFile stylesheet : stylesheets) {
            String filePath = fileName(stylesheet);
            if (sources.containsKey(filePath)) {
                throw new IllegalArgumentException("Aynı dosya adı birden fazla kez yüklendi: " + filePath);
            }
            sources.put(filePath, readStylesheet(stylesheet, filePath));
        }

        log.info("Toplu analiz isteği: {} dosya", sources.size());
        return ResponseEntity.ok(coordinator.analyzeSources(sources, requestDto.toOptions()));
    }

    @Operation(
            summary = "Saklanmış Analiz Sonucu",
            description = "Dosya kimliği (dosya yolunun SHA-256 özeti) ile son analiz sonucunu döner.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Sonuç bulundu"),
                    @ApiResponse(responseCode = "404", description = "Sonuç bulunamadı", content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping(value = "/analysis/{fileId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AnalysisResult> findAnalysis(@PathVariable String fileId) {
        return resultStore.find(fileId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new AnalysisNotFoundException(fileId));
    }

    private String readStylesheet(MultipartFile stylesheet, String filePath) throws IOException {
        if (stylesheet == null || stylesheet.isEmpty()) {
            throw new IllegalArgumentException("XSLT dosyası boş olamaz: " + filePath);
        }
        if (stylesheet.getSize() > maxStylesheetSizeMb * 1024L * 1024L) {
            throw new IllegalArgumentException(
                    "XSLT dosyası çok büyük: " + filePath + " (" + (stylesheet.getSize() / (1024 * 1024))
                            + " MB). Maksimum izin verilen: " + maxStylesheetSizeMb + " MB");
        }
        return new String(stylesheet.getBytes(), StandardCharsets.UTF_8);
    }

    private static String fileName(MultipartFile stylesheet) {
        String name = stylesheet != null ? stylesheet.getOriginalFilename() : null;
        return name == null || name.isBlank() ? DEFAULT_FILE_NAME : name;
    }
}
