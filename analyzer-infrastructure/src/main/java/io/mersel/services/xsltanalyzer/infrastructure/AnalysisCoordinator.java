package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.enums.AnalysisStage;
import io.mersel.services.xsltanalyzer.application.interfaces.AnalysisException;
import io.mersel.services.xsltanalyzer.application.interfaces.IAnalysisCoordinator;
import io.mersel.services.xsltanalyzer.application.interfaces.IAnalysisResultStore;
import io.mersel.services.xsltanalyzer.application.interfaces.IExecutionPathAnalyzer;
import io.mersel.services.xsltanalyzer.application.interfaces.ISemanticAnalyzer;
import io.mersel.services.xsltanalyzer.application.interfaces.ITemplateParser;
import io.mersel.services.xsltanalyzer.application.interfaces.StylesheetParseException;
import io.mersel.services.xsltanalyzer.application.models.AnalysisOptions;
import io.mersel.services.xsltanalyzer.application.models.AnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.BatchAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.BatchSummary;
import io.mersel.services.xsltanalyzer.application.models.CrossFileAnalysis;
import io.mersel.services.xsltanalyzer.application.models.ExecutionAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.ParseResult;
import io.mersel.services.xsltanalyzer.application.models.PathEnumerationLimits;
import io.mersel.services.xsltanalyzer.application.models.SemanticAnalysisResult;
import io.mersel.services.xsltanalyzer.infrastructure.config.AnalysisProperties;
import io.mersel.services.xsltanalyzer.infrastructure.diagnostics.AnalysisMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Analiz koordinatörü.
 * <p>
 * Tek dosya için aşamalar kesin sırayla çalışır:
 * <ol>
 *   <li>Ayrıştırma ({@link ITemplateParser})</li>
 *   <li>Semantik analiz ({@link ISemanticAnalyzer})</li>
 *   <li>Yürütme yolu analizi ({@link IExecutionPathAnalyzer})</li>
 * </ol>
 * Bir aşama başarısız olursa analiz durur ve {@link AnalysisException} aşama bilgisiyle fırlatılır.
 * Başarılı sonuç depoya kaydedilir; içerik özeti değişmemiş dosyalar
 * {@code forceReanalysis} verilmedikçe yeniden analiz edilmez.
 * <p>
 * Toplu modda dosyalar sabit boyutlu bir iş havuzunda bağımsız analiz edilir, tüm sonuçlar
 * toplandıktan sonra çapraz dosya analizi yapılır.
 */
@Service
public class AnalysisCoordinator implements IAnalysisCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisCoordinator.class);

    private final ITemplateParser parser;
    private final ISemanticAnalyzer semanticAnalyzer;
    private final IExecutionPathAnalyzer executionPathAnalyzer;
    private final IAnalysisResultStore resultStore;
    private final RecommendationEngine recommendationEngine;
    private final CrossFileAnalyzer crossFileAnalyzer;
    private final SaxonStylesheetVerifier stylesheetVerifier;
    private final AnalysisReportWriter reportWriter;
    private final AnalysisProperties properties;
    private final AnalysisMetrics metrics;

    public AnalysisCoordinator(ITemplateParser parser,
                               ISemanticAnalyzer semanticAnalyzer,
                               IExecutionPathAnalyzer executionPathAnalyzer,
                               IAnalysisResultStore resultStore,
                               RecommendationEngine recommendationEngine,
                               CrossFileAnalyzer crossFileAnalyzer,
                               SaxonStylesheetVerifier stylesheetVerifier,
                               AnalysisReportWriter reportWriter,
                               AnalysisProperties properties,
                               AnalysisMetrics metrics) {
        this.parser = parser;
        this.semanticAnalyzer = semanticAnalyzer;
        this.executionPathAnalyzer = executionPathAnalyzer;
        this.resultStore = resultStore;
        this.recommendationEngine = recommendationEngine;
        this.crossFileAnalyzer = crossFileAnalyzer;
        this.stylesheetVerifier = stylesheetVerifier;
        this.reportWriter = reportWriter;
        this.properties = properties;
        this.metrics = metrics;
    }

    // ── Tek dosya ───────────────────────────────────────────────────

    @Override
    public AnalysisResult analyzeFile(Path file, AnalysisOptions options) throws AnalysisException {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            metrics.recordStageError(AnalysisStage.PARSE);
            metrics.recordAnalysis("failure");
            throw new AnalysisException(file.toString(), AnalysisStage.PARSE,
                    "XSLT dosyası okunamadı: " + file + " (" + e.getMessage() + ")", e);
        }
        return analyzeSource(file.toString(), source, options);
    }

    @Override
    public AnalysisResult analyzeSource(String filePath, String source, AnalysisOptions options)
            throws AnalysisException {
        AnalysisOptions effective = options != null ? options : AnalysisOptions.defaults();
        PathEnumerationLimits limits = new PathEnumerationLimits(
                effective.maxPaths() != null ? effective.maxPaths() : properties.getMaxPaths(),
                effective.timeoutMs() != null ? effective.timeoutMs() : properties.getTimeoutMs());

        String fileId = fileId(filePath);
        String contentHash = Digests.contentHash(source != null ? source : "");

        if (!effective.forceReanalysis()) {
            Optional<AnalysisResult> existing = resultStore.find(fileId)
                    .filter(r -> contentHash.equals(r.getContentHash()))
                    .filter(r -> limits.equals(r.getPathLimits()));
            if (existing.isPresent()) {
                log.info("İçerik ve yol sınırları değişmemiş, mevcut analiz sonucu kullanılıyor: {}", filePath);
                metrics.recordAnalysis("skipped");
                return existing.get();
            }
        }

        long startTime = System.currentTimeMillis();
        log.info("XSLT analizi başlıyor: {}", filePath);

        // ── Aşama 1: Ayrıştırma ──
        long stageStart = System.currentTimeMillis();
        ParseResult parseResult;
        try {
            parseResult = parser.parse(source);
        } catch (StylesheetParseException e) {
            throw stageFailure(filePath, AnalysisStage.PARSE, "XSLT ayrıştırılamadı: " + e.getMessage(), e);
        }
        metrics.recordStage(AnalysisStage.PARSE, System.currentTimeMillis() - stageStart);
        log.info("Aşama 1/3 tamamlandı (ayrıştırma): {} şablon, {} değişken",
                parseResult.templates().size(), parseResult.variables().size());

        // ── Aşama 2: Semantik analiz ──
        stageStart = System.currentTimeMillis();
        SemanticAnalysisResult semantic;
        try {
            semantic = semanticAnalyzer.analyze(parseResult.templates(), parseResult.variables());
        } catch (RuntimeException e) {
            throw stageFailure(filePath, AnalysisStage.SEMANTIC, "Semantik analiz başarısız: " + e.getMessage(), e);
        }
        metrics.recordStage(AnalysisStage.SEMANTIC, System.currentTimeMillis() - stageStart);
        log.info("Aşama 2/3 tamamlandı (semantik analiz): {} kalıp", semantic.semanticPatterns().size());

        // ── Aşama 3: Yürütme yolu analizi ──
        stageStart = System.currentTimeMillis();
        ExecutionAnalysisResult execution;
        try {
            execution = executionPathAnalyzer.analyze(parseResult.templates(), semantic.variables(),
                    semantic.semanticPatterns(), limits);
        } catch (RuntimeException e) {
            throw stageFailure(filePath, AnalysisStage.EXECUTION, "Yürütme yolu analizi başarısız: " + e.getMessage(), e);
        }
        metrics.recordStage(AnalysisStage.EXECUTION, System.currentTimeMillis() - stageStart);
        metrics.recordPaths(execution.executionPaths().size(), execution.coverageAnalysis().truncated());
        log.info("Aşama 3/3 tamamlandı (yürütme yolu analizi): {} yol", execution.executionPaths().size());

        List<String> compilationIssues = properties.isVerifyCompilation()
                ? stylesheetVerifier.verify(filePath, source)
                : List.of();

        Instant analyzedAt = Instant.now();
        long elapsed = System.currentTimeMillis() - startTime;
        AnalysisResult result = AnalysisResult.builder()
                .analysisId("analysis_" + fileId + "_" + analyzedAt.toEpochMilli())
                .fileId(fileId)
                .filePath(filePath)
                .contentHash(contentHash)
                .analyzedAt(analyzedAt)
                .durationMs(elapsed)
                .templates(parseResult.templates())
                .variables(semantic.variables())
                .semanticAnalysis(semantic)
                .executionAnalysis(execution)
                .summary(recommendationEngine.summarize(parseResult.summary(), semantic, execution))
                .recommendations(recommendationEngine.recommend(parseResult.templates(), semantic, execution))
                .compilationIssues(compilationIssues)
                .pathLimits(limits)
                .build();

        resultStore.save(result);
        writeReport(result);
        metrics.recordAnalysis("success");
        log.info("XSLT analizi tamamlandı: {} ({} ms)", filePath, elapsed);
        return result;
    }

    // ── Toplu analiz ────────────────────────────────────────────────

    @Override
    public BatchAnalysisResult analyzeFiles(List<Path> files, AnalysisOptions options) {
        Map<String, Callable<AnalysisResult>> tasks = new LinkedHashMap<>();
        for (Path file : files) {
            tasks.put(file.toString(), () -> analyzeFile(file, options));
        }
        return runBatch(tasks);
    }

    @Override
    public BatchAnalysisResult analyzeSources(Map<String, String> sources, AnalysisOptions options) {
        Map<String, Callable<AnalysisResult>> tasks = new LinkedHashMap<>();
        sources.forEach((path, source) -> tasks.put(path, () -> analyzeSource(path, source, options)));
        return runBatch(tasks);
    }

    private BatchAnalysisResult runBatch(Map<String, Callable<AnalysisResult>> tasks) {
        long startTime = System.currentTimeMillis();
        Map<String, AnalysisResult> fileResults = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();

        if (!tasks.isEmpty()) {
            int poolSize = Math.min(properties.getBatchConcurrency(), tasks.size());
            log.info("Toplu analiz başlıyor: {} dosya, {} eşzamanlı iş", tasks.size(), poolSize);
            ExecutorService pool = Executors.newFixedThreadPool(poolSize);
            try {
                Map<String, Future<AnalysisResult>> futures = new LinkedHashMap<>();
                tasks.forEach((path, task) -> futures.put(path, pool.submit(task)));

                for (var entry : futures.entrySet()) {
                    try {
                        fileResults.put(entry.getKey(), entry.getValue().get());
                    } catch (ExecutionException e) {
                        Throwable cause = e.getCause();
                        String message = cause instanceof AnalysisException
                                ? cause.getMessage()
                                : "Beklenmeyen hata: " + cause;
                        errors.put(entry.getKey(), message);
                        log.warn("Toplu analizde dosya başarısız: {}: {}", entry.getKey(), message);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        errors.put(entry.getKey(), "Analiz kesintiye uğradı");
                    }
                }
            } finally {
                pool.shutdownNow();
            }
        }

        // Bariyer: çapraz analiz tüm dosya sonuçları toplandıktan sonra yapılır
        List<AnalysisResult> successes = new ArrayList<>(fileResults.values());
        CrossFileAnalysis crossFile = successes.size() > 1
                ? crossFileAnalyzer.analyze(successes)
                : CrossFileAnalysis.empty();

        long elapsed = System.currentTimeMillis() - startTime;
        metrics.recordBatch(successes.size(), errors.size(), elapsed);
        log.info("Toplu analiz tamamlandı: {} başarılı, {} başarısız ({} ms)", successes.size(), errors.size(), elapsed);

        return new BatchAnalysisResult(
                new BatchSummary(tasks.size(), successes.size(), errors.size(), elapsed, Instant.now()),
                fileResults,
                errors,
                crossFile,
                crossFileAnalyzer.aggregate(successes, tasks.size()));
    }

    // ── Yardımcılar ─────────────────────────────────────────────────

    /**
     * Kalıcılık katmanı için opak dosya kimliği: dosya yolunun SHA-256 özeti.
     */
    public static String fileId(String filePath) {
        return Digests.sha256Hex(filePath);
    }

    private AnalysisException stageFailure(String filePath, AnalysisStage stage, String message, Exception cause) {
        metrics.recordStageError(stage);
        metrics.recordAnalysis("failure");
        log.error("Analiz aşaması başarısız [{}]: {}", stage.value(), filePath, cause);
        return new AnalysisException(filePath, stage, message, cause);
    }

    private void writeReport(AnalysisResult result) {
        String directory = properties.getReportDirectory();
        if (directory == null || directory.isBlank()) {
            return;
        }
        Path target = Path.of(directory, result.getFileId() + ".json");
        try {
            reportWriter.write(result, target);
            log.debug("Analiz raporu yazıldı: {}", target);
        } catch (UncheckedIOException e) {
            log.warn("Analiz raporu yazılamadı, analiz sonucu etkilenmedi: {} ({})", target, e.getMessage());
        }
    }
}
