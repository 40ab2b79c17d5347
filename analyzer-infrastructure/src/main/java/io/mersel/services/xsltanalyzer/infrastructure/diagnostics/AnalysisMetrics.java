package io.mersel.services.xsltanalyzer.infrastructure.diagnostics;

import com.github.benmanes.caffeine.cache.Cache;
import io.mersel.services.xsltanalyzer.application.enums.AnalysisStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Analiz motoru metrikleri.
 * <p>
 * Prometheus üzerinden dışa aktarılan analiz sayılarını, aşama sürelerini ve yol sayılarını yönetir.
 */
@Component
public class AnalysisMetrics {

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Tek dosya analiz sonucunu kaydet.
     *
     * @param result "success", "failure" veya "skipped" (içerik değişmemiş)
     */
    public void recordAnalysis(String result) {
        Counter.builder("xslt_analysis_total")
                .tag("result", result)
                .description("XSLT analiz sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Bir analiz aşamasının süresini kaydet.
     */
    public void recordStage(AnalysisStage stage, long durationMs) {
        Timer.builder("xslt_analysis_stage_duration")
                .tag("stage", stage.value())
                .description("Analiz aşaması süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Aşama hatasını kaydet.
     */
    public void recordStageError(AnalysisStage stage) {
        Counter.builder("xslt_analysis_errors_total")
                .tag("stage", stage.value())
                .description("Aşama bazında analiz hata sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Numaralandırılan yol sayısını kaydet.
     *
     * @param pathCount Bulunan yol sayısı
     * @param truncated Numaralandırma sınır nedeniyle kesildi mi
     */
    public void recordPaths(int pathCount, boolean truncated) {
        DistributionSummary.builder("xslt_analysis_paths")
                .description("Dosya başına yürütme yolu sayısı")
                .register(registry)
                .record(pathCount);

        if (truncated) {
            Counter.builder("xslt_analysis_paths_truncated_total")
                    .description("Sınıra takılıp kısmi sonuç veren yol numaralandırmaları")
                    .register(registry)
                    .increment();
        }
    }

    /**
     * Toplu analiz metriklerini kaydet.
     */
    public void recordBatch(int successful, int failed, long durationMs) {
        Counter.builder("xslt_analysis_batch_files_total")
                .tag("result", "success")
                .description("Toplu analizde işlenen dosya sayısı")
                .register(registry)
                .increment(successful);
        Counter.builder("xslt_analysis_batch_files_total")
                .tag("result", "failure")
                .description("Toplu analizde işlenen dosya sayısı")
                .register(registry)
                .increment(failed);

        Timer.builder("xslt_analysis_batch_duration")
                .description("Toplu analiz süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Sonuç deposu boyutu için gauge kaydeder.
     *
     * @param cache Analiz sonuç önbelleği (Caffeine)
     */
    public void registerResultStoreSizeGauge(Cache<?, ?> cache) {
        Gauge.builder("xslt_analysis_result_store_size", cache, c -> (double) c.estimatedSize())
                .description("Saklanan analiz sonucu sayısı")
                .register(registry);
    }
}
