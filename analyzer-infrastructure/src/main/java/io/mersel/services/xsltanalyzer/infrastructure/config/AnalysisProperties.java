package io.mersel.services.xsltanalyzer.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Analiz motoru yapılandırma özellikleri.
 * <p>
 * {@code xslt-analysis} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code max-paths}: Yol numaralandırma üst sınırı (pozitif olmalı)</li>
 *   <li>{@code timeout-ms}: Yol numaralandırma süre sınırı (pozitif olmalı)</li>
 *   <li>{@code batch-concurrency}: Toplu analizde eşzamanlı dosya sayısı</li>
 *   <li>{@code verify-compilation}: Saxon ile statik derleme kontrolü yapılsın mı</li>
 *   <li>{@code report-directory}: Boş değilse her analiz sonucu bu dizine JSON olarak yazılır</li>
 *   <li>{@code cache.max-size} / {@code cache.ttl-hours}: Sonuç deposu sınırları</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "xslt-analysis")
public class AnalysisProperties {

    private static final Logger log = LoggerFactory.getLogger(AnalysisProperties.class);

    static final int DEFAULT_MAX_PATHS = 10000;
    static final long DEFAULT_TIMEOUT_MS = 30000;
    static final int DEFAULT_BATCH_CONCURRENCY = 4;

    private int maxPaths = DEFAULT_MAX_PATHS;
    private long timeoutMs = DEFAULT_TIMEOUT_MS;
    private int batchConcurrency = DEFAULT_BATCH_CONCURRENCY;
    private boolean verifyCompilation = true;
    private String reportDirectory = "";
    private Cache cache = new Cache();

    @PostConstruct
    void validate() {
        if (maxPaths <= 0) {
            log.warn("max-paths değeri pozitif olmalı (verilen: {}), varsayılan {} kullanılıyor", maxPaths, DEFAULT_MAX_PATHS);
            maxPaths = DEFAULT_MAX_PATHS;
        }
        if (timeoutMs <= 0) {
            log.warn("timeout-ms değeri pozitif olmalı (verilen: {}), varsayılan {} ms kullanılıyor", timeoutMs, DEFAULT_TIMEOUT_MS);
            timeoutMs = DEFAULT_TIMEOUT_MS;
        }
        if (batchConcurrency <= 0) {
            log.warn("batch-concurrency değeri pozitif olmalı (verilen: {}), varsayılan {} kullanılıyor",
                    batchConcurrency, DEFAULT_BATCH_CONCURRENCY);
            batchConcurrency = DEFAULT_BATCH_CONCURRENCY;
        }
        if (cache.maxSize <= 0) {
            log.warn("cache.max-size değeri pozitif olmalı (verilen: {}), varsayılan 200 kullanılıyor", cache.maxSize);
            cache.maxSize = 200;
        }
        if (cache.ttlHours <= 0) {
            log.warn("cache.ttl-hours değeri pozitif olmalı (verilen: {}), varsayılan 24 kullanılıyor", cache.ttlHours);
            cache.ttlHours = 24;
        }
    }

    public int getMaxPaths() {
        return maxPaths;
    }

    public void setMaxPaths(int maxPaths) {
        this.maxPaths = maxPaths;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getBatchConcurrency() {
        return batchConcurrency;
    }

    public void setBatchConcurrency(int batchConcurrency) {
        this.batchConcurrency = batchConcurrency;
    }

    public boolean isVerifyCompilation() {
        return verifyCompilation;
    }

    public void setVerifyCompilation(boolean verifyCompilation) {
        this.verifyCompilation = verifyCompilation;
    }

    public String getReportDirectory() {
        return reportDirectory;
    }

    public void setReportDirectory(String reportDirectory) {
        this.reportDirectory = reportDirectory;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    /**
     * Sonuç deposu (Caffeine) sınırları.
     */
    public static class Cache {

        private long maxSize = 200;
        private long ttlHours = 24;

        public long getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(long maxSize) {
            this.maxSize = maxSize;
        }

        public long getTtlHours() {
            return ttlHours;
        }

        public void setTtlHours(long ttlHours) {
            this.ttlHours = ttlHours;
        }
    }
}
