package io.mersel.services.xsltanalyzer.infrastructure;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.services.xsltanalyzer.application.interfaces.IAnalysisResultStore;
import io.mersel.services.xsltanalyzer.application.models.AnalysisResult;
import io.mersel.services.xsltanalyzer.infrastructure.config.AnalysisProperties;
import io.mersel.services.xsltanalyzer.infrastructure.diagnostics.AnalysisMetrics;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine tabanlı bellek içi analiz sonuç deposu.
 * <p>
 * Sonuçlar dosya kimliği ile saklanır; boyut ve yaşam süresi {@code xslt-analysis.cache.*}
 * ile sınırlandırılır.
 */
@Component
public class InMemoryAnalysisResultStore implements IAnalysisResultStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAnalysisResultStore.class);

    private final AnalysisProperties properties;
    private final AnalysisMetrics metrics;

    private Cache<String, AnalysisResult> results;

    public InMemoryAnalysisResultStore(AnalysisProperties properties, AnalysisMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    @PostConstruct
    void init() {
        results = Caffeine.newBuilder()
                .maximumSize(properties.getCache().getMaxSize())
                .expireAfterWrite(Duration.ofHours(properties.getCache().getTtlHours()))
                .build();
        metrics.registerResultStoreSizeGauge(results);
    }

    @Override
    public void save(AnalysisResult result) {
        results.put(result.getFileId(), result);
        log.debug("Analiz sonucu saklandı: {} ({})", result.getFileId(), result.getFilePath());
    }

    @Override
    public Optional<AnalysisResult> find(String fileId) {
        return Optional.ofNullable(results.getIfPresent(fileId));
    }

    @Override
    public long size() {
        return results.estimatedSize();
    }
}
