package io.mersel.services.xsltanalyzer.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Analiz sonuçlarını snake_case alan adlarıyla JSON'a serileştirir.
 * <p>
 * Aşağı akıştaki test üretici veya kalıcılık katmanı bu çıktıyı yeniden türetme yapmadan tüketir.
 */
@Component
public class AnalysisReportWriter {

    private final ObjectMapper mapper;

    public AnalysisReportWriter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(Object report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Analiz raporu JSON'a çevrilemedi: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Raporu dosyaya yazar, üst dizinleri gerekirse oluşturur.
     */
    public void write(Object report, Path target) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            mapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Analiz raporu yazılamadı: " + target, e);
        }
    }
}
