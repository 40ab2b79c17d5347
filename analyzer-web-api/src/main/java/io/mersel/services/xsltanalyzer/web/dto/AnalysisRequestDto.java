package io.mersel.services.xsltanalyzer.web.dto;

import io.mersel.services.xsltanalyzer.application.models.AnalysisOptions;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Analiz seçenekleri DTO'su.
 * <p>
 * multipart/form-data içinde dosyalarla birlikte alınır. Boş bırakılan
 * alanlar sunucu yapılandırmasındaki varsayılanlarla doldurulur.
 */
public class AnalysisRequestDto {

    @Min(value = 1, message = "En az 1 yol olmalı")
    @Max(value = 1_000_000, message = "En fazla 1000000 yol istenebilir")
    @Schema(description = "Numaralandırılacak en fazla yürütme yolu sayısı", example = "10000", nullable = true)
    private Integer maxPaths;

    @Min(value = 1, message = "Zaman aşımı pozitif olmalı")
    @Schema(description = "Yol numaralandırma zaman aşımı (ms)", example = "30000", nullable = true)
    private Long timeoutMs;

    @Schema(description = "İçerik değişmemiş olsa bile yeniden analiz et",
            nullable = true,
            defaultValue = "false")
    private Boolean forceReanalysis = false;

    public Integer getMaxPaths() {
        return maxPaths;
    }

    public void setMaxPaths(Integer maxPaths) {
        this.maxPaths = maxPaths;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public Boolean getForceReanalysis() {
        return forceReanalysis;
    }

    public void setForceReanalysis(Boolean forceReanalysis) {
        this.forceReanalysis = forceReanalysis;
    }

    public AnalysisOptions toOptions() {
        return new AnalysisOptions(maxPaths, timeoutMs, Boolean.TRUE.equals(forceReanalysis));
    }
}
