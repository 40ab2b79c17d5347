package io.mersel.services.xsltanalyzer.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantik analizde tespit edilen dönüşüm kalıbı türleri.
 * <p>
 * Her tür, sabit bir güven skoru ile birlikte bağımsız bir sezgisel kural tarafından üretilir.
 */
public enum PatternType {
    TRANSFORMATION_PIPELINE("transformation_pipeline", 0.8),
    CONDITIONAL_PROCESSING("conditional_processing", 0.9),
    RECURSIVE_PROCESSING("recursive_processing", 1.0),
    DATA_AGGREGATION("data_aggregation", 0.85),
    TEMPLATE_ORCHESTRATION("template_orchestration", 0.7),
    ERROR_HANDLING("error_handling", 0.6);

    private final String value;
    private final double confidence;

    PatternType(String value, double confidence) {
        this.value = value;
        this.confidence = confidence;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Kuralın sabit güven skoru [0,1]. */
    public double confidence() {
        return confidence;
    }
}
