package io.mersel.services.xsltanalyzer.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Analiz hattının aşamaları.
 */
public enum AnalysisStage {
    PARSE("parse"),
    SEMANTIC("semantic"),
    EXECUTION("execution");

    private final String value;

    AnalysisStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
