package io.mersel.services.xsltanalyzer.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Koşullu mantık kaydının türü: {@code xsl:if} veya {@code xsl:choose}.
 */
public enum ConditionalKind {
    IF("if"),
    CHOOSE("choose");

    private final String value;

    ConditionalKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
