package io.mersel.services.xsltanalyzer.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * {@code xsl:variable} veya {@code xsl:param}.
 */
public enum VariableType {
    VARIABLE("variable"),
    PARAMETER("parameter");

    private final String value;

    VariableType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
