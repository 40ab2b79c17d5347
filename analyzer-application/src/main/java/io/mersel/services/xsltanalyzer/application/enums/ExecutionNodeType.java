package io.mersel.services.xsltanalyzer.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Yürütme grafiğindeki düğüm türleri.
 */
public enum ExecutionNodeType {
    TEMPLATE_START("template_start"),
    TEMPLATE_END("template_end"),
    CONDITION("condition"),
    LOOP("loop"),
    TEMPLATE_CALL("template_call"),
    VARIABLE_ASSIGNMENT("variable_assignment"),
    OUTPUT_GENERATION("output_generation");

    private final String value;

    ExecutionNodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
