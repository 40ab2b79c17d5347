package io.mersel.services.xsltanalyzer.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Veri akışı grafiğindeki düğüm türleri.
 */
public enum DataFlowNodeType {
    VARIABLE_ASSIGNMENT("variable_assignment"),
    TEMPLATE_CALL("template_call"),
    CONDITIONAL_BRANCH("conditional_branch"),
    XPATH_SELECTION("xpath_selection");

    private final String value;

    DataFlowNodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
