package io.mersel.services.xsltanalyzer.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Yürütme yolu başına üretilen test verisi gereksinimi türleri.
 */
public enum RequirementType {
    CRITICAL_PATH("critical_path"),
    VARIABLE_HEAVY("variable_heavy"),
    COMPLEX_CONDITIONS("complex_conditions"),
    INPUT_VARIABLES("input_variables"),
    CONDITION_DATA("condition_data"),
    OUTPUT_VERIFICATION("output_verification");

    private final String value;

    RequirementType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
