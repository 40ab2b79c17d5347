package io.mersel.services.xsltanalyzer.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Değişken kapsamı.
 * <ul>
 *   <li>{@code GLOBAL}: stylesheet kök elementinin doğrudan çocuğu</li>
 *   <li>{@code TEMPLATE}: bir {@code xsl:template} içinde (herhangi bir derinlikte)</li>
 *   <li>{@code LOCAL}: ayrıştırıcı tarafından üretilmez; rapor şemasında ayrılmıştır</li>
 * </ul>
 */
public enum VariableScope {
    GLOBAL("global"),
    TEMPLATE("template"),
    LOCAL("local");

    private final String value;

    VariableScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
