package io.mersel.services.xsltanalyzer.application.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Öncelik / risk / karmaşıklık seviyesi.
 * <p>
 * Hotspot risk seviyesi, test veri gereksinimi önceliği, çapraz dosya bağımlılık
 * karmaşıklığı ve genel test üretim önceliği için ortak kullanılır.
 */
public enum PriorityLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    PriorityLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
