package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.ConditionalKind;

import java.util.List;

/**
 * Şablon içindeki tek bir koşullu yapı.
 * <p>
 * {@code xsl:if} için {@code conditions} tek elemanlıdır (test ifadesi).
 * {@code xsl:choose} için kardeş {@code xsl:when} test ifadelerinin tamamını taşır.
 *
 * @param kind       {@code if} veya {@code choose}
 * @param conditions Test ifadeleri
 * @param line       Kaynak satır numarası
 */
public record ConditionalLogic(
        ConditionalKind kind,
        List<String> conditions,
        int line
) {

    public ConditionalLogic {
        conditions = List.copyOf(conditions);
    }

    public static ConditionalLogic ifCondition(String test, int line) {
        return new ConditionalLogic(ConditionalKind.IF, List.of(test), line);
    }

    public static ConditionalLogic choose(List<String> whenTests, int line) {
        return new ConditionalLogic(ConditionalKind.CHOOSE, whenTests, line);
    }

    /**
     * Açıklama amaçlı koşul metni.
     * {@code choose} için {@code when} testleri {@code " | "} ile birleştirilir;
     * {@code when} içermeyen {@code choose} boş metin döner.
     */
    public String conditionText() {
        return String.join(" | ", conditions);
    }

    /**
     * Yürütme yoluna eklenen koşul. Yalnızca {@code xsl:if} için dolu;
     * {@code choose} dalları yol koşulu sayılmaz ve {@code null} döner.
     */
    public String pathCondition() {
        return kind == ConditionalKind.IF && !conditions.isEmpty() ? conditions.get(0) : null;
    }
}
