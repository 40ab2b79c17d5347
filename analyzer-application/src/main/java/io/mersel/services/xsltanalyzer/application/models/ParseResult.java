package io.mersel.services.xsltanalyzer.application.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ayrıştırıcı çıktısı: belge sırasına göre şablonlar ve değişkenler.
 *
 * @param templates Şablon anahtarı → şablon
 * @param variables Değişken anahtarı → değişken
 * @param summary   Sayımlar ve ortalama karmaşıklık
 */
public record ParseResult(
        Map<String, Template> templates,
        Map<String, Variable> variables,
        ParseSummary summary
) {

    public ParseResult {
        templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
