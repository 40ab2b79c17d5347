package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PatternType;

import java.util.List;

/**
 * Tespit edilmiş semantik kalıp örneği.
 * <p>
 * Doğal anahtarı {@code (patternType, templatesInvolved)} ikilisidir.
 *
 * @param patternType       Kalıp türü
 * @param description       İnsan tarafından okunabilir açıklama
 * @param templatesInvolved İlgili şablon anahtarları
 * @param confidenceScore   Güven skoru [0,1], kurala göre sabit
 * @param testImplications  Tavsiye niteliğindeki test çıkarımları
 */
public record SemanticPattern(
        PatternType patternType,
        String description,
        List<String> templatesInvolved,
        double confidenceScore,
        List<String> testImplications
) {

    public SemanticPattern {
        templatesInvolved = List.copyOf(templatesInvolved);
        testImplications = List.copyOf(testImplications);
    }
}
