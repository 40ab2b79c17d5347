package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PatternType;

import java.util.List;

/**
 * Semantik analiz özeti.
 *
 * @param totalPatterns             Tespit edilen kalıp sayısı
 * @param patternTypes              Tespit edilen kalıp türleri
 * @param highConfidencePatterns    Güveni 0.8'den büyük kalıp sayısı
 * @param dataFlowNodes             Veri akışı düğüm sayısı
 * @param transformationComplexity  Tüm şablonların karmaşıklık toplamı
 * @param testImplicationsCount     Toplam test çıkarımı sayısı
 */
public record SemanticSummary(
        int totalPatterns,
        List<PatternType> patternTypes,
        int highConfidencePatterns,
        int dataFlowNodes,
        int transformationComplexity,
        int testImplicationsCount
) {
}
