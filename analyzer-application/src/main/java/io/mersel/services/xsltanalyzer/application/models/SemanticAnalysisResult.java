package io.mersel.services.xsltanalyzer.application.models;

import java.util.List;
import java.util.Map;

/**
 * Semantik analiz aşamasının çıktısı.
 *
 * @param dataFlowGraph          Veri akışı grafiği
 * @param semanticPatterns       Tespit edilen kalıplar
 * @param variableAnalysis       Değişken kapsamı tanılaması
 * @param interactionAnalysis    Şablon etkileşim tanılaması
 * @param transformationHotspots Skora göre azalan sırada hotspot'lar
 * @param testImplications       Kalıplardan türetilen test çıkarımları
 * @param analysisSummary        Özet
 * @param variables              {@code usedByTemplates} alanı doldurulmuş değişkenler
 */
public record SemanticAnalysisResult(
        DataFlowGraph dataFlowGraph,
        List<SemanticPattern> semanticPatterns,
        VariableScopeReport variableAnalysis,
        TemplateInteractionReport interactionAnalysis,
        List<Hotspot> transformationHotspots,
        List<TestImplication> testImplications,
        SemanticSummary analysisSummary,
        Map<String, Variable> variables
) {
}
