package io.mersel.services.xsltanalyzer.application.models;

import java.util.List;
import java.util.Map;

/**
 * Şablon etkileşim tanılaması.
 *
 * @param callGraph            Şablon → onu çağıran şablonlar ({@code called_by_templates})
 * @param outgoingCalls        Şablon → çağırdığı hedefler ({@code calls_templates})
 * @param circularDependencies Bulunan döngüler; her biri yol + kapanış düğümü tekrarı
 * @param orphanedTemplates    Hiçbir şablonun çağırmadığı isimli (match'siz) şablonlar
 */
public record TemplateInteractionReport(
        Map<String, List<String>> callGraph,
        Map<String, List<String>> outgoingCalls,
        List<List<String>> circularDependencies,
        List<String> orphanedTemplates
) {
}
