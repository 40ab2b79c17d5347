package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.ExecutionNodeType;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Yürütme grafiğinde bir düğüm. Kimliği grafiğin düğüm listesindeki indeksidir.
 * <p>
 * {@code successors} ekleme sırasını korur; yol numaralandırmasının deterministik
 * olması bu sıraya dayanır.
 *
 * @param id                   Düğüm indeksi
 * @param nodeType             Düğüm türü
 * @param templateKey          Sahibi olan şablon
 * @param lineNumber           Kaynak satırı
 * @param description          Açıklama
 * @param condition            Koşul düğümüyse koşul metni
 * @param variablesRead        Okunan değişkenler
 * @param variablesWritten     Yazılan değişkenler
 * @param outputElements       Üretilen çıktı elementleri
 * @param predecessors         Önceki düğüm indeksleri
 * @param successors           Sonraki düğüm indeksleri
 * @param executionProbability Yürütme olasılığı (varsayılan 1.0)
 * @param complexityWeight     Toplamsal karmaşıklık ağırlığı (varsayılan 1)
 */
public record ExecutionNode(
        int id,
        ExecutionNodeType nodeType,
        String templateKey,
        int lineNumber,
        String description,
        String condition,
        Set<String> variablesRead,
        Set<String> variablesWritten,
        Set<String> outputElements,
        List<Integer> predecessors,
        List<Integer> successors,
        double executionProbability,
        int complexityWeight
) {

    public ExecutionNode {
        variablesRead = Collections.unmodifiableSet(new LinkedHashSet<>(variablesRead));
        variablesWritten = Collections.unmodifiableSet(new LinkedHashSet<>(variablesWritten));
        outputElements = Collections.unmodifiableSet(new LinkedHashSet<>(outputElements));
        predecessors = List.copyOf(predecessors);
        successors = List.copyOf(successors);
    }
}
