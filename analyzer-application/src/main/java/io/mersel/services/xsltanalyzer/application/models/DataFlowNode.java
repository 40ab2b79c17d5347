package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.DataFlowNodeType;

/**
 * Veri akışı grafiğinde tek bir düğüm. Kimliği, grafiğin düğüm listesindeki indeksidir.
 *
 * @param id              Düğüm indeksi
 * @param nodeType        Düğüm türü
 * @param templateKey     Sahibi olan şablon
 * @param lineNumber      Kaynak satırı
 * @param variableName    Değişken ataması ise değişken adı
 * @param condition       Koşul dalı ise koşul metni
 * @param xpathExpression XPath seçimi ise ifade
 * @param callTarget      Şablon çağrısı ise hedef
 */
public record DataFlowNode(
        int id,
        DataFlowNodeType nodeType,
        String templateKey,
        int lineNumber,
        String variableName,
        String condition,
        String xpathExpression,
        String callTarget
) {
}
