package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.VariableScope;
import io.mersel.services.xsltanalyzer.application.enums.VariableType;

import java.util.List;

/**
 * Ayrıştırılmış bir {@code xsl:variable} veya {@code xsl:param}.
 * <p>
 * Global değişkenler adlarıyla, şablon kapsamındakiler gölgelemeye tolerans için
 * {@code <ad>_<satır>} ile anahtarlanır.
 *
 * @param key              Dosya içinde benzersiz doğal anahtar
 * @param name             Değişken adı
 * @param variableType     variable veya parameter
 * @param selectExpression {@code select} ifadesi (opsiyonel)
 * @param content          {@code select} yoksa satır içi metin içeriği
 * @param scope            global, template veya local
 * @param lineNumber       Kaynak satır numarası
 * @param ownerTemplate    Şablon kapsamındaysa sahibi olan şablonun anahtarı, global ise {@code null}
 * @param usedByTemplates  Değişkeni kullanan şablonlar, semantik analiz tarafından doldurulur
 */
public record Variable(
        String key,
        String name,
        VariableType variableType,
        String selectExpression,
        String content,
        VariableScope scope,
        int lineNumber,
        String ownerTemplate,
        List<String> usedByTemplates
) {

    public Variable {
        usedByTemplates = List.copyOf(usedByTemplates);
    }

    public Variable withUsedByTemplates(List<String> templates) {
        return new Variable(key, name, variableType, selectExpression, content, scope,
                lineNumber, ownerTemplate, templates);
    }
}
