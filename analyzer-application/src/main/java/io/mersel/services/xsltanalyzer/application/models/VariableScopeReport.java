package io.mersel.services.xsltanalyzer.application.models;

import java.util.List;

/**
 * Değişken kapsamı tanılaması.
 *
 * @param globalVariables   Global değişken anahtarları
 * @param templateVariables Şablon kapsamlı değişken anahtarları
 * @param localVariables    Yerel kapsamlı değişken anahtarları
 * @param variableConflicts Birden fazla kapsam anahtarı altında görülen değişken adları
 * @param unusedVariables   Hiçbir şablon tarafından kullanılmayan değişken anahtarları
 */
public record VariableScopeReport(
        List<String> globalVariables,
        List<String> templateVariables,
        List<String> localVariables,
        List<String> variableConflicts,
        List<String> unusedVariables
) {
}
