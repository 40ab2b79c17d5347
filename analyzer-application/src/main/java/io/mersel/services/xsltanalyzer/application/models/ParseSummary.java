package io.mersel.services.xsltanalyzer.application.models;

/**
 * Ayrıştırma aşaması özeti.
 *
 * @param totalTemplates      Toplam şablon sayısı
 * @param namedTemplates      {@code name} attribute'u olan şablon sayısı
 * @param matchTemplates      {@code match} attribute'u olan şablon sayısı
 * @param recursiveTemplates  Doğrudan özyinelemeli şablon sayısı
 * @param totalVariables      Toplam değişken/parametre sayısı
 * @param avgComplexity       Ortalama karmaşıklık (2 ondalık)
 * @param mostComplexTemplate En karmaşık şablonun anahtarı, şablon yoksa {@code null}
 * @param xsltPrefix          XSLT namespace'ine bağlı önek (bulunamazsa {@code "xsl"})
 */
public record ParseSummary(
        int totalTemplates,
        int namedTemplates,
        int matchTemplates,
        int recursiveTemplates,
        int totalVariables,
        double avgComplexity,
        String mostComplexTemplate,
        String xsltPrefix
) {
}
