package io.mersel.services.xsltanalyzer.application.models;

import java.util.List;

/**
 * Yürütme yolu kapsama istatistikleri.
 *
 * @param nodeCoveragePercentage     En az bir yolun dokunduğu düğüm yüzdesi
 * @param templateCoveragePercentage En az bir yolun dokunduğu şablon yüzdesi
 * @param totalExecutionNodes        Toplam düğüm sayısı
 * @param coveredNodes               Kapsanan düğüm sayısı
 * @param uncoveredNodes             Kapsanmayan düğüm sayısı
 * @param uncoveredNodeList          Kapsanmayan düğüm indeksleri
 * @param uncoveredTemplates         Kapsanmayan şablonlar
 * @param untestedConditions         Hiçbir yolun koşul listesinde görünmeyen koşullar
 * @param coverageGaps               Boşluk kayıtları
 * @param truncated                  Yol numaralandırması bir sınıra takılıp erken durdu mu
 */
public record CoverageReport(
        double nodeCoveragePercentage,
        double templateCoveragePercentage,
        int totalExecutionNodes,
        int coveredNodes,
        int uncoveredNodes,
        List<Integer> uncoveredNodeList,
        List<String> uncoveredTemplates,
        List<String> untestedConditions,
        List<CoverageGap> coverageGaps,
        boolean truncated
) {
}
