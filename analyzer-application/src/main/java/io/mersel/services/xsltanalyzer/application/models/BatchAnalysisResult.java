package io.mersel.services.xsltanalyzer.application.models;

import java.util.Map;

/**
 * Çok dosyalı analiz sonucu.
 * <p>
 * Bir dosyanın hatası diğerlerini durdurmaz; hatalar dosya yolu → mesaj olarak toplanır.
 *
 * @param batchSummary          Özet
 * @param fileResults           Başarılı dosyalar (girdi sırasıyla)
 * @param errors                Başarısız dosyalar → hata mesajı
 * @param crossFileAnalysis     Çapraz dosya analizi
 * @param aggregatedStatistics  Toplanmış istatistikler
 */
public record BatchAnalysisResult(
        BatchSummary batchSummary,
        Map<String, AnalysisResult> fileResults,
        Map<String, String> errors,
        CrossFileAnalysis crossFileAnalysis,
        AggregatedStatistics aggregatedStatistics
) {
}
