package io.mersel.services.xsltanalyzer.application.models;

/**
 * Çağıran tarafından verilen analiz seçenekleri.
 * <p>
 * {@code null} alanlar yapılandırmadaki varsayılanlarla doldurulur.
 *
 * @param maxPaths         En fazla yol sayısı
 * @param timeoutMs        Yol numaralandırma zaman aşımı (ms)
 * @param forceReanalysis  İçerik değişmemiş olsa bile yeniden analiz et
 */
public record AnalysisOptions(
        Integer maxPaths,
        Long timeoutMs,
        boolean forceReanalysis
) {

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(null, null, false);
    }

    public static AnalysisOptions forced() {
        return new AnalysisOptions(null, null, true);
    }
}
