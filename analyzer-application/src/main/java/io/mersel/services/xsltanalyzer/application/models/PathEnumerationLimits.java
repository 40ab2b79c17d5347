package io.mersel.services.xsltanalyzer.application.models;

/**
 * Yol numaralandırması için kesme sınırları.
 * <p>
 * Sınırlardan birine ulaşıldığında numaralandırma durur ve kısmi kapsama raporlanır.
 *
 * @param maxPaths  Üretilecek en fazla yol sayısı (pozitif)
 * @param timeoutMs Duvar saati zaman aşımı, milisaniye (pozitif)
 */
public record PathEnumerationLimits(int maxPaths, long timeoutMs) {

    public PathEnumerationLimits {
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("maxPaths pozitif olmalı: " + maxPaths);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs pozitif olmalı: " + timeoutMs);
        }
    }
}
