package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

import java.util.List;

/**
 * Orantısız karmaşık/riskli olarak işaretlenmiş şablon.
 *
 * @param templateName Şablon anahtarı
 * @param hotspotScore Toplamsal sezgisel skor (≥5)
 * @param reasons      Skora katkı veren nedenler
 * @param riskLevel    ≥8 ise high, aksi halde medium
 */
public record Hotspot(
        String templateName,
        int hotspotScore,
        List<String> reasons,
        PriorityLevel riskLevel
) {
}
