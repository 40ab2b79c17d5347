package io.mersel.services.xsltanalyzer.application.models;

import java.util.List;
import java.util.Set;

/**
 * Bir giriş düğümünden terminal düğüme tek bir yürütme yolu.
 * <p>
 * Terminal düğüm ya ardılı olmayan bir düğümdür ya da aynı dolaşımda daha önce
 * ziyaret edilmiş olup bir kez daha eklenen döngü kapanış düğümüdür.
 *
 * @param pathId               Doğal anahtar ({@code path_<n>})
 * @param nodes                Sıralı düğüm indeksleri
 * @param conditions           Yol boyunca karşılaşılan koşullar
 * @param variablesUsed        Okunan ve yazılan değişkenler
 * @param templatesInvolved    Yolun dokunduğu şablonlar
 * @param outputElements       Üretilen çıktı elementleri
 * @param pathProbability      {@code 1 / (koşul sayısı + 1)}
 * @param complexityScore      Düğüm karmaşıklık ağırlıklarının toplamı
 * @param testDataRequirements Kural tabanlı test verisi gereksinimleri
 */
public record ExecutionPath(
        String pathId,
        List<Integer> nodes,
        List<String> conditions,
        Set<String> variablesUsed,
        Set<String> templatesInvolved,
        Set<String> outputElements,
        double pathProbability,
        int complexityScore,
        List<TestDataRequirement> testDataRequirements
) {
}
