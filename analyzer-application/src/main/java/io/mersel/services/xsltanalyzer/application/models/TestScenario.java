package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

import java.util.List;

/**
 * Yürütme yollarından türetilen test senaryosu.
 *
 * @param scenarioType     critical_path, conditional_logic, recursive_path veya happy_path
 * @param pathId           Kaynak yol
 * @param description      Açıklama
 * @param templatesInvolved Yolun dokunduğu şablonlar
 * @param conditions       Yolun koşulları
 * @param testRequirements Yolun test verisi gereksinimleri
 * @param priority         Öncelik
 */
public record TestScenario(
        String scenarioType,
        String pathId,
        String description,
        List<String> templatesInvolved,
        List<String> conditions,
        List<TestDataRequirement> testRequirements,
        PriorityLevel priority
) {
}
