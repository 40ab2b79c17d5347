package io.mersel.services.xsltanalyzer.application.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;
import io.mersel.services.xsltanalyzer.application.enums.RequirementType;

import java.util.List;

/**
 * Kural tabanlı test verisi gereksinimi.
 *
 * @param requirementType Gereksinim türü
 * @param description     Açıklama
 * @param priority        Öncelik
 * @param variables       {@code input_variables} için yol değişkenleri
 * @param condition       {@code condition_data} için koşul
 * @param outputElements  {@code output_verification} için beklenen çıktı elementleri
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestDataRequirement(
        RequirementType requirementType,
        String description,
        PriorityLevel priority,
        List<String> variables,
        String condition,
        List<String> outputElements
) {

    public static TestDataRequirement of(RequirementType type, String description, PriorityLevel priority) {
        return new TestDataRequirement(type, description, priority, null, null, null);
    }

    public static TestDataRequirement inputVariables(List<String> variables) {
        return new TestDataRequirement(RequirementType.INPUT_VARIABLES,
                "Yol değişkenleri için girdi verisi", PriorityLevel.HIGH, List.copyOf(variables), null, null);
    }

    public static TestDataRequirement conditionData(String condition) {
        return new TestDataRequirement(RequirementType.CONDITION_DATA,
                "Koşulu sağlayacak veri: " + condition, PriorityLevel.HIGH, null, condition, null);
    }

    public static TestDataRequirement outputVerification(List<String> outputElements) {
        return new TestDataRequirement(RequirementType.OUTPUT_VERIFICATION,
                "Beklenen çıktı elementlerinin doğrulanması", PriorityLevel.MEDIUM, null, null,
                List.copyOf(outputElements));
    }
}
