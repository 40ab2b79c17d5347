package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.ConditionalKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ConditionalLogic birim testleri.
 */
@DisplayName("ConditionalLogic")
class ConditionalLogicTest {

    @Test
    @DisplayName("xsl:if koşul metni test ifadesinin kendisi olmalı")
    void ifConditionText() {
        var logic = ConditionalLogic.ifCondition("@type='A'", 4);

        assertThat(logic.kind()).isEqualTo(ConditionalKind.IF);
        assertThat(logic.conditionText()).isEqualTo("@type='A'");
        assertThat(logic.pathCondition()).isEqualTo("@type='A'");
        assertThat(logic.line()).isEqualTo(4);
    }

    @Test
    @DisplayName("xsl:choose açıklaması when testlerini birleştirmeli, yol koşulu taşımamalı")
    void chooseConditionText() {
        var logic = ConditionalLogic.choose(List.of("$a > 1", "$b = 2"), 7);

        assertThat(logic.kind()).isEqualTo(ConditionalKind.CHOOSE);
        assertThat(logic.conditionText()).isEqualTo("$a > 1 | $b = 2");
        assertThat(logic.pathCondition()).isNull();
    }

    @Test
    @DisplayName("when içermeyen choose boş metin dönmeli")
    void emptyChoose() {
        assertThat(ConditionalLogic.choose(List.of(), 1).conditionText()).isEmpty();
    }
}
