package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.enums.DataFlowNodeType;
import io.mersel.services.xsltanalyzer.application.enums.PatternType;
import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;
import io.mersel.services.xsltanalyzer.application.interfaces.StylesheetParseException;
import io.mersel.services.xsltanalyzer.application.models.DataFlowNode;
import io.mersel.services.xsltanalyzer.application.models.GraphEdge;
import io.mersel.services.xsltanalyzer.application.models.ParseResult;
import io.mersel.services.xsltanalyzer.application.models.SemanticAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.SemanticPattern;
import io.mersel.services.xsltanalyzer.application.models.TestImplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SemanticAnalyzer birim testleri.
 */
@DisplayName("SemanticAnalyzer")
class SemanticAnalyzerTest {

    private static final String VARIABLES = """
            <xsl:stylesheet version="2.0" xmlns:xsl="http://www.w3.org/1999/XSL/Transform">
                <xsl:param name="currency"/>
                <xsl:variable name="rate" select="0.18"/>
                <xsl:template match="/">
                    <xsl:variable name="total">
                        <xsl:value-of select="sum(//amount) * $rate"/>
                    </xsl:variable>
                    <xsl:variable name="label">Toplam</xsl:variable>
                    <result><xsl:value-of select="$total"/></result>
                </xsl:template>
            </xsl:stylesheet>""";

    private XsltTemplateParser parser;
    private SemanticAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        parser = new XsltTemplateParser();
        analyzer = new SemanticAnalyzer();
    }

    private SemanticAnalysisResult analyze(String xslt) throws StylesheetParseException {
        ParseResult parsed = parser.parse(xslt);
        return analyzer.analyze(parsed.templates(), parsed.variables());
    }

    @Test
    @DisplayName("Düşük karmaşıklıklı çağrı zincirinde kalıp ve sıcak nokta olmamalı")
    void shouldFindNothingForSimpleStylesheet() throws StylesheetParseException {
        var result = analyze(XsltTemplateParserTest.HELPER_AND_MAIN);

        assertThat(result.semanticPatterns()).isEmpty();
        assertThat(result.transformationHotspots()).isEmpty();
        assertThat(result.interactionAnalysis().callGraph()).containsEntry("helperA", List.of("mainB"));
        assertThat(result.interactionAnalysis().orphanedTemplates()).isEmpty();
    }

    @Test
    @DisplayName("Kendini çağıran şablon tam güvenle özyineleme kalıbı üretmeli")
    void shouldDetectRecursion() throws StylesheetParseException {
        var result = analyze(XsltTemplateParserTest.SELF_CALLING);

        assertThat(result.semanticPatterns())
                .filteredOn(p -> p.patternType() == PatternType.RECURSIVE_PROCESSING)
                .singleElement()
                .satisfies(p -> {
                    assertThat(p.confidenceScore()).isEqualTo(1.0);
                    assertThat(p.templatesInvolved()).containsExactly("loop");
                });
        assertThat(result.interactionAnalysis().circularDependencies()).containsExactly(List.of("loop", "loop"));
    }

    @Test
    @DisplayName("Karşılıklı çağrı döngüsü bir kez raporlanmalı")
    void shouldReportMutualCycleOnce() throws StylesheetParseException {
        String xslt = """
                <xsl:stylesheet version="2.0" xmlns:xsl="http://www.w3.org/1999/XSL/Transform">
                    <xsl:template name="a"><xsl:call-template name="b"/></xsl:template>
                    <xsl:template name="b"><xsl:call-template name="a"/></xsl:template>
                </xsl:stylesheet>""";

        var interactions = analyze(xslt).interactionAnalysis();

        assertThat(interactions.circularDependencies()).containsExactly(List.of("a", "b", "a"));
        assertThat(interactions.orphanedTemplates()).isEmpty();
    }

    @Test
    @DisplayName("Dört koşullu şablon koşullu işleme kalıbı ve orta riskli sıcak nokta olmalı")
    void shouldDetectConditionalHotspot() throws StylesheetParseException {
        var result = analyze(XsltTemplateParserTest.FOUR_CONDITIONS);

        assertThat(result.semanticPatterns()).extracting(SemanticPattern::patternType)
                .contains(PatternType.CONDITIONAL_PROCESSING);
        assertThat(result.transformationHotspots()).singleElement().satisfies(h -> {
            assertThat(h.templateName()).isEqualTo("invoice");
            assertThat(h.hotspotScore()).isEqualTo(5);
            assertThat(h.riskLevel()).isEqualTo(PriorityLevel.MEDIUM);
            assertThat(h.reasons()).hasSize(2);
        });
    }

    @Test
    @DisplayName("Yüksek güvenli kalıpların test çıkarımları yüksek öncelikli olmalı")
    void shouldPrioritizeImplicationsByConfidence() throws StylesheetParseException {
        var result = analyze(XsltTemplateParserTest.FOUR_CONDITIONS);

        assertThat(result.testImplications())
                .filteredOn(i -> i.patternType() == PatternType.CONDITIONAL_PROCESSING)
                .hasSize(3)
                .extracting(TestImplication::priority)
                .containsOnly(PriorityLevel.HIGH);
        assertThat(result.analysisSummary().highConfidencePatterns()).isEqualTo(
                (int) result.semanticPatterns().stream().filter(p -> p.confidenceScore() > 0.8).count());
        assertThat(result.analysisSummary().transformationComplexity()).isEqualTo(14);
    }

    @Test
    @DisplayName("Hat, orkestrasyon, toplama ve hata yönetimi kalıpları tespit edilmeli")
    void shouldDetectStructuralPatterns() throws StylesheetParseException {
        String xslt = """
                <xsl:stylesheet version="2.0" xmlns:xsl="http://www.w3.org/1999/XSL/Transform">
                    <xsl:template match="/">
                        <doc>
                            <xsl:call-template name="header"/>
                            <xsl:call-template name="totals"/>
                        </doc>
                    </xsl:template>
                    <xsl:template name="header">
                        <head><xsl:call-template name="fallback-title"/></head>
                    </xsl:template>
                    <xsl:template name="totals">
                        <total><xsl:value-of select="count(//line)"/></total>
                    </xsl:template>
                    <xsl:template name="fallback-title">
                        <title>default</title>
                    </xsl:template>
                </xsl:stylesheet>""";

        var patterns = analyze(xslt).semanticPatterns();

        assertThat(patterns).extracting(SemanticPattern::patternType).containsExactly(
                PatternType.TRANSFORMATION_PIPELINE,
                PatternType.DATA_AGGREGATION,
                PatternType.TEMPLATE_ORCHESTRATION,
                PatternType.ERROR_HANDLING);
        assertThat(patterns.get(0).templatesInvolved()).containsExactly("/", "header");
        assertThat(patterns.get(1).templatesInvolved()).containsExactly("totals");
        assertThat(patterns.get(2).templatesInvolved()).containsExactly("/");
        assertThat(patterns.get(3).confidenceScore()).isEqualTo(0.6);
    }

    @Test
    @DisplayName("Değişken kullanımı kapsama göre çözülmeli ve kullanılmayanlar raporlanmalı")
    void shouldResolveVariableUsage() throws StylesheetParseException {
        var result = analyze(VARIABLES);

        assertThat(result.variables().get("rate").usedByTemplates()).containsExactly("/");
        assertThat(result.variables().get("total_5").usedByTemplates()).containsExactly("/");
        assertThat(result.variables().get("currency").usedByTemplates()).isEmpty();

        var scopes = result.variableAnalysis();
        assertThat(scopes.globalVariables()).containsExactly("currency", "rate");
        assertThat(scopes.templateVariables()).containsExactly("total_5", "label_8");
        assertThat(scopes.unusedVariables()).containsExactly("currency", "label_8");
        assertThat(scopes.variableConflicts()).isEmpty();
    }

    @Test
    @DisplayName("Aynı adlı global ve şablon değişkeni çakışma olarak raporlanmalı")
    void shouldReportNameConflicts() throws StylesheetParseException {
        String xslt = """
                <xsl:stylesheet version="2.0" xmlns:xsl="http://www.w3.org/1999/XSL/Transform">
                    <xsl:variable name="x" select="1"/>
                    <xsl:template match="/">
                        <xsl:variable name="x" select="2"/>
                        <out><xsl:value-of select="$x"/></out>
                    </xsl:template>
                </xsl:stylesheet>""";

        assertThat(analyze(xslt).variableAnalysis().variableConflicts()).containsExactly("x");
    }

    @Test
    @DisplayName("Veri akışı grafiği kullanılan değişken atamalarından kenar üretmeli")
    void shouldBuildDataFlowGraph() throws StylesheetParseException {
        var graph = analyze(VARIABLES).dataFlowGraph();

        assertThat(graph.nodes()).extracting(DataFlowNode::nodeType).containsExactly(
                DataFlowNodeType.VARIABLE_ASSIGNMENT,
                DataFlowNodeType.VARIABLE_ASSIGNMENT,
                DataFlowNodeType.XPATH_SELECTION,
                DataFlowNodeType.XPATH_SELECTION,
                DataFlowNodeType.XPATH_SELECTION);
        // Yalnızca kullanılan "total" ataması diğer düğümlere bağlanır
        assertThat(graph.edges()).containsExactly(
                new GraphEdge(0, 1), new GraphEdge(0, 2), new GraphEdge(0, 3), new GraphEdge(0, 4));
    }
}
