package io.mersel.services.xsltanalyzer.infrastructure.diagnostics;

import io.mersel.services.xsltanalyzer.application.interfaces.IExecutionPathAnalyzer;
import io.mersel.services.xsltanalyzer.application.interfaces.ISemanticAnalyzer;
import io.mersel.services.xsltanalyzer.application.interfaces.ITemplateParser;
import io.mersel.services.xsltanalyzer.application.models.ExecutionAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.ParseResult;
import io.mersel.services.xsltanalyzer.application.models.PathEnumerationLimits;
import io.mersel.services.xsltanalyzer.application.models.SemanticAnalysisResult;
import io.mersel.services.xsltanalyzer.infrastructure.SaxonStylesheetVerifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Analiz motoru sağlık kontrolü.
 * <p>
 * Küçük gömülü bir stylesheet üzerinde üç aşamayı da çalıştırır ve Saxon sürümünü raporlar.
 */
@Component
public class AnalyzerHealthCheck implements HealthIndicator {

    private static final String TEST_XSLT = """
            <?xml version="1.0" encoding="UTF-8"?>
            <xsl:stylesheet version="2.0" xmlns:xsl="http://www.w3.org/1999/XSL/Transform">
                <xsl:template match="/">
                    <result><xsl:call-template name="ok"/></result>
                </xsl:template>
                <xsl:template name="ok">OK</xsl:template>
            </xsl:stylesheet>""";

    private static final PathEnumerationLimits LIMITS = new PathEnumerationLimits(100, 1000);

    private final ITemplateParser parser;
    private final ISemanticAnalyzer semanticAnalyzer;
    private final IExecutionPathAnalyzer executionPathAnalyzer;
    private final SaxonStylesheetVerifier stylesheetVerifier;

    public AnalyzerHealthCheck(ITemplateParser parser,
                               ISemanticAnalyzer semanticAnalyzer,
                               IExecutionPathAnalyzer executionPathAnalyzer,
                               SaxonStylesheetVerifier stylesheetVerifier) {
        this.parser = parser;
        this.semanticAnalyzer = semanticAnalyzer;
        this.executionPathAnalyzer = executionPathAnalyzer;
        this.stylesheetVerifier = stylesheetVerifier;
    }

    @Override
    public Health health() {
        try {
            ParseResult parsed = parser.parse(TEST_XSLT);
            SemanticAnalysisResult semantic = semanticAnalyzer.analyze(parsed.templates(), parsed.variables());
            ExecutionAnalysisResult execution = executionPathAnalyzer.analyze(parsed.templates(),
                    semantic.variables(), semantic.semanticPatterns(), LIMITS);

            return Health.up()
                    .withDetail("engine", "Saxon HE")
                    .withDetail("version", stylesheetVerifier.engineVersion())
                    .withDetail("templates", parsed.templates().size())
                    .withDetail("paths", execution.executionPaths().size())
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("engine", "Saxon HE")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
