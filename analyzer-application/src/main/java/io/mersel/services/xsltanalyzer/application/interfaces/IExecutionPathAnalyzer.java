package io.mersel.services.xsltanalyzer.application.interfaces;

import io.mersel.services.xsltanalyzer.application.models.ExecutionAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.PathEnumerationLimits;
import io.mersel.services.xsltanalyzer.application.models.SemanticPattern;
import io.mersel.services.xsltanalyzer.application.models.Template;
import io.mersel.services.xsltanalyzer.application.models.Variable;

import java.util.List;
import java.util.Map;

/**
 * Yürütme grafiği kurup giriş noktalarından sonlu yürütme yollarını numaralandıran servis arayüzü.
 */
public interface IExecutionPathAnalyzer {

    /**
     * @param templates Ayrıştırılmış şablonlar
     * @param variables Değişkenler
     * @param patterns  Semantik kalıplar (test senaryosu ipuçları için)
     * @param limits    Yol sayısı ve süre sınırları; aşıldığında sonuç {@code truncated} işaretlenir
     */
    ExecutionAnalysisResult analyze(Map<String, Template> templates,
                                    Map<String, Variable> variables,
                                    List<SemanticPattern> patterns,
                                    PathEnumerationLimits limits);
}
