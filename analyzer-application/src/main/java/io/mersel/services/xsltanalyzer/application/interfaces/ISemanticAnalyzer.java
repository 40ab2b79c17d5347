package io.mersel.services.xsltanalyzer.application.interfaces;

import io.mersel.services.xsltanalyzer.application.models.SemanticAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.Template;
import io.mersel.services.xsltanalyzer.application.models.Variable;

import java.util.Map;

/**
 * Ayrıştırılmış şablonlar üzerinde veri akışı, kalıp, değişken kapsamı,
 * şablon etkileşimi ve sıcak nokta analizi yapan servis arayüzü.
 * <p>
 * Girdilerinin saf bir fonksiyonudur; G/Ç yapmaz ve iyi biçimli hiçbir girdi için hata fırlatmaz.
 */
public interface ISemanticAnalyzer {

    SemanticAnalysisResult analyze(Map<String, Template> templates, Map<String, Variable> variables);
}
