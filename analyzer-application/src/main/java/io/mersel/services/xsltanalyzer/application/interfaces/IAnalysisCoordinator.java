package io.mersel.services.xsltanalyzer.application.interfaces;

import io.mersel.services.xsltanalyzer.application.models.AnalysisOptions;
import io.mersel.services.xsltanalyzer.application.models.AnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.BatchAnalysisResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Ayrıştırma, semantik analiz ve yürütme yolu analizini sırayla çalıştıran koordinatör.
 * <p>
 * Tek dosyada herhangi bir aşama başarısız olursa kısmi sonuç üretilmez,
 * {@link AnalysisException} aşama bilgisiyle fırlatılır. Toplu modda dosyalar bağımsız
 * analiz edilir ve hatalar dosya bazında toplanır.
 */
public interface IAnalysisCoordinator {

    AnalysisResult analyzeFile(Path file, AnalysisOptions options) throws AnalysisException;

    /**
     * @param filePath Kimlik ve raporlama için kullanılan mantıksal dosya yolu
     * @param source   XSLT kaynak metni
     */
    AnalysisResult analyzeSource(String filePath, String source, AnalysisOptions options) throws AnalysisException;

    BatchAnalysisResult analyzeFiles(List<Path> files, AnalysisOptions options);

    /**
     * @param sources Mantıksal dosya yolu → XSLT kaynak metni (sıra korunur)
     */
    BatchAnalysisResult analyzeSources(Map<String, String> sources, AnalysisOptions options);
}
