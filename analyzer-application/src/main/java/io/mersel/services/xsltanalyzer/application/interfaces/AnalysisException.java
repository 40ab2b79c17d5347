package io.mersel.services.xsltanalyzer.application.interfaces;

import io.mersel.services.xsltanalyzer.application.enums.AnalysisStage;

/**
 * Tek bir dosyanın analizi bir aşamada başarısız olduğunda fırlatılan istisna.
 * <p>
 * Dosya yolu ve başarısız olan aşama ile birlikte raporlanır. Toplu analizde
 * diğer dosyalara yayılmaz; hata haritasına yazılır.
 */
public class AnalysisException extends Exception {

    private final String filePath;
    private final AnalysisStage stage;

    public AnalysisException(String filePath, AnalysisStage stage, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
        this.stage = stage;
    }

    public String getFilePath() {
        return filePath;
    }

    public AnalysisStage getStage() {
        return stage;
    }
}
