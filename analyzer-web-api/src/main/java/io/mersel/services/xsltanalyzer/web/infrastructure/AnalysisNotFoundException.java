package io.mersel.services.xsltanalyzer.web.infrastructure;

/**
 * İstenen dosya kimliği için saklanmış analiz sonucu bulunamadığında fırlatılır.
 */
public class AnalysisNotFoundException extends RuntimeException {

    private final String fileId;

    public AnalysisNotFoundException(String fileId) {
        super("Analiz sonucu bulunamadı: " + fileId);
        this.fileId = fileId;
    }

    public String getFileId() {
        return fileId;
    }
}
