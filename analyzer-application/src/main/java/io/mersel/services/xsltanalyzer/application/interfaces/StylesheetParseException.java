package io.mersel.services.xsltanalyzer.application.interfaces;

/**
 * XSLT kaynağı iyi biçimli XML olarak ayrıştırılamadığında fırlatılan istisna.
 * <p>
 * Boş girdi, okunamayan dosya ve DOCTYPE bildirimi (XXE koruması) de bu istisna ile
 * raporlanır. İyi biçimli fakat anlamsal olarak eksik XSLT (ör. olmayan bir şablona
 * {@code call-template}) bu istisnayı tetiklemez.
 */
public class StylesheetParseException extends Exception {

    private final int lineNumber;

    public StylesheetParseException(String message) {
        this(message, -1, null);
    }

    public StylesheetParseException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public StylesheetParseException(String message, int lineNumber, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * Hatanın bulunduğu satır; bilinmiyorsa {@code -1}.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
