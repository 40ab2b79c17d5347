package io.mersel.services.xsltanalyzer.web.infrastructure;

import io.mersel.services.xsltanalyzer.application.enums.AnalysisStage;
import io.mersel.services.xsltanalyzer.application.interfaces.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Global hata yöneticisi, RFC 7807 Problem Details.
 * <p>
 * Analiz hatalarında başarısız aşama ve dosya yolu yanıta eklenir:
 * <pre>
 * {
 *   "type": "https://mersel.io/xslt/errors/parse-failed",
 *   "title": "Ayrıştırma Başarısız",
 *   "status": 422,
 *   "detail": "XSLT ayrıştırılamadı: ...",
 *   "stage": "parse",
 *   "file_path": "invoice.xslt"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_BASE_URI = "https://mersel.io/xslt/errors/";

    /**
     * Ayrıştırma hatası → 422, sonraki aşamalardaki hatalar → 500.
     */
    @ExceptionHandler(AnalysisException.class)
    public ProblemDetail handleAnalysisException(AnalysisException ex) {
        ProblemDetail problem;
        if (ex.getStage() == AnalysisStage.PARSE) {
            log.warn("Ayrıştırma hatası: {}", ex.getMessage());
            problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
            problem.setType(URI.create(ERROR_BASE_URI + "parse-failed"));
            problem.setTitle("Ayrıştırma Başarısız");
        } else {
            log.error("Analiz hatası [{}]: {}", ex.getStage().value(), ex.getMessage(), ex);
            problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
            problem.setType(URI.create(ERROR_BASE_URI + "analysis-failed"));
            problem.setTitle("Analiz Başarısız");
        }
        problem.setProperty("stage", ex.getStage().value());
        problem.setProperty("file_path", ex.getFilePath());
        return problem;
    }

    /**
     * Saklanmış analiz yok → 404 Not Found.
     */
    @ExceptionHandler(AnalysisNotFoundException.class)
    public ProblemDetail handleNotFound(AnalysisNotFoundException ex) {
        log.debug("Analiz sonucu bulunamadı: {}", ex.getFileId());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "analysis-not-found"));
        problem.setTitle("Analiz Bulunamadı");
        return problem;
    }

    /**
     * Dosya boyutu aşımı → 413 Payload Too Large.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ProblemDetail handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Dosya boyutu aşımı: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.PAYLOAD_TOO_LARGE,
                "Yüklenen dosya boyutu izin verilen sınırı aşıyor");
        problem.setType(URI.create(ERROR_BASE_URI + "payload-too-large"));
        problem.setTitle("Dosya Boyutu Aşımı");
        return problem;
    }

    /**
     * Genel istek hatası → 400 Bad Request.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Geçersiz parametre: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "bad-request"));
        problem.setTitle("Geçersiz İstek");
        return problem;
    }

    /**
     * Bean Validation hatası → 400 Bad Request.
     */
    @ExceptionHandler(BindException.class)
    public ProblemDetail handleBindException(BindException ex) {
        String detail = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Doğrulama hatası: {}", detail);
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setType(URI.create(ERROR_BASE_URI + "validation-error"));
        problem.setTitle("Doğrulama Hatası");
        return problem;
    }

    /**
     * Beklenmeyen hata → 500 Internal Server Error.
     */
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex) {
        log.error("Beklenmeyen hata: {}", ex.getMessage(), ex);
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Beklenmeyen bir hata oluştu. Lütfen tekrar deneyin.");
        problem.setType(URI.create(ERROR_BASE_URI + "internal-error"));
        problem.setTitle("Sunucu Hatası");
        return problem;
    }
}
