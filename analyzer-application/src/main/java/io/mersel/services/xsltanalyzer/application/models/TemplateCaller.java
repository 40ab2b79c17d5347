package io.mersel.services.xsltanalyzer.application.models;

/**
 * Bir şablonu çağıran dosya + şablon ikilisi.
 */
public record TemplateCaller(String callingFile, String callingTemplate) {
}
