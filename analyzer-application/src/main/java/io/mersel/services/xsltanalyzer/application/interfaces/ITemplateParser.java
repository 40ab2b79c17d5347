package io.mersel.services.xsltanalyzer.application.interfaces;

import io.mersel.services.xsltanalyzer.application.models.ParseResult;

import java.nio.file.Path;

/**
 * XSLT kaynağını şablon ve değişken modeline ayrıştıran servis arayüzü.
 */
public interface ITemplateParser {

    /**
     * Ham XSLT metnini ayrıştırır.
     *
     * @param source XSLT kaynak metni
     * @return şablonlar, değişkenler ve özet
     * @throws StylesheetParseException metin iyi biçimli XML değilse
     */
    ParseResult parse(String source) throws StylesheetParseException;

    /**
     * Dosyadan okuyarak ayrıştırır.
     *
     * @param file XSLT dosyası (UTF-8)
     * @return şablonlar, değişkenler ve özet
     * @throws StylesheetParseException dosya okunamazsa veya iyi biçimli XML değilse
     */
    ParseResult parse(Path file) throws StylesheetParseException;
}
