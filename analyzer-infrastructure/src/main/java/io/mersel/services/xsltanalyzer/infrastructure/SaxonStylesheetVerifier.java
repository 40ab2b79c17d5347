package io.mersel.services.xsltanalyzer.infrastructure;

import net.sf.saxon.s9api.Processor;
import net.sf.saxon.s9api.SaxonApiException;
import net.sf.saxon.s9api.XsltCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.xml.transform.TransformerException;
import javax.xml.transform.stream.StreamSource;
import java.io.StringReader;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Saxon HE ile stylesheet statik derleme kontrolü.
 * <p>
 * Analizi hiçbir zaman durdurmaz; derleme hataları ve uyarıları metin olarak döndürülür.
 * Güvenlik: {@code xsl:import}/{@code xsl:include} ile harici kaynaklara erişim engellenir.
 */
@Component
public class SaxonStylesheetVerifier {

    private static final Logger log = LoggerFactory.getLogger(SaxonStylesheetVerifier.class);

    private final Processor processor = new Processor(false);

    /**
     * @param filePath Raporlama için dosya yolu
     * @param source   XSLT kaynak metni
     * @return derleme sorunları; sorunsuzsa boş liste
     */
    public List<String> verify(String filePath, String source) {
        List<String> issues = new ArrayList<>();
        XsltCompiler compiler = processor.newXsltCompiler();
        // SSRF koruması: harici URI çözümlemesini engelle
        compiler.setURIResolver((href, base) -> {
            throw new TransformerException("Güvenlik: Harici URI çözümlemesi devre dışı: " + href);
        });
        compiler.setErrorReporter(error -> {
            String msg = error.getMessage();
            if (error.getLocation() != null && error.getLocation().getLineNumber() > 0) {
                msg = String.format("Satır %d: %s", error.getLocation().getLineNumber(), msg);
            }
            issues.add(error.isWarning() ? "Uyarı: " + msg : msg);
        });

        try {
            compiler.compile(new StreamSource(new StringReader(source), systemId(filePath)));
        } catch (SaxonApiException e) {
            if (issues.isEmpty()) {
                issues.add(e.getMessage());
            }
        }

        if (!issues.isEmpty()) {
            log.warn("Saxon derleme kontrolü {} sorun buldu: {}", issues.size(), filePath);
        }
        return List.copyOf(issues);
    }

    /**
     * Saxon statik taban URI için mutlak bir sistem kimliği bekler.
     */
    private static String systemId(String filePath) {
        try {
            return Path.of(filePath).toAbsolutePath().toUri().toString();
        } catch (InvalidPathException e) {
            log.debug("Dosya yolu URI'ye çevrilemedi, sistem kimliği olmadan derleniyor: {}", filePath);
            return null;
        }
    }

    public String engineVersion() {
        return net.sf.saxon.Version.getProductVersion();
    }
}
