package io.mersel.services.xsltanalyzer.web;

import io.mersel.services.xsltanalyzer.infrastructure.config.InfrastructureConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * MERSEL XSLT Analyzer - Ana uygulama giriş noktası.
 * <p>
 * XSLT şablonlarını çalıştırmadan analiz eden ve test üretimi için
 * yürütme yollarını çıkaran servis.
 */
@SpringBootApplication
@Import(InfrastructureConfig.class)
public class XsltAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(XsltAnalyzerApplication.class, args);
    }
}
