package io.mersel.services.xsltanalyzer.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Analiz motoru bileşenlerini (ayrıştırıcı, analizciler, koordinatör, metrikler) tarar
 * ve analiz yapılandırma özelliklerini etkinleştirir.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.xsltanalyzer.infrastructure")
@EnableConfigurationProperties(AnalysisProperties.class)
public class InfrastructureConfig {
}
