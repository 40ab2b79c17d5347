package io.mersel.services.xsltanalyzer.web.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI dokümantasyon yapılandırması.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI xsltAnalyzerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("MERSEL XSLT Analyzer API")
                        .description("""
                                XSLT şablonları için statik analiz servisi.
                                
                                ## Aşamalar
                                - **Ayrıştırma**: Şablonlar, değişkenler, koşullar ve çağrılar çıkarılır
                                - **Semantik Analiz**: Veri akışı, kalıplar, kapsam ve sıcak noktalar
                                - **Yürütme Yolu Analizi**: Yürütme grafiği, yollar, kapsam ve test senaryoları
                                
                                Birden fazla dosya yüklendiğinde dosyalar arası bağımlılıklar da raporlanır.
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT")
                                .url("https://opensource.org/licenses/MIT"))
                        .contact(new Contact()
                                .name("Mersel")
                                .url("https://mersel.io")))
                .servers(List.of(
                        new Server().url("/").description("Yerel sunucu")
                ));
    }
}
