package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.infrastructure.config.AnalysisProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AnalysisProperties birim testleri.
 * <p>
 * @PostConstruct validate() metodunun geçersiz değerleri varsayılana döndürdüğünü test eder.
 */
@DisplayName("AnalysisProperties")
class AnalysisPropertiesTest {

    @Test
    @DisplayName("varsayilan_degerler")
    void varsayilan_degerler() {
        var props = new AnalysisProperties();

        assertThat(props.getMaxPaths()).isEqualTo(10000);
        assertThat(props.getTimeoutMs()).isEqualTo(30000);
        assertThat(props.getBatchConcurrency()).isEqualTo(4);
        assertThat(props.isVerifyCompilation()).isTrue();
        assertThat(props.getCache().getMaxSize()).isEqualTo(200);
        assertThat(props.getCache().getTtlHours()).isEqualTo(24);
    }

    @Test
    @DisplayName("validate_gecerli_degerler: değerler korunmalı")
    void validate_gecerli_degerler() throws Exception {
        var props = new AnalysisProperties();
        props.setMaxPaths(500);
        props.setTimeoutMs(2000);
        props.setBatchConcurrency(8);

        invokeValidate(props);

        assertThat(props.getMaxPaths()).isEqualTo(500);
        assertThat(props.getTimeoutMs()).isEqualTo(2000);
        assertThat(props.getBatchConcurrency()).isEqualTo(8);
    }

    @Test
    @DisplayName("validate_sifir_ve_negatif: varsayılanlara dönmeli")
    void validate_sifir_ve_negatif() throws Exception {
        var props = new AnalysisProperties();
        props.setMaxPaths(0);
        props.setTimeoutMs(-1);
        props.setBatchConcurrency(-4);
        props.getCache().setMaxSize(0);
        props.getCache().setTtlHours(-2);

        invokeValidate(props);

        assertThat(props.getMaxPaths()).isEqualTo(10000);
        assertThat(props.getTimeoutMs()).isEqualTo(30000);
        assertThat(props.getBatchConcurrency()).isEqualTo(4);
        assertThat(props.getCache().getMaxSize()).isEqualTo(200);
        assertThat(props.getCache().getTtlHours()).isEqualTo(24);
    }

    private static void invokeValidate(AnalysisProperties props) throws Exception {
        Method validate = AnalysisProperties.class.getDeclaredMethod("validate");
        validate.setAccessible(true);
        validate.invoke(props);
    }
}
