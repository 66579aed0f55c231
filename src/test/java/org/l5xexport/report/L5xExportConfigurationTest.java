package org.l5xexport.report;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

class L5xExportConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(TestConfig.class);

    @Test
    void defaultsBindAndWireExporter() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            L5xExportProperties properties = context.getBean(L5xExportProperties.class);
            assertThat(properties.getOutputCharset()).isEqualTo("UTF-8");
            assertThat(properties.getConflictTimestampPattern()).isEqualTo("yyyyMMdd_HHmmss");
            assertThat(properties.getMaxConflictAttempts()).isEqualTo(1000);
            assertThat(context).hasSingleBean(L5xReportExporter.class);
            assertThat(context).hasSingleBean(ConflictSafeFileWriter.class);
        });
    }

    @Test
    void overridesAreBound() {
        contextRunner
                .withPropertyValues(
                        "app.l5x.output-charset=ISO-8859-1",
                        "app.l5x.conflict-timestamp-pattern=yyyyMMddHHmm",
                        "app.l5x.max-conflict-attempts=3")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    L5xExportProperties properties = context.getBean(L5xExportProperties.class);
                    assertThat(properties.getOutputCharset()).isEqualTo("ISO-8859-1");
                    assertThat(properties.getMaxConflictAttempts()).isEqualTo(3);
                });
    }

    @Test
    void invalidAttemptLimitFailsStartup() {
        contextRunner
                .withPropertyValues("app.l5x.max-conflict-attempts=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void blankCharsetFailsStartup() {
        contextRunner
                .withPropertyValues("app.l5x.output-charset=")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(L5xExportProperties.class)
    @Import(L5xExportConfiguration.class)
    static class TestConfig {
    }
}
