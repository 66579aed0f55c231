package org.l5xexport.report;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.Charset;
import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * L5X 导出的 Bean 装配。
 * <p>
 * 把配置 {@link L5xExportProperties} 注入到冲突安全写入器中；全部基于本地文件系统，不引入外部依赖。
 */
@Configuration(proxyBeanMethods = false)
public class L5xExportConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ConflictSafeFileWriter conflictSafeFileWriter(L5xExportProperties properties, Clock clock) {
        return new ConflictSafeFileWriter(
                Charset.forName(properties.getOutputCharset()),
                DateTimeFormatter.ofPattern(properties.getConflictTimestampPattern()),
                properties.getMaxConflictAttempts(),
                clock
        );
    }

    @Bean
    public ReportFormatter reportFormatter() {
        return new ReportFormatter();
    }

    @Bean
    public L5xReportExporter l5xReportExporter(ReportFormatter formatter, ConflictSafeFileWriter writer) {
        return new L5xReportExporter(formatter, writer);
    }
}
