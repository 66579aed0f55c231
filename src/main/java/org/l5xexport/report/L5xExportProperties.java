package org.l5xexport.report;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * L5X 导出工具的业务配置（{@code app.l5x.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #outputCharset} 指定报告文件编码。</li>
 *   <li>目标文件已存在时不会覆盖，而是按 {@link #conflictTimestampPattern} 追加时间戳另存；
 *       时间戳文件名仍冲突时追加序号，最多尝试 {@link #maxConflictAttempts} 次。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.l5x")
public class L5xExportProperties {

    /**
     * 报告文件的字符集。
     */
    @NotBlank
    private String outputCharset = "UTF-8";

    /**
     * 冲突时追加到文件名中的时间戳格式（{@link java.time.format.DateTimeFormatter} 模式，系统时区）。
     */
    @NotBlank
    private String conflictTimestampPattern = "yyyyMMdd_HHmmss";

    /**
     * 时间戳文件名也冲突时，序号后缀的最大尝试次数（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int maxConflictAttempts = 1_000;

    public String getOutputCharset() {
        return outputCharset;
    }

    public void setOutputCharset(String outputCharset) {
        this.outputCharset = outputCharset;
    }

    public String getConflictTimestampPattern() {
        return conflictTimestampPattern;
    }

    public void setConflictTimestampPattern(String conflictTimestampPattern) {
        this.conflictTimestampPattern = conflictTimestampPattern;
    }

    public int getMaxConflictAttempts() {
        return maxConflictAttempts;
    }

    public void setMaxConflictAttempts(int maxConflictAttempts) {
        this.maxConflictAttempts = maxConflictAttempts;
    }
}
