package org.l5xexport.report;

import org.l5xexport.l5x.L5xAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * 报告导出：抽取 -> 格式化 -> 冲突安全写入，每个 {@link ReportCategory} 一个文件。
 * <p>
 * 各报告之间互不依赖，顺序无语义；单个报告内部的顺序与源文档一致。
 */
public class L5xReportExporter {

    private static final Logger log = LoggerFactory.getLogger(L5xReportExporter.class);

    private final ReportFormatter formatter;
    private final ConflictSafeFileWriter writer;

    public L5xReportExporter(ReportFormatter formatter, ConflictSafeFileWriter writer) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * 加载并校验 L5X 文件；失败时抛出 {@link org.l5xexport.l5x.L5xException} 的子类。
     */
    public L5xAnalyzer open(Path l5xFile) {
        return L5xAnalyzer.open(l5xFile);
    }

    public String render(L5xAnalyzer analyzer, ReportCategory category) {
        switch (category) {
            case CONTROLLER_INFO:
                return formatter.formatControllerInfo(analyzer.getControllerInfo());
            case GLOBAL_TAGS:
                return formatter.formatGlobalTags(analyzer.getGlobalTags());
            case DATA_TYPES:
                return formatter.formatDataTypes(analyzer.getDataTypes());
            case ADD_ON_INSTRUCTIONS:
                return formatter.formatInstructionDefinitions(analyzer.getInstructionDefinitions());
            case MODULES:
                return formatter.formatModules(analyzer.getModules());
            case TASKS:
                return formatter.formatTasks(analyzer.getTasks());
            case PROGRAMS:
                return formatter.formatPrograms(analyzer.getPrograms());
            default:
                throw new IllegalArgumentException("Unsupported report category: " + category);
        }
    }

    /**
     * 渲染并写入一个类别的报告，返回实际写入的路径。
     */
    public Path export(L5xAnalyzer analyzer, ReportCategory category, Path outDir) throws IOException {
        String text = render(analyzer, category);
        Path written = writer.write(outDir.resolve(category.fileName()), text);
        log.info("{} report written to {}", category.displayName(), written);
        return written;
    }

    public Map<ReportCategory, Path> exportAll(Path l5xFile, Path outDir) throws IOException {
        return exportAll(l5xFile, outDir, (category, written) -> {
        });
    }

    /**
     * 加载一次文档，按 {@link ReportCategory} 声明顺序逐个导出；每写完一个报告回调一次 {@code onWritten}。
     * <p>
     * 加载失败时不会写出任何文件；某个报告写入失败时立即中止，已写出的报告保留。
     */
    public Map<ReportCategory, Path> exportAll(Path l5xFile, Path outDir,
                                               BiConsumer<ReportCategory, Path> onWritten) throws IOException {
        L5xAnalyzer analyzer = open(l5xFile);
        Map<ReportCategory, Path> written = new EnumMap<>(ReportCategory.class);
        for (ReportCategory category : ReportCategory.values()) {
            Path path = export(analyzer, category, outDir);
            written.put(category, path);
            onWritten.accept(category, path);
        }
        return written;
    }
}
