package org.l5xexport.cli;

import org.l5xexport.l5x.ErrorCategory;
import org.l5xexport.l5x.L5xException;
import org.l5xexport.l5x.L5xNotFoundException;
import org.l5xexport.report.L5xReportExporter;
import org.l5xexport.report.ReportCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 命令行入口：{@code l5x-export <l5x_path> <out_dir> [-v|--verbose]}。
 * <p>
 * 退出码：
 * <ul>
 *   <li>0：全部报告导出成功</li>
 *   <li>1：文件不存在 / XML 解析失败 / 根元素不符 / 其它未预期错误</li>
 *   <li>2：参数错误</li>
 * </ul>
 * 只有这里会兜底捕获异常；verbose 模式下额外打印完整堆栈。
 */
@Component
public class L5xExportCommand implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(L5xExportCommand.class);

    private final L5xReportExporter exporter;
    private final PrintStream out;
    private final PrintStream err;
    private int exitCode = EXIT_OK;

    @Autowired
    public L5xExportCommand(L5xReportExporter exporter) {
        this(exporter, System.out, System.err);
    }

    public L5xExportCommand(L5xReportExporter exporter, PrintStream out, PrintStream err) {
        this.exporter = exporter;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public int execute(String... args) {
        boolean verbose = false;
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "-h":
                case "--help":
                    printUsage(out);
                    return EXIT_OK;
                case "-v":
                case "--verbose":
                    verbose = true;
                    break;
                default:
                    // --key=value 交给 Spring 作为配置属性处理
                    if (arg.startsWith("--") && arg.contains("=")) {
                        break;
                    }
                    if (arg.startsWith("-")) {
                        err.println("Error: unknown argument: " + arg);
                        printUsage(err);
                        return EXIT_USAGE;
                    }
                    positional.add(arg);
            }
        }
        if (positional.size() != 2) {
            err.println("Error: expected <l5x_path> and <out_dir>");
            printUsage(err);
            return EXIT_USAGE;
        }

        String l5xPath = positional.get(0);
        out.println("Processing file: " + l5xPath);

        try {
            Path outDir = Path.of(positional.get(1));
            exporter.exportAll(Path.of(l5xPath), outDir,
                    (category, written) -> out.println("  > " + category.displayName() + " exported to " + written));
            out.println();
            out.println("Export completed successfully!");
            return EXIT_OK;
        } catch (L5xNotFoundException e) {
            log.info("Export aborted ({}): {} does not exist", e.category(), e.path());
            err.println("Error: The file '" + l5xPath + "' does not exist.");
            return EXIT_FAILURE;
        } catch (L5xException e) {
            log.info("Export aborted ({}): {}", e.category(), e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (Exception e) {
            // 控制台只有 WARN 以上；完整堆栈记入文件日志
            log.info("Export aborted ({}): {} failed", ErrorCategory.UNEXPECTED, l5xPath, e);
            err.println("An unexpected error occurred: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return EXIT_FAILURE;
        }
    }

    static void printUsage(PrintStream stream) {
        stream.println("Usage: l5x-export <l5x_path> <out_dir> [-v|--verbose]");
        stream.println();
        stream.println("Rockwell L5X Logic Export Tool - Extract PLC logic to text format");
        stream.println();
        stream.println("Options:");
        stream.println("  -v, --verbose   Print the full stack trace on unexpected errors");
        stream.println("  -h, --help      Show this help");
        stream.println();
        stream.println("Output Files:");
        for (ReportCategory category : ReportCategory.values()) {
            stream.println(String.format("  - %-29s: %s", category.fileName(), category.summary()));
        }
    }
}
