package org.l5xexport.report;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.l5xexport.l5x.L5xAnalyzer;
import org.l5xexport.l5x.L5xFixtures;
import org.l5xexport.l5x.L5xNotFoundException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class L5xReportExporterTest {

    @TempDir
    Path tempDir;

    private final L5xReportExporter exporter = new L5xReportExporter(
            new ReportFormatter(),
            new ConflictSafeFileWriter(StandardCharsets.UTF_8, DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"), 100,
                    Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC)));

    @Test
    void exportAll_writesOneFilePerCategory() throws IOException {
        Path l5x = L5xFixtures.write(tempDir, "sample.L5X", L5xFixtures.SAMPLE);
        Path outDir = tempDir.resolve("reports");

        Map<ReportCategory, Path> written = exporter.exportAll(l5x, outDir);

        assertThat(written).containsOnlyKeys(ReportCategory.values());
        for (ReportCategory category : ReportCategory.values()) {
            assertThat(written.get(category)).isEqualTo(outDir.resolve(category.fileName())).isRegularFile();
        }
        assertThat(Files.readString(outDir.resolve("extract_controller_info.txt"))).startsWith("Name: Line1\n");
        assertThat(Files.readString(outDir.resolve("extract_data_types.txt"))).startsWith("USER DEFINED TYPES (UDTs) - Found 1");
        assertThat(Files.readString(outDir.resolve("extract_programs.txt"))).startsWith("PROGRAM: MainProgram");
    }

    @Test
    void exportAll_reportsEachWrittenFileInCategoryOrder() throws IOException {
        Path l5x = L5xFixtures.write(tempDir, "sample.L5X", L5xFixtures.SAMPLE);
        Path outDir = tempDir.resolve("reports");
        List<ReportCategory> seen = new ArrayList<>();

        Map<ReportCategory, Path> written = exporter.exportAll(l5x, outDir, (category, path) -> {
            assertThat(path).isRegularFile();
            seen.add(category);
        });

        assertThat(seen).containsExactly(ReportCategory.values());
        assertThat(written).hasSize(ReportCategory.values().length);
    }

    @Test
    void exportAll_secondRunKeepsFirstReports() throws IOException {
        Path l5x = L5xFixtures.write(tempDir, "sample.L5X", L5xFixtures.SAMPLE);
        Path outDir = tempDir.resolve("reports");
        exporter.exportAll(l5x, outDir);

        Map<ReportCategory, Path> second = exporter.exportAll(l5x, outDir);

        assertThat(second.get(ReportCategory.TASKS).getFileName().toString())
                .isEqualTo("extract_tasks_20240102_030405.txt");
        assertThat(outDir.resolve("extract_tasks.txt")).isRegularFile();
    }

    @Test
    void exportAll_missingInputWritesNothing() {
        Path outDir = tempDir.resolve("reports");

        assertThatThrownBy(() -> exporter.exportAll(tempDir.resolve("nope.L5X"), outDir))
                .isInstanceOf(L5xNotFoundException.class);
        assertThat(outDir).doesNotExist();
    }

    @Test
    void render_controllerInfoListsRemainingFieldsInSourceOrder() throws IOException {
        L5xAnalyzer analyzer = exporter.open(L5xFixtures.write(tempDir, "sample.L5X", L5xFixtures.SAMPLE));

        assertThat(exporter.render(analyzer, ReportCategory.CONTROLLER_INFO)).isEqualTo(
                "Name: Line1\n"
                        + "ProcessorType: 1756-L83E\n"
                        + "Description: Packaging line controller\n"
                        + "Use: Target\n"
                        + "MajorRev: 33\n"
                        + "MinorRev: 11");
    }

    @Test
    void render_handlesDocumentWithoutController() throws IOException {
        Path l5x = L5xFixtures.write(tempDir, "bare.L5X", "<RSLogix5000Content/>");

        L5xAnalyzer analyzer = exporter.open(l5x);

        assertThat(exporter.render(analyzer, ReportCategory.CONTROLLER_INFO)).isEmpty();
        assertThat(exporter.render(analyzer, ReportCategory.MODULES)).startsWith("I/O MODULES - Found 0");
        assertThat(exporter.render(analyzer, ReportCategory.PROGRAMS)).isEmpty();
    }
}
