package com.firmware.inspector.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.firmware.inspector.analysis.InspectionDiagnostics;
import com.firmware.inspector.analysis.InspectionResult;
import com.firmware.inspector.grouping.TemplateGroupBuilder;
import com.firmware.inspector.grouping.model.TemplateGroupSummary;
import com.firmware.inspector.model.Symbol;

import static org.assertj.core.api.Assertions.*;

class MarkdownReportWriterTest {

    @TempDir
    Path tempDir;

    private final MarkdownReportWriter writer = new MarkdownReportWriter();

    @Test
    void testRenderSummaryAndGroupTable() throws IOException {
        String report = writer.render(sampleResult(), ReportOptions.builder().build(), "app.elf");

        assertThat(report).startsWith("# Template group report");
        assertThat(report).contains("Image: `app.elf`");
        assertThat(report).contains("| Symbols | 5 |");
        assertThat(report).contains("| Template groups | 2 |");
        assertThat(report).contains("| Size (bytes) | 1184 |");
        assertThat(report).contains("| 1 | `Matrix` | yes | 3 | 2 | 1088 | 1088 | 512 | 64 |");
        assertThat(report).contains("| `main` | no | 1 | 1 | 80 | 80 | 80 | 80 |");
    }

    @Test
    void testDefaultReportOptions() {
        ReportOptions options = ReportOptions.builder().build();

        assertThat(options.getTopGroups()).isEqualTo(20);
        assertThat(options.getTopSpecializations()).isEqualTo(5);
        assertThat(options.isTemplatesOnly()).isFalse();
    }

    @Test
    void testRenderRanksByUniqueSize() throws IOException {
        String report = writer.render(sampleResult(), ReportOptions.builder().build(), null);

        assertThat(report).doesNotContain("Image:");
        assertThat(report.indexOf("`Matrix`")).isLessThan(report.indexOf("`main`"));
        assertThat(report.indexOf("`main`")).isLessThan(report.indexOf("`Pair`"));
    }

    @Test
    void testRenderTemplatesOnlyAndHiddenSpecializations() throws IOException {
        ReportOptions options = ReportOptions.builder().templatesOnly(true).topSpecializations(1).build();

        String report = writer.render(sampleResult(), options, "app.elf");

        assertThat(report).contains("## Largest template groups");
        assertThat(report).doesNotContain("main");
        assertThat(report).contains("### `Matrix`");
        assertThat(report).contains("| `float, 4` | 2 | 1024 | 1024 |");
        assertThat(report).contains("_1 more specialization(s) not shown._");
    }

    @Test
    void testRenderEscapesPipes() throws IOException {
        List<TemplateGroupSummary> groups = new TemplateGroupBuilder().build(List.of(
                Symbol.builder().id("sym_0").name("Pred<a|b>::eval()").size(4L).build()));
        InspectionResult result = InspectionResult.builder().success(true).groups(groups).build();

        String report = writer.render(result, ReportOptions.builder().build(), null);

        assertThat(report).contains("`a\\|b`");
    }

    @Test
    void testRenderEmptyResultWithWarnings() throws IOException {
        InspectionDiagnostics diagnostics = new InspectionDiagnostics();
        diagnostics.warn("Symbol stray at 0x30000000 does not fall within any known section.");
        InspectionResult result = InspectionResult.builder().success(true).diagnostics(diagnostics).build();

        String report = writer.render(result, ReportOptions.builder().build(), null);

        assertThat(report).contains("_No symbols to report._");
        assertThat(report).contains("## Diagnostics");
        assertThat(report).contains("- Symbol stray at 0x30000000");
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path target = tempDir.resolve("reports/nested/app.md");

        writer.write(sampleResult(), ReportOptions.builder().build(), "app.elf", target);

        assertThat(target).exists();
        assertThat(Files.readString(target)).contains("`Matrix`");
    }

    static InspectionResult sampleResult() {
        List<Symbol> symbols = List.of(
                symbol("sym_0", "Matrix<float, 4>::multiply(Matrix<float, 4> const&)", 512L, 0x100L),
                symbol("sym_1", "main", 80L, 0x300L),
                symbol("sym_2", "Matrix<float, 4>::invert()", 512L, 0x400L),
                symbol("sym_3", "Matrix<int, 2>::invert()", 64L, 0x600L),
                symbol("sym_4", "Pair<int, int>::swap()", 16L, 0x640L));

        return InspectionResult.builder()
                .success(true)
                .symbols(symbols)
                .groups(new TemplateGroupBuilder().build(symbols))
                .diagnostics(new InspectionDiagnostics())
                .build();
    }

    private static Symbol symbol(String id, String name, Long size, Long addr) {
        return Symbol.builder().id(id).name(name).size(size).sectionId("sec_1").addr(addr).build();
    }
}
