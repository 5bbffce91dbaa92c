package com.firmware.inspector.report;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.firmware.inspector.analysis.InspectionResult;
import com.firmware.inspector.grouping.model.SpecializationSummary;
import com.firmware.inspector.grouping.model.TemplateGroupSummary;
import com.firmware.inspector.util.FileWriteUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders an inspection result as a Markdown report.
 */
public class MarkdownReportWriter {
    private static final Logger log = LoggerFactory.getLogger(MarkdownReportWriter.class);

    static final String TEMPLATE_NAME = "template-groups-report.md.ftl";

    private final Configuration freemarkerConfig;

    public MarkdownReportWriter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setNumberFormat("computer");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public void write(InspectionResult result, ReportOptions options, String imageName, Path target)
            throws IOException {
        FileWriteUtil.safeWriteString(target, render(result, options, imageName));
        log.info("Report written to {}", target.toAbsolutePath());
    }

    public String render(InspectionResult result, ReportOptions options, String imageName) throws IOException {
        Map<String, Object> model = new HashMap<>();
        if (imageName != null) {
            model.put("imageName", imageName);
        }
        model.put("symbolCount", result.getSymbols().size());
        model.put("sectionCount", result.getSections().size());
        model.put("groupCount", result.getGroups().size());
        model.put("templateGroupCount", result.getTemplateGroupCount());
        model.put("totalSizeBytes", result.getTotalSizeBytes());
        model.put("totalUniqueSizeBytes", result.getTotalUniqueSizeBytes());
        model.put("templatesOnly", options.isTemplatesOnly());
        model.put("groups", buildViews(result.getGroups(), options));
        model.put("warnings", result.getDiagnostics() != null ? result.getDiagnostics().getWarnings() : List.of());

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render report template " + TEMPLATE_NAME + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    private static List<ReportGroupView> buildViews(List<TemplateGroupSummary> groups, ReportOptions options) {
        List<TemplateGroupSummary> ranked = GroupRanking.top(groups, options.isTemplatesOnly(), options.getTopGroups());
        List<ReportGroupView> views = new ArrayList<>(ranked.size());
        int rank = 1;
        for (TemplateGroupSummary group : ranked) {
            List<SpecializationSummary> shown = GroupRanking.topSpecializations(group, options.getTopSpecializations());
            views.add(new ReportGroupView(rank++, group, shown, group.getSpecializations().size() - shown.size()));
        }
        return views;
    }
}
