package com.pivotbot.backend.service.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.model.CycleReport;
import com.pivotbot.backend.service.util.AtomicFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Rewrites the status report file with the latest cycle report.
 */
@Service
public class JsonStatusReportRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(JsonStatusReportRenderer.class);

    private final ObjectMapper objectMapper;
    private final Path reportFile;

    @Autowired
    public JsonStatusReportRenderer(ObjectMapper objectMapper, TradingProperties properties) {
        this(objectMapper, Paths.get(properties.getReportFile()));
    }

    JsonStatusReportRenderer(ObjectMapper objectMapper, Path reportFile) {
        this.objectMapper = objectMapper;
        this.reportFile = reportFile;
    }

    @Override
    public void render(CycleReport report) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
            AtomicFileWriter.write(reportFile, json);
            logger.debug("Status report written to {}", reportFile);
        } catch (IOException e) {
            logger.warn("Could not write status report to {}: {}", reportFile, e.getMessage());
        }
    }
}
