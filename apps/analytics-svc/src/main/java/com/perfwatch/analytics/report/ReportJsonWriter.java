package com.perfwatch.analytics.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.perfwatch.analytics.model.AnalysisReport;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Serializes reports as JSON with ISO-8601 timestamps.
 */
@Component
public class ReportJsonWriter {

    private final ObjectMapper objectMapper;

    public ReportJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String write(AnalysisReport report) {
        return serialize(report);
    }

    public String write(List<AnalysisReport> reports) {
        return serialize(reports);
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize analysis report", ex);
        }
    }
}
