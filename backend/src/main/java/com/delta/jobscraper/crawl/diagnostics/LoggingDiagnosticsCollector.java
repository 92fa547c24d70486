package com.delta.jobscraper.crawl.diagnostics;

import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class LoggingDiagnosticsCollector implements DiagnosticsCollector {
    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnosticsCollector.class);

    private final ObjectMapper objectMapper;

    public LoggingDiagnosticsCollector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void report(SourceDescriptor source, String errorType, String message, String pageUrl, Map<String, Object> context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", source.name());
        payload.put("group", source.group());
        payload.put("type", errorType);
        payload.put("message", message);
        payload.put("url", pageUrl);
        if (context != null && !context.isEmpty()) {
            payload.put("context", context);
        }
        log.warn("Diagnostic for {}: {}", source.name(), render(payload));
    }

    private String render(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return payload.toString();
        }
    }
}
