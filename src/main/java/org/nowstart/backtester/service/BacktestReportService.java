package org.nowstart.backtester.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.BacktestResult;
import org.springframework.stereotype.Service;

/**
 * Serializes a {@link BacktestResult} as indented JSON with ISO-8601 timestamps.
 */
@Slf4j
@Service
public class BacktestReportService {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(BacktestResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize backtest result", e);
        }
    }

    public Path write(BacktestResult result, Path path) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), result);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write report: " + path, e);
        }
        log.info("[Report] saved path={} trades={}", path.toAbsolutePath(), result.trades().size());
        return path;
    }
}
