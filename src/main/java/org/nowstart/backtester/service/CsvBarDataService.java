package org.nowstart.backtester.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.exception.DataLoadException;
import org.nowstart.backtester.strategy.core.BarSeries;
import org.nowstart.backtester.strategy.core.OhlcvCandle;
import org.springframework.stereotype.Service;

/**
 * Reads and writes {@code timestamp,open,high,low,close,volume} CSV files.
 *
 * <p>Columns are located by header name, case-insensitively. Timestamps without an offset are read as UTC.
 * Rows are neither sorted nor de-duplicated: a malformed row or an out-of-order timestamp fails the load.
 */
@Slf4j
@Service
public class CsvBarDataService {

    static final String CSV_HEADER = "timestamp,open,high,low,close,volume";

    private static final List<String> TIMESTAMP_COLUMNS = List.of("timestamp", "date", "datetime", "time");
    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            Instant::parse,
            value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
            value -> LocalDateTime.parse(value, SPACE_SEPARATED).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    public BarSeries loadBars(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DataLoadException("Failed to read CSV: " + path, e);
        }
        if (lines.isEmpty() || lines.get(0).isBlank()) {
            throw new DataLoadException("CSV header is missing: " + path);
        }

        Columns columns = Columns.of(splitCsvLine(stripBom(lines.get(0))), path);
        if (columns.volume() < 0) {
            log.warn("[Data] volume column missing path={}, using 0", path.toAbsolutePath());
        }

        List<OhlcvCandle> candles = new ArrayList<>(lines.size());
        Instant previous = null;
        for (int i = 1; i < lines.size(); i++) {
            int lineNumber = i + 1;
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            OhlcvCandle candle = parseRow(splitCsvLine(line), columns, path, lineNumber);
            if (previous != null && !candle.timestamp().isAfter(previous)) {
                throw new DataLoadException(
                        path + ":" + lineNumber + " timestamp " + candle.timestamp()
                                + " is not after the previous row " + previous
                );
            }
            previous = candle.timestamp();
            candles.add(candle);
        }

        log.info("[Data] loaded path={} rows={}", path.toAbsolutePath(), candles.size());
        return BarSeries.of(candles);
    }

    public void saveBars(Path path, BarSeries series) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }

            List<String> lines = new ArrayList<>(series.size() + 1);
            lines.add(CSV_HEADER);
            for (OhlcvCandle c : series.candles()) {
                lines.add(
                        c.timestamp().toString()
                                + "," + c.open()
                                + "," + c.high()
                                + "," + c.low()
                                + "," + c.close()
                                + "," + c.volume()
                );
            }

            Files.write(path, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DataLoadException("Failed to save CSV: " + path, e);
        }
    }

    private OhlcvCandle parseRow(String[] parts, Columns columns, Path path, int lineNumber) {
        if (parts.length < columns.width()) {
            throw new DataLoadException(
                    path + ":" + lineNumber + " expected " + columns.width() + " columns, got " + parts.length
            );
        }
        try {
            return new OhlcvCandle(
                    parseTs(parts[columns.timestamp()]),
                    parseDouble(parts[columns.open()]),
                    parseDouble(parts[columns.high()]),
                    parseDouble(parts[columns.low()]),
                    parseDouble(parts[columns.close()]),
                    columns.volume() < 0 ? 0.0 : parseDouble(parts[columns.volume()])
            );
        } catch (IllegalArgumentException e) {
            throw new DataLoadException(path + ":" + lineNumber + " " + e.getMessage(), e);
        }
    }

    static Instant parseTs(String raw) {
        String value = raw.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("timestamp is empty");
        }
        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new IllegalArgumentException("unparsable timestamp: " + value, lastFailure);
    }

    private static double parseDouble(String raw) {
        String value = raw.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing numeric value");
        }
        return Double.parseDouble(value);
    }

    private static String[] splitCsvLine(String line) {
        return line.split(",", -1);
    }

    private static String stripBom(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }

    private record Columns(int timestamp, int open, int high, int low, int close, int volume, int width) {

        static Columns of(String[] header, Path path) {
            Map<String, Integer> byName = new HashMap<>();
            for (int i = 0; i < header.length; i++) {
                byName.putIfAbsent(header[i].trim().toLowerCase(Locale.ROOT), i);
            }

            int timestamp = -1;
            for (String candidate : TIMESTAMP_COLUMNS) {
                if (byName.containsKey(candidate)) {
                    timestamp = byName.get(candidate);
                    break;
                }
            }
            if (timestamp < 0) {
                throw new DataLoadException("CSV header has no timestamp column: " + path);
            }

            int open = required(byName, "open", path);
            int high = required(byName, "high", path);
            int low = required(byName, "low", path);
            int close = required(byName, "close", path);
            int volume = byName.getOrDefault("volume", -1);
            int width = 1 + Math.max(Math.max(timestamp, volume), Math.max(Math.max(open, high), Math.max(low, close)));
            return new Columns(timestamp, open, high, low, close, volume, width);
        }

        private static int required(Map<String, Integer> byName, String column, Path path) {
            Integer index = byName.get(column);
            if (index == null) {
                throw new DataLoadException("CSV header has no " + column + " column: " + path);
            }
            return index;
        }
    }
}
