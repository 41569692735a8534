package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.IndexHistory;
import com.gillianbc.socialsecurity.model.Projection;
import com.gillianbc.socialsecurity.model.ProjectionTable;
import com.gillianbc.socialsecurity.model.YearSeries;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the historical index table ({@code Year,Max_Wages,COLA,AWI}) and the projection table
 * ({@code Year,COLA,AWI_Increase}) from comma separated files, from the classpath or the file system.
 * Columns are found by header name; a blank cell means the year has no value.
 */
@Slf4j
public class IndexTableReader {

    static final String YEAR = "Year";
    static final String MAX_WAGES = "Max_Wages";
    static final String COLA = "COLA";
    static final String AWI = "AWI";
    static final String AWI_INCREASE = "AWI_Increase";

    public IndexHistory readHistory(String resource) {
        return toHistory(readResource(resource), resource);
    }

    public IndexHistory readHistory(Path path) {
        return toHistory(readFile(path), path.toString());
    }

    public ProjectionTable readProjections(String resource) {
        return toProjections(readResource(resource), resource);
    }

    public ProjectionTable readProjections(Path path) {
        return toProjections(readFile(path), path.toString());
    }

    private IndexHistory toHistory(List<Map<String, String>> rows, String source) {
        if (rows.isEmpty()) {
            throw new IllegalStateException("history table " + source + " has no rows");
        }
        IndexHistory history = new IndexHistory(
                column(rows, MAX_WAGES, source),
                column(rows, COLA, source),
                column(rows, AWI, source));
        log.info("Loaded index history from {} ({} rows, current year {})", source, rows.size(), history.getCurrentYear());
        return history;
    }

    private ProjectionTable toProjections(List<Map<String, String>> rows, String source) {
        ProjectionTable table = new ProjectionTable(
                Projection.mapping(column(rows, COLA, source)),
                Projection.mapping(column(rows, AWI_INCREASE, source)));
        log.info("Loaded projections from {} ({} rows)", source, rows.size());
        return table;
    }

    private static YearSeries column(List<Map<String, String>> rows, String name, String source) {
        YearSeries series = new YearSeries();
        for (Map<String, String> row : rows) {
            if (!row.containsKey(name)) {
                throw new IllegalStateException("table " + source + " has no " + name + " column");
            }
            String cell = row.get(name);
            if (cell.isEmpty()) {
                continue;
            }
            series.put(parseYear(row.get(YEAR), source), parseNumber(cell, name, source));
        }
        return series;
    }

    private static int parseYear(String cell, String source) {
        if (cell == null) {
            throw new IllegalStateException("table " + source + " has no " + YEAR + " column");
        }
        try {
            return Integer.parseInt(cell);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("invalid year '" + cell + "' in " + source, e);
        }
    }

    private static BigDecimal parseNumber(String cell, String column, String source) {
        try {
            return new BigDecimal(cell);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("invalid " + column + " value '" + cell + "' in " + source, e);
        }
    }

    private List<Map<String, String>> readResource(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream in = IndexTableReader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("table resource not found on classpath: " + resource);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return parse(reader);
        } catch (IOException e) {
            log.error("Failed to read table resource {}", resource, e);
            throw new IllegalStateException("Failed to read table resource " + resource, e);
        }
    }

    private List<Map<String, String>> readFile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            log.error("Failed to read table file {}", path.toAbsolutePath(), e);
            throw new IllegalStateException("Failed to read table file " + path, e);
        }
    }

    private static List<Map<String, String>> parse(BufferedReader reader) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>();
        String header = reader.readLine();
        if (header == null) {
            return rows;
        }
        String[] columns = Arrays.stream(header.split(",", -1)).map(String::trim).toArray(String[]::new);
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            String[] cells = line.split(",", -1);
            Map<String, String> row = new HashMap<>();
            for (int i = 0; i < columns.length; i++) {
                row.put(columns[i], i < cells.length ? cells[i].trim() : "");
            }
            rows.add(row);
        }
        return rows;
    }
}
