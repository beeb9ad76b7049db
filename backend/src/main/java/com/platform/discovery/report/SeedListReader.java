package com.platform.discovery.report;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.platform.discovery.config.SplunkClientConfig;
import com.platform.discovery.error.InvalidSeedListException;
import com.platform.discovery.model.SeedInstance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a seed list from CSV.
 * 
 * The header row must name the columns {@code address}, {@code port},
 * {@code username} and {@code password}, in any order; other columns are
 * ignored. An empty port falls back to the default management port.
 */
@Slf4j
@Component
public class SeedListReader {
    
    static final List<String> REQUIRED_COLUMNS = List.of("address", "port", "username", "password");
    
    private final CsvMapper csvMapper;
    private final SplunkClientConfig clientConfig;
    
    public SeedListReader(CsvMapper csvMapper, SplunkClientConfig clientConfig) {
        this.csvMapper = csvMapper;
        this.clientConfig = clientConfig;
    }
    
    public List<SeedInstance> read(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new InvalidSeedListException("Seed CSV is empty");
        }
        return read(new StringReader(csv));
    }
    
    public List<SeedInstance> read(Reader reader) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<SeedInstance> seeds = new ArrayList<>();
        
        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .with(CsvParser.Feature.TRIM_SPACES)
                .with(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .readValues(reader)) {
            
            boolean hasRows = rows.hasNextValue();
            checkHeader(headerOf(rows));
            
            int row = 0;
            while (hasRows) {
                row++;
                seeds.add(toSeed(row, normalizeHeader(rows.nextValue())));
                hasRows = rows.hasNextValue();
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new InvalidSeedListException("Malformed seed CSV: " + e.getMessage(), e);
        }
        
        log.debug("Read {} seeds from CSV", seeds.size());
        return seeds;
    }
    
    private SeedInstance toSeed(int row, Map<String, String> values) {
        String address = values.get("address");
        if (address == null || address.isBlank()) {
            throw new InvalidSeedListException(row, "address", "Address must not be blank");
        }
        
        String portText = values.get("port");
        int port = clientConfig.getDefaultPort();
        if (portText != null && !portText.isBlank()) {
            try {
                port = Integer.parseInt(portText.trim());
            } catch (NumberFormatException e) {
                throw new InvalidSeedListException(row, "port", "Port is not a number: " + portText);
            }
        }
        if (port < 1 || port > 65535) {
            throw new InvalidSeedListException(row, "port", "Port must be between 1 and 65535, got " + port);
        }
        
        String username = values.get("username");
        if (username == null || username.isBlank()) {
            throw new InvalidSeedListException(row, "username", "Username must not be blank");
        }
        
        String password = values.get("password");
        return new SeedInstance(address.trim(), port, username.trim(), password != null ? password : "");
    }
    
    private static Map<String, String> normalizeHeader(Map<String, String> values) {
        Map<String, String> normalized = new LinkedHashMap<>();
        values.forEach((column, value) -> normalized.put(column.trim().toLowerCase(Locale.ROOT), value));
        return normalized;
    }
    
    private static Set<String> headerOf(MappingIterator<?> rows) {
        Set<String> columns = new HashSet<>();
        if (rows.getParserSchema() instanceof CsvSchema csvSchema) {
            csvSchema.forEach(column -> columns.add(column.getName().trim().toLowerCase(Locale.ROOT)));
        }
        return columns;
    }
    
    private static void checkHeader(Set<String> columns) {
        List<String> missing = REQUIRED_COLUMNS.stream().filter(c -> !columns.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new InvalidSeedListException("Seed CSV header is missing columns " + missing);
        }
    }
}
