package com.pricetrack.ingest.service;

import com.pricetrack.config.TrackerProperties;
import com.pricetrack.ingest.error.InvalidInputException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Submits one job per web code listed in the watchlist CSV when
 * {@code tracker.cli.run} is set.
 */
@Component
public class WatchlistCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(WatchlistCliRunner.class);

    private final TrackerProperties properties;
    private final JobOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public WatchlistCliRunner(
        TrackerProperties properties,
        JobOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        Path watchlist = resolvePath(properties.getCli().getWatchlistCsv());
        List<String> jobIds = submitAll(readWebCodes(watchlist));
        log.info("Submitted {} job(s) from watchlist {}", jobIds.size(), watchlist);

        if (properties.getCli().isExitAfterSubmit()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    List<String> submitAll(List<String> webCodes) {
        List<String> jobIds = new ArrayList<>();
        for (String webCode : webCodes) {
            try {
                jobIds.add(orchestratorService.submit(webCode));
            } catch (InvalidInputException e) {
                log.warn("Skipping watchlist entry '{}': {}", webCode, e.getMessage());
            }
        }
        return jobIds;
    }

    List<String> readWebCodes(Path watchlist) {
        Set<String> webCodes = new LinkedHashSet<>();
        try (Reader reader = Files.newBufferedReader(watchlist, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String webCode = getColumn(record, "web_code", "webcode", "sku");
                if (webCode == null) {
                    log.warn("Watchlist row {} has no web code", record.getRecordNumber());
                    continue;
                }
                webCodes.add(webCode);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read watchlist " + watchlist, e);
        }
        return List.copyOf(webCodes);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
