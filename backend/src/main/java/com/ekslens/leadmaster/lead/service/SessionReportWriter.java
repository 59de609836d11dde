package com.ekslens.leadmaster.lead.service;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.model.SessionReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Writes a completed session report as pretty-printed JSON, one file per run.
 */
@Component
public class SessionReportWriter {
    private static final Logger log = LoggerFactory.getLogger(SessionReportWriter.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
        .withZone(ZoneId.systemDefault());

    private final LeadMasterProperties properties;
    private final ObjectMapper objectMapper;

    public SessionReportWriter(LeadMasterProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Optional<Path> write(SessionReport report) {
        if (!properties.getReport().isEnabled()) {
            return Optional.empty();
        }
        Path directory = Paths.get(properties.getReport().getDirectory());
        Path target = directory.resolve(fileName(report));
        try {
            Files.createDirectories(directory);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("Failed to write session report {}", target, e);
            return Optional.empty();
        }
    }

    static String fileName(SessionReport report) {
        return "session_" + report.industryId() + "_" + FILE_TIMESTAMP.format(report.finishedAt()) + ".json";
    }
}
