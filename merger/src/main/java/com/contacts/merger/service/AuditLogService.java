package com.contacts.merger.service;

import com.contacts.merger.exception.ContactExportException;
import com.contacts.merger.model.AuditEntry;
import com.contacts.merger.model.FinalRowSnapshot;
import com.contacts.merger.model.MergeDelta;
import com.contacts.merger.model.MergeSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the per-contact audit trail of a merge run next to the merged CSV.
 */
@Service
public class AuditLogService {

    private static final Logger logger = LoggerFactory.getLogger(AuditLogService.class);

    private static final String[] CSV_HEADERS = {
            "Primary Contact",
            "Secondary Name",
            "Secondary Original Name",
            "Added Numbers",
            "Added First Name",
            "Added Last Name",
            "Final Phone Numbers",
            "Final Group Membership",
            "Final Sources",
            "Final Duplicates"
    };

    private final ObjectMapper objectMapper;

    public AuditLogService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Writes {@code {"summary": ..., "details": [...]}}.
     *
     * @return the written file, or {@code null} when there was nothing to log
     */
    public Path writeJsonLog(List<AuditEntry> entries, MergeSummary summary, Path file) {
        if (entries.isEmpty()) {
            logger.info("No detailed merge logs to write.");
            return null;
        }
        Map<String, Object> fullLog = new LinkedHashMap<>();
        fullLog.put("summary", summary);
        fullLog.put("details", entries);
        try {
            createParent(file);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), fullLog);
            logger.info("✅ Wrote {} detailed log entries with summary to '{}'.", entries.size(), file);
            return file;
        } catch (IOException e) {
            logger.error("❌ Failed to write detailed log '{}': {}", file, e.getMessage(), e);
            throw new ContactExportException("Failed to write detailed log " + file, e);
        }
    }

    public Path writeCsvLog(List<AuditEntry> entries, Path file) {
        if (entries.isEmpty()) {
            return null;
        }
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADERS).build();
        try {
            createParent(file);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writer.write(ContactExportService.UTF8_BOM);
                try (CSVPrinter csvPrinter = new CSVPrinter(writer, csvFormat)) {
                    for (AuditEntry entry : entries) {
                        MergeDelta delta = entry.getUpdateData();
                        FinalRowSnapshot finalRow = entry.getFinalRow();
                        csvPrinter.printRecord(
                                entry.getPrimaryName(),
                                delta.getSecondaryName(),
                                delta.getSecondaryOriginalName(),
                                String.join(", ", delta.getAddedNumbers()),
                                delta.isAddedFirstName(),
                                delta.isAddedLastName(),
                                String.join(", ", finalRow.getPhones()),
                                finalRow.getGroupMembership(),
                                finalRow.getSources(),
                                finalRow.getDuplicates()
                        );
                    }
                }
            }
            logger.info("✅ Wrote {} detailed log entries to CSV '{}'.", entries.size(), file);
            return file;
        } catch (IOException e) {
            logger.error("❌ Failed to write detailed CSV log '{}': {}", file, e.getMessage(), e);
            throw new ContactExportException("Failed to write detailed CSV log " + file, e);
        }
    }

    /**
     * Human-readable run log: inputs, totals and, per updated contact, the original row, the
     * update applied and the final row.
     */
    public Path writeTextLog(String runId, String primaryFile, List<String> secondaryFiles, int totalMerged,
                             List<AuditEntry> entries, Path file) {
        StringBuilder sb = new StringBuilder();
        sb.append("Merge run: ").append(runId).append('\n');
        sb.append("Primary file: ").append(primaryFile).append('\n');
        sb.append("Secondary files: ").append(secondaryFiles).append('\n');
        sb.append("Total merged contacts: ").append(totalMerged).append("\n\n");

        if (entries.isEmpty()) {
            sb.append("No detailed per-row logs available.\n");
        } else {
            sb.append("DETAILED ROW UPDATES:\n");
            for (AuditEntry entry : entries) {
                sb.append("---\n");
                sb.append("1) Original primary row:\n");
                sb.append(entry.getOriginalPrimaryRow() != null ? entry.getOriginalPrimaryRow().toString() : "<no original row preserved>")
                        .append('\n');
                sb.append("2) Update data applied:\n").append(entry.getUpdateData()).append('\n');
                sb.append("3) Final row in output:\n").append(entry.getFinalRow()).append('\n');
            }
            sb.append("---\n");
        }

        try {
            createParent(file);
            Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
            logger.info("✅ Log saved to '{}'", file);
            return file;
        } catch (IOException e) {
            logger.error("❌ Failed to write run log '{}': {}", file, e.getMessage(), e);
            throw new ContactExportException("Failed to write run log " + file, e);
        }
    }

    private static void createParent(Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
    }
}
