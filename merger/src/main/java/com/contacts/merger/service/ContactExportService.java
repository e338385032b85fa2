package com.contacts.merger.service;

import com.contacts.merger.exception.ContactExportException;
import com.contacts.merger.export.ContactRowProjector;
import com.contacts.merger.model.ContactRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class ContactExportService {

    private static final Logger logger = LoggerFactory.getLogger(ContactExportService.class);

    // spreadsheet tools only detect UTF-8 when the file starts with a BOM
    static final String UTF8_BOM = "\uFEFF";

    private final ContactRowProjector rowProjector;

    public ContactExportService(ContactRowProjector rowProjector) {
        this.rowProjector = rowProjector;
    }

    /**
     * Builds the merged CSV content, using {@code template} (the primary export's header) as the
     * column layout.
     */
    public String generateCsvContent(Map<String, ContactRecord> merged, List<String> template) throws IOException {
        List<String> columns = rowProjector.resolveColumns(template);
        StringWriter writer = new StringWriter();
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader(columns.toArray(new String[0]))
                .build();

        try (CSVPrinter csvPrinter = new CSVPrinter(writer, csvFormat)) {
            for (Map.Entry<String, ContactRecord> entry : merged.entrySet()) {
                Map<String, String> row = rowProjector.project(entry.getKey(), entry.getValue(), columns);
                List<String> values = new ArrayList<>(columns.size());
                for (String column : columns) {
                    values.add(row.get(column));
                }
                csvPrinter.printRecord(values);
            }
        }
        return writer.toString();
    }

    public byte[] renderCsv(Map<String, ContactRecord> merged, List<String> template) {
        try {
            return (UTF8_BOM + generateCsvContent(merged, template)).getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ContactExportException("Failed to render merged contacts", e);
        }
    }

    public Path exportContacts(Map<String, ContactRecord> merged, List<String> template, Path outputFile) {
        logger.info("Exporting {} contacts to '{}'.", merged.size(), outputFile);
        try {
            if (outputFile.getParent() != null) {
                Files.createDirectories(outputFile.getParent());
            }
            Files.write(outputFile, renderCsv(merged, template));
            logger.info("✅ Successfully saved {} contacts to '{}'", merged.size(), outputFile);
            return outputFile;
        } catch (IOException e) {
            logger.error("❌ Failed to save contacts to '{}': {}", outputFile, e.getMessage(), e);
            throw new ContactExportException("Failed to save contacts to " + outputFile, e);
        }
    }
}
