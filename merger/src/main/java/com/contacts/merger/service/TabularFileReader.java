package com.contacts.merger.service;

import com.contacts.merger.exception.ContactSourceException;
import com.contacts.merger.model.TabularFile;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the CSV exports handed to the merger. Address-book exports come in UTF-8 (with or without
 * a BOM) or UTF-16, database dumps often in a Windows code page, so decoding falls back through
 * a fixed list of charsets.
 */
@Component
public class TabularFileReader {

    private static final Logger logger = LoggerFactory.getLogger(TabularFileReader.class);

    private static final List<Charset> FALLBACK_CHARSETS = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-1252"),
            StandardCharsets.ISO_8859_1
    );

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    public TabularFile read(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            logger.error("❌ Cannot open file '{}': {}", path, e.getMessage());
            throw new ContactSourceException("Cannot read file " + path, e);
        }

        Decoded decoded = decode(bytes, path);
        TabularFile file = parse(decoded.text, decoded.charset.name(), path);
        logger.info("Successfully read CSV '{}' with encoding '{}' ({} rows).", path, decoded.charset.name(), file.getRows().size());
        return file;
    }

    TabularFile parse(String text, String encoding, Path path) {
        List<String> headers = new ArrayList<>();
        List<Map<String, String>> rows = new ArrayList<>();
        int skipped = 0;

        try (CSVParser parser = CSVParser.parse(text, CSV_FORMAT)) {
            for (CSVRecord record : parser) {
                if (headers.isEmpty()) {
                    headers.addAll(cleanHeaders(record));
                    continue;
                }
                if (record.size() > headers.size()) {
                    skipped++;
                    continue;
                }
                Map<String, String> row = new LinkedHashMap<>();
                boolean blank = true;
                for (int i = 0; i < headers.size(); i++) {
                    String value = i < record.size() ? record.get(i) : "";
                    if (!value.trim().isEmpty()) {
                        blank = false;
                    }
                    row.put(headers.get(i), value);
                }
                if (!blank) {
                    rows.add(row);
                }
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            logger.error("❌ Malformed CSV '{}': {}", path, e.getMessage());
            throw new ContactSourceException("Cannot parse CSV file " + path, e);
        }

        if (skipped > 0) {
            logger.warn("⚠️ Skipped {} malformed line(s) in '{}'.", skipped, path);
        }
        return new TabularFile(headers, rows, encoding);
    }

    private Decoded decode(byte[] bytes, Path path) {
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            return tryDecode(bytes, 3, StandardCharsets.UTF_8, path, true);
        }
        if (bytes.length >= 2 && (((bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xFE)
                || ((bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF))) {
            return tryDecode(bytes, 0, StandardCharsets.UTF_16, path, true);
        }
        for (Charset charset : FALLBACK_CHARSETS) {
            Decoded decoded = tryDecode(bytes, 0, charset, path, false);
            if (decoded != null) {
                return decoded;
            }
        }
        throw new ContactSourceException("Cannot read file " + path + " with tried encodings.");
    }

    private Decoded tryDecode(byte[] bytes, int offset, Charset charset, Path path, boolean required) {
        try {
            String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset))
                    .toString();
            return new Decoded(text, charset);
        } catch (CharacterCodingException e) {
            if (required) {
                throw new ContactSourceException("File " + path + " is not valid " + charset.name(), e);
            }
            logger.warn("Could not read CSV '{}' with encoding '{}': {}", path, charset.name(), e.getMessage());
            return null;
        }
    }

    // strips BOM leftovers and renames repeated headers the way spreadsheet tools do ("Name", "Name.1")
    private static List<String> cleanHeaders(CSVRecord record) {
        List<String> headers = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String raw : record) {
            String header = raw.replace("\uFEFF", "").replace("ÿþ", "").trim();
            String unique = header;
            int suffix = 1;
            while (!seen.add(unique)) {
                unique = header + "." + suffix++;
            }
            headers.add(unique);
        }
        return headers;
    }

    private static final class Decoded {
        private final String text;
        private final Charset charset;

        private Decoded(String text, Charset charset) {
            this.text = text;
            this.charset = charset;
        }
    }
}
