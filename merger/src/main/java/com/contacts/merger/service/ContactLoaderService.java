package com.contacts.merger.service;

import com.contacts.merger.model.PrimaryContact;
import com.contacts.merger.model.PrimarySourceData;
import com.contacts.merger.model.SecondaryContact;
import com.contacts.merger.model.TabularFile;
import com.contacts.merger.normalizer.GroupNameMapper;
import com.contacts.merger.normalizer.NameNormalizer;
import com.contacts.merger.normalizer.PhoneNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class ContactLoaderService {

    private static final Logger logger = LoggerFactory.getLogger(ContactLoaderService.class);

    private static final int MAX_PHONE_COLUMNS = 9;

    private final TabularFileReader tabularFileReader;
    private final PhoneNormalizer phoneNormalizer;
    private final SecondaryContactFactory secondaryContactFactory;

    public ContactLoaderService(TabularFileReader tabularFileReader, PhoneNormalizer phoneNormalizer,
                                SecondaryContactFactory secondaryContactFactory) {
        this.tabularFileReader = tabularFileReader;
        this.phoneNormalizer = phoneNormalizer;
        this.secondaryContactFactory = secondaryContactFactory;
    }

    /**
     * Loads an address-book CSV export. Rows without any name are skipped; a later row with the
     * same display name replaces the earlier one.
     */
    public PrimarySourceData loadPrimary(Path path) {
        logger.info("Loading primary contacts from CSV: '{}'", path);
        TabularFile file = tabularFileReader.read(path);
        Map<String, PrimaryContact> contacts = toPrimaryContacts(file);
        logger.info("Loaded {} primary contacts from CSV.", contacts.size());
        return new PrimarySourceData(file.getHeaders(), contacts);
    }

    Map<String, PrimaryContact> toPrimaryContacts(TabularFile file) {
        Map<String, PrimaryContact> contacts = new LinkedHashMap<>();
        int skipped = 0;
        for (Map<String, String> row : file.getRows()) {
            String first = value(row, "First Name");
            String middle = value(row, "Middle Name");
            String last = value(row, "Last Name");

            String rawName = value(row, "Name");
            if (rawName.isEmpty()) {
                rawName = Stream.of(first, middle, last).filter(p -> !p.isEmpty()).collect(Collectors.joining(" "));
            }
            if (rawName.isEmpty()) {
                skipped++;
                continue;
            }

            String groupsRaw = value(row, "Labels");
            if (groupsRaw.isEmpty()) {
                groupsRaw = value(row, "Group Membership");
            }
            if (groupsRaw.isEmpty()) {
                groupsRaw = GroupNameMapper.MY_CONTACTS;
            }

            boolean markerGroup = GroupNameMapper.isMarkerGroup(groupsRaw);
            String name = NameNormalizer.normalizeDisplayName(rawName, markerGroup, true);

            List<String> phoneCells = new ArrayList<>();
            for (int i = 1; i <= MAX_PHONE_COLUMNS; i++) {
                String cell = row.get("Phone " + i + " - Value");
                if (cell != null) {
                    phoneCells.add(cell);
                }
            }
            Set<String> groups = new LinkedHashSet<>();
            groups.add(GroupNameMapper.normalize(groupsRaw));

            Map<String, String> snapshot = new LinkedHashMap<>();
            row.forEach((column, cell) -> snapshot.put(column, cell == null ? "" : cell));

            contacts.put(name, PrimaryContact.builder()
                    .numbers(new LinkedHashSet<>(phoneNormalizer.expandAndNormalize(phoneCells)))
                    .groups(groups)
                    .protectedRecord(!markerGroup)
                    .comparisonKey(NameNormalizer.comparisonKey(name))
                    .firstName(first)
                    .middleName(middle)
                    .lastName(last)
                    .fieldSnapshot(snapshot)
                    .build());
        }
        if (skipped > 0) {
            logger.warn("⚠️ Skipped {} primary row(s) without a name.", skipped);
        }
        return contacts;
    }

    /**
     * Loads a secondary CSV dump: the first column is the full name, every other column may hold
     * phone numbers. Rows without a usable number are skipped.
     */
    public Map<String, SecondaryContact> loadSecondary(Path path) {
        logger.info("Loading secondary contacts from CSV: '{}'", path);
        TabularFile file = tabularFileReader.read(path);
        Map<String, SecondaryContact> contacts = new LinkedHashMap<>();
        for (Map<String, String> row : file.getRows()) {
            List<String> values = TabularFile.valuesOf(row);
            if (values.isEmpty()) {
                continue;
            }
            Map.Entry<String, SecondaryContact> entry =
                    secondaryContactFactory.fromRow(values.get(0), values.subList(1, values.size()));
            if (entry != null) {
                contacts.put(entry.getKey(), entry.getValue());
            }
        }
        logger.info("Loaded {} secondary contacts from CSV.", contacts.size());
        return contacts;
    }

    private static String value(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null ? "" : value.trim();
    }
}
