package com.contacts.merger.export;

import com.contacts.merger.model.ContactRecord;
import com.contacts.merger.normalizer.GroupNameMapper;
import com.contacts.merger.normalizer.PhoneNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens a merged record back into address-book columns so the result can be re-imported.
 * Untouched columns come from the record's original row; phones, labels, duplicate names and
 * sources are rewritten.
 */
@Component
public class ContactRowProjector {

    public static final int PHONE_SLOTS = 4;

    public static final List<String> REQUIRED_COLUMNS = List.of(
            "First Name",
            "Middle Name",
            "Last Name",
            "Group Membership",
            "Phone 1 - Type",
            "Phone 1 - Value",
            "Phone 2 - Type",
            "Phone 2 - Value",
            "Phone 3 - Type",
            "Phone 3 - Value",
            "Phone 4 - Type",
            "Phone 4 - Value",
            "Labels",
            "Custom Field 1 - Label",
            "Custom Field 1 - Value",
            "Custom Field 2 - Label",
            "Custom Field 2 - Value"
    );

    private static final String DEFAULT_PHONE_TYPE = "Mobile";
    private static final String DUPLICATES_LABEL = "Duplicate Names";
    private static final String SOURCES_LABEL = "Sources";

    private final PhoneNormalizer phoneNormalizer;

    public ContactRowProjector(PhoneNormalizer phoneNormalizer) {
        this.phoneNormalizer = phoneNormalizer;
    }

    /**
     * Template columns without {@code Name} (the importer rebuilds it), followed by any required
     * column the template lacks. No template means exactly the required columns.
     */
    public List<String> resolveColumns(List<String> template) {
        List<String> columns = new ArrayList<>();
        if (template != null) {
            for (String column : template) {
                if (!"Name".equals(column) && !columns.contains(column)) {
                    columns.add(column);
                }
            }
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.contains(required)) {
                columns.add(required);
            }
        }
        return columns;
    }

    public Map<String, String> project(String name, ContactRecord record, List<String> columns) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : columns) {
            row.put(column, "");
        }

        String groups = record.getGroups().isEmpty() ? GroupNameMapper.MY_CONTACTS : record.joinedGroups();
        groups = GroupNameMapper.normalize(groups);

        if (record.hasFieldSnapshot()) {
            for (String column : columns) {
                String original = record.getFieldSnapshot().get(column);
                row.put(column, original == null ? "" : original);
            }
        } else {
            row.put("First Name", name);
        }

        List<String> existing = new ArrayList<>();
        for (int i = 1; i <= PHONE_SLOTS; i++) {
            existing.add(row.getOrDefault(phoneValueColumn(i), ""));
        }
        Set<String> phones = new LinkedHashSet<>(phoneNormalizer.expandAndNormalize(existing));
        phones.addAll(phoneNormalizer.expandAndNormalize(record.getNumbers()));

        List<String> finalPhones = new ArrayList<>();
        for (String phone : phones) {
            if (finalPhones.size() == PHONE_SLOTS) {
                break;
            }
            finalPhones.add(phone);
        }
        finalPhones.removeIf(p -> p.equals(phoneNormalizer.getDefaultCountryCode()));

        for (int i = 1; i <= PHONE_SLOTS; i++) {
            row.put(phoneValueColumn(i), "");
        }
        for (int i = 0; i < finalPhones.size(); i++) {
            int slot = i + 1;
            row.put(phoneValueColumn(slot), finalPhones.get(i));
            if (row.getOrDefault(phoneTypeColumn(slot), "").isEmpty()) {
                row.put(phoneTypeColumn(slot), DEFAULT_PHONE_TYPE);
            }
        }

        row.put("Labels", groups);
        if (row.getOrDefault("Custom Field 1 - Label", "").isEmpty()) {
            row.put("Custom Field 1 - Label", DUPLICATES_LABEL);
        }
        row.put("Custom Field 1 - Value", record.joinedDuplicates());
        if (row.getOrDefault("Custom Field 2 - Label", "").isEmpty()) {
            row.put("Custom Field 2 - Label", SOURCES_LABEL);
        }
        row.put("Custom Field 2 - Value", record.joinedSources());
        return row;
    }

    private static String phoneValueColumn(int slot) {
        return "Phone " + slot + " - Value";
    }

    private static String phoneTypeColumn(int slot) {
        return "Phone " + slot + " - Type";
    }
}
