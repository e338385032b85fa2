package com.contacts.merger.service;

import com.contacts.merger.model.SecondaryContact;
import com.contacts.merger.normalizer.NameNormalizer;
import com.contacts.merger.normalizer.PhoneNormalizer;
import org.springframework.stereotype.Component;

import java.util.AbstractMap;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds secondary contacts from "full name + phone columns" rows, whether they come from a CSV
 * dump or straight from the database.
 */
@Component
public class SecondaryContactFactory {

    private final PhoneNormalizer phoneNormalizer;

    public SecondaryContactFactory(PhoneNormalizer phoneNormalizer) {
        this.phoneNormalizer = phoneNormalizer;
    }

    /**
     * @return display name → contact, or {@code null} when the row has no usable phone number
     */
    public Map.Entry<String, SecondaryContact> fromRow(String fullName, List<String> phoneCells) {
        List<String> numbers = phoneNormalizer.expandAndNormalize(phoneCells.stream()
                .filter(v -> v != null && !v.trim().isEmpty())
                .collect(Collectors.toList()));
        if (numbers.isEmpty()) {
            return null;
        }

        String full = fullName == null ? "" : fullName.trim();
        List<String> parts = Arrays.stream(full.split("\\s+"))
                .filter(p -> !p.isEmpty())
                .collect(Collectors.toList());
        String first = parts.isEmpty() ? "" : parts.get(0);
        String middle = parts.size() > 1 ? String.join(" ", parts.subList(1, parts.size())) : "";
        String last = NameNormalizer.MARKER;

        String rawDisplay = (first + (middle.isEmpty() ? "" : " " + middle) + " " + last).trim();
        String displayName = NameNormalizer.normalizeDisplayName(rawDisplay, true, false);

        SecondaryContact contact = SecondaryContact.builder()
                .numbers(new LinkedHashSet<>(numbers))
                .firstName(first)
                .middleName(middle)
                .lastName(last)
                .originalName(full)
                .comparisonKey(NameNormalizer.comparisonKey(displayName))
                .build();
        return new AbstractMap.SimpleImmutableEntry<>(displayName, contact);
    }

    /**
     * Folds one more batch into {@code target}: numbers are unioned per display name, name parts
     * are taken from the later batch.
     */
    public void combine(Map<String, SecondaryContact> target, Map<String, SecondaryContact> batch) {
        for (Map.Entry<String, SecondaryContact> entry : batch.entrySet()) {
            SecondaryContact incoming = entry.getValue();
            SecondaryContact existing = target.get(entry.getKey());
            if (existing == null) {
                target.put(entry.getKey(), incoming);
                continue;
            }
            existing.getNumbers().addAll(incoming.getNumbers());
            existing.setFirstName(incoming.getFirstName());
            existing.setMiddleName(incoming.getMiddleName());
            existing.setLastName(incoming.getLastName());
            existing.setOriginalName(incoming.getOriginalName());
        }
    }
}
