package com.contacts.merger.merge;

import com.contacts.merger.index.PhoneIndex;
import com.contacts.merger.model.AuditEntry;
import com.contacts.merger.model.ContactRecord;
import com.contacts.merger.model.ContactSource;
import com.contacts.merger.model.FinalRowSnapshot;
import com.contacts.merger.model.MergeDelta;
import com.contacts.merger.model.MergeResult;
import com.contacts.merger.model.PrimaryContact;
import com.contacts.merger.model.ProtectedSkip;
import com.contacts.merger.model.SecondaryContact;
import com.contacts.merger.normalizer.GroupNameMapper;
import com.contacts.merger.normalizer.NameNormalizer;
import com.contacts.merger.normalizer.PhoneNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * State of a single merge call: the working set (display name → record) and its phone index.
 * Both are mutated only here, and only through {@link #absorb}, {@link #addRecord} and
 * {@link #integrate}, so the index never drifts from the records.
 */
class MergeSession {

    private static final Logger logger = LoggerFactory.getLogger(MergeSession.class);

    private final PhoneNormalizer phoneNormalizer;
    private final String defaultNewGroup;

    private final Map<String, ContactRecord> workingSet = new LinkedHashMap<>();
    private final PhoneIndex phoneIndex = new PhoneIndex();
    // comparison key -> first primary display name carrying it
    private final Map<String, String> primaryKeyLookup = new LinkedHashMap<>();
    // absorbed display name -> the record it went into
    private final Map<String, String> aliases = new HashMap<>();

    private final List<AuditEntry> auditLog = new ArrayList<>();
    private final List<ProtectedSkip> protectedSkips = new ArrayList<>();
    private int droppedSecondary;
    private int absorptions;

    MergeSession(PhoneNormalizer phoneNormalizer, String defaultNewGroup) {
        this.phoneNormalizer = phoneNormalizer;
        this.defaultNewGroup = defaultNewGroup;
    }

    MergeResult run(Map<String, PrimaryContact> primary, Map<String, SecondaryContact> secondary) {
        logger.info("Starting contact merge. Primary contacts: {}, secondary contacts: {}", primary.size(), secondary.size());

        seedPrimary(primary);
        logger.info("[STEP 1] Seeded {} records from the primary source.", workingSet.size());

        consolidateByName();
        logger.info("[STEP 2] After name-based merging: {} records.", workingSet.size());

        consolidateByPhone();
        logger.info("[STEP 3] After phone-based merging: {} records.", workingSet.size());

        integrateSecondary(secondary);
        logger.info("[STEP 4] After secondary integration: {} records, {} updated, {} dropped without numbers, {} skipped as protected.",
                workingSet.size(), auditLog.size(), droppedSecondary, protectedSkips.size());

        consolidateByPhone();
        logger.info("[STEP 5] Final merged contact count: {} ({} absorptions).", workingSet.size(), absorptions);

        return new MergeResult(workingSet, auditLog, protectedSkips, droppedSecondary, absorptions);
    }

    // ---------------------------------------------------------------- passes

    private void seedPrimary(Map<String, PrimaryContact> primary) {
        for (Map.Entry<String, PrimaryContact> entry : primary.entrySet()) {
            String name = entry.getKey();
            PrimaryContact data = entry.getValue();
            if (isBlank(name) || data == null) {
                continue;
            }

            String key = comparisonKeyOf(data.getComparisonKey(), name);
            if (!key.isEmpty()) {
                primaryKeyLookup.putIfAbsent(key, name);
            }

            ContactRecord record = new ContactRecord();
            record.getNumbers().addAll(phoneNormalizer.expandAndNormalize(data.getNumbers()));
            if (data.getGroups() != null) {
                for (String group : data.getGroups()) {
                    String normalized = GroupNameMapper.normalize(group);
                    if (!normalized.isEmpty()) {
                        record.getGroups().add(normalized);
                    }
                }
            }
            record.getSources().add(ContactSource.PRIMARY);
            record.setProtectedRecord(data.isProtectedRecord());
            record.setFirstName(nullToEmpty(data.getFirstName()));
            record.setLastName(nullToEmpty(data.getLastName()));
            record.setComparisonKey(key);
            if (data.getFieldSnapshot() != null && !data.getFieldSnapshot().isEmpty()) {
                record.setFieldSnapshot(new LinkedHashMap<>(data.getFieldSnapshot()));
            }
            addRecord(name, record);
        }
    }

    private void consolidateByName() {
        Map<String, List<String>> namesByKey = new LinkedHashMap<>();
        for (Map.Entry<String, ContactRecord> entry : workingSet.entrySet()) {
            String key = entry.getValue().getComparisonKey();
            if (!key.isEmpty()) {
                namesByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(entry.getKey());
            }
        }
        for (List<String> names : namesByKey.values()) {
            if (names.size() > 1) {
                absorbIntoCanonical(names);
            }
        }
    }

    private void consolidateByPhone() {
        for (String number : phoneIndex.sharedNumbers()) {
            List<String> holders = phoneIndex.holders(number);
            if (holders.size() > 1) {
                absorbIntoCanonical(holders);
            }
        }
    }

    private void integrateSecondary(Map<String, SecondaryContact> secondary) {
        for (Map.Entry<String, SecondaryContact> entry : secondary.entrySet()) {
            String name = entry.getKey();
            SecondaryContact data = entry.getValue();
            if (isBlank(name) || data == null) {
                continue;
            }
            List<String> numbers = phoneNormalizer.expandAndNormalize(data.getNumbers());
            if (numbers.isEmpty()) {
                droppedSecondary++;
                logger.debug("Dropping secondary contact '{}' without a usable phone number.", name);
                continue;
            }

            String target = null;
            String matchedBy = null;
            for (String number : numbers) {
                String holder = phoneIndex.firstHolder(number);
                if (holder != null) {
                    target = holder;
                    matchedBy = "phone " + number;
                    break;
                }
            }
            if (target == null) {
                target = resolve(primaryKeyLookup.get(comparisonKeyOf(data.getComparisonKey(), name)));
                matchedBy = "name";
            }
            if (target == null && workingSet.containsKey(name)) {
                target = name;
                matchedBy = "display name";
            }

            if (target == null) {
                addSecondaryRecord(name, data, numbers);
                continue;
            }

            ContactRecord existing = workingSet.get(target);
            if (existing.isProtectedRecord()) {
                logger.warn("Secondary contact '{}' matched protected contact '{}' by {}; numbers {} were not merged.",
                        name, target, matchedBy, numbers);
                protectedSkips.add(new ProtectedSkip(name, target, matchedBy, new ArrayList<>(numbers)));
                continue;
            }
            integrate(target, existing, name, data, numbers);
        }
    }

    // ---------------------------------------------------------------- mutations

    private void addRecord(String name, ContactRecord record) {
        workingSet.put(name, record);
        phoneIndex.attachAll(record.getNumbers(), name);
    }

    private void addSecondaryRecord(String name, SecondaryContact data, List<String> numbers) {
        ContactRecord record = new ContactRecord();
        record.getNumbers().addAll(numbers);
        record.getGroups().add(defaultNewGroup);
        record.getSources().add(ContactSource.SECONDARY);
        record.setFirstName(nullToEmpty(data.getFirstName()));
        record.setLastName(nullToEmpty(data.getLastName()));
        record.setComparisonKey(comparisonKeyOf(data.getComparisonKey(), name));

        String folded = name.trim().toLowerCase(Locale.ROOT);
        for (String existingName : workingSet.keySet()) {
            if (!existingName.equals(name) && existingName.trim().toLowerCase(Locale.ROOT).equals(folded)) {
                record.getDuplicates().add(existingName);
            }
        }
        addRecord(name, record);
        logger.debug("Added new secondary contact '{}' with {} number(s).", name, numbers.size());
    }

    private void integrate(String target, ContactRecord record, String name, SecondaryContact data, List<String> numbers) {
        Map<String, String> originalRow = record.hasFieldSnapshot() ? new LinkedHashMap<>(record.getFieldSnapshot()) : null;

        List<String> added = new ArrayList<>();
        for (String number : new LinkedHashSet<>(numbers)) {
            if (!record.getNumbers().contains(number)) {
                added.add(number);
            }
        }
        Collections.sort(added);

        record.getNumbers().addAll(numbers);
        phoneIndex.attachAll(numbers, target);
        record.getSources().add(ContactSource.SECONDARY);

        MergeDelta delta = new MergeDelta(name, data.getOriginalName(), added, false, false);
        if (isBlank(record.getFirstName()) && !isBlank(data.getFirstName())) {
            record.setFirstName(data.getFirstName());
            delta.setAddedFirstName(true);
        }
        if (isBlank(record.getLastName()) && !isBlank(data.getLastName())) {
            record.setLastName(data.getLastName());
            delta.setAddedLastName(true);
        }
        record.getDuplicates().add(isBlank(data.getOriginalName()) ? name : data.getOriginalName());

        FinalRowSnapshot finalRow = new FinalRowSnapshot(target, record.sortedNumbers(),
                record.joinedGroups(), record.joinedSources(), record.joinedDuplicates());
        auditLog.add(new AuditEntry(target, originalRow, delta, finalRow));
        logger.debug("Merged secondary contact '{}' into '{}', added numbers {}.", name, target, added);
    }

    /**
     * Folds {@code source} into {@code destination}. Missing keys and self-merges are ignored,
     * so repeating a call for an already absorbed record does nothing.
     */
    void absorb(String source, String destination) {
        if (source.equals(destination) || !workingSet.containsKey(source) || !workingSet.containsKey(destination)) {
            return;
        }
        ContactRecord src = workingSet.get(source);
        ContactRecord dst = workingSet.get(destination);
        logger.debug("Merging '{}' into '{}'.", source, destination);

        List<String> moved = new ArrayList<>(src.getNumbers());
        dst.getNumbers().addAll(moved);
        phoneIndex.reassign(moved, source, destination);

        dst.getGroups().addAll(src.getGroups());
        dst.getSources().addAll(src.getSources());
        dst.getDuplicates().addAll(src.getDuplicates());
        dst.getDuplicates().add(source);
        if (!dst.hasFieldSnapshot() && src.hasFieldSnapshot()) {
            dst.setFieldSnapshot(new LinkedHashMap<>(src.getFieldSnapshot()));
        }
        dst.setProtectedRecord(dst.isProtectedRecord() || src.isProtectedRecord());

        workingSet.remove(source);
        aliases.put(source, destination);
        absorptions++;
    }

    // ---------------------------------------------------------------- helpers

    // the first unprotected member wins, otherwise the first member
    private void absorbIntoCanonical(List<String> names) {
        List<String> present = new ArrayList<>();
        for (String name : names) {
            if (workingSet.containsKey(name)) {
                present.add(name);
            }
        }
        if (present.size() < 2) {
            return;
        }
        String canonical = present.get(0);
        for (String name : present) {
            if (!workingSet.get(name).isProtectedRecord()) {
                canonical = name;
                break;
            }
        }
        for (String name : present) {
            if (!name.equals(canonical)) {
                absorb(name, canonical);
            }
        }
    }

    // follows absorb aliases to the record that currently carries a name
    private String resolve(String name) {
        String current = name;
        int hops = 0;
        while (current != null && !workingSet.containsKey(current) && hops++ <= aliases.size()) {
            current = aliases.get(current);
        }
        return current != null && workingSet.containsKey(current) ? current : null;
    }

    PhoneIndex getPhoneIndex() {
        return phoneIndex;
    }

    Map<String, ContactRecord> getWorkingSet() {
        return workingSet;
    }

    private static String comparisonKeyOf(String given, String name) {
        if (!isBlank(given)) {
            return NameNormalizer.collapseWhitespace(given).toLowerCase(Locale.ROOT);
        }
        return NameNormalizer.comparisonKey(name);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
