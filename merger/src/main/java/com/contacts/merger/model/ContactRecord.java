package com.contacts.merger.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * One identity of the merged working set, keyed by its display name.
 * <p>
 * The collections only ever grow while a merge runs. {@code firstName} and {@code lastName} are
 * filled when empty and never overwritten.
 */
@Data
@NoArgsConstructor
public class ContactRecord {

    private Set<String> numbers = new LinkedHashSet<>();
    private Set<String> groups = new TreeSet<>();
    private Set<ContactSource> sources = EnumSet.noneOf(ContactSource.class);
    private Set<String> duplicates = new TreeSet<>();
    private boolean protectedRecord;
    private String firstName = "";
    private String lastName = "";
    private String comparisonKey = "";
    // original address-book columns, null for records that never had a row
    private Map<String, String> fieldSnapshot;

    public boolean hasFieldSnapshot() {
        return fieldSnapshot != null && !fieldSnapshot.isEmpty();
    }

    public List<String> sortedNumbers() {
        List<String> sorted = new ArrayList<>(numbers);
        Collections.sort(sorted);
        return sorted;
    }

    public String joinedGroups() {
        return String.join(" ::: ", new TreeSet<>(groups));
    }

    public String joinedSources() {
        return sources.stream().map(ContactSource::getLabel).sorted().collect(Collectors.joining(" & "));
    }

    public String joinedDuplicates() {
        return String.join(" - ", new TreeSet<>(duplicates));
    }
}
