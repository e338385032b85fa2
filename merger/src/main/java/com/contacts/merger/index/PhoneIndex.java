package com.contacts.merger.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reverse index from canonical phone number to the display names currently holding it.
 * <p>
 * Numbers and holders are both kept in lexicographic order, which is the tie-break used
 * whenever the merge needs "the first" number or holder. A number without holders is removed,
 * so {@link #contains(String)} is true only for numbers some record still holds.
 * <p>
 * Not thread-safe: an instance belongs to a single merge call.
 */
public class PhoneIndex {

    private final Map<String, NavigableSet<String>> holdersByNumber = new TreeMap<>();

    public void attach(String number, String key) {
        holdersByNumber.computeIfAbsent(number, n -> new TreeSet<>()).add(key);
    }

    public void attachAll(Collection<String> numbers, String key) {
        for (String number : numbers) {
            attach(number, key);
        }
    }

    public void detach(String number, String key) {
        NavigableSet<String> holders = holdersByNumber.get(number);
        if (holders == null) {
            return;
        }
        holders.remove(key);
        if (holders.isEmpty()) {
            holdersByNumber.remove(number);
        }
    }

    /** Points each of {@code numbers} at {@code to} instead of {@code from}. */
    public void reassign(Collection<String> numbers, String from, String to) {
        for (String number : numbers) {
            attach(number, to);
            if (!from.equals(to)) {
                detach(number, from);
            }
        }
    }

    public boolean contains(String number) {
        return holdersByNumber.containsKey(number);
    }

    public List<String> holders(String number) {
        NavigableSet<String> holders = holdersByNumber.get(number);
        return holders == null ? Collections.emptyList() : new ArrayList<>(holders);
    }

    public String firstHolder(String number) {
        NavigableSet<String> holders = holdersByNumber.get(number);
        return holders == null ? null : holders.first();
    }

    /** Snapshot of the numbers that currently have more than one holder, in ascending order. */
    public List<String> sharedNumbers() {
        List<String> shared = new ArrayList<>();
        for (Map.Entry<String, NavigableSet<String>> entry : holdersByNumber.entrySet()) {
            if (entry.getValue().size() > 1) {
                shared.add(entry.getKey());
            }
        }
        return shared;
    }

    public int size() {
        return holdersByNumber.size();
    }

    /** Every (number, holder) pair, for consistency checks. */
    public Map<String, List<String>> snapshot() {
        Map<String, List<String>> copy = new TreeMap<>();
        holdersByNumber.forEach((number, holders) -> copy.put(number, new ArrayList<>(holders)));
        return copy;
    }
}
