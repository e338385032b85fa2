package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A decoded CSV file: cleaned, unique header names and one ordered column→value map per row.
 */
@Getter
@AllArgsConstructor
public class TabularFile {
    private final List<String> headers;
    private final List<Map<String, String>> rows;
    private final String encoding;

    public static List<String> valuesOf(Map<String, String> row) {
        return new ArrayList<>(row.values());
    }
}
