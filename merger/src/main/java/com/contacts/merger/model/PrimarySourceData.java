package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Loaded address-book export: its column layout (reused as the export template) and its contacts
 * keyed by display name.
 */
@Getter
@AllArgsConstructor
public class PrimarySourceData {
    private final List<String> columns;
    private final Map<String, PrimaryContact> contacts;
}
