package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A row of the address-book export after loading. Its source tag is always {@link ContactSource#PRIMARY}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrimaryContact {

    @Builder.Default
    private Set<String> numbers = new LinkedHashSet<>();
    @Builder.Default
    private Set<String> groups = new LinkedHashSet<>();
    private boolean protectedRecord;
    private String comparisonKey;
    @Builder.Default
    private String firstName = "";
    @Builder.Default
    private String middleName = "";
    @Builder.Default
    private String lastName = "";
    @Builder.Default
    private Map<String, String> fieldSnapshot = new LinkedHashMap<>();
}
