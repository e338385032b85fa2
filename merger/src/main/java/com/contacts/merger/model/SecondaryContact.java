package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A row of the phone-centric secondary source (CSV dump or database). Its source tag is always
 * {@link ContactSource#SECONDARY}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecondaryContact {

    @Builder.Default
    private Set<String> numbers = new LinkedHashSet<>();
    @Builder.Default
    private String firstName = "";
    @Builder.Default
    private String middleName = "";
    @Builder.Default
    private String lastName = "";
    private String originalName;
    private String comparisonKey;
}
