package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What one secondary record changed on the record it was merged into.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeDelta {
    private String secondaryName;
    private String secondaryOriginalName;
    private List<String> addedNumbers = new ArrayList<>();
    private boolean addedFirstName;
    private boolean addedLastName;
}
