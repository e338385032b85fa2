package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A secondary contact that matched a protected record and was therefore not integrated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProtectedSkip {
    private String secondaryName;
    private String protectedName;
    private String matchedBy;
    private List<String> ignoredNumbers;
}
