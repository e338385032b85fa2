package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One secondary contact folded into an existing contact, with the row before and after the change.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {
    private String primaryName;
    private Map<String, String> originalPrimaryRow;
    private MergeDelta updateData;
    private FinalRowSnapshot finalRow;
}
