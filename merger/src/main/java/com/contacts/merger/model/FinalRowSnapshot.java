package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The merged record as it stood right after a secondary record was folded into it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FinalRowSnapshot {
    private String name;
    private List<String> phones;
    private String groupMembership;
    private String sources;
    private String duplicates;
}
