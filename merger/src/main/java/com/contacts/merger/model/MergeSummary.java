package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeSummary {
    private int primary;
    private int secondary;
    private int total;
    // only secondary-source records
    private int newContacts;
    // carry both source tags
    private int merged;
    private int protectedContacts;
    private int updated;
    private int droppedSecondary;
    private int protectedSkips;

    public static MergeSummary of(int primaryCount, int secondaryCount, MergeResult result) {
        int newContacts = 0;
        int merged = 0;
        int protectedContacts = 0;
        for (Map.Entry<String, ContactRecord> entry : result.getMerged().entrySet()) {
            Set<ContactSource> sources = entry.getValue().getSources();
            if (sources.size() == 1 && sources.contains(ContactSource.SECONDARY)) {
                newContacts++;
            }
            if (sources.contains(ContactSource.PRIMARY) && sources.contains(ContactSource.SECONDARY)) {
                merged++;
            }
            if (entry.getValue().isProtectedRecord()) {
                protectedContacts++;
            }
        }
        return MergeSummary.builder()
                .primary(primaryCount)
                .secondary(secondaryCount)
                .total(result.getMerged().size())
                .newContacts(newContacts)
                .merged(merged)
                .protectedContacts(protectedContacts)
                .updated(result.getAuditLog().size())
                .droppedSecondary(result.getDroppedSecondary())
                .protectedSkips(result.getProtectedSkips().size())
                .build();
    }
}
