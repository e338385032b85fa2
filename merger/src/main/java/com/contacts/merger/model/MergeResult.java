package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Everything one merge call produces. The audit log belongs to the call, never to shared state.
 */
@Getter
@AllArgsConstructor
public class MergeResult {
    private final Map<String, ContactRecord> merged;
    private final List<AuditEntry> auditLog;
    private final List<ProtectedSkip> protectedSkips;
    private final int droppedSecondary;
    private final int absorptions;
}
