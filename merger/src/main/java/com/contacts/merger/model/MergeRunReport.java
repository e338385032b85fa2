package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeRunReport {
    private String runId;
    private MergeSummary summary;
    private String mergedFile;
    private String auditJsonFile;
    private String auditCsvFile;
    private String textLogFile;
    @Builder.Default
    private List<String> failedSources = new ArrayList<>();
    @Builder.Default
    private List<ProtectedSkip> protectedSkips = new ArrayList<>();
}
