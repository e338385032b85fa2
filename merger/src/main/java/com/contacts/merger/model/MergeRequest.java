package com.contacts.merger.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeRequest {
    private String primaryCsvPath;
    private List<String> secondaryCsvPaths = new ArrayList<>();
    private DatabaseSource database;
    // defaults to an "output" folder next to the primary CSV
    private String outputDirectory;
    // skip writing the merged CSV
    private boolean dryRun;
    private boolean writeLog;
}
