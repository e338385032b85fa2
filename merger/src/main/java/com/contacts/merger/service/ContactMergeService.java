package com.contacts.merger.service;

import com.contacts.merger.Repository.SecondaryContactRepo;
import com.contacts.merger.exception.ContactSourceException;
import com.contacts.merger.merge.ContactMergeEngine;
import com.contacts.merger.model.MergeRequest;
import com.contacts.merger.model.MergeResult;
import com.contacts.merger.model.MergeRunReport;
import com.contacts.merger.model.MergeSummary;
import com.contacts.merger.model.PrimarySourceData;
import com.contacts.merger.model.SecondaryContact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a complete merge: load both sources, consolidate, then write the merged CSV and the audit
 * logs. Every call works on its own data, so concurrent runs do not interfere.
 */
@Service
public class ContactMergeService {

    private static final Logger logger = LoggerFactory.getLogger(ContactMergeService.class);

    public static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ContactLoaderService contactLoaderService;
    private final SecondaryContactRepo secondaryContactRepo;
    private final SecondaryContactFactory secondaryContactFactory;
    private final ContactMergeEngine contactMergeEngine;
    private final ContactExportService contactExportService;
    private final AuditLogService auditLogService;

    @Value("${merger.output-dir:}")
    private String defaultOutputDir;

    // every input path must resolve inside this folder; empty means the working directory
    @Value("${merger.input-dir:}")
    private String inputDir;

    public ContactMergeService(ContactLoaderService contactLoaderService,
                               SecondaryContactRepo secondaryContactRepo,
                               SecondaryContactFactory secondaryContactFactory,
                               ContactMergeEngine contactMergeEngine,
                               ContactExportService contactExportService,
                               AuditLogService auditLogService) {
        this.contactLoaderService = contactLoaderService;
        this.secondaryContactRepo = secondaryContactRepo;
        this.secondaryContactFactory = secondaryContactFactory;
        this.contactMergeEngine = contactMergeEngine;
        this.contactExportService = contactExportService;
        this.auditLogService = auditLogService;
    }

    public MergeRunReport run(MergeRequest request) {
        String runId = LocalDateTime.now().format(RUN_ID_FORMAT);
        logger.info("=== [MERGE START] Run {} ===", runId);

        Path primaryPath = resolveInput(requirePrimary(request));
        Path outputDir = resolveOutputDir(request, primaryPath);

        MergeOutcome outcome = mergeSources(request);
        MergeResult result = outcome.result;

        MergeRunReport report = MergeRunReport.builder()
                .runId(runId)
                .summary(outcome.summary)
                .failedSources(outcome.failedSources)
                .protectedSkips(result.getProtectedSkips())
                .build();

        if (request.isDryRun()) {
            logger.info("[DRY RUN] Skipping export of {} merged contacts.", result.getMerged().size());
        } else {
            Path mergedFile = contactExportService.exportContacts(result.getMerged(), outcome.primary.getColumns(),
                    outputDir.resolve("merged_contacts_" + runId + ".csv"));
            report.setMergedFile(mergedFile.toString());
        }

        Path jsonLog = auditLogService.writeJsonLog(result.getAuditLog(), outcome.summary,
                outputDir.resolve("merge_log_" + runId + ".json"));
        Path csvLog = auditLogService.writeCsvLog(result.getAuditLog(), outputDir.resolve("merge_log_" + runId + ".csv"));
        report.setAuditJsonFile(jsonLog == null ? null : jsonLog.toString());
        report.setAuditCsvFile(csvLog == null ? null : csvLog.toString());

        if (request.isWriteLog()) {
            Path textLog = auditLogService.writeTextLog(runId, request.getPrimaryCsvPath(), secondaryPaths(request),
                    result.getMerged().size(), result.getAuditLog(), outputDir.resolve("merge_log_" + runId + ".txt"));
            report.setTextLogFile(textLog.toString());
        }

        logger.info("=== [MERGE COMPLETE] {} ===", outcome.summary);
        return report;
    }

    /** Runs the merge without touching the file system and returns the merged CSV (UTF-8 with BOM). */
    public byte[] renderMergedCsv(MergeRequest request) {
        MergeOutcome outcome = mergeSources(request);
        return contactExportService.renderCsv(outcome.result.getMerged(), outcome.primary.getColumns());
    }

    MergeOutcome mergeSources(MergeRequest request) {
        Path primaryPath = resolveInput(requirePrimary(request));
        Map<String, Path> secondaryFiles = new LinkedHashMap<>();
        for (String path : secondaryPaths(request)) {
            if (path != null && !path.isBlank()) {
                secondaryFiles.put(path, resolveInput(path));
            }
        }

        logger.info("[STEP 1] Loading primary contacts... please wait ⏳");
        PrimarySourceData primary = contactLoaderService.loadPrimary(primaryPath);

        logger.info("[STEP 2] Loading secondary contacts... please wait ⏳");
        Map<String, SecondaryContact> secondary = new LinkedHashMap<>();
        List<String> failedSources = new ArrayList<>();
        for (Map.Entry<String, Path> file : secondaryFiles.entrySet()) {
            String path = file.getKey();
            try {
                secondaryContactFactory.combine(secondary, contactLoaderService.loadSecondary(file.getValue()));
            } catch (ContactSourceException e) {
                logger.warn("⚠️ Failed to read secondary file '{}': {}", path, e.getMessage());
                failedSources.add(path);
            }
        }
        if (request.getDatabase() != null && request.getDatabase().isConfigured()) {
            try {
                secondaryContactFactory.combine(secondary, secondaryContactRepo.loadContacts(request.getDatabase()));
            } catch (ContactSourceException e) {
                logger.warn("⚠️ Failed to load from database: {}", e.getMessage());
                failedSources.add(request.getDatabase().getServer() + "/" + request.getDatabase().getDatabase());
            }
        }

        logger.info("[STEP 3] Merging {} primary and {} secondary contacts... please wait ⏳",
                primary.getContacts().size(), secondary.size());
        MergeResult result = contactMergeEngine.merge(primary.getContacts(), secondary);
        MergeSummary summary = MergeSummary.of(primary.getContacts().size(), secondary.size(), result);
        return new MergeOutcome(primary, result, summary, failedSources);
    }

    private static String requirePrimary(MergeRequest request) {
        if (request == null || request.getPrimaryCsvPath() == null || request.getPrimaryCsvPath().isBlank()) {
            throw new IllegalArgumentException("Please select a primary contacts CSV before merging.");
        }
        return request.getPrimaryCsvPath();
    }

    Path resolveInput(String path) {
        Path base = inputBase();
        Path resolved = base.resolve(path).normalize();
        if (!resolved.startsWith(base)) {
            throw new IllegalArgumentException("Input file '" + path + "' is outside the input directory " + base);
        }
        return resolved;
    }

    /**
     * The configured output folder, or an {@code output} folder next to the primary CSV. A requested
     * directory is resolved against it and may not leave it.
     */
    Path resolveOutputDir(MergeRequest request, Path primaryPath) {
        Path base;
        if (defaultOutputDir != null && !defaultOutputDir.isBlank()) {
            base = Paths.get(defaultOutputDir).toAbsolutePath().normalize();
        } else {
            Path parent = primaryPath.getParent();
            base = parent == null ? Paths.get("output").toAbsolutePath() : parent.resolve("output");
        }
        String requested = request.getOutputDirectory();
        if (requested == null || requested.isBlank()) {
            return base;
        }
        Path resolved = base.resolve(requested).normalize();
        if (!resolved.startsWith(base)) {
            throw new IllegalArgumentException("Output directory '" + requested + "' is outside " + base);
        }
        return resolved;
    }

    private Path inputBase() {
        Path base = inputDir == null || inputDir.isBlank() ? Paths.get("") : Paths.get(inputDir);
        return base.toAbsolutePath().normalize();
    }

    private static List<String> secondaryPaths(MergeRequest request) {
        return request.getSecondaryCsvPaths() == null ? new ArrayList<>() : request.getSecondaryCsvPaths();
    }

    static final class MergeOutcome {
        final PrimarySourceData primary;
        final MergeResult result;
        final MergeSummary summary;
        final List<String> failedSources;

        MergeOutcome(PrimarySourceData primary, MergeResult result, MergeSummary summary, List<String> failedSources) {
            this.primary = primary;
            this.result = result;
            this.summary = summary;
            this.failedSources = failedSources;
        }
    }
}
