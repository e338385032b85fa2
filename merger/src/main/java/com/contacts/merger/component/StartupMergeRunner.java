package com.contacts.merger.component;

import com.contacts.merger.model.MergeRequest;
import com.contacts.merger.model.MergeRunReport;
import com.contacts.merger.service.ContactMergeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one merge when the application starts, if {@code merger.startup.primary-csv} is set.
 */
@Component
public class StartupMergeRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupMergeRunner.class);

    private final ContactMergeService contactMergeService;

    @Value("${merger.startup.primary-csv:}")
    private String primaryCsv;

    @Value("${merger.startup.secondary-csvs:}")
    private List<String> secondaryCsvs = new ArrayList<>();

    @Value("${merger.startup.write-log:true}")
    private boolean writeLog = true;

    public StartupMergeRunner(ContactMergeService contactMergeService) {
        this.contactMergeService = contactMergeService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (primaryCsv == null || primaryCsv.isBlank()) {
            logger.info("No startup merge configured (merger.startup.primary-csv is empty).");
            return;
        }

        logger.info("🚀 Startup: running merge for '{}'...", primaryCsv);
        MergeRequest request = new MergeRequest();
        request.setPrimaryCsvPath(primaryCsv);
        request.setSecondaryCsvPaths(new ArrayList<>(secondaryCsvs));
        request.setWriteLog(writeLog);
        try {
            MergeRunReport report = contactMergeService.run(request);
            logger.info("✅ Startup merge finished. Output: {}", report.getMergedFile());
        } catch (Exception e) {
            // The service stays up for HTTP-triggered runs.
            logger.error("❌ Startup merge failed: {}", e.getMessage(), e);
        }
        logger.info("🏁 Startup: finished merge execution.");
    }
}
