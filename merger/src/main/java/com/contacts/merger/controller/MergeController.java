package com.contacts.merger.controller;

import com.contacts.merger.exception.ContactExportException;
import com.contacts.merger.exception.ContactSourceException;
import com.contacts.merger.model.MergeRequest;
import com.contacts.merger.model.MergeRunReport;
import com.contacts.merger.service.ContactMergeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/merge")
public class MergeController {

    private static final Logger logger = LoggerFactory.getLogger(MergeController.class);

    private final ContactMergeService contactMergeService;

    public MergeController(ContactMergeService contactMergeService) {
        this.contactMergeService = contactMergeService;
    }

    @PostMapping("/run")
    public ResponseEntity<MergeRunReport> runMerge(@RequestBody MergeRequest request) {
        logger.info("Merge requested for primary file: '{}'", request.getPrimaryCsvPath());
        MergeRunReport report = contactMergeService.run(request);
        return ResponseEntity.ok(report);
    }

    // Same merge, but the result is streamed back instead of being written to disk.
    @PostMapping("/csv")
    public ResponseEntity<ByteArrayResource> downloadMergedCsv(@RequestBody MergeRequest request) {
        byte[] csv = contactMergeService.renderMergedCsv(request);
        String fileName = "merged_contacts_" + LocalDateTime.now().format(ContactMergeService.RUN_ID_FORMAT) + ".csv";

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"");

        ByteArrayResource resource = new ByteArrayResource(csv);
        logger.info("Merged CSV generated successfully. Preparing it for download.");

        return ResponseEntity.ok()
                .headers(headers)
                .contentLength(resource.contentLength())
                .contentType(MediaType.parseMediaType("application/csv"))
                .body(resource);
    }

    @ExceptionHandler({IllegalArgumentException.class, ContactSourceException.class})
    public ResponseEntity<Map<String, String>> handleBadInput(RuntimeException e) {
        logger.warn("⚠️ Merge request rejected: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error(e.getMessage()));
    }

    @ExceptionHandler(ContactExportException.class)
    public ResponseEntity<Map<String, String>> handleExportFailure(ContactExportException e) {
        logger.error("❌ Error while writing merge output: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
    }

    private static Map<String, String> error(String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message == null ? "Unknown error" : message);
        return body;
    }
}
