package com.star.loginsight.controller;

import com.star.loginsight.dto.AnalysisRequest;
import com.star.loginsight.dto.ApiResponse;
import com.star.loginsight.exception.FileSizeLimitExceededException;
import com.star.loginsight.exception.LogReadException;
import com.star.loginsight.model.Report;
import com.star.loginsight.model.ReportStatus;
import com.star.loginsight.parser.PatternRule;
import com.star.loginsight.service.AnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/analysis")
@Slf4j
public class AnalysisController {

    @Autowired
    private AnalysisService analysisService;

    @Value("${app.file.max-size:52428800}")
    private long maxFileSize;

    @PostMapping
    @Operation(summary = "Analyze log lines sent in the request body")
    public ResponseEntity<ApiResponse<Report>> analyze(@Valid @RequestBody AnalysisRequest request) {
        log.info("Received analysis request with {} sources", request.getSources().size());

        Report report = analysisService.analyze(request);
        return respond(report);
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Analyze an uploaded log file")
    public ResponseEntity<ApiResponse<Report>> upload(
            @RequestParam("logfile") MultipartFile logfile,
            @Parameter(description = "Source id; defaults to the file name")
            @RequestParam(value = "sourceId", required = false) String sourceId) {

        log.info("Received file upload request: {} ({})",
                logfile.getOriginalFilename(),
                logfile.getSize());

        if (logfile.isEmpty()) {
            throw new LogReadException("No file uploaded or file is empty");
        }

        if (logfile.getSize() > maxFileSize) {
            throw new FileSizeLimitExceededException(maxFileSize, logfile.getSize());
        }

        String source = sourceId != null && !sourceId.isBlank() ? sourceId : logfile.getOriginalFilename();
        if (source == null || source.isBlank()) {
            throw new LogReadException("A source id is required when the file has no name");
        }

        Report report = analysisService.analyzeFile(logfile, source);
        return respond(report);
    }

    @GetMapping("/rules")
    @Operation(summary = "List the active pattern rules in evaluation order")
    public ResponseEntity<ApiResponse<List<PatternRule>>> rules() {
        return ResponseEntity.ok(
                ApiResponse.success("Active pattern rules retrieved successfully", analysisService.activeRules())
        );
    }

    private ResponseEntity<ApiResponse<Report>> respond(Report report) {
        log.info("Analysis finished with status {}", report.getStatus());

        if (report.getStatus() == ReportStatus.FAILED) {
            return ResponseEntity
                    .status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(ApiResponse.failure("Analysis failed: " + report.getFailureCause(), report));
        }

        return ResponseEntity.ok(
                ApiResponse.success("Analysis completed with status " + report.getStatus(), report)
        );
    }
}
