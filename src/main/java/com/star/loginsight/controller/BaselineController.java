package com.star.loginsight.controller;

import com.star.loginsight.dto.ApiResponse;
import com.star.loginsight.dto.BaselineRequest;
import com.star.loginsight.entity.BaselineDocument;
import com.star.loginsight.service.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/baselines")
@Validated
@Slf4j
public class BaselineController {

    @Autowired
    private BaselineService baselineService;

    @GetMapping
    @Operation(summary = "List stored baselines, optionally for one service")
    public ResponseEntity<ApiResponse<List<BaselineDocument>>> list(
            @RequestParam(value = "service", required = false) String service) {

        log.debug("Fetching baselines for service: {}", service != null ? service : "all");

        List<BaselineDocument> baselines = service != null
                ? baselineService.findByService(service)
                : baselineService.findAll();

        return ResponseEntity.ok(
                ApiResponse.success("Baselines retrieved successfully", baselines)
        );
    }

    @PutMapping
    @Operation(summary = "Replace every stored baseline")
    public ResponseEntity<ApiResponse<List<BaselineDocument>>> replace(
            @RequestBody @NotNull List<@Valid BaselineRequest> baselines) {

        log.info("Replacing baselines with {} entries", baselines.size());

        List<BaselineDocument> stored = baselineService.replaceAll(baselines);

        return ResponseEntity.ok(
                ApiResponse.success("Baselines replaced successfully", stored)
        );
    }
}
