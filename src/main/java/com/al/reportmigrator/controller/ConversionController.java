package com.al.reportmigrator.controller;

import com.al.reportmigrator.dto.BatchTransformationRequest;
import com.al.reportmigrator.dto.BatchTransformationResponse;
import com.al.reportmigrator.dto.ExpressionRequest;
import com.al.reportmigrator.dto.TransformedReport;
import com.al.reportmigrator.model.ReportDefinition;
import com.al.reportmigrator.model.target.TranslatedExpression;
import com.al.reportmigrator.service.BatchTransformationService;
import com.al.reportmigrator.service.ReportTransformationService;
import com.al.reportmigrator.service.expression.ExpressionTranslator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/convert")
@Slf4j
@Tag(name = "Conversion", description = "Report definition and formula conversion endpoints")
public class ConversionController {

    private final ReportTransformationService transformationService;
    private final BatchTransformationService batchTransformationService;
    private final ExpressionTranslator expressionTranslator;

    @Autowired
    public ConversionController(ReportTransformationService transformationService,
            BatchTransformationService batchTransformationService,
            ExpressionTranslator expressionTranslator) {
        this.transformationService = transformationService;
        this.batchTransformationService = batchTransformationService;
        this.expressionTranslator = expressionTranslator;
    }

    @Operation(summary = "Convert a report definition", description = "Converts a parsed report definition: queries, parameters, formulas and layout. Partial conversions are returned with their issues.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report converted (check status and issues)"),
            @ApiResponse(responseCode = "400", description = "Malformed report definition"),
            @ApiResponse(responseCode = "422", description = "A formula was refused under the fail-hard policy")
    })
    @PostMapping(value = "/report", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TransformedReport> convertReport(@RequestBody ReportDefinition report) {
        log.info("Received report conversion request: {}", report.getName());
        return ResponseEntity.ok(transformationService.transform(report));
    }

    @Operation(summary = "Batch convert report definitions", description = "Converts up to 50 report definitions in parallel. Each report is converted independently.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Batch processed"),
            @ApiResponse(responseCode = "400", description = "Empty or oversized batch")
    })
    @PostMapping(value = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchTransformationResponse> convertBatch(
            @Valid @RequestBody BatchTransformationRequest request) {
        log.info("Received batch conversion request: {} reports", request.getReports().size());
        return ResponseEntity.ok(batchTransformationService.transformBatch(request.getReports()));
    }

    @Operation(summary = "Translate a single formula", description = "Translates one formula into a target function without converting a whole report.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Formula translated"),
            @ApiResponse(responseCode = "400", description = "Missing formula name"),
            @ApiResponse(responseCode = "422", description = "Formula refused under the fail-hard policy")
    })
    @PostMapping(value = "/expression", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TranslatedExpression> convertExpression(@Valid @RequestBody ExpressionRequest request) {
        return ResponseEntity.ok(expressionTranslator.translate(request.getName(), request.getExpression(),
                request.getReturnType()));
    }
}
