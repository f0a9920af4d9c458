package com.al.reportmigrator.dto;

import com.al.reportmigrator.model.enums.ConversionStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for batch transformation.
 *
 * @author Report Migrator Team
 * @version 1.0.0
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchTransformationResponse {

    /**
     * Number of reports in the batch.
     */
    private int totalReports;

    /**
     * Reports that produced a result, whatever their status.
     */
    private int successCount;

    /**
     * Reports whose transformation threw.
     */
    private int failureCount;

    private List<ReportResult> results = new ArrayList<>();

    private List<ReportError> errors = new ArrayList<>();

    /**
     * Total processing time in milliseconds.
     */
    private long processingTimeMs;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReportResult {
        /**
         * Position of the report in the batch (0-based).
         */
        private int index;

        private String reportName;

        private ConversionStatus status;

        private double completionPercentage;

        private long processingTimeMs;

        private TransformedReport report;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReportError {
        /**
         * Position of the failed report in the batch (0-based).
         */
        private int index;

        private String reportName;

        private String error;
    }
}
