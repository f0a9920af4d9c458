package com.al.reportmigrator.service;

import com.al.reportmigrator.dto.BatchTransformationResponse;
import com.al.reportmigrator.dto.BatchTransformationResponse.ReportError;
import com.al.reportmigrator.dto.BatchTransformationResponse.ReportResult;
import com.al.reportmigrator.dto.TransformedReport;
import com.al.reportmigrator.model.ReportDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Transforms many reports in parallel.
 *
 * <p>
 * Each report runs on its own worker with its own trigger numbering, so
 * output for a report does not depend on what else is in the batch. A report
 * that throws is reported in the error list; the others are unaffected.
 *
 * @author Report Migrator Team
 * @version 1.0.0
 * @since 1.0.0
 */
@Service
@Slf4j
public class BatchTransformationService {

    private final ReportTransformationService transformationService;
    private final ExecutorService executorService;

    @Autowired
    public BatchTransformationService(ReportTransformationService transformationService,
            @Qualifier("batchExecutor") ExecutorService executorService) {
        this.transformationService = transformationService;
        this.executorService = executorService;
    }

    public BatchTransformationResponse transformBatch(List<ReportDefinition> reports) {
        long startTime = System.currentTimeMillis();
        log.info("Starting batch transformation: {} reports", reports.size());

        BatchTransformationResponse response = new BatchTransformationResponse();
        response.setTotalReports(reports.size());

        List<CompletableFuture<ReportResult>> futures = new ArrayList<>();
        for (int i = 0; i < reports.size(); i++) {
            final int index = i;
            final ReportDefinition report = reports.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> {
                long reportStart = System.currentTimeMillis();
                TransformedReport transformed = transformationService.transform(report);
                return new ReportResult(
                        index,
                        transformed.getName(),
                        transformed.getStatus(),
                        transformed.getStatistics().getCompletionPercentage(),
                        System.currentTimeMillis() - reportStart,
                        transformed);
            }, executorService));
        }

        // failures are collected per report below
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .exceptionally(e -> null)
                .join();

        for (int i = 0; i < futures.size(); i++) {
            try {
                response.getResults().add(futures.get(i).join());
                response.setSuccessCount(response.getSuccessCount() + 1);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                String name = reports.get(i) == null ? null : reports.get(i).getName();
                log.error("Failed to transform report at index {} ({}): {}", i, name, cause.getMessage());
                response.getErrors().add(new ReportError(i, name, truncate(cause.getMessage(), 200)));
                response.setFailureCount(response.getFailureCount() + 1);
            }
        }

        response.setProcessingTimeMs(System.currentTimeMillis() - startTime);
        log.info("Batch transformation completed: {} success, {} failures, {}ms total",
                response.getSuccessCount(), response.getFailureCount(), response.getProcessingTimeMs());
        return response;
    }

    private String truncate(String str, int maxLength) {
        if (str == null)
            return null;
        if (str.length() <= maxLength)
            return str;
        return str.substring(0, maxLength) + "...";
    }
}
