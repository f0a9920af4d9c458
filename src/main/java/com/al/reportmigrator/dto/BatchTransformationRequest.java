package com.al.reportmigrator.dto;

import com.al.reportmigrator.model.ReportDefinition;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for batch transformation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchTransformationRequest {

    /**
     * Maximum 50 reports per batch.
     */
    @NotEmpty(message = "Reports list cannot be empty")
    @Size(min = 1, max = 50, message = "Batch size must be between 1 and 50 reports")
    private List<ReportDefinition> reports;
}
