package com.al.reportmigrator.dto;

import com.al.reportmigrator.model.enums.ValueType;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for translating a single formula.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpressionRequest {

    @NotBlank(message = "name is required")
    private String name;

    /**
     * Formula text; may be empty.
     */
    private String expression;

    @Builder.Default
    private ValueType returnType = ValueType.STRING;
}
