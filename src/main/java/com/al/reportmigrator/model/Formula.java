package com.al.reportmigrator.model;

import com.al.reportmigrator.model.enums.ValueType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named calculated expression in the source formula language.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Formula {

    private String name;

    private String expression;

    @Builder.Default
    private ValueType returnType = ValueType.STRING;
}
