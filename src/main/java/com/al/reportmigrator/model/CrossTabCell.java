package com.al.reportmigrator.model;

import com.al.reportmigrator.model.enums.SummaryFunction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrossTabCell {

    private String name;

    private String fieldName;

    @Builder.Default
    private SummaryFunction summary = SummaryFunction.SUM;

    private String formatString;
}
