package com.al.reportmigrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChartSeries {

    private String name;

    private String fieldName;

    private String legendText;
}
