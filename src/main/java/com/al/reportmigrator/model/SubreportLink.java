package com.al.reportmigrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Passes a parent field value into a subreport parameter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubreportLink {

    private String parentField;

    private String subreportParameter;
}
