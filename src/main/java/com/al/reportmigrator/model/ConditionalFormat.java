package com.al.reportmigrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A formatting rule applied to a field when its condition holds,
 * e.g. property "color" with value "red".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConditionalFormat {

    private String property;

    private String condition;

    private String value;
}
