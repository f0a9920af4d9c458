package com.al.reportmigrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormatSpec {

    /**
     * left, center, right or justify
     */
    private String horizontalAlignment;

    /**
     * top, middle or bottom
     */
    private String verticalAlignment;

    private String formatMask;

    private boolean suppressIfZero;

    private boolean suppressIfBlank;

    private boolean canGrow;

    private String foregroundColor;

    private String backgroundColor;
}
