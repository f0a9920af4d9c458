package com.al.reportmigrator.model.target;

import com.al.reportmigrator.model.enums.Elasticity;
import com.al.reportmigrator.model.enums.SourceKind;
import lombok.Builder;
import lombok.Value;

/**
 * A positioned field in the target layout, in target units relative to its frame.
 */
@Value
@Builder(toBuilder = true)
public class OutputField {

    String name;

    String sourceName;

    SourceKind sourceKind;

    /**
     * Resolved binding: column, formula or parameter name, system variable or literal text.
     */
    String source;

    double x;

    double y;

    double width;

    double height;

    String fontFamily;

    double fontSize;

    String fontStyle;

    boolean underline;

    String horizontalAlignment;

    String verticalAlignment;

    String formatMask;

    String foregroundColor;

    String backgroundColor;

    @Builder.Default
    Elasticity verticalElasticity = Elasticity.FIXED;

    @Builder.Default
    boolean visible = true;

    /**
     * Name of the format trigger controlling this field, if any.
     */
    String formatTrigger;
}
