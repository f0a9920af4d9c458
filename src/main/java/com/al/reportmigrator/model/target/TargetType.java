package com.al.reportmigrator.model.target;

import lombok.Builder;
import lombok.Value;

/**
 * A target column or variable type with its optional size attributes.
 */
@Value
@Builder
public class TargetType {

    /**
     * Base type name, e.g. VARCHAR2 or NUMBER.
     */
    String name;

    Integer length;

    Integer precision;

    Integer scale;

    /**
     * Full declaration, e.g. "VARCHAR2(4000)", "NUMBER(15,2)" or "DATE".
     */
    public String getDeclaration() {
        if (length != null) {
            return name + "(" + length + ")";
        }
        if (precision != null) {
            return scale != null ? name + "(" + precision + "," + scale + ")" : name + "(" + precision + ")";
        }
        if (scale != null) {
            return name + "(*," + scale + ")";
        }
        return name;
    }

    @Override
    public String toString() {
        return getDeclaration();
    }
}
