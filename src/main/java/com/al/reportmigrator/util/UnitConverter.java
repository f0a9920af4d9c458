package com.al.reportmigrator.util;

import com.al.reportmigrator.model.enums.LinearUnit;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pure conversions between linear units.
 *
 * <p>
 * Source layouts are measured in twips (1/1440 inch). Every conversion goes
 * through inches, so the result of {@code convert(convert(v, a, b), b, a)}
 * equals {@code v} up to floating point error for every pair of units.
 *
 * @author Report Migrator Team
 * @version 1.0.0
 * @since 1.0.0
 */
public final class UnitConverter {

    /**
     * Private constructor to prevent instantiation.
     */
    private UnitConverter() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Convert a length between two units.
     *
     * @param value length expressed in {@code from}
     * @param from  unit of {@code value}
     * @param to    unit of the result
     * @return the same length expressed in {@code to}
     */
    public static double convert(double value, LinearUnit from, LinearUnit to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Units must not be null");
        }
        if (from == to) {
            return value;
        }
        return value / from.getPerInch() * to.getPerInch();
    }

    /**
     * Convert a source length (twips) to the given target unit.
     */
    public static double fromTwips(double twips, LinearUnit target) {
        return convert(twips, LinearUnit.TWIPS, target);
    }

    /**
     * Convert a target length back to twips.
     */
    public static double toTwips(double value, LinearUnit unit) {
        return convert(value, unit, LinearUnit.TWIPS);
    }

    /**
     * Round half-up to the given number of decimals.
     */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
