package com.al.reportmigrator.util;

import java.util.Locale;

/**
 * Derivation of target identifiers from source names.
 *
 * <p>
 * Target identifiers are upper case, contain only letters, digits and
 * underscores, never start with a digit and carry their prefix exactly once.
 *
 * @author Report Migrator Team
 * @version 1.0.0
 * @since 1.0.0
 */
public final class TargetNames {

    private TargetNames() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Name of the generated function for a formula, e.g. "@Order Total" to
     * "CF_ORDER_TOTAL" with prefix "CF_".
     */
    public static String formulaName(String prefix, String formulaName) {
        return prefixed(prefix, stripMarker(formulaName, '@'), "F_");
    }

    /**
     * Name of the target parameter, e.g. "?Start Date" to "P_START_DATE".
     */
    public static String parameterName(String prefix, String parameterName) {
        return prefixed(prefix, stripMarker(parameterName, '?'), "P");
    }

    /**
     * Name of a generated layout object such as a chart or subreport, e.g.
     * "Sales by Region" to "CH_SALES_BY_REGION" with prefix "CH_".
     */
    public static String objectName(String prefix, String name) {
        return prefixed(prefix, stripBraces(name == null ? "" : name.trim()), "");
    }

    /**
     * Bound name of a column reference: the last dot segment, upper case,
     * spaces as underscores. "{orders.unit price}" gives "UNIT_PRICE".
     */
    public static String columnName(String reference) {
        if (reference == null) {
            return "";
        }
        String ref = stripBraces(reference.trim());
        int dot = ref.lastIndexOf('.');
        if (dot >= 0) {
            ref = ref.substring(dot + 1);
        }
        return ref.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
    }

    /**
     * Upper case, every character outside [A-Z0-9_] replaced by an underscore.
     */
    public static String sanitize(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_]", "_");
    }

    /**
     * Remove one pair of surrounding braces, as in "{orders.amount}".
     */
    public static String stripBraces(String text) {
        if (text != null && text.length() >= 2 && text.startsWith("{") && text.endsWith("}")) {
            return text.substring(1, text.length() - 1).trim();
        }
        return text;
    }

    private static String stripMarker(String name, char marker) {
        String stripped = stripBraces(name == null ? "" : name.trim());
        if (!stripped.isEmpty() && stripped.charAt(0) == marker) {
            stripped = stripped.substring(1);
        }
        return stripped.trim();
    }

    private static String prefixed(String prefix, String name, String digitGuard) {
        String safePrefix = prefix == null ? "" : prefix.toUpperCase(Locale.ROOT);
        String body = name.replaceAll("[^A-Za-z0-9_]", "_").toUpperCase(Locale.ROOT);
        if (body.isEmpty()) {
            body = "UNNAMED";
        }
        if (Character.isDigit(body.charAt(0))) {
            body = digitGuard + body;
        }
        if (!body.startsWith(safePrefix)) {
            body = safePrefix + body;
        }
        return body;
    }
}
