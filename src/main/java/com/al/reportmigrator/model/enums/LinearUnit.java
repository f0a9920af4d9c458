package com.al.reportmigrator.model.enums;

import lombok.Getter;

import java.util.Locale;

/**
 * Linear units understood by the layout engine. Every unit is defined by how
 * many of it make up one inch, so any pair converts through inches.
 */
@Getter
public enum LinearUnit {

    /**
     * Source layout unit, 1/1440 inch.
     */
    TWIPS(1440.0),
    POINTS(72.0),
    INCHES(1.0),
    CENTIMETERS(2.54),
    MILLIMETERS(25.4);

    private final double perInch;

    LinearUnit(double perInch) {
        this.perInch = perInch;
    }

    /**
     * Resolve a unit from configuration text such as "points", "pt", "cm" or
     * "inches". Returns null when the text names no known unit.
     */
    public static LinearUnit fromName(String name) {
        if (name == null) {
            return null;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "twips":
            case "twip":
                return TWIPS;
            case "points":
            case "point":
            case "pt":
                return POINTS;
            case "inches":
            case "inch":
            case "in":
                return INCHES;
            case "centimeters":
            case "centimetres":
            case "cm":
                return CENTIMETERS;
            case "millimeters":
            case "millimetres":
            case "mm":
                return MILLIMETERS;
            default:
                return null;
        }
    }
}
