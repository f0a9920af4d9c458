package com.al.reportmigrator.model.enums;

public enum ProgramUnitKind {
    FORMULA_FUNCTION,
    FORMAT_TRIGGER
}
