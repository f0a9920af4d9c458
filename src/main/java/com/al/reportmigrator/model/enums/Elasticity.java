package com.al.reportmigrator.model.enums;

public enum Elasticity {
    FIXED,
    EXPAND,
    CONTRACT,
    VARIABLE
}
