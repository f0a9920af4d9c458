package com.al.reportmigrator.model.enums;

public enum PrintDirection {
    DOWN,
    ACROSS,
    DOWN_ACROSS,
    ACROSS_DOWN
}
