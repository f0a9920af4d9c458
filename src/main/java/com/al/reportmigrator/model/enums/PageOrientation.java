package com.al.reportmigrator.model.enums;

public enum PageOrientation {
    PORTRAIT,
    LANDSCAPE
}
