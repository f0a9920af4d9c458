package com.al.reportmigrator.model.enums;

public enum FrameKind {
    MARGIN,
    HEADER,
    BODY,
    TRAILER,
    REPEATING
}
