package com.al.reportmigrator.model.enums;

public enum ConnectionType {
    ODBC,
    OLE_DB,
    JDBC,
    NATIVE,
    ORACLE,
    SQL_SERVER,
    UNKNOWN
}
