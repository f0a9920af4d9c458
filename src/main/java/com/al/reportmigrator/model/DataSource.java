package com.al.reportmigrator.model;

import com.al.reportmigrator.model.enums.ConnectionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Database connection the source report reads from. Passwords are never
 * carried over.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSource {

    private String name;

    @Builder.Default
    private ConnectionType connectionType = ConnectionType.UNKNOWN;

    /**
     * Raw driver connection string, e.g. "Server=db01;Database=sales".
     */
    private String connectionString;

    private String server;

    private String database;

    private String username;
}
