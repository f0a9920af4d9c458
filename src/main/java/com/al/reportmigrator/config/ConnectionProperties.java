package com.al.reportmigrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection defaults and explicit data source to TNS alias mappings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "report-migrator.connections")
public class ConnectionProperties {

    /**
     * Source data source name (or ODBC DSN) to connect string, consulted
     * before the connection string is parsed.
     */
    private Map<String, String> templates = new LinkedHashMap<>();

    private int defaultPort = 1521;

    /**
     * Service name used when a source names a server but no database.
     */
    private String defaultService = "ORCL";
}
