package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.config.ConnectionProperties;
import com.al.reportmigrator.model.DataSource;
import com.al.reportmigrator.model.target.TargetConnection;
import com.al.reportmigrator.util.TargetNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps source data sources onto target connections: a configured template,
 * an Easy Connect string parsed from the driver connection string, or a TNS
 * alias derived from the source name.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionMapper {

    private static final Pattern SERVER_DATABASE =
            Pattern.compile("Server=([^;]+);.*Database=([^;]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATA_SOURCE_CATALOG =
            Pattern.compile("Data Source=([^;]+);.*Initial Catalog=([^;]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOST_SERVICE =
            Pattern.compile("HOST=([^)]+).*SERVICE_NAME=([^)]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TNS_ALIAS =
            Pattern.compile("Data Source=(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ODBC_DSN =
            Pattern.compile("DSN=([^;]+)", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> HOST_PATTERNS = List.of(SERVER_DATABASE, DATA_SOURCE_CATALOG, HOST_SERVICE);

    private final ConnectionProperties properties;

    public TargetConnection map(DataSource source) {
        if (source.getName() == null || source.getName().isBlank()) {
            throw new IllegalArgumentException("Data source without a name");
        }
        String alias = TargetNames.sanitize(source.getName());
        TargetConnection.TargetConnectionBuilder builder = TargetConnection.builder()
                .sourceName(source.getName())
                .name(alias)
                .username(source.getUsername() == null || source.getUsername().isBlank()
                        ? null : source.getUsername());

        String template = properties.getTemplates().get(source.getName());
        if (template != null) {
            log.debug("Data source '{}' mapped by template to {}", source.getName(), template);
            return builder.connectString(template).build();
        }

        String connectionString = source.getConnectionString() == null ? "" : source.getConnectionString();
        for (Pattern pattern : HOST_PATTERNS) {
            Matcher matcher = pattern.matcher(connectionString);
            if (matcher.find()) {
                return hostConnection(builder, alias, matcher.group(1).trim(), matcher.group(2).trim());
            }
        }
        Matcher matcher = TNS_ALIAS.matcher(connectionString);
        if (matcher.find()) {
            return builder.connectString(matcher.group(1)).build();
        }
        matcher = ODBC_DSN.matcher(connectionString);
        if (matcher.find()) {
            String dsn = matcher.group(1).trim();
            String mapped = mapOdbcDsn(dsn, properties.getTemplates());
            return builder.connectString(mapped)
                    .warning("ODBC DSN '" + dsn + "' mapped to '" + mapped + "'; verify the TNS alias exists")
                    .build();
        }

        if (notBlank(source.getServer()) && notBlank(source.getDatabase())) {
            return hostConnection(builder, alias, source.getServer().trim(), source.getDatabase().trim());
        }
        if (notBlank(source.getServer())) {
            builder.warning("No database given for server '" + source.getServer().trim()
                    + "'; using service " + properties.getDefaultService());
            return hostConnection(builder, alias, source.getServer().trim(), properties.getDefaultService());
        }
        String fallback = source.getName().trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        return builder.connectString(fallback)
                .warning("No connection details; assuming TNS alias " + fallback)
                .build();
    }

    /**
     * TNS alias for an ODBC DSN: the explicit mapping when present, else the
     * DSN upper cased with spaces and dashes as underscores.
     */
    public String mapOdbcDsn(String dsn, Map<String, String> mapping) {
        if (mapping != null && mapping.containsKey(dsn)) {
            return mapping.get(dsn);
        }
        return dsn.toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    /**
     * Entry for tnsnames.ora.
     */
    public String tnsEntry(String alias, String host, int port, String serviceName) {
        return alias + " =\n"
                + "  (DESCRIPTION =\n"
                + "    (ADDRESS = (PROTOCOL = TCP)(HOST = " + host + ")(PORT = " + port + "))\n"
                + "    (CONNECT_DATA = (SERVICE_NAME = " + serviceName + "))\n"
                + "  )";
    }

    private TargetConnection hostConnection(TargetConnection.TargetConnectionBuilder builder, String alias,
                                            String server, String service) {
        String host = server;
        int port = properties.getDefaultPort();
        int colon = server.lastIndexOf(':');
        if (colon > 0 && colon < server.length() - 1
                && server.substring(colon + 1).chars().allMatch(Character::isDigit)) {
            host = server.substring(0, colon);
            port = Integer.parseInt(server.substring(colon + 1));
        }
        return builder.connectString("//" + server + "/" + service)
                .tnsEntry(tnsEntry(alias, host, port, service))
                .build();
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
