package com.al.reportmigrator.model.target;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TargetConnection {

    String sourceName;

    String name;

    /**
     * TNS alias or Easy Connect string ("//host/service").
     */
    String connectString;

    String username;

    /**
     * tnsnames.ora entry for a server-based source, null for an alias.
     */
    String tnsEntry;

    @Singular
    List<String> warnings;
}
