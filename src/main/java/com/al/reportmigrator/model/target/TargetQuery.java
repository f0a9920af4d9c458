package com.al.reportmigrator.model.target;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TargetQuery {

    String sourceName;

    String name;

    String sql;

    /**
     * The SQL was assembled from tables and columns instead of copied.
     */
    boolean generated;

    @Singular
    List<TargetColumn> columns;

    @Singular
    List<String> warnings;
}
