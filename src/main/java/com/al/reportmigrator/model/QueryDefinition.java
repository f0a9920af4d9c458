package com.al.reportmigrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryDefinition {

    private String name;

    /**
     * Explicit SQL command, if the source report carries one.
     */
    private String sql;

    @Builder.Default
    private List<String> tables = new ArrayList<>();

    @Builder.Default
    private List<QueryColumn> columns = new ArrayList<>();
}
