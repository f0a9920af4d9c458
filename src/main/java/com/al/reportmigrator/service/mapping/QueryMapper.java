package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.model.QueryColumn;
import com.al.reportmigrator.model.QueryDefinition;
import com.al.reportmigrator.model.target.TargetColumn;
import com.al.reportmigrator.model.target.TargetQuery;
import com.al.reportmigrator.util.TargetNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps source queries to target data model queries. Explicit SQL is kept as
 * is; otherwise a SELECT is assembled from the declared tables and columns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryMapper {

    private final TypeMapper typeMapper;

    public TargetQuery map(QueryDefinition query) {
        String name = "Q_" + TargetNames.sanitize(query.getName() == null || query.getName().isBlank()
                ? "MAIN"
                : query.getName());
        TargetQuery.TargetQueryBuilder builder = TargetQuery.builder()
                .sourceName(query.getName())
                .name(name);

        for (QueryColumn column : query.getColumns()) {
            builder.column(TargetColumn.builder()
                    .sourceName(column.getName())
                    .name(TargetNames.columnName(column.getName()))
                    .dataType(typeMapper.mapType(column.getValueType(), column.getLength(),
                            column.getPrecision(), column.getScale()).getDeclaration())
                    .build());
        }

        if (query.getSql() != null && !query.getSql().isBlank()) {
            builder.sql(query.getSql().trim()).generated(false);
        } else if (!query.getColumns().isEmpty()) {
            builder.sql(generateSelect(query)).generated(true);
            log.debug("Generated SQL for query {}", query.getName());
        } else {
            throw new IllegalArgumentException("Query '" + query.getName() + "' has neither SQL nor columns");
        }
        if (query.getTables().size() > 1 && (query.getSql() == null || query.getSql().isBlank())) {
            builder.warning("Query '" + query.getName() + "' joins " + query.getTables().size()
                    + " tables without join conditions; add them to the generated SQL");
        }
        return builder.build();
    }

    private String generateSelect(QueryDefinition query) {
        List<String> selectList = new ArrayList<>();
        for (QueryColumn column : query.getColumns()) {
            if (column.getTableName() != null && !column.getTableName().isBlank()) {
                selectList.add(column.getTableName() + "." + column.getName());
            } else {
                selectList.add(column.getName());
            }
        }
        String from = query.getTables().isEmpty() ? "DUAL" : String.join(", ", query.getTables());
        return "SELECT " + String.join(", ", selectList) + " FROM " + from;
    }
}
