package com.al.reportmigrator.model;

import com.al.reportmigrator.model.enums.ValueType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryColumn {

    private String name;

    private String tableName;

    @Builder.Default
    private ValueType valueType = ValueType.STRING;

    private Integer length;

    private Integer precision;

    private Integer scale;
}
