package com.al.reportmigrator.model;

import com.al.reportmigrator.model.enums.SortDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Group {

    private String name;

    /**
     * Field the group breaks on, e.g. "{orders.region}".
     */
    private String fieldName;

    @Builder.Default
    private SortDirection sortDirection = SortDirection.ASCENDING;

    private boolean keepTogether;

    private boolean repeatHeader;
}
