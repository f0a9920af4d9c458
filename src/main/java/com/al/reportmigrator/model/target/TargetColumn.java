package com.al.reportmigrator.model.target;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TargetColumn {

    String sourceName;

    String name;

    String dataType;
}
