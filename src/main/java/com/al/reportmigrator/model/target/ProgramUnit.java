package com.al.reportmigrator.model.target;

import com.al.reportmigrator.model.enums.ProgramUnitKind;
import lombok.Builder;
import lombok.Value;

/**
 * One named block of generated code handed to the target code generator.
 */
@Value
@Builder
public class ProgramUnit {

    String name;

    ProgramUnitKind kind;

    String code;
}
