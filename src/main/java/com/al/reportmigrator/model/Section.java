package com.al.reportmigrator.model;

import com.al.reportmigrator.model.enums.SectionRole;
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
public class Section {

    private String name;

    /**
     * Explicit role; when null the role is inferred from {@link #typeTag} or
     * the section name.
     */
    private SectionRole role;

    /**
     * Raw role tag as exported by the source tool.
     */
    private String typeTag;

    /**
     * Height in twips.
     */
    private double height;

    private boolean suppress;

    private String suppressCondition;

    /**
     * 1-based group level for group header and footer sections.
     */
    private Integer groupIndex;

    @Builder.Default
    private List<Field> fields = new ArrayList<>();

    public SectionRole resolveRole() {
        return role != null ? role : SectionRole.resolve(typeTag, name);
    }
}
