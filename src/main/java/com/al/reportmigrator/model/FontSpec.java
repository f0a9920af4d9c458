package com.al.reportmigrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FontSpec {

    private String name;

    private double size;

    private boolean bold;

    private boolean italic;

    private boolean underline;

    private boolean strikeout;

    private String color;
}
