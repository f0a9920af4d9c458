package com.al.reportmigrator.model.target;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of one layout synthesis run: the frame tree, every trigger generated
 * for fields and sections, and the warnings raised along the way.
 */
@Value
@Builder
public class LayoutResult {

    double pageWidth;

    double pageHeight;

    double margin;

    /**
     * Root of the tree, spanning the printable area.
     */
    Frame marginFrame;

    Frame headerFrame;

    Frame bodyFrame;

    Frame trailerFrame;

    @Singular
    List<Trigger> triggers;

    @Singular
    List<String> warnings;

    /**
     * Owners whose trigger could not be generated under the fail-hard policy.
     */
    @Singular
    List<String> failedTriggers;
}
