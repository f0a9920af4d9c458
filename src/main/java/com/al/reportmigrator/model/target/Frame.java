package com.al.reportmigrator.model.target;

import com.al.reportmigrator.model.enums.Elasticity;
import com.al.reportmigrator.model.enums.FrameKind;
import com.al.reportmigrator.model.enums.PrintDirection;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Immutable node of the synthesized layout tree. Coordinates are in target
 * units relative to the parent frame.
 */
@Value
@Builder(toBuilder = true)
public class Frame {

    /**
     * Group sentinel bound by the innermost repeating frame.
     */
    public static final String DETAIL_GROUP = "DETAIL";

    String name;

    FrameKind kind;

    /**
     * Group a repeating frame iterates over, or {@link #DETAIL_GROUP}.
     */
    String sourceGroup;

    /**
     * Source section this frame was built from, if any.
     */
    String sourceSection;

    double x;

    double y;

    double width;

    double height;

    @Builder.Default
    Elasticity verticalElasticity = Elasticity.FIXED;

    @Builder.Default
    Elasticity horizontalElasticity = Elasticity.FIXED;

    @Builder.Default
    PrintDirection printDirection = PrintDirection.DOWN;

    boolean pageProtect;

    @Builder.Default
    boolean visible = true;

    String formatTrigger;

    @Singular
    List<Frame> children;

    @Singular
    List<OutputField> fields;

    /**
     * Direct children of the given kind, in order.
     */
    public List<Frame> childrenOfKind(FrameKind frameKind) {
        List<Frame> result = new ArrayList<>();
        for (Frame child : children) {
            if (child.getKind() == frameKind) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * This frame and all descendants matching the predicate, depth first.
     */
    public List<Frame> collect(Predicate<Frame> predicate) {
        List<Frame> result = new ArrayList<>();
        collectInto(predicate, result);
        return result;
    }

    private void collectInto(Predicate<Frame> predicate, List<Frame> result) {
        if (predicate.test(this)) {
            result.add(this);
        }
        for (Frame child : children) {
            child.collectInto(predicate, result);
        }
    }
}
