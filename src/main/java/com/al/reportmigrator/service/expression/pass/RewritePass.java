package com.al.reportmigrator.service.expression.pass;

import com.al.reportmigrator.service.expression.RewriteState;

/**
 * One whole-string rewrite step. Implementations are pure: they never mutate
 * the incoming state and never re-match text produced by an earlier pass.
 */
public interface RewritePass {

    /**
     * Short name used in logs.
     */
    String name();

    RewriteState apply(RewriteState state);
}
