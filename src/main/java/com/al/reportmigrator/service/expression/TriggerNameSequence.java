package com.al.reportmigrator.service.expression;

/**
 * Counter numbering generated triggers. One instance per report run; names
 * are reproducible after {@link #reset()}.
 */
public class TriggerNameSequence {

    private int counter;

    public int next() {
        return ++counter;
    }

    public int current() {
        return counter;
    }

    public void reset() {
        counter = 0;
    }
}
