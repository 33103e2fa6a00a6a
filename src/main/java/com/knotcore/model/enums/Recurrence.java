package com.knotcore.model.enums;

/**
 * How often a milestone repeats.
 */
public enum Recurrence {
    YEARLY, ONE_TIME
}
