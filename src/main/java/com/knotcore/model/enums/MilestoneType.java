package com.knotcore.model.enums;

/**
 * Kind of milestone tracked for a partner.
 */
public enum MilestoneType {
    BIRTHDAY, ANNIVERSARY, HOLIDAY, CUSTOM
}
