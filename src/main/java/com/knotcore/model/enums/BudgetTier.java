package com.knotcore.model.enums;

/**
 * Budget bracket attached to a milestone.
 */
public enum BudgetTier {
    JUST_BECAUSE,
    MINOR_OCCASION,
    MAJOR_MILESTONE;

    /**
     * Default tier for a milestone type.
     *
     * @param type Milestone type
     * @return Default tier, or null when the type requires an explicit tier
     */
    public static BudgetTier defaultFor(MilestoneType type) {
        switch (type) {
            case BIRTHDAY:
            case ANNIVERSARY:
                return MAJOR_MILESTONE;
            case HOLIDAY:
                return MINOR_OCCASION;
            default:
                return null;
        }
    }
}
