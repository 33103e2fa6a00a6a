package com.knotcore.model.enums;

/**
 * User action recorded against a recommendation.
 */
public enum FeedbackAction {
    SELECTED,
    REFRESHED,
    SAVED,
    SHARED,
    RATED,
    HANDOFF,
    PURCHASED;

    /**
     * Signal carried by this action for the weight learner.
     *
     * @param rating Rating for {@link #RATED}, ignored otherwise
     * @return +1 for positive, -1 for negative, 0 for neutral
     */
    public int polarity(Integer rating) {
        switch (this) {
            case SELECTED:
            case SAVED:
            case SHARED:
            case PURCHASED:
                return 1;
            case REFRESHED:
                return -1;
            case RATED:
                if (rating == null) {
                    return 0;
                }
                if (rating >= 4) {
                    return 1;
                }
                return rating <= 2 ? -1 : 0;
            default:
                return 0;
        }
    }
}
