package com.knotcore.service.scheduling;

import com.knotcore.model.entity.Milestone;
import lombok.Value;

/**
 * Emitted when a milestone is created, updated or about to be deleted.
 */
@Value
public class MilestoneChangedEvent {

    public enum Kind {
        CREATED,
        UPDATED,
        DELETED
    }

    Kind kind;
    Milestone milestone;
}
