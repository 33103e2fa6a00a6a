package com.knotcore.service.scheduling;

import com.knotcore.model.entity.Milestone;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MilestoneEventHandlerTest {

    @Mock
    private NotificationScheduler notificationScheduler;

    @InjectMocks
    private MilestoneEventHandler handler;

    private final Milestone milestone = Milestone.builder().id(UUID.randomUUID()).build();

    @Test
    void handle_UpdateReschedules() {
        when(notificationScheduler.scheduleFor(milestone)).thenReturn(Mono.just(List.of()));

        StepVerifier.create(handler.handle(new MilestoneChangedEvent(MilestoneChangedEvent.Kind.UPDATED, milestone)))
                .verifyComplete();

        verify(notificationScheduler, never()).cancelFor(any());
    }

    @Test
    void handle_DeleteCancels() {
        when(notificationScheduler.cancelFor(milestone.getId())).thenReturn(Mono.just(2));

        StepVerifier.create(handler.handle(new MilestoneChangedEvent(MilestoneChangedEvent.Kind.DELETED, milestone)))
                .verifyComplete();

        verify(notificationScheduler, never()).scheduleFor(any(Milestone.class));
    }
}
