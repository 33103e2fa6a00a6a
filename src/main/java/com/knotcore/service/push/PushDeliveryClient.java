package com.knotcore.service.push;

import com.knotcore.model.enums.DevicePlatform;
import reactor.core.publisher.Mono;

/**
 * Transport to the user's device (APNs/FCM behind a gateway).
 * Completes empty on success and errors on any delivery failure.
 */
public interface PushDeliveryClient {

    Mono<Void> send(String deviceToken, DevicePlatform platform, PushPayload payload);
}
