package com.knotcore.service.push;

import com.knotcore.model.enums.DevicePlatform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Push delivery through an HTTP push gateway.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpPushDeliveryClient implements PushDeliveryClient {

    private final WebClient.Builder webClientBuilder;

    @Value("${knot.push.gateway-url}")
    private String gatewayUrl;

    @Value("${knot.push.api-key:}")
    private String apiKey;

    @Override
    public Mono<Void> send(String deviceToken, DevicePlatform platform, PushPayload payload) {
        WebClient webClient = webClientBuilder.baseUrl(gatewayUrl).build();

        Map<String, Object> data = new HashMap<>();
        data.put("notificationId", payload.getNotificationId().toString());
        data.put("milestoneId", payload.getMilestoneId().toString());
        data.put("daysBefore", payload.getDaysBefore());
        data.put("recommendationIds", payload.getRecommendationIds());

        Map<String, Object> requestBody = Map.of(
                "token", deviceToken,
                "platform", platform.name(),
                "title", payload.getTitle(),
                "body", payload.getBody(),
                "data", data
        );

        return webClient.post()
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .bodyValue(requestBody)
                .retrieve()
                .toBodilessEntity()
                .doOnNext(response -> log.debug("Push gateway accepted notification {} ({})",
                        payload.getNotificationId(), response.getStatusCode()))
                .then();
    }
}
