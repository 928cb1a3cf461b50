package com.example.engage.dto;

import com.example.engage.domain.Engagement;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Body of the {@code proactive_message} push.
 */
@Value
@Builder
public class ProactiveMessagePayload {

    public static final String TYPE = "proactive_message";

    String type;
    String engagementId;
    String content;
    String trigger;
    Double confidence;
    Map<String, Object> metadata;

    public static ProactiveMessagePayload from(Engagement engagement) {
        return ProactiveMessagePayload.builder()
                .type(TYPE)
                .engagementId(engagement.getId())
                .content(engagement.getContent())
                .trigger(engagement.getTrigger())
                .confidence(engagement.getConfidence())
                .metadata(Map.of("proactive", true))
                .build();
    }
}
