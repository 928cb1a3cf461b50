package com.example.engage.service;

import com.example.engage.config.EngageProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final EngageProperties engageProperties;

    public RedisKeyFactory(EngageProperties engageProperties) {
        this.engageProperties = engageProperties;
    }

    private String prefix() {
        return engageProperties.getRedis().getKeyPrefix();
    }

    public String presenceKey(String userId) {
        return "%s:presence:%s".formatted(prefix(), userId);
    }
}
