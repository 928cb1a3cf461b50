package com.example.engage.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Netty-SocketIO JSON support aligned with the application's {@link ObjectMapper}: ISO
 * instants, lenient reads, and null fields left out of pushed payloads.
 */
public class SocketIoJsonSupport extends JacksonJsonSupport {

    public SocketIoJsonSupport(ObjectMapper applicationMapper) {
        super(new JavaTimeModule());

        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.objectMapper.setTimeZone(applicationMapper.getSerializationConfig().getTimeZone());
        if (applicationMapper.getPropertyNamingStrategy() != null) {
            this.objectMapper.setPropertyNamingStrategy(applicationMapper.getPropertyNamingStrategy());
        }
    }
}
