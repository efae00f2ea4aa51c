package com.example.messenger.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Socket.IO JSON support aligned with the application {@link ObjectMapper}, so agent console
 * payloads carry ISO-8601 timestamps like the REST API does.
 */
public class SpringJacksonJsonSupport extends JacksonJsonSupport {

    public SpringJacksonJsonSupport(ObjectMapper applicationMapper) {
        super(new JavaTimeModule());
        objectMapper.configure(
                SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                applicationMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        objectMapper.configure(
                DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                applicationMapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        objectMapper.setTimeZone(applicationMapper.getSerializationConfig().getTimeZone());
    }
}
