package com.agentverse.authz.infrastructure.cache;

import com.agentverse.authz.domain.cache.PermissionValue;
import com.agentverse.authz.domain.error.UnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON encoding of {@link PermissionValue} for out-of-process caches.
 *
 * <p>An unreadable value decodes to a miss, so a format change only costs a store read.
 */
public class PermissionValueCodec {

    private static final Logger log = LoggerFactory.getLogger(PermissionValueCodec.class);

    private final ObjectMapper mapper;

    public PermissionValueCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(PermissionValue value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UnavailableException("Could not encode permission value", e);
        }
    }

    public Optional<PermissionValue> decode(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(json, PermissionValue.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached permission value: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
