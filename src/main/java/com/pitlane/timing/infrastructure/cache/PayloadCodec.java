package com.pitlane.timing.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.domain.model.SessionSummary;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of volatile-tier payloads. A payload that cannot be read back is a miss.
 */
@Component
public class PayloadCodec {

    private static final Logger logger = LoggerFactory.getLogger(PayloadCodec.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final JavaType sessionResultType;
    private final JavaType scheduleType;
    private final JavaType sessionSummariesType;

    public PayloadCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;

        TypeFactory types = objectMapper.getTypeFactory();
        this.sessionResultType = types.constructType(SessionResult.class);
        this.scheduleType = types.constructCollectionType(List.class, Event.class);
        this.sessionSummariesType = types.constructCollectionType(List.class, SessionSummary.class);
    }

    public Optional<String> encode(Object data, Duration ttl) {
        try {
            CacheEnvelope<Object> envelope = new CacheEnvelope<>(data, clock.instant(), ttl.toSeconds());
            return Optional.of(objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            logger.warn("Failed to encode cache payload: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<SessionResult> decodeSessionResult(String json) {
        return decode(json, sessionResultType);
    }

    public Optional<List<Event>> decodeSchedule(String json) {
        return decode(json, scheduleType);
    }

    public Optional<List<SessionSummary>> decodeSessionSummaries(String json) {
        return decode(json, sessionSummariesType);
    }

    public <T> Optional<CacheEnvelope<T>> decodeEnvelope(String json, JavaType dataType) {
        if (json == null || json.isEmpty()) {
            return Optional.empty();
        }
        try {
            JavaType envelopeType = objectMapper.getTypeFactory()
                    .constructParametricType(CacheEnvelope.class, dataType);
            CacheEnvelope<T> envelope = objectMapper.readValue(json, envelopeType);
            return Optional.ofNullable(envelope);
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable cache payload: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> decode(String json, JavaType dataType) {
        return this.<T>decodeEnvelope(json, dataType).map(CacheEnvelope::data);
    }
}
