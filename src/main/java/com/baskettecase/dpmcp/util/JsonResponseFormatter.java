package com.baskettecase.dpmcp.util;

import com.baskettecase.dpmcp.error.ErrorCode;
import com.baskettecase.dpmcp.gateway.ResponseEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders tool results as JSON text for MCP clients.
 *
 * Temporal values are written as ISO-8601 strings, never as epoch arrays.
 */
@Slf4j
public final class JsonResponseFormatter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonResponseFormatter() {
    }

    public static ObjectMapper mapper() {
        return mapper;
    }

    public static String toJson(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }

    /**
     * Serialize an envelope. Serialization failures become an INTERNAL_ERROR envelope
     * so the tool caller still receives valid JSON.
     */
    public static String formatEnvelope(ResponseEnvelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.error("❌ Could not serialize response {}: {}", envelope.getRequestId(), e.getMessage());
            ResponseEnvelope fallback = ResponseEnvelope.error(envelope.getRequestId(), envelope.getTransactionId(),
                    ErrorCode.INTERNAL_ERROR, "Response could not be serialized: " + e.getOriginalMessage());
            try {
                return mapper.writeValueAsString(fallback);
            } catch (JsonProcessingException unexpected) {
                throw new IllegalStateException("Error envelope is not serializable", unexpected);
            }
        }
    }
}
