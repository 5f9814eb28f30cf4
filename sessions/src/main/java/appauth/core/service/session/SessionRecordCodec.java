package appauth.core.service.session;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import appauth.core.model.session.SessionRecord;

/**
 * JSON form of a session record.
 *
 * <p>The layout is flat so that records written by earlier deployments remain
 * readable: {@code sub} is the owner, {@code ts} the issue time and {@code exp} the
 * expiry (both epoch seconds, fractional allowed), {@code rts} the last renewal.
 * Every other top-level field is part of the opaque attribute payload. The
 * session ID is not stored; it is part of the key.
 */
public class SessionRecordCodec {

    static final String OWNER = "sub";
    static final String ISSUED_AT = "ts";
    static final String EXPIRES_AT = "exp";
    static final String RENEWED_AT = "rts";

    /** Attribute names that would collide with the record's own fields. */
    public static final Set<String> RESERVED = Set.of(OWNER, ISSUED_AT, EXPIRES_AT, RENEWED_AT);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {};

    public String encode(SessionRecord record) {
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        for (var entry : record.attributes().entrySet()) {
            if (!RESERVED.contains(entry.getKey())) {
                node.set(entry.getKey(), OBJECT_MAPPER.valueToTree(entry.getValue()));
            }
        }
        node.put(OWNER, record.userId());
        putEpochSeconds(node, ISSUED_AT, record.issuedAt());
        if (record.expiresAt() != null) {
            putEpochSeconds(node, EXPIRES_AT, record.expiresAt());
        }
        if (record.lastRenewedAt() != null) {
            putEpochSeconds(node, RENEWED_AT, record.lastRenewedAt());
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize session " + record.id(), e);
        }
    }

    /**
     * Decode a stored record.
     *
     * @throws IllegalArgumentException if the value is not a session record
     */
    public SessionRecord decode(String sessionId, String json) {
        JsonNode tree;
        try {
            tree = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed session record " + sessionId, e);
        }
        if (!(tree instanceof ObjectNode node) || !node.hasNonNull(OWNER) || !node.hasNonNull(ISSUED_AT)) {
            throw new IllegalArgumentException("Session record " + sessionId + " lacks owner or issue time");
        }

        Instant issuedAt = fromEpochSeconds(node.get(ISSUED_AT));
        Instant expiresAt = node.hasNonNull(EXPIRES_AT) ? fromEpochSeconds(node.get(EXPIRES_AT)) : null;
        Instant renewedAt = node.hasNonNull(RENEWED_AT) ? fromEpochSeconds(node.get(RENEWED_AT)) : issuedAt;
        String owner = node.get(OWNER).asText();

        ObjectNode payload = node.deepCopy();
        payload.remove(RESERVED);
        Map<String, Object> attributes = OBJECT_MAPPER.convertValue(payload, ATTRIBUTES_TYPE);

        return new SessionRecord(sessionId, owner, attributes, issuedAt, expiresAt, renewedAt);
    }

    private static void putEpochSeconds(ObjectNode node, String field, Instant instant) {
        long millis = instant.toEpochMilli();
        if (millis % 1000 == 0) {
            node.put(field, millis / 1000);
        } else {
            node.put(field, BigDecimal.valueOf(millis, 3));
        }
    }

    private static Instant fromEpochSeconds(JsonNode node) {
        return Instant.ofEpochMilli(
                node.decimalValue().movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValueExact());
    }
}
