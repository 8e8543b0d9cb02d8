package com.smsgate.ratelimit;

import com.smsgate.message.MessageType;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds counter keys of the form {@code smsgate:rate_limit:{tenant}:sms:minute}.
 * The tenant id is URL-encoded so that no tenant can produce a key that collides with
 * another tenant's, and the braces form a Redis Cluster hash tag so all windows of one
 * tenant land in the same slot.
 */
@Component
public class RateLimitKeyGenerator {

    static final String PREFIX = "smsgate:rate_limit:";

    public String key(String tenantId, MessageType messageType, RateWindow window) {
        return tenantPrefix(tenantId) + messageType.lowerName() + ":" + window.lowerName();
    }

    /** Common prefix of every key belonging to {@code tenantId}. */
    public String tenantPrefix(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        return PREFIX + "{" + URLEncoder.encode(tenantId, StandardCharsets.UTF_8) + "}:";
    }

    public long windowSeconds(RateWindow window) {
        return window.seconds();
    }

    public List<String> keys(String tenantId, MessageType messageType) {
        List<String> keys = new ArrayList<>(RateWindow.values().length);
        for (RateWindow window : RateWindow.values()) {
            keys.add(key(tenantId, messageType, window));
        }
        return keys;
    }

    /**
     * Reverses {@link #key}. Returns null for anything that is not a rate-limit key.
     */
    public ParsedKey parse(String key) {
        if (key == null || !key.startsWith(PREFIX + "{")) return null;

        int close = key.lastIndexOf("}:");
        if (close < 0) return null;
        String[] rest = key.substring(close + 2).split(":");
        if (rest.length != 2) return null;

        try {
            String tenantId = URLDecoder.decode(key.substring(PREFIX.length() + 1, close), StandardCharsets.UTF_8);
            MessageType type = MessageType.valueOf(rest[0].toUpperCase(Locale.ROOT));
            RateWindow window = RateWindow.valueOf(rest[1].toUpperCase(Locale.ROOT));
            return new ParsedKey(tenantId, type, window);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public record ParsedKey(String tenantId, MessageType messageType, RateWindow window) {}
}
