package com.smsgate.web;

import com.smsgate.audit.AuditEvent;
import com.smsgate.audit.AuditService;
import com.smsgate.message.MessageType;
import com.smsgate.ratelimit.RateLimitKeyGenerator;
import com.smsgate.ratelimit.RateLimitResult;
import com.smsgate.ratelimit.RateWindow;
import com.smsgate.ratelimit.SmsRateLimiter;
import com.smsgate.ratelimit.UsageSnapshot;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/rate-limits/{tenantId}")
public class RateLimitAdminController {

    private final SmsRateLimiter rateLimiter;
    private final AuditService auditService;

    public RateLimitAdminController(SmsRateLimiter rateLimiter, AuditService auditService) {
        this.rateLimiter = rateLimiter;
        this.auditService = auditService;
    }

    @GetMapping
    public List<RateLimitKeyGenerator.ParsedKey> activeCounters(@PathVariable String tenantId) {
        return rateLimiter.activeCounters(tenantId);
    }

    @GetMapping("/{type}")
    public UsageSnapshot usage(@PathVariable String tenantId, @PathVariable String type) {
        return rateLimiter.getCurrentUsage(tenantId, messageType(type));
    }

    @GetMapping("/{type}/check")
    public RateLimitResult check(@PathVariable String tenantId, @PathVariable String type) {
        return rateLimiter.checkOnly(tenantId, messageType(type));
    }

    @DeleteMapping("/{type}")
    public Map<String, Object> reset(@PathVariable String tenantId, @PathVariable String type,
                                     @RequestParam(required = false) String window) {
        RateWindow rateWindow = window != null ? RateWindow.fromName(window) : null;
        long deleted = rateLimiter.resetLimits(tenantId, messageType(type), rateWindow);
        auditService.log(AuditEvent.of(AuditEvent.TYPE_RATE_LIMIT_RESET, "RESET " + type)
                .withTenantId(tenantId)
                .withDetails("window=" + (rateWindow != null ? rateWindow.lowerName() : "all")));
        return Map.of("deleted", deleted, "window", rateWindow != null ? rateWindow.lowerName() : "all");
    }

    private static MessageType messageType(String type) {
        try {
            return MessageType.valueOf(type.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown message type: " + type);
        }
    }
}
