package com.smsgate.security;

import com.smsgate.audit.AuditService;
import com.smsgate.config.SmsGateProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UriComponentsBuilder;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Map;
import java.util.TreeMap;

/**
 * Verifies the carrier's request signature on every {@code /webhooks/} call.
 * Signature = Base64(HMAC-SHA1(authToken, url + each form parameter name and value, sorted by name)).
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class WebhookSignatureFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureFilter.class);

    static final String SIGNATURE_HEADER = "X-Twilio-Signature";

    private final SmsGateProperties properties;
    private final AuditService auditService;

    public WebhookSignatureFilter(SmsGateProperties properties, AuditService auditService) {
        this.properties = properties;
        this.auditService = auditService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/webhooks/")
                || !properties.getWebhook().isSignatureValidationEnabled();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                   HttpServletResponse response,
                                   FilterChain filterChain) throws ServletException, IOException {
        String path = request.getRequestURI();
        String tenantId = extractTenantId(path);

        if (!verify(request)) {
            log.warn("Webhook signature verification failed path={} ip={}", path, request.getRemoteAddr());
            auditService.logWebhookAuth(tenantId, path, false, request.getRemoteAddr());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            response.getWriter().write("{\"error\":\"webhook_auth_failed\"}");
            return;
        }

        log.debug("Webhook authenticated path={}", path);
        auditService.logWebhookAuth(tenantId, path, true, request.getRemoteAddr());
        filterChain.doFilter(request, response);
    }

    private boolean verify(HttpServletRequest request) {
        String authToken = properties.getGateway().getAuthToken();
        if (authToken == null || authToken.isEmpty()) {
            log.warn("Carrier auth token not configured, rejecting webhook");
            return false;
        }
        String signature = request.getHeader(SIGNATURE_HEADER);
        if (signature == null || signature.isEmpty()) return false;

        String expected = computeSignature(authToken, requestUrl(request), formParameters(request));
        return constantTimeEquals(signature, expected);
    }

    static String computeSignature(String authToken, String url, Map<String, String[]> params) {
        StringBuilder data = new StringBuilder(url);
        for (Map.Entry<String, String[]> entry : new TreeMap<>(params).entrySet()) {
            for (String value : entry.getValue()) {
                data.append(entry.getKey()).append(value);
            }
        }
        try {
            Mac mac = Mac.getInstance("HmacSHA1");
            mac.init(new SecretKeySpec(authToken.getBytes(StandardCharsets.UTF_8), "HmacSHA1"));
            byte[] hash = mac.doFinal(data.toString().getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            log.error("HMAC computation failed", e);
            return "";
        }
    }

    // query-string parameters are already part of the signed URL
    private static Map<String, String[]> formParameters(HttpServletRequest request) {
        String query = request.getQueryString();
        if (query == null) return request.getParameterMap();
        Map<String, String[]> params = new TreeMap<>(request.getParameterMap());
        UriComponentsBuilder.fromUriString("?" + query).build().getQueryParams().keySet().forEach(params::remove);
        return params;
    }

    private String requestUrl(HttpServletRequest request) {
        String publicBaseUrl = properties.getWebhook().getPublicBaseUrl();
        String base = publicBaseUrl != null && !publicBaseUrl.isBlank()
                ? stripTrailingSlash(publicBaseUrl) + request.getRequestURI()
                : request.getRequestURL().toString();
        String query = request.getQueryString();
        return query != null ? base + "?" + query : base;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null || a.length() != b.length()) return false;
        int result = 0;
        for (int i = 0; i < a.length(); i++) {
            result |= a.charAt(i) ^ b.charAt(i);
        }
        return result == 0;
    }

    private static String extractTenantId(String path) {
        // /webhooks/sms/{tenantId}/...
        String[] parts = path.split("/");
        return parts.length > 3 ? parts[3] : null;
    }
}
