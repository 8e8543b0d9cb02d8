package com.smsgate.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sets MDC correlation ids for every HTTP request.
 * Propagates: requestId, tenantId (from the URL path), carrierRequestId.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final String CARRIER_REQUEST_ID_HEADER = "I-Twilio-Idempotency-Token";
    private static final Pattern TENANT_IN_PATH = Pattern.compile("/(?:tenants|sms|rate-limits)/([^/]+)");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                   HttpServletResponse response,
                                   FilterChain filterChain) throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString().substring(0, 8);
        }

        MDC.put("requestId", requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        Matcher matcher = TENANT_IN_PATH.matcher(request.getRequestURI());
        if (matcher.find()) {
            MDC.put("tenantId", matcher.group(1));
        }
        String carrierRequestId = request.getHeader(CARRIER_REQUEST_ID_HEADER);
        if (carrierRequestId != null && !carrierRequestId.isBlank()) {
            MDC.put("carrierRequestId", carrierRequestId);
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("requestId");
            MDC.remove("tenantId");
            MDC.remove("carrierRequestId");
        }
    }
}
