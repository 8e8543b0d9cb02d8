package com.smsgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "smsgate")
public class SmsGateProperties {

    private RateLimitProperties rateLimit = new RateLimitProperties();
    private RedisProperties redis = new RedisProperties();
    private ConsentProperties consent = new ConsentProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private GatewayProperties gateway = new GatewayProperties();
    private WebhookProperties webhook = new WebhookProperties();
    private LoggingProperties logging = new LoggingProperties();

    public RateLimitProperties getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitProperties rateLimit) { this.rateLimit = rateLimit; }

    public RedisProperties getRedis() { return redis; }
    public void setRedis(RedisProperties redis) { this.redis = redis; }

    public ConsentProperties getConsent() { return consent; }
    public void setConsent(ConsentProperties consent) { this.consent = consent; }

    public DispatchProperties getDispatch() { return dispatch; }
    public void setDispatch(DispatchProperties dispatch) { this.dispatch = dispatch; }

    public GatewayProperties getGateway() { return gateway; }
    public void setGateway(GatewayProperties gateway) { this.gateway = gateway; }

    public WebhookProperties getWebhook() { return webhook; }
    public void setWebhook(WebhookProperties webhook) { this.webhook = webhook; }

    public LoggingProperties getLogging() { return logging; }
    public void setLogging(LoggingProperties logging) { this.logging = logging; }

    /**
     * Per-tier, per-message-type window thresholds. Keys are lower-case tier names
     * (free, basic, premium, enterprise) and message types (sms, mms).
     */
    public static class RateLimitProperties {
        private String defaultTier = "free";
        private Map<String, String> tenantTiers = new LinkedHashMap<>();
        private Map<String, Map<String, WindowLimitProperties>> tiers = defaultTiers();

        public String getDefaultTier() { return defaultTier; }
        public void setDefaultTier(String defaultTier) { this.defaultTier = defaultTier; }
        public Map<String, String> getTenantTiers() { return tenantTiers; }
        public void setTenantTiers(Map<String, String> tenantTiers) { this.tenantTiers = tenantTiers; }
        public Map<String, Map<String, WindowLimitProperties>> getTiers() { return tiers; }
        public void setTiers(Map<String, Map<String, WindowLimitProperties>> tiers) { this.tiers = tiers; }

        private static Map<String, Map<String, WindowLimitProperties>> defaultTiers() {
            Map<String, Map<String, WindowLimitProperties>> tiers = new LinkedHashMap<>();
            tiers.put("free", tier(new WindowLimitProperties(5, 25, 100), new WindowLimitProperties(2, 10, 30)));
            tiers.put("basic", tier(new WindowLimitProperties(15, 75, 300), new WindowLimitProperties(5, 25, 100)));
            tiers.put("premium", tier(new WindowLimitProperties(30, 150, 600), new WindowLimitProperties(10, 50, 200)));
            tiers.put("enterprise", tier(new WindowLimitProperties(60, 300, 1200), new WindowLimitProperties(20, 100, 400)));
            return tiers;
        }

        private static Map<String, WindowLimitProperties> tier(WindowLimitProperties sms, WindowLimitProperties mms) {
            Map<String, WindowLimitProperties> limits = new LinkedHashMap<>();
            limits.put("sms", sms);
            limits.put("mms", mms);
            return limits;
        }
    }

    public static class WindowLimitProperties {
        private int minute;
        private int hour;
        private int day;

        public WindowLimitProperties() {}

        public WindowLimitProperties(int minute, int hour, int day) {
            this.minute = minute;
            this.hour = hour;
            this.day = day;
        }

        public int getMinute() { return minute; }
        public void setMinute(int minute) { this.minute = minute; }
        public int getHour() { return hour; }
        public void setHour(int hour) { this.hour = hour; }
        public int getDay() { return day; }
        public void setDay(int day) { this.day = day; }
    }

    public static class RedisProperties {
        private Duration commandTimeout = Duration.ofSeconds(1);

        public Duration getCommandTimeout() { return commandTimeout; }
        public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
    }

    public static class ConsentProperties {
        private int validityMonths = 18;
        private String defaultRegion = "US";

        public int getValidityMonths() { return validityMonths; }
        public void setValidityMonths(int validityMonths) { this.validityMonths = validityMonths; }
        public String getDefaultRegion() { return defaultRegion; }
        public void setDefaultRegion(String defaultRegion) { this.defaultRegion = defaultRegion; }
    }

    public static class DispatchProperties {
        private int maxRetries = 3;
        private Duration gatewayTimeout = Duration.ofSeconds(10);
        private boolean requireConsentForTransactional = false;
        private int retryJobPriority = 5;
        private int smsMaxLength = 1600;
        private int retryBatchSize = 50;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getGatewayTimeout() { return gatewayTimeout; }
        public void setGatewayTimeout(Duration gatewayTimeout) { this.gatewayTimeout = gatewayTimeout; }
        public boolean isRequireConsentForTransactional() { return requireConsentForTransactional; }
        public void setRequireConsentForTransactional(boolean v) { this.requireConsentForTransactional = v; }
        public int getRetryJobPriority() { return retryJobPriority; }
        public void setRetryJobPriority(int retryJobPriority) { this.retryJobPriority = retryJobPriority; }
        public int getSmsMaxLength() { return smsMaxLength; }
        public void setSmsMaxLength(int smsMaxLength) { this.smsMaxLength = smsMaxLength; }
        public int getRetryBatchSize() { return retryBatchSize; }
        public void setRetryBatchSize(int retryBatchSize) { this.retryBatchSize = retryBatchSize; }
    }

    public static class GatewayProperties {
        private String baseUrl = "https://api.twilio.com";
        private String accountSid;
        private String authToken;
        private String statusCallbackUrl;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getAccountSid() { return accountSid; }
        public void setAccountSid(String accountSid) { this.accountSid = accountSid; }
        public String getAuthToken() { return authToken; }
        public void setAuthToken(String authToken) { this.authToken = authToken; }
        public String getStatusCallbackUrl() { return statusCallbackUrl; }
        public void setStatusCallbackUrl(String statusCallbackUrl) { this.statusCallbackUrl = statusCallbackUrl; }
    }

    public static class WebhookProperties {
        private boolean signatureValidationEnabled = true;
        private String publicBaseUrl;

        public boolean isSignatureValidationEnabled() { return signatureValidationEnabled; }
        public void setSignatureValidationEnabled(boolean v) { this.signatureValidationEnabled = v; }
        public String getPublicBaseUrl() { return publicBaseUrl; }
        public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }
    }

    public static class LoggingProperties {
        private List<String> redactPatterns = new ArrayList<>();

        public List<String> getRedactPatterns() { return redactPatterns; }
        public void setRedactPatterns(List<String> redactPatterns) { this.redactPatterns = redactPatterns; }
    }
}
