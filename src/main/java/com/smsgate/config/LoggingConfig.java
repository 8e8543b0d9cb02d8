package com.smsgate.config;

import com.smsgate.observability.PiiRedactionConverter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Pushes configured redaction patterns into the Logback PiiRedactionConverter
 * via its static holder.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final SmsGateProperties properties;

    public LoggingConfig(SmsGateProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void configurePiiRedaction() {
        List<String> patterns = properties.getLogging().getRedactPatterns();
        if (patterns != null && !patterns.isEmpty()) {
            log.info("Configuring {} additional PII redaction patterns", patterns.size());
            PiiRedactionConverter.setConfiguredPatterns(patterns);
        } else {
            log.info("Using default PII redaction patterns (phone, email)");
        }
    }
}
