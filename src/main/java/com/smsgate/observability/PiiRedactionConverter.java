package com.smsgate.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Logback converter that masks phone numbers and e-mail addresses in log messages.
 * The last four digits of a phone number are kept so operators can still correlate
 * log lines with carrier dashboards. Extra patterns come from
 * smsgate.logging.redact-patterns via LoggingConfig.
 */
public class PiiRedactionConverter extends ClassicConverter {

    private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d\\s().-]{6,}(\\d{4})\\b");
    private static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");

    private static volatile List<Pattern> configuredPatterns = List.of();

    public static void setConfiguredPatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        if (patterns != null) {
            for (String p : patterns) {
                compiled.add(Pattern.compile(p));
            }
        }
        configuredPatterns = List.copyOf(compiled);
    }

    @Override
    public String convert(ILoggingEvent event) {
        return redact(event.getFormattedMessage());
    }

    static String redact(String message) {
        if (message == null) return "";

        String redacted = PHONE.matcher(message).replaceAll("***$1");
        redacted = EMAIL.matcher(redacted).replaceAll("[REDACTED]");
        for (Pattern pattern : configuredPatterns) {
            redacted = pattern.matcher(redacted).replaceAll("[REDACTED]");
        }
        return redacted;
    }
}
