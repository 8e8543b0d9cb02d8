package com.smsgate.phone;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.PhoneNumberUtil.PhoneNumberFormat;
import com.google.i18n.phonenumbers.Phonenumber.PhoneNumber;
import com.smsgate.config.SmsGateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Phone number parsing and E.164 normalization. Numbers without a country code are
 * read in the configured default region.
 */
@Component
public class PhoneNumbers {

    private static final Logger log = LoggerFactory.getLogger(PhoneNumbers.class);

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");
    private static final int MAX_INPUT_LENGTH = 50;

    private final PhoneNumberUtil util = PhoneNumberUtil.getInstance();
    private final String defaultRegion;

    public PhoneNumbers(SmsGateProperties properties) {
        this.defaultRegion = properties.getConsent().getDefaultRegion();
    }

    /**
     * Returns the E.164 form of {@code raw}, or empty when it is not a valid number.
     */
    public Optional<String> normalize(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        if (raw.length() > MAX_INPUT_LENGTH) {
            log.warn("Rejected phone number input of length {}", raw.length());
            return Optional.empty();
        }
        try {
            PhoneNumber parsed = util.parse(raw.trim(), defaultRegion);
            if (!util.isValidNumber(parsed)) return Optional.empty();
            return Optional.of(util.format(parsed, PhoneNumberFormat.E164));
        } catch (NumberParseException e) {
            log.debug("Phone number parse failed: {}", e.getErrorType());
            return Optional.empty();
        }
    }

    public boolean isValid(String raw) {
        return normalize(raw).isPresent();
    }

    /**
     * True only when {@code raw} is already written in canonical E.164 form.
     */
    public boolean isE164(String raw) {
        return raw != null && E164.matcher(raw).matches()
                && normalize(raw).map(raw::equals).orElse(false);
    }

    public boolean sameNumber(String a, String b) {
        Optional<String> first = normalize(a);
        return first.isPresent() && first.equals(normalize(b));
    }
}
