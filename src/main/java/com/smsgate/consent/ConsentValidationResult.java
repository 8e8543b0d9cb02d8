package com.smsgate.consent;

import java.util.List;

public record ConsentValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public static ConsentValidationResult of(List<String> errors, List<String> warnings) {
        return new ConsentValidationResult(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }
}
