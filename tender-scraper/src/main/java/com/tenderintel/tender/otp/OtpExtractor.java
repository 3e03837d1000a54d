package com.tenderintel.tender.otp;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the OTP inside forwarded SMS text. Patterns are tried broadest last.
 */
public final class OtpExtractor {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b(\\d{6})\\b"),    // standard 6-digit OTP
            Pattern.compile("\\b(\\d{4,8})\\b")   // fallback: 4-8 digits
    );

    private OtpExtractor() {
    }

    public static Optional<String> extract(String message) {
        if (message == null || message.isBlank()) return Optional.empty();
        for (Pattern pattern : PATTERNS) {
            Matcher m = pattern.matcher(message);
            if (m.find()) {
                return Optional.of(m.group(1));
            }
        }
        return Optional.empty();
    }

    /** First field that yields a code wins, even if a later field would match the stricter pattern. */
    public static Optional<String> extractFirst(List<String> fields) {
        for (String field : fields) {
            Optional<String> otp = extract(field);
            if (otp.isPresent()) {
                return otp;
            }
        }
        return Optional.empty();
    }

    public static boolean isPlausibleCode(String value) {
        return value != null && value.matches("\\d{4,8}");
    }
}
