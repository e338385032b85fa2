package com.contacts.merger.normalizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the phone values found in address-book exports and database dumps into one comparable
 * international form ({@code +<country code><number>}).
 * <p>
 * The mapping is pure: the same input always gives the same output, nothing is thrown, and
 * every non-null result starts with {@code +} so feeding a result back in returns it unchanged.
 */
public class PhoneNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(PhoneNormalizer.class);

    /** Several numbers stored in one cell are joined with this token. */
    public static final String MULTI_VALUE_DELIMITER = ":::";

    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    // national prefixes first, already-international country codes after; first match wins
    private static final List<PhoneRule> RULES = List.of(
            new PhoneRule("EG mobile", Pattern.compile("^(01\\d{8,})$"), "+2$1"),
            new PhoneRule("SA mobile", Pattern.compile("^0(5\\d{8,})$"), "+966$1"),
            new PhoneRule("AE international", Pattern.compile("^(971\\d{8,9})$"), "+$1"),
            new PhoneRule("TR international", Pattern.compile("^(90\\d{10})$"), "+$1"),
            new PhoneRule("GB international", Pattern.compile("^(44\\d{10})$"), "+$1"),
            new PhoneRule("RU international", Pattern.compile("^(7\\d{10})$"), "+$1")
    );

    private final String defaultCountryCode;

    public PhoneNormalizer(String defaultCountryCode) {
        String digits = defaultCountryCode == null ? "" : NON_DIGITS.matcher(defaultCountryCode).replaceAll("");
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("Default country code must contain digits: " + defaultCountryCode);
        }
        this.defaultCountryCode = "+" + digits;
    }

    public String getDefaultCountryCode() {
        return defaultCountryCode;
    }

    /**
     * @param raw a phone value as typed by a user or exported by a database
     * @return the canonical number, or {@code null} when nothing usable is left
     */
    public String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || "null".equals(trimmed.toLowerCase(Locale.ROOT))) {
            return null;
        }

        String cleaned = clean(trimmed);
        if (cleaned.isEmpty() || "+".equals(cleaned)) {
            return null;
        }
        if (cleaned.startsWith("+")) {
            return cleaned;
        }
        if (cleaned.startsWith("00")) {
            return cleaned.length() > 2 ? "+" + cleaned.substring(2) : null;
        }

        for (PhoneRule rule : RULES) {
            Matcher matcher = rule.pattern.matcher(cleaned);
            if (matcher.matches()) {
                return matcher.replaceFirst(rule.replacement);
            }
        }

        String digits = stripLeadingZeros(NON_DIGITS.matcher(cleaned).replaceAll(""));
        if (digits.isEmpty()) {
            return null;
        }
        return defaultCountryCode + digits;
    }

    /**
     * Splits multi-number cells on {@link #MULTI_VALUE_DELIMITER}, normalizes every part and
     * keeps the first occurrence of each canonical number.
     */
    public List<String> expandAndNormalize(Collection<String> values) {
        Set<String> out = new LinkedHashSet<>();
        if (values == null) {
            return new ArrayList<>();
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            for (String part : value.split(Pattern.quote(MULTI_VALUE_DELIMITER), -1)) {
                String normalized = normalize(part);
                if (normalized != null) {
                    out.add(normalized);
                } else if (!part.isBlank()) {
                    logger.debug("Dropping unusable phone value '{}'", part);
                }
            }
        }
        return new ArrayList<>(out);
    }

    // ASCII digits (Arabic-Indic digits are folded) plus a '+' when it is the first kept character
    private static String clean(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (Character.isDigit(ch)) {
                sb.append((char) ('0' + Character.digit(ch, 10)));
            } else if (ch == '+' && sb.length() == 0) {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    private static final class PhoneRule {
        private final String name;
        private final Pattern pattern;
        private final String replacement;

        private PhoneRule(String name, Pattern pattern, String replacement) {
            this.name = name;
            this.pattern = pattern;
            this.replacement = replacement;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
