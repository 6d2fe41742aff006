package com.embedbot.onboarding;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-field format checks. Each returns the normalised answer or throws
 * {@link ValidationException} with {@link ValidationReason#INVALID_FORMAT}.
 */
final class FieldRules {
    static final int DEFAULT_PORT = 5432;

    private static final Pattern PHONE = Pattern.compile("\\+?[1-9]\\d{6,14}");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-()]");
    private static final Pattern WHITESPACE = Pattern.compile(".*\\s.*", Pattern.DOTALL);
    private static final Pattern HOST_NAME = Pattern.compile(
            "(?=.{1,253}$)[A-Za-z0-9]([A-Za-z0-9-]{0,61}[A-Za-z0-9])?(\\.[A-Za-z0-9]([A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*");
    private static final Pattern IPV6 = Pattern.compile("\\[?([0-9A-Fa-f]{0,4}(:[0-9A-Fa-f]{0,4}){2,7})\\]?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_.$-]{0,62}");

    private FieldRules() {
    }

    static String normalize(OnboardingField field, String raw) {
        String value = raw == null ? "" : raw;
        return switch (field) {
            case PHONE -> phone(value);
            case STORE_HOST -> host(value);
            case STORE_PORT -> port(value);
            case STORE_DATABASE, STORE_USER -> identifier(field, value);
            case STORE_PASSWORD -> password(value);
            case PROVIDER_API_KEY -> apiKey(value);
        };
    }

    private static String phone(String value) {
        String compact = PHONE_SEPARATORS.matcher(value.trim()).replaceAll("");
        if (!PHONE.matcher(compact).matches()) {
            throw invalid(OnboardingField.PHONE, "Phone number must be 7 to 15 digits, optionally starting with +.");
        }
        return compact.startsWith("+") ? compact : "+" + compact;
    }

    /**
     * Accepts a host name, an IPv4 address or an IPv6 address. IPv6 is returned in brackets
     * so it can be placed in a JDBC URL.
     */
    private static String host(String value) {
        String host = value.trim();
        if (host.isEmpty() || WHITESPACE.matcher(host).matches()) {
            throw invalid(OnboardingField.STORE_HOST, "Host must not be empty or contain spaces.");
        }
        Matcher ipv6 = IPV6.matcher(host);
        if (ipv6.matches()) {
            return "[" + ipv6.group(1) + "]";
        }
        if (!HOST_NAME.matcher(host).matches()) {
            throw invalid(OnboardingField.STORE_HOST,
                    "Host must be a host name or IP address, without port, path or parameters.");
        }
        if (!host.contains(".") && !host.equalsIgnoreCase("localhost")) {
            throw invalid(OnboardingField.STORE_HOST, "Host must include a domain.");
        }
        return host;
    }

    private static String port(String value) {
        String port = value.trim();
        if (port.isEmpty() || port.equals("-")) {
            return Integer.toString(DEFAULT_PORT);
        }
        try {
            int parsed = Integer.parseInt(port);
            if (parsed <= 0 || parsed >= 65536) {
                throw invalid(OnboardingField.STORE_PORT, "Port must be between 1 and 65535.");
            }
            return Integer.toString(parsed);
        } catch (NumberFormatException e) {
            throw invalid(OnboardingField.STORE_PORT, "Port must be a number.");
        }
    }

    private static String identifier(OnboardingField field, String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty() || WHITESPACE.matcher(trimmed).matches()) {
            throw invalid(field, "Value must not be empty or contain spaces.");
        }
        if (!IDENTIFIER.matcher(trimmed).matches()) {
            throw invalid(field, "Use up to 63 letters, digits, '_', '-', '.' or '$'.");
        }
        return trimmed;
    }

    private static String password(String value) {
        if (value.length() < 6) {
            throw invalid(OnboardingField.STORE_PASSWORD, "Password must be at least 6 characters.");
        }
        return value;
    }

    private static String apiKey(String value) {
        String key = value.trim();
        if (key.length() < 20 || WHITESPACE.matcher(key).matches()) {
            throw invalid(OnboardingField.PROVIDER_API_KEY,
                    "API key must be at least 20 characters without spaces.");
        }
        return key;
    }

    private static ValidationException invalid(OnboardingField field, String message) {
        return new ValidationException(field, ValidationReason.INVALID_FORMAT, message);
    }
}
