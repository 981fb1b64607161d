package com.example.collab.shared.quota;

import java.util.regex.Pattern;

/**
 * Tells IP-address identifiers (anonymous callers) apart from opaque user ids.
 */
public final class IdentifierClassifier {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}$");
    private static final Pattern IPV6 = Pattern.compile("^([0-9a-fA-F]{1,4}:){7}[0-9a-fA-F]{1,4}$");

    private IdentifierClassifier() {}

    public static boolean isIpAddress(String identifier) {
        return identifier != null && (IPV4.matcher(identifier).matches() || IPV6.matcher(identifier).matches());
    }
}
