package com.paperharvest.backend.util;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

public final class TextUtils {

    private static final Pattern ABSOLUTE_HTTP = Pattern.compile("(?i)https?://[^/?#\\s]+");

    private TextUtils() {
    }

    /**
     * Collapse runs of whitespace and trim. Blank input becomes null.
     */
    public static String cleanText(String s) {
        if (s == null) return null;
        String cleaned = s.replaceAll("[\\s\\u00A0]+", " ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    /**
     * Resolve {@code href} against {@code base} and drop the fragment.
     * Returns null for hrefs that are not http(s) URLs once resolved.
     */
    public static String normalizeUrl(String href, String base) {
        if (isBlank(href)) return null;
        String candidate = href.trim();
        if (base != null && !ABSOLUTE_HTTP.matcher(candidate).lookingAt()) {
            try {
                candidate = new URL(new URL(base.trim()), candidate).toString();
            } catch (MalformedURLException e) {
                return null;
            }
        }
        if (!ABSOLUTE_HTTP.matcher(candidate).lookingAt()) return null;
        int hash = candidate.indexOf('#');
        return hash >= 0 ? candidate.substring(0, hash) : candidate;
    }

    public static String hostOf(String url) {
        if (url == null) return null;
        try {
            String host = new URL(url.trim()).getHost();
            return host == null || host.isEmpty() ? null : host.toLowerCase();
        } catch (MalformedURLException e) {
            return null;
        }
    }

    /**
     * Message of an exception, or its type name when it carries none
     */
    public static String describe(Throwable e) {
        String message = e.getMessage();
        return isBlank(message) ? e.getClass().getSimpleName() : message;
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
