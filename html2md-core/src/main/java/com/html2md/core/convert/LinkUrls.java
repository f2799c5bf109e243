package com.html2md.core.convert;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL handling for Markdown links: scheme allowlist, path re-encoding and title escaping.
 *
 * <p>Only {@code http}, {@code https}, {@code file} and scheme-less (relative, fragment or
 * protocol-relative) URLs are emitted as links. Everything else, {@code javascript:} in
 * particular, is rejected and the caller renders the link text alone.
 */
final class LinkUrls {

    static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https", "file");

    // RFC 3986 appendix B
    private static final Pattern URI_PARTS =
        Pattern.compile("^(([^:/?#]+):)?(//([^/?#]*))?([^?#]*)(\\?([^#]*))?(#(.*))?$", Pattern.DOTALL);
    private static final Pattern SCHEME = Pattern.compile("[A-Za-z][A-Za-z0-9+.-]*");

    // reserved characters left as-is inside a re-encoded path segment
    private static final String[][] KEPT_RESERVED = {
        {"%21", "!"}, {"%24", "$"}, {"%26", "&"}, {"%27", "'"}, {"%28", "("}, {"%29", ")"},
        {"%2A", "*"}, {"%2B", "+"}, {"%2C", ","}, {"%3B", ";"}, {"%3D", "="}, {"%3A", ":"},
        {"%40", "@"}, {"%5B", "["}, {"%5D", "]"}, {"%7E", "~"}
    };

    private LinkUrls() {
        // Utility class
    }

    /**
     * Checks whether a link target may be emitted.
     *
     * @param url raw {@code href} value
     * @return true for http, https, file and scheme-less URLs
     */
    static boolean hasAllowedScheme(String url) {
        String scheme = schemeOf(url);
        return scheme == null || ALLOWED_SCHEMES.contains(scheme);
    }

    /**
     * Extracts the lower-case scheme of a URL.
     *
     * @param url raw URL
     * @return scheme, or null for scheme-less URLs
     */
    static String schemeOf(String url) {
        Matcher matcher = URI_PARTS.matcher(url);
        if (!matcher.matches() || matcher.group(2) == null) {
            return null;
        }
        String scheme = matcher.group(2);
        if (!SCHEME.matcher(scheme).matches()) {
            return null;
        }
        return scheme.toLowerCase(Locale.ROOT);
    }

    /**
     * Re-encodes the path component of a URL so spaces and other characters that are not
     * valid in a URL are percent-encoded exactly once. Scheme, authority, query and fragment
     * are kept as written.
     *
     * @param url raw {@code href} value
     * @return URL safe to place inside Markdown link parentheses
     */
    static String escapeUrl(String url) {
        Matcher matcher = URI_PARTS.matcher(url);
        if (!matcher.matches()) {
            return url;
        }

        String path = matcher.group(5);
        if (path == null || path.isEmpty()) {
            return url;
        }

        StringBuilder escaped = new StringBuilder();
        if (matcher.group(1) != null) {
            escaped.append(matcher.group(1));
        }
        if (matcher.group(3) != null) {
            escaped.append(matcher.group(3));
        }
        escaped.append(reencodePath(path));
        if (matcher.group(6) != null) {
            escaped.append(matcher.group(6));
        }
        if (matcher.group(8) != null) {
            escaped.append(matcher.group(8));
        }
        return escaped.toString();
    }

    /**
     * Escapes double quotes for use inside a Markdown link or image title.
     *
     * @param title raw title
     * @return escaped title
     */
    static String escapeTitle(String title) {
        return title.replace("\"", "\\\"");
    }

    private static String reencodePath(String path) {
        String decoded;
        try {
            // '+' is literal in a path, URLDecoder would turn it into a space
            decoded = URLDecoder.decode(path.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return path;
        }

        StringBuilder encoded = new StringBuilder();
        String[] segments = decoded.split("/", -1);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                encoded.append('/');
            }
            encoded.append(encodeSegment(segments[i]));
        }
        return encoded.toString();
    }

    private static String encodeSegment(String segment) {
        String encoded = URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
        for (String[] kept : KEPT_RESERVED) {
            encoded = encoded.replace(kept[0], kept[1]);
        }
        return encoded;
    }
}
