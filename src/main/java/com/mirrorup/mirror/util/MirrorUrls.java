package com.mirrorup.mirror.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class MirrorUrls {

    private MirrorUrls() {
    }

    /**
     * Lowercase host of a mirror URL, or null when the URL has no parseable host.
     */
    public static String host(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * Joins a mirror base URL and a relative path with exactly one slash between them.
     */
    public static String join(String baseUrl, String relativePath) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        String path = relativePath == null ? "" : relativePath.trim();
        if (base.endsWith("/") && path.startsWith("/")) {
            return base + path.substring(1);
        }
        if (!base.endsWith("/") && !path.startsWith("/")) {
            return base + "/" + path;
        }
        return base + path;
    }

    public static boolean isHttpScheme(URI uri) {
        String scheme = uri == null ? null : uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
