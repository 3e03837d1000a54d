package com.tenderintel.tender.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls real targets out of the portal's javascript-driven links.
 *
 * Links on the portal are usually {@code href="#"} with the target inside an onclick
 * handler, e.g. {@code postRequestNewWindow('/epsn/nitPublish.do', ...)} or
 * {@code window.open('/ireps/upload/files/x.pdf')}.
 */
public final class LinkResolver {

    private static final Pattern POST_NEW_WINDOW =
            Pattern.compile("postRequestNewWindow\\(['\"]([^'\"]+)['\"]");
    private static final Pattern WINDOW_OPEN =
            Pattern.compile("window\\.open\\(['\"]([^'\"]+)['\"]\\)");

    private LinkResolver() {
    }

    /** Detail-page target of a listing row's "View Tender Details" control. */
    public static Optional<String> detailTarget(String onclick, String href, String baseUrl) {
        return fromHandler(POST_NEW_WINDOW, onclick, href, baseUrl);
    }

    /** Download target of an attachment link. */
    public static Optional<String> documentTarget(String onclick, String href, String baseUrl) {
        return fromHandler(WINDOW_OPEN, onclick, href, baseUrl);
    }

    public static String absolute(String path, String baseUrl) {
        if (path == null || path.isBlank()) return path;
        String trimmed = path.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) return trimmed;
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return trimmed.startsWith("/") ? base + trimmed : base + "/" + trimmed;
    }

    private static Optional<String> fromHandler(Pattern pattern, String onclick, String href, String baseUrl) {
        if (onclick != null && !onclick.isBlank()) {
            Matcher m = pattern.matcher(onclick);
            if (m.find()) {
                return Optional.of(absolute(m.group(1), baseUrl));
            }
        }
        if (isRealHref(href)) {
            return Optional.of(absolute(href, baseUrl));
        }
        return Optional.empty();
    }

    private static boolean isRealHref(String href) {
        if (href == null) return false;
        String h = href.trim();
        return !h.isEmpty() && !h.equals("#") && !h.startsWith("javascript:");
    }
}
