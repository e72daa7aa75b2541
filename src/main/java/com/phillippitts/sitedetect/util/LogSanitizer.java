package com.phillippitts.sitedetect.util;

/** Privacy-safe previews for log lines and error details. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Drops the query string and fragment of a URL. Photo URLs are often presigned and
     * carry credentials in the query.
     */
    public static String stripQuery(String url) {
        if (url == null) {
            return "";
        }
        int cut = url.length();
        int q = url.indexOf('?');
        if (q >= 0) {
            cut = q;
        }
        int h = url.indexOf('#');
        if (h >= 0 && h < cut) {
            cut = h;
        }
        return url.substring(0, cut);
    }
}
