package com.rollup.service.buffer;

/**
 * Extracts the source domain from a referrer URL.
 *
 * Deliberately lenient: strips the scheme, then everything from the first path
 * separator, then the port. No validation and no case folding.
 */
public final class ReferrerDomains {

    private static final String SCHEME_SEPARATOR = "://";

    private ReferrerDomains() {
    }

    /**
     * @param referrer a referrer URL, e.g. {@code https://google.com:443/search?q=x}
     * @return the host part, e.g. {@code google.com}; empty when nothing remains
     */
    public static String extractDomain(String referrer) {
        if (referrer == null) {
            return "";
        }
        String url = referrer;

        int schemeEnd = url.indexOf(SCHEME_SEPARATOR);
        if (schemeEnd >= 0) {
            url = url.substring(schemeEnd + SCHEME_SEPARATOR.length());
        }

        int pathStart = url.indexOf('/');
        if (pathStart >= 0) {
            url = url.substring(0, pathStart);
        }

        int portStart = url.indexOf(':');
        if (portStart >= 0) {
            url = url.substring(0, portStart);
        }

        return url;
    }
}
