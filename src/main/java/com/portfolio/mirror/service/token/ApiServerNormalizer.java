package com.portfolio.mirror.service.token;

import com.portfolio.mirror.common.constants.BrokerageConstants;

/**
 * Brings the {@code api_server} value returned by the OAuth endpoint into the form used as a base URL:
 * scheme present, no trailing slash.
 */
public final class ApiServerNormalizer {

    private ApiServerNormalizer() {
    }

    public static String normalize(String apiServer) {
        if (apiServer == null) return null;
        String s = apiServer.trim();
        if (s.isEmpty()) return null;
        if (!s.contains("://")) {
            s = BrokerageConstants.DEFAULT_SCHEME + s;
        }
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
