package com.orgauth.authservice.infrastructure.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.util.UrlPathHelper;

/**
 * Resolves the path that security checks run against.
 *
 * <p>Handler mapping matches on the percent-decoded path with {@code ;} parameters removed, so
 * {@code /users;x=1} and {@code /%75sers} both reach the {@code /users} handler. The exemption
 * list and the route-role table must see that same path, not the raw request URI.
 */
public final class RequestPaths {

    private static final UrlPathHelper LOOKUP = lookupPathHelper();

    private RequestPaths() {
        // utility class
    }

    /** Decoded, parameter-free path within the application, without the context path. */
    public static String lookupPath(HttpServletRequest request) {
        return LOOKUP.getLookupPathForRequest(request);
    }

    private static UrlPathHelper lookupPathHelper() {
        UrlPathHelper helper = new UrlPathHelper();
        helper.setAlwaysUseFullPath(true);
        helper.setUrlDecode(true);
        helper.setRemoveSemicolonContent(true);
        return helper;
    }
}
