package com.varia.service.selection;

import com.varia.model.VaryHeaders;

/**
 * Matches the vary headers recorded with a response against a new request.
 */
public final class VaryMatcher {

    private static final String ANY = "*";

    private VaryMatcher() {
    }

    /**
     * Every header the stored response declares must have the same value in the request,
     * absent matching only absent. Headers the response does not declare are ignored.
     */
    public static boolean matches(VaryHeaders stored, VaryHeaders request) {
        for (String name : stored.names()) {
            if (ANY.equals(name)) {
                return false;
            }
            if (!stored.valueOf(name).equals(request.valueOf(name))) {
                return false;
            }
        }
        return true;
    }
}
