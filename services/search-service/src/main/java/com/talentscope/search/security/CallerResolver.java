package com.talentscope.search.security;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * Resolves the authenticated recruiter on whose behalf a search runs. Authentication itself
 * happens upstream; implementations only read what the gateway established.
 */
public interface CallerResolver {
    Optional<CallerIdentity> resolve(HttpServletRequest request);

    default CallerIdentity require(HttpServletRequest request) {
        return resolve(request).orElseThrow(() -> new UnauthorizedException("Login required"));
    }
}
