package com.talentscope.search.security;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class HeaderCallerResolver implements CallerResolver {
    private final AuthProperties properties;

    public HeaderCallerResolver(AuthProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<CallerIdentity> resolve(HttpServletRequest request) {
        if (properties.isBypass()) {
            return parse(properties.getDevUserId());
        }
        return parse(request.getHeader(properties.getUserHeader()));
    }

    private Optional<CallerIdentity> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new CallerIdentity(UUID.fromString(raw.trim()).toString()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
