package com.example.tuckshop.infrastructure.adapter.in.web;

import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.CallerRole;
import com.example.tuckshop.infrastructure.exception.MissingCallerIdentityException;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link Caller} from the identity headers set by the authenticating gateway.
 */
@Component
public class CallerIdentityResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    /**
     * @throws MissingCallerIdentityException if either header is missing or the role is unknown
     */
    public Caller resolve(String userId, String role) {
        if (userId == null || userId.isBlank() || role == null || role.isBlank()) {
            throw new MissingCallerIdentityException("Unauthorized: " + USER_ID_HEADER + " and "
                    + USER_ROLE_HEADER + " headers are required");
        }
        try {
            return new Caller(userId.trim(), CallerRole.fromValue(role.trim()));
        } catch (IllegalArgumentException e) {
            throw new MissingCallerIdentityException("Unauthorized: " + e.getMessage());
        }
    }
}
