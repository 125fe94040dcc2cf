package com.verticx.finance.security;

import com.verticx.finance.user.Role;

/**
 * Caller identity, resolved once from the bearer token before a request reaches any service.
 */
public record AuthenticatedPrincipal(Long userId, String username, Role role, Long branchId, Long studentId,
                                     Long staffId) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
