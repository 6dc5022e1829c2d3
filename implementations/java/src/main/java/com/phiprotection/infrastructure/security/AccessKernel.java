package com.phiprotection.infrastructure.security;

/**
 * Access Kernel - central decision point for per-subject data isolation.
 */
public interface AccessKernel {

    /**
     * Allow the caller to act on data owned by {@code resourceOwnerId}.
     *
     * @throws TrustedAccessKernel.AccessDeniedException if the caller is neither the owner nor an admin
     */
    void authorizeSubjectAccess(AuthorizationContext context, String resourceOwnerId);
}
