package com.simqueue.auth;

import java.io.IOException;

/**
 * RBAC lookup owned by another service.
 */
public interface PermissionChecker {

    String RUN_SIMULATION = "workbench.run_simulation";
    String VIEW_HISTORY = "workbench.view_history";

    /**
     * @param userId an authenticated user
     * @param permission permission name, e.g. {@link #RUN_SIMULATION}
     * @return true if the user holds the permission
     * @throws IOException if the permission backend cannot be reached
     */
    boolean hasPermission(long userId, String permission) throws IOException;

    static PermissionChecker allowAll() {
        return (userId, permission) -> true;
    }
}
