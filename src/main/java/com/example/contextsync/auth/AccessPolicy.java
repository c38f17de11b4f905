package com.example.contextsync.auth;

import com.example.contextsync.config.ContextServiceProperties;
import com.example.contextsync.error.PermissionDeniedException;
import com.example.contextsync.model.ClientPrincipal;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Role checks for destructive operations. Writes and reads are open to any
 * authenticated principal; clearing is restricted.
 */
@Component
public class AccessPolicy {

    private final Set<String> elevatedRoles;

    public AccessPolicy(ContextServiceProperties properties) {
        this.elevatedRoles = properties.getAuth().getElevatedRoles().stream()
                .map(role -> role.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isElevated(ClientPrincipal principal) {
        return principal.getRole() != null && elevatedRoles.contains(principal.getRole().toLowerCase(Locale.ROOT));
    }

    /**
     * A principal owns the sources named after its user id, either exactly or
     * as {@code <user_id>_<suffix>}.
     */
    public boolean owns(ClientPrincipal principal, String source) {
        String userId = principal.getUserId();
        return source.equals(userId) || source.startsWith(userId + "_");
    }

    public void checkClearAll(ClientPrincipal principal) {
        if (!isElevated(principal)) {
            throw new PermissionDeniedException("Role '" + principal.getRole() + "' may not clear the whole context");
        }
    }

    public void checkClearSource(ClientPrincipal principal, String source) {
        if (!isElevated(principal) && !owns(principal, source)) {
            throw new PermissionDeniedException("Not allowed to clear context of source '" + source + "'");
        }
    }
}
