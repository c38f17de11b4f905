package com.example.contextsync.auth;

import com.example.contextsync.config.ContextServiceProperties;
import com.example.contextsync.error.PermissionDeniedException;
import com.example.contextsync.model.ClientPrincipal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AccessPolicyTest {

    private final AccessPolicy policy = new AccessPolicy(new ContextServiceProperties());

    private final ClientPrincipal student = new ClientPrincipal("s1", "student", Map.of());
    private final ClientPrincipal teacher = new ClientPrincipal("t1", "Teacher", Map.of());

    @Test
    void testElevatedRolesAreCaseInsensitive() {
        assertTrue(policy.isElevated(teacher));
        assertFalse(policy.isElevated(student));
    }

    @Test
    void testClearAll_OnlyElevated() {
        assertDoesNotThrow(() -> policy.checkClearAll(teacher));
        assertThrows(PermissionDeniedException.class, () -> policy.checkClearAll(student));
    }

    @Test
    void testClearSource_OwnerOrElevated() {
        assertDoesNotThrow(() -> policy.checkClearSource(student, "s1"));
        assertDoesNotThrow(() -> policy.checkClearSource(student, "s1_abc123"));
        assertThrows(PermissionDeniedException.class, () -> policy.checkClearSource(student, "s10_abc"));
        assertThrows(PermissionDeniedException.class, () -> policy.checkClearSource(student, "quiz_agent"));
        assertDoesNotThrow(() -> policy.checkClearSource(teacher, "quiz_agent"));
    }

    @Test
    void testConfiguredElevatedRoles() {
        ContextServiceProperties properties = new ContextServiceProperties();
        properties.getAuth().setElevatedRoles(List.of("operator"));
        AccessPolicy custom = new AccessPolicy(properties);

        assertTrue(custom.isElevated(new ClientPrincipal("o", "operator", Map.of())));
        assertFalse(custom.isElevated(teacher));
    }
}
