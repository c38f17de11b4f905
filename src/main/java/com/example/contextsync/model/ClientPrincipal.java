package com.example.contextsync.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity resolved from a verified credential.
 */
@Value
public class ClientPrincipal {

    String userId;
    String role;
    Map<String, Object> claims;

    public ClientPrincipal(String userId, String role, Map<String, Object> claims) {
        this.userId = userId;
        this.role = role;
        this.claims = claims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }
}
