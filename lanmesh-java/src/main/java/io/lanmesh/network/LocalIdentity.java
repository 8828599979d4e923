package io.lanmesh.network;

import java.util.Objects;
import java.util.UUID;

/**
 * Process-lifetime identity of this node.
 *
 * @param id      random UUID string, compared lexicographically for tie-breaking
 * @param appName namespace shared by compatible peers
 */
public record LocalIdentity(String id, String appName) {

    public LocalIdentity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(appName, "appName");
        if (appName.isBlank()) {
            throw new IllegalArgumentException("appName must not be blank");
        }
    }

    public static LocalIdentity generate(String appName) {
        return new LocalIdentity(UUID.randomUUID().toString(), appName);
    }

    public boolean isCompatibleWith(String remoteAppName) {
        return appName.equals(remoteAppName);
    }
}
