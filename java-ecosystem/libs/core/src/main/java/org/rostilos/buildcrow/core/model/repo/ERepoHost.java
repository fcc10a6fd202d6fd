package org.rostilos.buildcrow.core.model.repo;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Hosting services a repository can be registered from.
 * The id is the host tag stored on the repository and used as the first slug segment.
 */
public enum ERepoHost {
    GITHUB("github.com"),
    BITBUCKET("bitbucket.org"),
    GOOGLE_CODE("code.google.com"),
    CUSTOM("custom");

    private final String id;

    ERepoHost(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public static ERepoHost fromId(String hostId) {
        if (hostId == null) {
            throw new IllegalArgumentException("Host ID cannot be null");
        }

        String normalized = hostId.toLowerCase(Locale.ENGLISH);
        for (ERepoHost host : values()) {
            if (host.id.equals(normalized)) {
                return host;
            }
        }

        // Fallback to enum name matching
        try {
            return valueOf(hostId.toUpperCase(Locale.ENGLISH).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown repository host: " + hostId);
        }
    }
}
