package org.rostilos.buildcrow.core.model.repo;

import java.util.Locale;
import java.util.Optional;

/**
 * Source control systems a repository can use, each with its conventional default branch.
 */
public enum EScmKind {
    GIT("git", "master"),
    HG("hg", "default"),
    SVN("svn", "trunk");

    private final String id;
    private final String defaultBranch;

    EScmKind(String id, String defaultBranch) {
        this.id = id;
        this.defaultBranch = defaultBranch;
    }

    public String getId() {
        return id;
    }

    public String getDefaultBranch() {
        return defaultBranch;
    }

    /**
     * Looks up a kind by its stored id. The id must match exactly: {@code "HG"} or {@code " git"}
     * are not recognized.
     *
     * @return the matching kind, or empty for null and unrecognized ids
     */
    public static Optional<EScmKind> lookup(String scmId) {
        if (scmId == null) {
            return Optional.empty();
        }
        for (EScmKind kind : values()) {
            if (kind.id.equals(scmId)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses user input, ignoring case and surrounding whitespace.
     */
    public static EScmKind fromId(String scmId) {
        if (scmId == null) {
            throw new IllegalArgumentException("SCM ID cannot be null");
        }
        return lookup(scmId.trim().toLowerCase(Locale.ENGLISH))
                .orElseThrow(() -> new IllegalArgumentException("Unknown SCM kind: " + scmId));
    }
}
