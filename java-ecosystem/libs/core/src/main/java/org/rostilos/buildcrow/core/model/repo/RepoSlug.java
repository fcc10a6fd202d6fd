package org.rostilos.buildcrow.core.model.repo;

/**
 * Builds the canonical {@code host/owner/name} slug that identifies a repository.
 * Segments are joined verbatim; case and trailing slashes are not touched.
 */
public final class RepoSlug {

    private static final String SEPARATOR = "/";

    private RepoSlug() {
        // Utility class
    }

    public static String of(String host, String owner, String name) {
        return host + SEPARATOR + owner + SEPARATOR + name;
    }

    public static String of(ERepoHost host, String owner, String name) {
        return of(host.getId(), owner, name);
    }
}
