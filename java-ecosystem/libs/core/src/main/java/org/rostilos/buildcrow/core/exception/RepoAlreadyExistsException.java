package org.rostilos.buildcrow.core.exception;

public class RepoAlreadyExistsException extends RuntimeException {

    private final String slug;

    public RepoAlreadyExistsException(String slug) {
        super(String.format("Repository %s is already registered", slug));
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
