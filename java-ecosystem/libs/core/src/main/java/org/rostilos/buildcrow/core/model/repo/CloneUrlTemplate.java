package org.rostilos.buildcrow.core.model.repo;

import java.util.Optional;

/**
 * Clone URL templates keyed by hosting service and visibility.
 * <p>
 * The rendered shapes are consumed by build agents and external tooling, so they must not change.
 * Hosts without an entry here (legacy Google Code, custom hosts) have their clone URL supplied
 * by the caller.
 */
public enum CloneUrlTemplate {
    GITHUB_PUBLIC(ERepoHost.GITHUB, false, "git://github.com/%s/%s.git"),
    GITHUB_PRIVATE(ERepoHost.GITHUB, true, "git@github.com:%s/%s.git"),
    BITBUCKET_PUBLIC(ERepoHost.BITBUCKET, false, "https://bitbucket.org/%s/%s.git"),
    BITBUCKET_PRIVATE(ERepoHost.BITBUCKET, true, "git@bitbucket.org:%s/%s.git");

    private final ERepoHost host;
    private final boolean privateRepo;
    private final String pattern;

    CloneUrlTemplate(ERepoHost host, boolean privateRepo, String pattern) {
        this.host = host;
        this.privateRepo = privateRepo;
        this.pattern = pattern;
    }

    public ERepoHost getHost() {
        return host;
    }

    public boolean isPrivateRepo() {
        return privateRepo;
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Substitutes owner and name, in that order, into the template.
     */
    public String render(String owner, String name) {
        return String.format(pattern, owner, name);
    }

    public static Optional<CloneUrlTemplate> lookup(ERepoHost host, boolean privateRepo) {
        for (CloneUrlTemplate template : values()) {
            if (template.host == host && template.privateRepo == privateRepo) {
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }

    public static boolean supports(ERepoHost host) {
        return lookup(host, false).isPresent() || lookup(host, true).isPresent();
    }

    /**
     * Renders the clone URL for a repository.
     *
     * @return the URL, or empty when the host has no template for this visibility
     */
    public static Optional<String> build(ERepoHost host, String owner, String name, boolean privateRepo) {
        return lookup(host, privateRepo).map(template -> template.render(owner, name));
    }
}
