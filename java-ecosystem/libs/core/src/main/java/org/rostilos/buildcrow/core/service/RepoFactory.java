package org.rostilos.buildcrow.core.service;

import org.rostilos.buildcrow.core.config.RepoProperties;
import org.rostilos.buildcrow.core.model.repo.CloneUrlTemplate;
import org.rostilos.buildcrow.core.model.repo.ERepoHost;
import org.rostilos.buildcrow.core.model.repo.EScmKind;
import org.rostilos.buildcrow.core.model.repo.Repo;
import org.rostilos.buildcrow.core.security.KeyGenerationException;
import org.rostilos.buildcrow.core.security.SshKeyPair;
import org.rostilos.buildcrow.core.security.SshKeyProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates fully populated {@link Repo} instances: canonical slug, clone URL and a fresh key pair.
 * <p>
 * Host-specific methods only pick the clone URL template; every path ends in
 * {@link #create(ERepoHost, String, String, boolean, EScmKind, String)}, which is the single
 * place keys are provisioned.
 */
@Service
public class RepoFactory {

    private static final Logger log = LoggerFactory.getLogger(RepoFactory.class);

    private final SshKeyProvisioner keyProvisioner;
    private final RepoProperties properties;

    public RepoFactory(SshKeyProvisioner keyProvisioner, RepoProperties properties) {
        this.keyProvisioner = keyProvisioner;
        this.properties = properties;
    }

    /**
     * Create a public repository with an explicit clone URL.
     * This is the only way to create repositories on hosts without a URL template.
     *
     * @throws KeyGenerationException if the key pair cannot be generated; no repository is returned
     */
    public Repo create(ERepoHost host, String owner, String name, EScmKind scm, String url) {
        return create(host, owner, name, false, scm, url);
    }

    public Repo create(ERepoHost host, String owner, String name, boolean privateRepo,
                       EScmKind scm, String url) {
        SshKeyPair keyPair = keyProvisioner.provision();

        Repo repo = new Repo(host, owner, name, privateRepo, scm, url, keyPair);
        repo.setTimeout(properties.getDefaultTimeout());
        log.info("Created repository {} ({}, private={})", repo.getSlug(), scm.getId(), privateRepo);
        return repo;
    }

    public Repo createGitHub(String owner, String name, boolean privateRepo) {
        return createHosted(ERepoHost.GITHUB, owner, name, privateRepo);
    }

    public Repo createBitbucket(String owner, String name, boolean privateRepo) {
        return createHosted(ERepoHost.BITBUCKET, owner, name, privateRepo);
    }

    /**
     * Create a git repository on a host with a clone URL template.
     *
     * @throws IllegalArgumentException if the host has no template, e.g. {@link ERepoHost#CUSTOM}
     */
    public Repo createHosted(ERepoHost host, String owner, String name, boolean privateRepo) {
        CloneUrlTemplate template = CloneUrlTemplate.lookup(host, privateRepo)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No clone URL template for host " + host.getId() + "; supply the URL explicitly"));
        return create(template.getHost(), owner, name, privateRepo, EScmKind.GIT, template.render(owner, name));
    }
}
