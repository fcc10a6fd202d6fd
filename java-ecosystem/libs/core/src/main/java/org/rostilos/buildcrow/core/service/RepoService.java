package org.rostilos.buildcrow.core.service;

import org.rostilos.buildcrow.core.exception.RepoAlreadyExistsException;
import org.rostilos.buildcrow.core.model.repo.Repo;
import org.rostilos.buildcrow.core.persistence.repository.repo.RepoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Registration and build settings of repositories.
 */
@Service
@Transactional
public class RepoService {

    private static final Logger log = LoggerFactory.getLogger(RepoService.class);

    private final RepoRepository repoRepository;

    public RepoService(RepoRepository repoRepository) {
        this.repoRepository = repoRepository;
    }

    /**
     * Persist a newly created repository.
     *
     * @throws RepoAlreadyExistsException if a repository with the same slug is registered
     */
    public Repo register(Repo repo) {
        if (repoRepository.existsBySlug(repo.getSlug())) {
            log.warn("Rejected duplicate registration of {}", repo.getSlug());
            throw new RepoAlreadyExistsException(repo.getSlug());
        }
        Repo saved = repoRepository.save(repo);
        log.info("Registered repository {} with id {}", saved.getSlug(), saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Repo> findBySlug(String slug) {
        return repoRepository.findBySlug(slug);
    }

    @Transactional(readOnly = true)
    public List<Repo> findByUser(Long userId) {
        return repoRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<Repo> findByTeam(Long teamId) {
        return repoRepository.findByTeamId(teamId);
    }

    public Repo setDisabled(String slug, boolean disabled) {
        Repo repo = getBySlug(slug);
        repo.setDisabled(disabled);
        log.info("Builds for {} {}", slug, disabled ? "disabled" : "enabled");
        return repoRepository.save(repo);
    }

    public Repo setPullRequestsDisabled(String slug, boolean disabled) {
        Repo repo = getBySlug(slug);
        repo.setDisabledPullRequests(disabled);
        log.info("Pull request builds for {} {}", slug, disabled ? "disabled" : "enabled");
        return repoRepository.save(repo);
    }

    /**
     * @param timeoutSeconds build time limit, must not be negative
     */
    public Repo updateTimeout(String slug, long timeoutSeconds) {
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("Timeout must not be negative: " + timeoutSeconds);
        }
        Repo repo = getBySlug(slug);
        repo.setTimeout(timeoutSeconds);
        return repoRepository.save(repo);
    }

    /**
     * Replace the build parameters of a repository. Values are not logged.
     */
    public Repo updateParams(String slug, Map<String, String> params) {
        Repo repo = getBySlug(slug);
        repo.setParams(params);
        log.debug("Updated {} build parameter(s) for {}", repo.getParams().size(), slug);
        return repoRepository.save(repo);
    }

    public void delete(String slug) {
        Repo repo = getBySlug(slug);
        repoRepository.delete(repo);
        log.info("Deleted repository {}", slug);
    }

    private Repo getBySlug(String slug) {
        return repoRepository.findBySlug(slug)
                .orElseThrow(() -> new NoSuchElementException("Repository not found: " + slug));
    }
}
