package org.rostilos.buildcrow.core.persistence.repository.repo;

import org.rostilos.buildcrow.core.model.repo.ERepoHost;
import org.rostilos.buildcrow.core.model.repo.Repo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RepoRepository extends JpaRepository<Repo, Long> {

    Optional<Repo> findBySlug(String slug);

    boolean existsBySlug(String slug);

    List<Repo> findByUserId(Long userId);

    List<Repo> findByTeamId(Long teamId);

    List<Repo> findByHostAndOwner(ERepoHost host, String owner);
}
