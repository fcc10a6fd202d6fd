package org.rostilos.buildcrow.core.dto.repo;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.rostilos.buildcrow.core.model.repo.Repo;

import java.time.Instant;

/**
 * API view of a repository. Username, password, private key and build parameters are
 * persisted on {@link Repo} but never exposed here.
 */
public record RepoDTO(
        @JsonProperty("id") Long id,
        @JsonProperty("slug") String slug,
        @JsonProperty("host") String host,
        @JsonProperty("owner") String owner,
        @JsonProperty("name") String name,
        @JsonProperty("private") boolean privateRepo,
        @JsonProperty("disabled") boolean disabled,
        @JsonProperty("disabled_pr") boolean disabledPullRequests,
        @JsonProperty("scm") String scm,
        @JsonProperty("url") String url,
        @JsonProperty("public_key") String publicKey,
        @JsonProperty("default_branch") String defaultBranch,
        @JsonProperty("timeout") long timeout,
        @JsonProperty("priveleged") boolean privileged,
        @JsonProperty("user_id") Long userId,
        @JsonProperty("team_id") Long teamId,
        @JsonProperty("created") Instant created,
        @JsonProperty("updated") Instant updated
) {
    public static RepoDTO fromRepo(Repo repo) {
        return new RepoDTO(
                repo.getId(),
                repo.getSlug(),
                repo.getHost() != null ? repo.getHost().getId() : null,
                repo.getOwner(),
                repo.getName(),
                repo.isPrivateRepo(),
                repo.isDisabled(),
                repo.isDisabledPullRequests(),
                repo.getScm(),
                repo.getUrl(),
                repo.getPublicKey(),
                repo.getDefaultBranch(),
                repo.getTimeout(),
                repo.isPrivileged(),
                repo.getUserId(),
                repo.getTeamId(),
                repo.getCreated(),
                repo.getUpdated()
        );
    }
}
