package org.rostilos.buildcrow.core.model.repo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;
import org.rostilos.buildcrow.core.security.SshKeyPair;
import org.rostilos.buildcrow.core.util.DefaultBranchResolver;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A source repository registered with the build platform.
 * <p>
 * Identity (host, owner, name, slug), SCM descriptor and key pair are fixed at construction.
 * Build gating flags, timeout, parameters and ownership are changed afterwards by callers,
 * who are responsible for their own concurrency control.
 */
@Entity
@Table(name = "repos", indexes = {
    @Index(name = "idx_repos_user", columnList = "user_id"),
    @Index(name = "idx_repos_team", columnList = "team_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uq_repos_slug", columnNames = {"slug"})
})
public class Repo {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    /**
     * Full canonical name, for example {@code github.com/octocat/hello-world}
     */
    @Column(name = "slug", nullable = false, updatable = false, length = 1024)
    private String slug;

    @Convert(converter = ERepoHostConverter.class)
    @Column(name = "host", nullable = false, updatable = false, length = 255)
    private ERepoHost host;

    /**
     * Owner on the host system, e.g. the GitHub user or organization
     */
    @Column(name = "owner", nullable = false, updatable = false, length = 255)
    private String owner;

    @Column(name = "name", nullable = false, updatable = false, length = 255)
    private String name;

    @Column(name = "private", nullable = false, updatable = false)
    private boolean privateRepo;

    /**
     * Disabled repositories run no builds
     */
    @Column(name = "disabled", nullable = false)
    private boolean disabled = false;

    @Column(name = "disabled_pr", nullable = false)
    private boolean disabledPullRequests = false;

    /**
     * Stored as the raw SCM id so unknown values survive a round trip and resolve through the
     * default branch fallback.
     */
    @Column(name = "scm", nullable = false, updatable = false, length = 16)
    private String scm;

    @Column(name = "url", nullable = false, updatable = false, length = 1024)
    private String url;

    @JsonIgnore
    @Column(name = "username", length = 255)
    private String username;

    @JsonIgnore
    @Column(name = "password", length = 255)
    private String password;

    /**
     * Injected into the build machine as {@code .ssh/id_rsa.pub}
     */
    @Column(name = "public_key", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String publicKey;

    /**
     * Injected into the build machine as {@code .ssh/id_rsa}
     */
    @JsonIgnore
    @Column(name = "private_key", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String privateKey;

    /**
     * Parameters kept outside the repository and injected into the build at runtime
     */
    @JsonIgnore
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "params")
    private Map<String, String> params = new HashMap<>();

    /**
     * Seconds a build may run before it is killed
     */
    @Column(name = "timeout", nullable = false)
    private long timeout;

    /**
     * Run builds in privileged mode, e.g. Docker in Docker
     */
    @Column(name = "priveleged", nullable = false)
    private boolean privileged = false;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "team_id")
    private Long teamId;

    @CreationTimestamp
    @Column(name = "created", updatable = false)
    private Instant created;

    @UpdateTimestamp
    @Column(name = "updated")
    private Instant updated;

    protected Repo() {
    }

    public Repo(ERepoHost host, String owner, String name, boolean privateRepo,
                EScmKind scm, String url, SshKeyPair keyPair) {
        this.host = host;
        this.owner = owner;
        this.name = name;
        this.slug = RepoSlug.of(host, owner, name);
        this.privateRepo = privateRepo;
        this.scm = scm.getId();
        this.url = url;
        this.publicKey = keyPair.publicKey();
        this.privateKey = keyPair.privateKey();
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getSlug() {
        return slug;
    }

    public ERepoHost getHost() {
        return host;
    }

    public String getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    @JsonProperty("private")
    public boolean isPrivateRepo() {
        return privateRepo;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }

    @JsonProperty("disabled_pr")
    public boolean isDisabledPullRequests() {
        return disabledPullRequests;
    }

    public void setDisabledPullRequests(boolean disabledPullRequests) {
        this.disabledPullRequests = disabledPullRequests;
    }

    public String getScm() {
        return scm;
    }

    @JsonIgnore
    public Optional<EScmKind> getScmKind() {
        return EScmKind.lookup(scm);
    }

    public String getUrl() {
        return url;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    @JsonProperty("public_key")
    public String getPublicKey() {
        return publicKey;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public Map<String, String> getParams() {
        return params != null ? Collections.unmodifiableMap(params) : Collections.emptyMap();
    }

    public void setParams(Map<String, String> params) {
        this.params = params != null ? new HashMap<>(params) : new HashMap<>();
    }

    public long getTimeout() {
        return timeout;
    }

    /**
     * @throws IllegalArgumentException if {@code timeout} is negative
     */
    public void setTimeout(long timeout) {
        if (timeout < 0) {
            throw new IllegalArgumentException("Timeout must not be negative: " + timeout);
        }
        this.timeout = timeout;
    }

    @JsonProperty("priveleged")
    public boolean isPrivileged() {
        return privileged;
    }

    public void setPrivileged(boolean privileged) {
        this.privileged = privileged;
    }

    @JsonProperty("user_id")
    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    @JsonProperty("team_id")
    public Long getTeamId() {
        return teamId;
    }

    public void setTeamId(Long teamId) {
        this.teamId = teamId;
    }

    public Instant getCreated() {
        return created;
    }

    public Instant getUpdated() {
        return updated;
    }

    /**
     * Default branch for this repository's SCM, {@code master} when the SCM is not recognized.
     */
    @JsonProperty("default_branch")
    public String getDefaultBranch() {
        return DefaultBranchResolver.resolve(scm);
    }
}
