package org.rostilos.buildcrow.core.util;

import org.rostilos.buildcrow.core.model.repo.EScmKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves the conventional default branch for a source control system.
 * <p>
 * Unrecognized kinds resolve to the git default instead of failing, so repositories stored
 * with an unexpected SCM value still get a branch to build.
 */
public final class DefaultBranchResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultBranchResolver.class);

    public static final String FALLBACK_BRANCH = EScmKind.GIT.getDefaultBranch();

    private DefaultBranchResolver() {
        // Utility class
    }

    public static String resolve(EScmKind kind) {
        if (kind == null) {
            return FALLBACK_BRANCH;
        }
        return kind.getDefaultBranch();
    }

    /**
     * @param scm stored SCM id such as {@code git}, {@code hg} or {@code svn}
     * @return the default branch, {@link #FALLBACK_BRANCH} for anything unrecognized
     */
    public static String resolve(String scm) {
        Optional<EScmKind> kind = EScmKind.lookup(scm);
        if (kind.isEmpty()) {
            log.debug("Unrecognized SCM kind '{}', falling back to '{}'", scm, FALLBACK_BRANCH);
            return FALLBACK_BRANCH;
        }
        return kind.get().getDefaultBranch();
    }
}
