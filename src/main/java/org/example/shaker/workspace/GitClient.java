package org.example.shaker.workspace;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * The git operations needed to materialize formulas.
 */
public interface GitClient {

    void cloneRepository(String source, Path target) throws IOException;

    /**
     * Commit currently checked out, or empty when the directory is not a usable repository.
     */
    Optional<String> headSha(Path repository) throws IOException;

    void fetch(Path repository) throws IOException;

    /**
     * Checks out a commit, detaching HEAD.
     */
    void checkout(Path repository, String sha) throws IOException;
}
