package org.example.shaker.remote;

import org.example.shaker.exception.RemoteConnectionException;
import org.example.shaker.model.PackageKey;
import org.example.shaker.model.ResolvedRevision;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the host of formula repositories.
 *
 * <p>"Not found" answers are returned as empty optionals. Authentication and
 * transport failures are raised as {@link RemoteConnectionException}.</p>
 */
public interface RemoteRepository {

    /**
     * Checks once per run that credentials are available (and, when configured, accepted).
     *
     * @throws RemoteConnectionException if no credential is configured or the host rejects it
     */
    void verifyAccess() throws RemoteConnectionException;

    /**
     * Lists the repository's tags, newest first as the host reports them.
     */
    List<RemoteTag> listTags(PackageKey key) throws RemoteConnectionException;

    /**
     * Head commit of a branch.
     */
    Optional<ResolvedRevision> getBranch(PackageKey key, String branch) throws RemoteConnectionException;

    /**
     * A commit looked up by (possibly abbreviated) sha. The returned revision carries the full sha.
     */
    Optional<ResolvedRevision> getCommit(PackageKey key, String sha) throws RemoteConnectionException;

    /**
     * Head commit of the repository's default branch.
     */
    Optional<ResolvedRevision> getDefaultBranch(PackageKey key) throws RemoteConnectionException;

    /**
     * Raw contents of a file at a ref.
     */
    Optional<String> fetchFile(PackageKey key, String ref, String path) throws RemoteConnectionException;
}
