package org.example.shaker.remote;

import java.util.Objects;

/**
 * A tag as listed by the remote host: its name and the commit it points at.
 */
public final class RemoteTag {

    private final String name;
    private final String commitSha;

    public RemoteTag(String name, String commitSha) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.commitSha = Objects.requireNonNull(commitSha, "commitSha cannot be null");
    }

    public String getName() {
        return name;
    }

    public String getCommitSha() {
        return commitSha;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RemoteTag remoteTag = (RemoteTag) o;
        return name.equals(remoteTag.name) && commitSha.equals(remoteTag.commitSha);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, commitSha);
    }

    @Override
    public String toString() {
        return name + "@" + commitSha;
    }
}
