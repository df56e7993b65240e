package org.example.shaker.resolver;

import org.example.shaker.remote.RemoteTag;
import org.example.shaker.version.SemverTag;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Tags of one repository: the raw tag-to-commit map as listed by the remote,
 * plus the semantic-version tags sorted ascending. Non-semver tags are kept in
 * the raw map only.
 */
public class TagCatalogue {

    private final Map<String, RemoteTag> rawTags;
    private final List<SemverTag> sortedTags;

    public TagCatalogue(List<RemoteTag> tags) {
        this.rawTags = new LinkedHashMap<>();
        for (RemoteTag tag : tags) {
            rawTags.putIfAbsent(tag.getName(), tag);
        }
        this.sortedTags = rawTags.keySet().stream()
                .map(SemverTag::parse)
                .filter(SemverTag::isSemver)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Picks the highest version from a list of tag names.
     *
     * @param tags               tag names; only 'v'-prefixed ones are versions
     * @param includePrereleases whether prerelease tags may be picked
     * @return the version without its leading 'v', if any tag qualifies
     */
    public static Optional<String> latestVersion(Collection<String> tags, boolean includePrereleases) {
        return tags.stream()
                .map(SemverTag::parse)
                .filter(t -> includePrereleases ? t.isSemver() : t.isRelease())
                .max(Comparator.naturalOrder())
                .map(SemverTag::getVersion);
    }

    public Map<String, RemoteTag> getRawTags() {
        return Collections.unmodifiableMap(rawTags);
    }

    /**
     * Semantic-version tags, lowest first.
     */
    public List<SemverTag> getSortedTags() {
        return Collections.unmodifiableList(sortedTags);
    }

    public List<SemverTag> getSortedTagsDescending() {
        List<SemverTag> descending = new ArrayList<>(sortedTags);
        Collections.reverse(descending);
        return descending;
    }

    public List<String> getVersions() {
        return sortedTags.stream().map(SemverTag::getVersion).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return sortedTags.isEmpty();
    }

    /**
     * Finds the tag whose version (tag minus leading 'v') equals the given string verbatim.
     */
    public Optional<RemoteTag> findByVersion(String version) {
        return sortedTags.stream()
                .filter(t -> t.getVersion().equals(version))
                .findFirst()
                .map(t -> rawTags.get(t.getTag()));
    }

    public RemoteTag get(SemverTag tag) {
        return rawTags.get(tag.getTag());
    }

    /**
     * Highest release tag, or highest tag of any kind when prereleases are included.
     */
    public Optional<RemoteTag> latest(boolean includePrereleases) {
        return getSortedTagsDescending().stream()
                .filter(t -> includePrereleases || t.isRelease())
                .findFirst()
                .map(this::get);
    }
}
