package org.example.shaker.version;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decomposition of a tag of the form {@code vMAJOR.MINOR.PATCH(-POSTFIX)?}.
 *
 * <p>Parsing is all-or-nothing: either major, minor and patch all parse or the
 * tag is not a semantic version and every component is {@code null}. Three
 * shapes are tried in order:</p>
 * <ol>
 *   <li>release: {@code v1.2.3}</li>
 *   <li>semver prerelease: {@code v1.2.3-rc.1}</li>
 *   <li>non-semver prerelease: {@code v1.2.3rc1} (letters followed by a number)</li>
 * </ol>
 *
 * <p>Ordering is by (major, minor, patch); for equal numbers a prerelease sorts
 * below the release, and prereleases among themselves by postfix.</p>
 */
public final class SemverTag implements Comparable<SemverTag> {

    private static final Pattern RELEASE = Pattern.compile("^v(\\d+)\\.(\\d+)\\.(\\d+)$");
    private static final Pattern PRERELEASE = Pattern.compile("^v(\\d+)\\.(\\d+)\\.(\\d+)-(.+)$");
    private static final Pattern LENIENT_PRERELEASE =
            Pattern.compile("^v(\\d+)\\.(\\d+)\\.(\\d+)([A-Za-z]+[0-9]+[0-9A-Za-z.]*)$");

    private static final Comparator<SemverTag> ORDER = Comparator
            .comparing(SemverTag::getMajor)
            .thenComparing(SemverTag::getMinor)
            .thenComparing(SemverTag::getPatch)
            .thenComparing(SemverTag::isRelease)
            .thenComparing(t -> t.postfix == null ? "" : t.postfix);

    private final String tag;
    private final Integer major;
    private final Integer minor;
    private final Integer patch;
    private final String postfix;

    private SemverTag(String tag, Integer major, Integer minor, Integer patch, String postfix) {
        this.tag = tag;
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.postfix = postfix;
    }

    /**
     * Parses a tag name. Never throws; unparseable input yields a tag whose
     * numeric components are all {@code null}.
     */
    public static SemverTag parse(String tag) {
        String value = tag == null ? "" : tag.trim();
        for (Pattern pattern : new Pattern[]{RELEASE, PRERELEASE, LENIENT_PRERELEASE}) {
            Matcher matcher = pattern.matcher(value);
            if (matcher.matches()) {
                try {
                    return new SemverTag(value,
                            Integer.valueOf(matcher.group(1)),
                            Integer.valueOf(matcher.group(2)),
                            Integer.valueOf(matcher.group(3)),
                            matcher.groupCount() > 3 ? matcher.group(4) : null);
                } catch (NumberFormatException e) {
                    // component overflows an int
                    return new SemverTag(value, null, null, null, null);
                }
            }
        }
        return new SemverTag(value, null, null, null, null);
    }

    /**
     * True iff the tag parses and has no postfix.
     */
    public static boolean isTagRelease(String tag) {
        return parse(tag).isRelease();
    }

    /**
     * True iff the tag parses and carries a postfix.
     */
    public static boolean isTagPrerelease(String tag) {
        return parse(tag).isPrerelease();
    }

    // Getters

    public String getTag() {
        return tag;
    }

    /**
     * The tag without its leading 'v', e.g. {@code 1.2.3-rc1}.
     */
    public String getVersion() {
        return tag.startsWith("v") ? tag.substring(1) : tag;
    }

    public Integer getMajor() {
        return major;
    }

    public Integer getMinor() {
        return minor;
    }

    public Integer getPatch() {
        return patch;
    }

    public String getPostfix() {
        return postfix;
    }

    public boolean isSemver() {
        return major != null;
    }

    public boolean isRelease() {
        return isSemver() && (postfix == null || postfix.isEmpty());
    }

    public boolean isPrerelease() {
        return isSemver() && postfix != null && !postfix.isEmpty();
    }

    /**
     * @throws IllegalStateException if either tag is not a semantic version
     */
    @Override
    public int compareTo(SemverTag other) {
        if (!isSemver() || !other.isSemver()) {
            throw new IllegalStateException("Cannot order non-semver tags: " + tag + ", " + other.tag);
        }
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return tag.equals(((SemverTag) o).tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
