package org.example.shaker.version;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single comparator and tag pair, e.g. {@code ==v1.0.1} or {@code >=v2.0}.
 *
 * <p>An empty comparator means "unconstrained". Parsing never throws: strings
 * that do not match the comparator-plus-tag shape produce a neutral result
 * that keeps the raw text so callers can report it.</p>
 */
public final class VersionConstraint {

    public static final String EQUAL = "==";
    public static final String GREATER_OR_EQUAL = ">=";
    public static final String LESS_OR_EQUAL = "<=";

    private static final Set<String> COMPARATORS = Set.of(EQUAL, GREATER_OR_EQUAL, LESS_OR_EQUAL);
    private static final Pattern CONSTRAINT_PATTERN = Pattern.compile("^([=><]+)\\s*(.*?)\\s*$");

    public static final VersionConstraint UNCONSTRAINED = new VersionConstraint("", "", "");

    private final String raw;
    private final String comparator;
    private final String tag;

    private VersionConstraint(String raw, String comparator, String tag) {
        this.raw = raw;
        this.comparator = comparator;
        this.tag = tag;
    }

    /**
     * Parses a constraint string.
     *
     * @param value the raw constraint, may be {@code null} or empty
     * @return the parsed constraint, never {@code null}
     */
    public static VersionConstraint parse(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            return UNCONSTRAINED;
        }
        Matcher matcher = CONSTRAINT_PATTERN.matcher(trimmed);
        if (!matcher.matches() || matcher.group(2).isEmpty()) {
            return new VersionConstraint(trimmed, "", "");
        }
        return new VersionConstraint(trimmed, matcher.group(1), matcher.group(2));
    }

    public static VersionConstraint of(String comparator, String tag) {
        Objects.requireNonNull(comparator, "comparator cannot be null");
        Objects.requireNonNull(tag, "tag cannot be null");
        return parse(comparator + tag);
    }

    // Getters

    public String getComparator() {
        return comparator;
    }

    public String getTag() {
        return tag;
    }

    /**
     * The tag with its leading 'v' removed, or {@code null} when the tag is
     * not 'v'-prefixed and so names a branch or commit instead.
     */
    public String getVersion() {
        return tag.startsWith("v") && tag.length() > 1 ? tag.substring(1) : null;
    }

    /**
     * Postfix of the tag when it is a prerelease, otherwise {@code null}.
     */
    public String getPostfix() {
        return SemverTag.parse(tag).getPostfix();
    }

    public String getRaw() {
        return raw;
    }

    /**
     * True for the empty constraint.
     */
    public boolean isEmpty() {
        return raw.isEmpty();
    }

    /**
     * True when the comparator is one of {@code ==}, {@code >=}, {@code <=}
     * and a tag follows it.
     */
    public boolean isRecognised() {
        return COMPARATORS.contains(comparator) && !tag.isEmpty();
    }

    public boolean isEquality() {
        return EQUAL.equals(comparator);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /**
     * Canonical form: comparator directly followed by tag, or the raw text
     * when the constraint is not recognised.
     */
    @Override
    public String toString() {
        return comparator.isEmpty() ? raw : comparator + tag;
    }
}
