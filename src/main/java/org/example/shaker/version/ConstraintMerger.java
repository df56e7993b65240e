package org.example.shaker.version;

import org.apache.maven.artifact.versioning.ComparableVersion;
import org.example.shaker.exception.ConstraintFormatException;
import org.example.shaker.exception.ConstraintResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines two constraints on the same formula discovered along different paths.
 *
 * <p>Precedence:</p>
 * <ul>
 *   <li>an empty constraint yields to a non-empty one</li>
 *   <li>a current {@code ==} wins unconditionally, then a new {@code ==}</li>
 *   <li>{@code >=} against {@code <=} is rejected</li>
 *   <li>two {@code >=} keep the greater bound, two {@code <=} the lesser</li>
 * </ul>
 *
 * <p>Bounds are compared with Maven's ComparableVersion on the tag without its 'v'.</p>
 */
public class ConstraintMerger {

    private final Logger log;

    public ConstraintMerger() {
        this(LoggerFactory.getLogger(ConstraintMerger.class));
    }

    public ConstraintMerger(Logger log) {
        this.log = log;
    }

    /**
     * Merges two raw constraint strings.
     *
     * @see #merge(VersionConstraint, VersionConstraint)
     */
    public String merge(String newConstraint, String currentConstraint)
            throws ConstraintFormatException, ConstraintResolutionException {
        return merge(VersionConstraint.parse(newConstraint), VersionConstraint.parse(currentConstraint)).toString();
    }

    /**
     * Merges a newly discovered constraint into the one currently held.
     *
     * @param newConstraint     the constraint just discovered
     * @param currentConstraint the constraint currently recorded
     * @return the constraint that takes precedence
     * @throws ConstraintFormatException     if either non-empty constraint is malformed
     * @throws ConstraintResolutionException if the comparators contradict each other
     */
    public VersionConstraint merge(VersionConstraint newConstraint, VersionConstraint currentConstraint)
            throws ConstraintFormatException, ConstraintResolutionException {
        if (newConstraint.isEmpty()) {
            return currentConstraint;
        }
        if (currentConstraint.isEmpty()) {
            return newConstraint;
        }

        requireRecognised(newConstraint, currentConstraint);
        requireRecognised(currentConstraint, newConstraint);

        log.debug("Merging constraint '{}' into '{}'", newConstraint, currentConstraint);

        if (currentConstraint.isEquality()) {
            return currentConstraint;
        }
        if (newConstraint.isEquality()) {
            return newConstraint;
        }

        String comparator = newConstraint.getComparator();
        if (!comparator.equals(currentConstraint.getComparator())) {
            throw new ConstraintResolutionException(String.format(
                    "Contradictory constraints '%s' and '%s' cannot be merged", newConstraint, currentConstraint));
        }

        int order = compareTags(newConstraint.getTag(), currentConstraint.getTag());
        switch (comparator) {
            case VersionConstraint.GREATER_OR_EQUAL:
                return order > 0 ? newConstraint : currentConstraint;
            case VersionConstraint.LESS_OR_EQUAL:
                return order < 0 ? newConstraint : currentConstraint;
            default:
                throw new ConstraintFormatException(String.format(
                        "Cannot merge constraints '%s' and '%s'", newConstraint, currentConstraint));
        }
    }

    private void requireRecognised(VersionConstraint constraint, VersionConstraint other)
            throws ConstraintFormatException {
        if (!constraint.isRecognised()) {
            throw new ConstraintFormatException(String.format(
                    "Unrecognised constraint '%s' (while merging with '%s')", constraint.getRaw(), other));
        }
    }

    private static int compareTags(String left, String right) {
        return new ComparableVersion(stripV(left)).compareTo(new ComparableVersion(stripV(right)));
    }

    private static String stripV(String tag) {
        return tag.startsWith("v") ? tag.substring(1) : tag;
    }
}
