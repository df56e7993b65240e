package org.example.shaker.resolver;

import org.example.shaker.exception.ConfigException;
import org.example.shaker.exception.ConstraintFormatException;
import org.example.shaker.model.DependencyRecord;
import org.example.shaker.model.PackageKey;
import org.example.shaker.version.VersionConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses requirement lines into dependency records.
 *
 * <p>Accepted forms:</p>
 * <ul>
 *   <li>{@code git@github.com:org/name.git==v1.0.1}</li>
 *   <li>{@code org/name>=v1.0}</li>
 * </ul>
 * <p>The constraint is optional in both.</p>
 */
public class RequirementParser {

    private static final Pattern SSH_SOURCE =
            Pattern.compile("^git@([^:\\s]+):([^/\\s]+)/([^/\\s]+?)\\.git\\s*(.*)$");
    private static final Pattern SHORT_SOURCE =
            Pattern.compile("^([^/\\s=<>:@]+)/([^/\\s=<>]+?)\\s*([=<>].*)?$");

    private final String gitHost;
    private final Logger log;

    public RequirementParser(String gitHost) {
        this(gitHost, LoggerFactory.getLogger(RequirementParser.class));
    }

    public RequirementParser(String gitHost, Logger log) {
        this.gitHost = Objects.requireNonNull(gitHost, "gitHost cannot be null");
        this.log = log;
    }

    /**
     * Parses one requirement line.
     *
     * @throws ConfigException           if the repository locator is not recognised
     * @throws ConstraintFormatException if a constraint is present but malformed
     */
    public DependencyRecord parse(String line) throws ConfigException, ConstraintFormatException {
        String value = line == null ? "" : line.trim();

        String host;
        String organisation;
        String name;
        String constraintText;

        Matcher ssh = SSH_SOURCE.matcher(value);
        Matcher shortForm = SHORT_SOURCE.matcher(value);
        if (ssh.matches()) {
            host = ssh.group(1);
            organisation = ssh.group(2);
            name = ssh.group(3);
            constraintText = ssh.group(4);
        } else if (shortForm.matches()) {
            host = gitHost;
            organisation = shortForm.group(1);
            name = shortForm.group(2);
            constraintText = shortForm.group(3);
        } else {
            throw new ConfigException("Unrecognised requirement '" + value + "'");
        }

        VersionConstraint constraint = VersionConstraint.parse(constraintText);
        if (!constraint.isEmpty() && !constraint.isRecognised()) {
            throw new ConstraintFormatException(String.format(
                    "Requirement '%s' has malformed constraint '%s'", value, constraint.getRaw()));
        }

        PackageKey key = new PackageKey(organisation, name);
        String source = String.format("git@%s:%s/%s.git", host, organisation, name);
        return new DependencyRecord(key, source, constraint);
    }

    /**
     * Parses a list of requirement lines. When two lines name the same formula,
     * even under different organisations, the first wins and the rest are
     * skipped with a warning.
     *
     * @return records keyed by formula, in input order
     */
    public Map<PackageKey, DependencyRecord> parseAll(List<String> lines)
            throws ConfigException, ConstraintFormatException {
        Map<PackageKey, DependencyRecord> records = new LinkedHashMap<>();
        Set<String> names = new HashSet<>();
        for (String line : lines) {
            DependencyRecord record = parse(line);
            if (!names.add(record.getKey().getName())) {
                log.warn("Skipping duplicate dependency {} ('{}')", record.getKey().getName(), line.trim());
                continue;
            }
            records.put(record.getKey(), record);
        }
        return records;
    }
}
