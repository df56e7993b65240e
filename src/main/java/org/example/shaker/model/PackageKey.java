package org.example.shaker.model;

import org.example.shaker.exception.ConfigException;

import java.util.Objects;

/**
 * Identifies a formula by its (organisation, name) pair.
 * Rendered as {@code organisation/name}.
 */
public final class PackageKey implements Comparable<PackageKey> {

    private final String organisation;
    private final String name;

    public PackageKey(String organisation, String name) {
        this.organisation = Objects.requireNonNull(organisation, "organisation cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    /**
     * Parses an {@code organisation/name} identifier.
     *
     * @param value the identifier
     * @return the key
     * @throws ConfigException if the value does not contain exactly one '/' separating two non-empty parts
     */
    public static PackageKey parse(String value) throws ConfigException {
        if (value == null) {
            throw new ConfigException("Formula identifier cannot be null");
        }
        String[] parts = value.trim().split("/", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new ConfigException("Formula identifier must be of the form 'organisation/name', but was: " + value);
        }
        return new PackageKey(parts[0], parts[1]);
    }

    // Getters

    public String getOrganisation() {
        return organisation;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(PackageKey other) {
        int result = organisation.compareTo(other.organisation);
        return result != 0 ? result : name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageKey that = (PackageKey) o;
        return organisation.equals(that.organisation) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(organisation, name);
    }

    @Override
    public String toString() {
        return organisation + "/" + name;
    }
}
