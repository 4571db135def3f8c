package org.stianloader.refresolve;

import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.version.PackageVersion;

/**
 * A {@link PackageIdentity} stores the id and the exact version of a package. Package ids are
 * case-insensitive, so two identities that only differ in the case of the id are equal. Versions
 * are compared semantically, meaning that "1.0" and "1.0.0" denote the same identity.
 *
 * <p>Identities are used as keys for all maps and sets that make up the dependency graph.
 */
public final class PackageIdentity {

    @NotNull
    private final String id;
    @NotNull
    private final PackageVersion version;

    public PackageIdentity(@NotNull String id, @NotNull PackageVersion version) {
        this.id = Objects.requireNonNull(id, "id may not be null");
        this.version = Objects.requireNonNull(version, "version may not be null");
    }

    @NotNull
    public static PackageIdentity of(@NotNull String id, @NotNull String version) {
        return new PackageIdentity(id, PackageVersion.parse(version));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PackageIdentity) {
            PackageIdentity other = (PackageIdentity) obj;
            return other.id.equalsIgnoreCase(this.id) && other.version.equals(this.version);
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    public String id() {
        return this.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id.toLowerCase(Locale.ROOT), this.version);
    }

    @Contract(pure = true)
    public boolean hasId(@NotNull String id) {
        return this.id.equalsIgnoreCase(id);
    }

    @NotNull
    @Contract(pure = true)
    public String lowerCaseId() {
        return this.id.toLowerCase(Locale.ROOT);
    }

    @Override
    @NotNull
    public String toString() {
        return this.id + '@' + this.version;
    }

    @NotNull
    @Contract(pure = true)
    public PackageVersion version() {
        return this.version;
    }
}
