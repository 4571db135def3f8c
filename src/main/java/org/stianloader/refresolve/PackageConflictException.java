package org.stianloader.refresolve;

import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when no combination of package versions satisfies all version constraints of the
 * dependency graph.
 */
public class PackageConflictException extends ReferenceResolutionException {

    private static final long serialVersionUID = 7746412207563416221L;

    @NotNull
    private final List<@NotNull String> conflictingIds;

    public PackageConflictException(@NotNull String message, @NotNull List<@NotNull String> conflictingIds) {
        super(message);
        this.conflictingIds = Collections.unmodifiableList(conflictingIds);
    }

    /**
     * Obtains the ids of the packages for which no acceptable version could be selected.
     *
     * @return The conflicting package ids
     */
    @NotNull
    public List<@NotNull String> getConflictingIds() {
        return this.conflictingIds;
    }
}
