package org.stianloader.refresolve;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when the reference assemblies of a {@link ReferenceAssemblies} descriptor cannot be
 * resolved.
 */
public class ReferenceResolutionException extends RuntimeException {

    private static final long serialVersionUID = -3416873411602398917L;

    public ReferenceResolutionException(@NotNull String message) {
        super(message);
    }

    public ReferenceResolutionException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
