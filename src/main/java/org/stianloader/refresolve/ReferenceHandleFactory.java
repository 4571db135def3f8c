package org.stianloader.refresolve;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;

/**
 * Turns a resolved assembly file into whatever object a compiler uses to refer to it.
 *
 * @param <R> The type of the reference handles
 */
@FunctionalInterface
public interface ReferenceHandleFactory<R> {

    /**
     * Creates the handle for an assembly file. Called once per file and per
     * {@link ReferenceAssemblies#resolveReferencesAsync} call.
     *
     * @param assembly The absolute path of the assembly file
     * @return The handle
     */
    @NotNull
    R fromFile(@NotNull Path assembly);
}
