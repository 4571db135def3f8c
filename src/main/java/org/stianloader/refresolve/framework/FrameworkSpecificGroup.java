package org.stianloader.refresolve.framework;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * An asset group of a package: a set of items tagged with the {@link TargetFramework} they apply to.
 * For "lib" and "ref" groups the items are paths relative to the package root using '/' as the
 * separator, for "framework" groups they are assembly names without extension.
 */
public final class FrameworkSpecificGroup {
    @NotNull
    private final TargetFramework targetFramework;
    @NotNull
    private final List<@NotNull String> items;

    public FrameworkSpecificGroup(@NotNull TargetFramework targetFramework, @NotNull List<@NotNull String> items) {
        this.targetFramework = Objects.requireNonNull(targetFramework, "targetFramework may not be null");
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getItems() {
        return this.items;
    }

    @NotNull
    @Contract(pure = true)
    public TargetFramework getTargetFramework() {
        return this.targetFramework;
    }

    @Override
    @NotNull
    public String toString() {
        return "FrameworkSpecificGroup[framework=" + this.targetFramework + " items=" + this.items + "]";
    }
}
