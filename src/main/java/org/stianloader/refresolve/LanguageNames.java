package org.stianloader.refresolve;

/**
 * The source language names under which language-specific assemblies are registered.
 */
public final class LanguageNames {

    public static final String CSHARP = "C#";
    public static final String VISUAL_BASIC = "Visual Basic";

    private LanguageNames() {
        throw new AssertionError();
    }
}
