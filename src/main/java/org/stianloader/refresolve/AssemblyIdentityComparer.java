package org.stianloader.refresolve;

/**
 * The rules a compiler should apply when deciding whether two assembly references denote the same
 * assembly. The resolver itself does not compare assemblies; the comparer is carried by the
 * {@link ReferenceAssemblies} descriptor so that compilation harnesses can configure their
 * compiler accordingly.
 */
public enum AssemblyIdentityComparer {

    /**
     * Assemblies are equal only if their names, versions, cultures and public key tokens match.
     */
    DEFAULT,

    /**
     * The rules of the .NET Framework desktop runtime, under which references to older versions of
     * framework assemblies are unified with the version that ships with the targeted framework.
     */
    DESKTOP;
}
