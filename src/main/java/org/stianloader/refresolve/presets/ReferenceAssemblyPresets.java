package org.stianloader.refresolve.presets;

import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.AssemblyIdentityComparer;
import org.stianloader.refresolve.LanguageNames;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.ReferenceAssemblies;
import org.stianloader.refresolve.framework.TargetFramework;

/**
 * Ready-made {@link ReferenceAssemblies} descriptors for the commonly targeted frameworks.
 *
 * <p>Each group of descriptors lives in its own holder class, so a descriptor is only created
 * once its holder class is first accessed. As descriptors memoize their resolved assemblies,
 * reusing these shared instances avoids resolving the same framework over and over again.
 */
public final class ReferenceAssemblyPresets {

    /**
     * The version of the "Microsoft.NETFramework.ReferenceAssemblies" packages used by the
     * .NET Framework descriptors.
     */
    public static final String NETFRAMEWORK_REFERENCE_ASSEMBLIES_VERSION = "1.0.0-preview.2";

    public static final class NetCore {
        public static final ReferenceAssemblies NET_CORE_APP_10 = ReferenceAssemblyPresets.withPackage("netcoreapp1.0", "Microsoft.NETCore.App", "1.0.16");
        public static final ReferenceAssemblies NET_CORE_APP_11 = ReferenceAssemblyPresets.withPackage("netcoreapp1.1", "Microsoft.NETCore.App", "1.1.13");
        public static final ReferenceAssemblies NET_CORE_APP_20 = ReferenceAssemblyPresets.withPackage("netcoreapp2.0", "Microsoft.NETCore.App", "2.0.9");
        public static final ReferenceAssemblies NET_CORE_APP_21 = ReferenceAssemblyPresets.withPackage("netcoreapp2.1", "Microsoft.NETCore.App", "2.1.13");

        private NetCore() {
            throw new AssertionError();
        }
    }

    public static final class NetFramework {
        public static final class Net20 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework("net20", "v2.0")
                    .addAssemblies("mscorlib", "System", "System.Data", "System.Xml")
                    .addLanguageSpecificAssemblies(LanguageNames.VISUAL_BASIC, "Microsoft.VisualBasic");
            public static final ReferenceAssemblies WINDOWS_FORMS = Net20.DEFAULT.addAssemblies("System.Drawing", "System.Windows.Forms");

            private Net20() {
                throw new AssertionError();
            }
        }

        public static final class Net40 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework40("net40", "v4.0");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net40.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net40.DEFAULT);

            private Net40() {
                throw new AssertionError();
            }
        }

        public static final class Net45 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework45("net45", "v4.5");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net45.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net45.DEFAULT);

            private Net45() {
                throw new AssertionError();
            }
        }

        public static final class Net451 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework45("net451", "v4.5.1");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net451.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net451.DEFAULT);

            private Net451() {
                throw new AssertionError();
            }
        }

        public static final class Net452 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework45("net452", "v4.5.2");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net452.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net452.DEFAULT);

            private Net452() {
                throw new AssertionError();
            }
        }

        public static final class Net46 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework45("net46", "v4.6");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net46.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net46.DEFAULT);

            private Net46() {
                throw new AssertionError();
            }
        }

        public static final class Net461 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework45("net461", "v4.6.1");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net461.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net461.DEFAULT);

            private Net461() {
                throw new AssertionError();
            }
        }

        public static final class Net462 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework45("net462", "v4.6.2");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net462.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net462.DEFAULT);

            private Net462() {
                throw new AssertionError();
            }
        }

        public static final class Net47 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework45("net47", "v4.7");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net47.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net47.DEFAULT);

            private Net47() {
                throw new AssertionError();
            }
        }

        public static final class Net471 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework45("net471", "v4.7.1");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net471.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net471.DEFAULT);

            private Net471() {
                throw new AssertionError();
            }
        }

        public static final class Net472 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework45("net472", "v4.7.2");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net472.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net472.DEFAULT);

            private Net472() {
                throw new AssertionError();
            }
        }

        public static final class Net48 {
            public static final ReferenceAssemblies DEFAULT = ReferenceAssemblyPresets.netFramework45("net48", "v4.8");
            public static final ReferenceAssemblies WINDOWS_FORMS = ReferenceAssemblyPresets.windowsForms(Net48.DEFAULT);
            public static final ReferenceAssemblies WPF = ReferenceAssemblyPresets.wpf(Net48.DEFAULT);

            private Net48() {
                throw new AssertionError();
            }
        }

        private NetFramework() {
            throw new AssertionError();
        }
    }

    public static final class NetStandard {
        public static final ReferenceAssemblies NET_STANDARD_10 = ReferenceAssemblyPresets.withPackage("netstandard1.0", "NETStandard.Library", "1.6.1");
        public static final ReferenceAssemblies NET_STANDARD_11 = ReferenceAssemblyPresets.withPackage("netstandard1.1", "NETStandard.Library", "1.6.1");
        public static final ReferenceAssemblies NET_STANDARD_12 = ReferenceAssemblyPresets.withPackage("netstandard1.2", "NETStandard.Library", "1.6.1");
        public static final ReferenceAssemblies NET_STANDARD_13 = ReferenceAssemblyPresets.withPackage("netstandard1.3", "NETStandard.Library", "1.6.1");
        public static final ReferenceAssemblies NET_STANDARD_14 = ReferenceAssemblyPresets.withPackage("netstandard1.4", "NETStandard.Library", "1.6.1");
        public static final ReferenceAssemblies NET_STANDARD_15 = ReferenceAssemblyPresets.withPackage("netstandard1.5", "NETStandard.Library", "1.6.1");
        public static final ReferenceAssemblies NET_STANDARD_16 = ReferenceAssemblyPresets.withPackage("netstandard1.6", "NETStandard.Library", "1.6.1");
        public static final ReferenceAssemblies NET_STANDARD_20 = new ReferenceAssemblies(TargetFramework.parse("netstandard2.0"),
                PackageIdentity.of("NETStandard.Library", "2.0.3"), "build/netstandard2.0/ref")
                .addAssemblies("netstandard");

        private NetStandard() {
            throw new AssertionError();
        }
    }

    @NotNull
    private static ReferenceAssemblies netFramework(@NotNull String targetFramework, @NotNull String folderVersion) {
        PackageIdentity referenceAssemblies = PackageIdentity.of("Microsoft.NETFramework.ReferenceAssemblies." + targetFramework, ReferenceAssemblyPresets.NETFRAMEWORK_REFERENCE_ASSEMBLIES_VERSION);
        return new ReferenceAssemblies(TargetFramework.parse(targetFramework), referenceAssemblies, "build/.NETFramework/" + folderVersion)
                .withAssemblyIdentityComparer(AssemblyIdentityComparer.DESKTOP);
    }

    @NotNull
    private static ReferenceAssemblies netFramework40(@NotNull String targetFramework, @NotNull String folderVersion) {
        return ReferenceAssemblyPresets.netFramework(targetFramework, folderVersion)
                .addAssemblies("mscorlib", "System", "System.Core", "System.Data", "System.Data.DataSetExtensions", "System.Xml", "System.Xml.Linq")
                .addLanguageSpecificAssemblies(LanguageNames.CSHARP, "Microsoft.CSharp")
                .addLanguageSpecificAssemblies(LanguageNames.VISUAL_BASIC, "Microsoft.VisualBasic");
    }

    @NotNull
    private static ReferenceAssemblies netFramework45(@NotNull String targetFramework, @NotNull String folderVersion) {
        return ReferenceAssemblyPresets.netFramework(targetFramework, folderVersion)
                .addAssemblies("mscorlib", "System", "System.Core", "System.Data", "System.Data.DataSetExtensions", "System.Net.Http", "System.Xml", "System.Xml.Linq")
                .addLanguageSpecificAssemblies(LanguageNames.CSHARP, "Microsoft.CSharp")
                .addLanguageSpecificAssemblies(LanguageNames.VISUAL_BASIC, "Microsoft.VisualBasic");
    }

    @NotNull
    private static ReferenceAssemblies windowsForms(@NotNull ReferenceAssemblies base) {
        return base.addAssemblies("System.Deployment", "System.Drawing", "System.Windows.Forms");
    }

    @NotNull
    private static ReferenceAssemblies withPackage(@NotNull String targetFramework, @NotNull String id, @NotNull String version) {
        return new ReferenceAssemblies(TargetFramework.parse(targetFramework)).addPackages(PackageIdentity.of(id, version));
    }

    @NotNull
    private static ReferenceAssemblies wpf(@NotNull ReferenceAssemblies base) {
        return base.addAssemblies("PresentationCore", "PresentationFramework", "System.Xaml", "WindowsBase");
    }

    private ReferenceAssemblyPresets() {
        throw new AssertionError();
    }
}
