package org.stianloader.refresolve.packaging;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A downloaded package archive (".nupkg" file), held in memory.
 */
public final class PackageArchive extends PackageReader {

    @NotNull
    public static PackageArchive read(byte @NotNull[] data) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipInputStream zipIn = new ZipInputStream(new ByteArrayInputStream(data))) {
            for (ZipEntry entry = zipIn.getNextEntry(); entry != null; entry = zipIn.getNextEntry()) {
                if (entry.isDirectory()) {
                    continue;
                }
                String name = entry.getName().replace('\\', '/');
                while (name.startsWith("/")) {
                    name = name.substring(1);
                }
                entries.put(name, zipIn.readAllBytes());
            }
        }
        return new PackageArchive(data, entries);
    }

    private final byte @NotNull[] data;
    @NotNull
    private final Map<String, byte[]> entries;
    @Nullable
    private NuspecReader nuspec;

    private PackageArchive(byte @NotNull[] data, @NotNull Map<String, byte[]> entries) {
        this.data = data;
        this.entries = Collections.unmodifiableMap(entries);
    }

    @Nullable
    @Contract(pure = true)
    public byte[] getEntry(@NotNull String name) {
        return this.entries.get(Objects.requireNonNull(name, "name may not be null"));
    }

    @NotNull
    @Override
    public List<@NotNull String> getFiles() {
        return new ArrayList<>(this.entries.keySet());
    }

    @Override
    @Nullable
    public synchronized NuspecReader getNuspec() throws IOException {
        NuspecReader nuspec = this.nuspec;
        if (nuspec != null) {
            return nuspec;
        }
        String name = this.getNuspecEntryName();
        if (name == null) {
            return null;
        }
        return this.nuspec = NuspecReader.read(this.entries.get(name));
    }

    /**
     * Obtains the name of the manifest entry, which is the only ".nuspec" file at the archive root.
     *
     * @return The entry name, or null if the archive has no manifest
     */
    @Nullable
    public String getNuspecEntryName() {
        for (String name : this.entries.keySet()) {
            if (name.indexOf('/') == -1 && name.toLowerCase(Locale.ROOT).endsWith(".nuspec")) {
                return name;
            }
        }
        return null;
    }

    /**
     * Obtains the raw bytes of the archive as it was downloaded.
     *
     * @return The archive bytes
     */
    @Contract(pure = true)
    public byte @NotNull[] getRawData() {
        return this.data;
    }
}
