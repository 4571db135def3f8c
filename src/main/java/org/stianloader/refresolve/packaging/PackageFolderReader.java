package org.stianloader.refresolve.packaging;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.internal.XMLUtil;

/**
 * Reads an installed (extracted) package from its directory.
 */
public class PackageFolderReader extends PackageReader {

    @NotNull
    private final Path directory;
    @Nullable
    private List<@NotNull String> files;

    public PackageFolderReader(@NotNull Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory may not be null");
    }

    @NotNull
    public Path getDirectory() {
        return this.directory;
    }

    @Override
    @NotNull
    public synchronized List<@NotNull String> getFiles() throws IOException {
        List<@NotNull String> files = this.files;
        if (files != null) {
            return files;
        }
        files = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(this.directory)) {
            for (Path file : (Iterable<Path>) stream::iterator) {
                if (Files.isRegularFile(file)) {
                    files.add(this.directory.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/"));
                }
            }
        }
        Collections.sort(files);
        return this.files = Collections.unmodifiableList(files);
    }

    @Override
    @Nullable
    public NuspecReader getNuspec() throws IOException {
        for (String file : this.getFiles()) {
            if (file.indexOf('/') == -1 && file.toLowerCase(Locale.ROOT).endsWith(".nuspec")) {
                try (InputStream in = Files.newInputStream(this.directory.resolve(file))) {
                    return new NuspecReader(XMLUtil.parse(in));
                }
            }
        }
        return null;
    }
}
