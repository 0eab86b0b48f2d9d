package guraa.photoclean.util;

import guraa.photoclean.model.ImageFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recursive enumeration of candidate image files under a root directory.
 */
@Slf4j
public final class ImageFileScanner {

    /**
     * Windows thumbnail database, never an image despite living next to them.
     */
    private static final String THUMBS_DB = "thumbs.db";

    private ImageFileScanner() {
    }

    /**
     * Enumerate image files below a root.
     *
     * @param root The directory to walk
     * @param includeExtensions Extensions with or without a leading dot, matched case-insensitively
     * @param excludeSubstrings A file is skipped when its {@code /}-separated path contains any of these
     * @return Files sorted by path
     */
    public static List<ImageFile> scan(Path root, Collection<String> includeExtensions,
                                       Collection<String> excludeSubstrings) {
        Set<String> extensions = includeExtensions.stream()
                .map(ImageFileScanner::normalizeExtension)
                .filter(ext -> !ext.isEmpty())
                .collect(Collectors.toSet());
        List<String> excludes = excludeSubstrings == null ? List.of() : excludeSubstrings.stream()
                .filter(s -> s != null && !s.isEmpty())
                .collect(Collectors.toList());

        List<ImageFile> files = new ArrayList<>();
        try {
            Files.walkFileTree(root.toAbsolutePath().normalize(), new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && accepts(file, extensions, excludes)) {
                        files.add(new ImageFile(file.toString(),
                                attrs.lastModifiedTime().toMillis() / 1000L, attrs.size()));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Skipping unreadable entry {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to enumerate " + root, e);
        }

        files.sort(Comparator.comparing(ImageFile::getPath));
        log.debug("Enumerated {} image files under {}", files.size(), root);
        return files;
    }

    static boolean accepts(Path file, Set<String> extensions, List<String> excludes) {
        String name = file.getFileName().toString();
        if (THUMBS_DB.equals(name.toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (!extensions.contains(FilenameUtils.getExtension(name).toLowerCase(Locale.ROOT))) {
            return false;
        }
        String unixPath = FilenameUtils.separatorsToUnix(file.toString());
        for (String exclude : excludes) {
            if (unixPath.contains(exclude)) {
                return false;
            }
        }
        return true;
    }

    private static String normalizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        String ext = extension.trim().toLowerCase(Locale.ROOT);
        return ext.startsWith(".") ? ext.substring(1) : ext;
    }
}
