package io.github.huiyu.imgsort.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import io.github.huiyu.imgsort.Const;
import io.github.huiyu.imgsort.util.NaturalOrderComparator;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Where images come from and where sorted images go. For every start directory each
 * category maps to {@code <sortDir>/<category>} and deletion to {@code <sortDir>/deleted},
 * where the sort directory defaults to the start directory itself.
 */
public final class SortingLayout {

    private final ImmutableList<Path> startDirs;
    private final ImmutableList<String> categories;
    private final ImmutableMap<Path, ImmutableMap<String, Path>> destinations;
    private final ImmutableMap<Path, Path> deleteFolders;
    private final ImmutableSet<Path> sortingFolders;

    private SortingLayout(ImmutableList<Path> startDirs,
                          ImmutableList<String> categories,
                          ImmutableMap<Path, ImmutableMap<String, Path>> destinations,
                          ImmutableMap<Path, Path> deleteFolders) {
        this.startDirs = startDirs;
        this.categories = categories;
        this.destinations = destinations;
        this.deleteFolders = deleteFolders;
        ImmutableSet.Builder<Path> folders = ImmutableSet.builder();
        destinations.values().forEach(m -> folders.addAll(m.values()));
        folders.addAll(deleteFolders.values());
        this.sortingFolders = folders.build();
    }

    public static SortingLayout create(Collection<Path> startDirs, Path sortDir, List<String> categories) {
        checkArgument(!startDirs.isEmpty(), "at least one start directory is required");
        ImmutableList<Path> roots = startDirs.stream()
                .map(p -> p.toAbsolutePath().normalize())
                .distinct()
                .sorted(Comparator.comparing(Path::toString, NaturalOrderComparator.INSTANCE))
                .collect(ImmutableList.toImmutableList());
        Path base = sortDir == null ? null : sortDir.toAbsolutePath().normalize();

        ImmutableMap.Builder<Path, ImmutableMap<String, Path>> destinations = ImmutableMap.builder();
        ImmutableMap.Builder<Path, Path> deleteFolders = ImmutableMap.builder();
        for (Path root : roots) {
            Path target = base == null ? root : base;
            ImmutableMap.Builder<String, Path> byCategory = ImmutableMap.builder();
            for (String category : categories) {
                byCategory.put(category, target.resolve(category).normalize());
            }
            destinations.put(root, byCategory.build());
            deleteFolders.put(root, target.resolve(Const.DELETE_FOLDER_NAME).normalize());
        }
        return new SortingLayout(roots, ImmutableList.copyOf(categories),
                destinations.build(), deleteFolders.build());
    }

    public List<Path> getStartDirs() {
        return startDirs;
    }

    public List<String> getCategories() {
        return categories;
    }

    /**
     * @return the innermost start directory containing {@code file}, or null
     */
    public Path startDirOf(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        Path match = null;
        for (Path root : startDirs) {
            if (normalized.startsWith(root)
                    && (match == null || root.getNameCount() > match.getNameCount())) {
                match = root;
            }
        }
        return match;
    }

    public Path destinationFor(Path file, String category) {
        Path root = requireStartDir(file);
        Path destination = destinations.get(root).get(category);
        checkArgument(destination != null, "Unknown category %s", category);
        return destination;
    }

    public Path deleteFolderFor(Path file) {
        return deleteFolders.get(requireStartDir(file));
    }

    public boolean isSortingFolder(Path directory) {
        return sortingFolders.contains(directory.toAbsolutePath().normalize());
    }

    public Map<Path, Path> getDeleteFolders() {
        return deleteFolders;
    }

    private Path requireStartDir(Path file) {
        Path root = startDirOf(file);
        checkArgument(root != null, "%s is outside of all start directories", file);
        return root;
    }

    @Override
    public String toString() {
        return "SortingLayout{" +
                "startDirs=" + startDirs +
                ", destinations=" + destinations +
                ", deleteFolders=" + deleteFolders +
                '}';
    }
}
