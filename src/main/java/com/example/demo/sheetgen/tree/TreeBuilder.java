package com.example.demo.sheetgen.tree;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds trees that mirror some external hierarchy.
 */
@Slf4j
public final class TreeBuilder {

    private TreeBuilder() {
    }

    /**
     * Mirror the hierarchy rooted at {@code root}. Branch children are produced one
     * level at a time, when the branch is first asked for them, so an infinite
     * hierarchy can be mirrored and inspected to any finite depth.
     *
     * @param isBranch whether a source element has children
     * @param children the source children of a branch element, in display order
     * @param root     the source root
     * @param label    node label for an element
     * @param value    value map for a leaf element
     */
    public static <T, K> TreeNode<K> build(Predicate<? super T> isBranch,
                                           Function<? super T, ? extends Collection<? extends T>> children,
                                           T root,
                                           Function<? super T, String> label,
                                           Function<? super T, ValueMap<K>> value) {
        if (!isBranch.test(root)) {
            return TreeNode.leaf(label.apply(root), value.apply(root));
        }
        return TreeNode.lazyBranch(label.apply(root), () -> children.apply(root).stream()
                .map(child -> TreeBuilder.<T, K>build(isBranch, children, child, label, value))
                .collect(Collectors.toList()));
    }

    /**
     * A tree of the directory, with each regular file's byte count under the
     * {@code "size"} key. Directories are listed in name order.
     */
    public static TreeNode<String> fileTree(Path root) {
        if (!Files.exists(root)) {
            throw new UncheckedIOException(new IOException("No such file or directory: " + root));
        }
        log.debug("Building file tree for {}", root);
        return build(Files::isDirectory, TreeBuilder::list, root, TreeBuilder::fileName,
                path -> ValueMap.of("size", size(path)));
    }

    private static List<Path> list(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.sorted(Comparator.comparing(TreeBuilder::fileName)).collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    private static long size(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read size of " + file, e);
        }
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
