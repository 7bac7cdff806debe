package com.example.demo.sheetgen.tree;

import com.example.demo.sheetgen.exception.MalformedTreeException;
import com.example.demo.sheetgen.exception.SheetGenerationException;
import com.example.demo.sheetgen.exception.TreeOperationException;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Folding, algebra and derived constructors over {@link TreeNode}s.
 *
 * Every traversal here runs off an explicit stack, so trees of any depth are safe.
 */
public final class Trees {

    private Trees() {
    }

    /**
     * A leaf's own map, or the sum of every leaf beneath a branch.
     */
    public static <K> ValueMap<K> value(TreeNode<K> node) {
        if (node.isLeaf()) {
            return node.value();
        }
        List<ValueMap<K>> maps = new ArrayList<>();
        for (TreeNode<K> leaf : leaves(node)) {
            maps.add(leaf.value());
        }
        return ValueMaps.sum(maps);
    }

    /**
     * Leaves beneath the node in preorder, left to right. A leaf yields itself.
     */
    public static <K> List<TreeNode<K>> leaves(TreeNode<K> node) {
        List<TreeNode<K>> out = new ArrayList<>();
        Deque<TreeNode<K>> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            TreeNode<K> current = stack.pop();
            if (current.isLeaf()) {
                out.add(current);
                continue;
            }
            List<TreeNode<K>> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /**
     * Reduce the leaf maps key by key with {@code f}, left to right in preorder,
     * substituting {@code identity} wherever a leaf lacks a key. With three leaves
     * holding a, b and c at some key the result is {@code f(f(a, b), c)}.
     * Folding a tree without leaves gives the empty map.
     */
    public static <K> ValueMap<K> fold(BinaryOperator<BigDecimal> f, BigDecimal identity, TreeNode<K> node) {
        return aggregate(node, ValueMaps.combiner(f, identity)).orElse(ValueMap.empty());
    }

    /**
     * Reduce the leaf maps beneath the node with a whole-map operator. Empty when
     * there are no leaves. A failing operator is rethrown as a
     * {@link TreeOperationException} naming the leaf being folded in.
     */
    public static <K> Optional<ValueMap<K>> aggregate(TreeNode<K> node, BinaryOperator<ValueMap<K>> op) {
        ValueMap<K> acc = null;
        Deque<TreeNode<K>> stack = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        stack.push(node);
        depths.push(0);
        while (!stack.isEmpty()) {
            TreeNode<K> current = stack.pop();
            int depth = depths.pop();
            if (current.isLeaf()) {
                if (acc == null) {
                    acc = current.value();
                } else {
                    try {
                        acc = op.apply(acc, current.value());
                    } catch (SheetGenerationException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        throw new TreeOperationException("fold", current.getLabel(), depth, e);
                    }
                }
                continue;
            }
            List<TreeNode<K>> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
                depths.push(depth + 1);
            }
        }
        return Optional.ofNullable(acc);
    }

    /**
     * Rebuild the tree applying {@code f} to every node. Branch children are
     * mapped lazily, on first access of the rebuilt branch.
     */
    public static <K> TreeNode<K> mapNodes(TreeNode<K> node, UnaryOperator<TreeNode<K>> f) {
        if (node.isLeaf()) {
            return f.apply(node);
        }
        TreeNode<K> rebuilt = TreeNode.lazyBranch(node.getLabel(), () -> node.getChildren().stream()
                .map(child -> mapNodes(child, f))
                .collect(Collectors.toList()));
        return f.apply(rebuilt);
    }

    public static <K> TreeNode<K> negateTree(TreeNode<K> tree) {
        return mapNodes(tree, node -> node.isLeaf()
                ? TreeNode.leaf(node.getLabel(), ValueMaps.negate(node.value()))
                : node);
    }

    /**
     * Drop the root and collapse one level: the children's labels are joined with
     * {@code " & "}, leaf children are kept and branch children contribute their
     * own children. A leaf comes back unchanged.
     */
    public static <K> TreeNode<K> shallow(TreeNode<K> tree) {
        if (tree.isLeaf()) {
            return tree;
        }
        String mergedLabel = tree.getChildren().stream()
                .map(TreeNode::getLabel)
                .collect(Collectors.joining(" & "));
        List<TreeNode<K>> merged = new ArrayList<>();
        for (TreeNode<K> child : tree.getChildren()) {
            if (child.isLeaf()) {
                merged.add(child);
            } else {
                merged.addAll(child.getChildren());
            }
        }
        return TreeNode.branch(mergedLabel, merged);
    }

    /**
     * Put the children of every given tree side by side under a new root.
     */
    public static <K> TreeNode<K> mergeTrees(String rootLabel, List<? extends TreeNode<K>> trees) {
        return shallow(TreeNode.branch("Merged", trees)).withLabel(rootLabel);
    }

    @SafeVarargs
    public static <K> TreeNode<K> mergeTrees(String rootLabel, TreeNode<K>... trees) {
        return mergeTrees(rootLabel, Arrays.asList(trees));
    }

    /**
     * Sum of any mix of trees and value maps; a tree contributes its value.
     */
    @SafeVarargs
    public static <K> ValueMap<K> treeSum(Valued<K>... xs) {
        List<ValueMap<K>> maps = new ArrayList<>(xs.length);
        for (Valued<K> x : xs) {
            maps.add(x.value());
        }
        return ValueMaps.sum(maps);
    }

    /**
     * {@code x} minus each of {@code xs}, trees contributing their values.
     */
    @SafeVarargs
    public static <K> ValueMap<K> treeSubtract(Valued<K> x, Valued<K>... xs) {
        ValueMap<K> acc = x.value();
        for (Valued<K> other : xs) {
            acc = ValueMaps.subtract(acc, other.value());
        }
        return acc;
    }

    /**
     * Column keys of the tree's value: {@code first} keys, then the remaining
     * keys in first-seen order, then {@code last} keys. Keys the tree does not
     * carry are left out.
     */
    public static <K> List<K> headers(TreeNode<K> tree, List<K> first, List<K> last) {
        Set<K> present = value(tree).keySet();
        List<K> out = new ArrayList<>();
        for (K k : first) {
            if (present.contains(k) && !out.contains(k)) {
                out.add(k);
            }
        }
        for (K k : present) {
            if (!first.contains(k) && !last.contains(k)) {
                out.add(k);
            }
        }
        for (K k : last) {
            if (present.contains(k) && !out.contains(k)) {
                out.add(k);
            }
        }
        return out;
    }

    /**
     * Group flat records into a forest. Each grouping function labels one level;
     * groups keep the order in which they were first seen. At the bottom level a
     * group holding one record becomes a leaf, and a larger group becomes a branch
     * of unlabeled leaves, one per record.
     */
    @SafeVarargs
    public static <R, K> List<TreeNode<K>> tableToTrees(List<R> records,
                                                       Function<? super R, ValueMap<K>> formatLeaf,
                                                       Function<? super R, ?>... groupingFns) {
        return tableToTrees(records, formatLeaf, Arrays.asList(groupingFns));
    }

    public static <R, K> List<TreeNode<K>> tableToTrees(List<R> records,
                                                       Function<? super R, ValueMap<K>> formatLeaf,
                                                       List<? extends Function<? super R, ?>> groupingFns) {
        if (groupingFns.isEmpty()) {
            throw new IllegalArgumentException("At least one grouping function is required");
        }
        return group(records, formatLeaf, groupingFns, 0);
    }

    private static <R, K> List<TreeNode<K>> group(List<R> records,
                                                  Function<? super R, ValueMap<K>> formatLeaf,
                                                  List<? extends Function<? super R, ?>> groupingFns,
                                                  int level) {
        Map<String, List<R>> groups = new LinkedHashMap<>();
        for (R record : records) {
            String key = String.valueOf(groupingFns.get(level).apply(record));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }
        List<TreeNode<K>> out = new ArrayList<>(groups.size());
        boolean bottom = level == groupingFns.size() - 1;
        for (Map.Entry<String, List<R>> group : groups.entrySet()) {
            List<R> members = group.getValue();
            if (!bottom) {
                out.add(TreeNode.branch(group.getKey(), group(members, formatLeaf, groupingFns, level + 1)));
            } else if (members.size() == 1) {
                out.add(TreeNode.leaf(group.getKey(), formatted(formatLeaf, members.get(0), group.getKey())));
            } else {
                List<TreeNode<K>> rows = new ArrayList<>(members.size());
                for (R member : members) {
                    rows.add(TreeNode.leaf("", formatted(formatLeaf, member, group.getKey())));
                }
                out.add(TreeNode.branch(group.getKey(), rows));
            }
        }
        return out;
    }

    private static <R, K> ValueMap<K> formatted(Function<? super R, ValueMap<K>> formatLeaf, R record, String group) {
        ValueMap<K> values = formatLeaf.apply(record);
        if (values == null) {
            throw new MalformedTreeException("Record in group '" + group + "' formatted to a null value map");
        }
        return values;
    }
}
