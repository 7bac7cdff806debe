package com.example.demo.sheetgen.table;

import com.example.demo.sheetgen.exception.SheetGenerationException;
import com.example.demo.sheetgen.exception.TreeOperationException;
import com.example.demo.sheetgen.tree.TreeNode;
import com.example.demo.sheetgen.tree.ValueMap;

import java.util.*;
import java.util.function.BinaryOperator;

/**
 * Branch aggregates for one walk. The first lookup under a root computes every
 * branch beneath it in a single pass: each leaf is folded into the running
 * accumulator of each open ancestor, so every branch still sees its leaves left
 * to right in preorder, exactly as {@code Trees.aggregate} would.
 */
final class Subtotals<K> {
    private final BinaryOperator<ValueMap<K>> aggregation;
    private final Map<TreeNode<K>, Optional<ValueMap<K>>> computed = new IdentityHashMap<>();

    Subtotals(BinaryOperator<ValueMap<K>> aggregation) {
        this.aggregation = aggregation;
    }

    /**
     * Aggregate of the leaves beneath the branch, empty when it has none.
     */
    Optional<ValueMap<K>> of(TreeNode<K> branch, int depth) {
        if (branch.isLeaf()) {
            return Optional.of(branch.value());
        }
        Optional<ValueMap<K>> known = computed.get(branch);
        if (known == null) {
            computeUnder(branch, depth);
            known = computed.get(branch);
        }
        return known;
    }

    private void computeUnder(TreeNode<K> root, int rootDepth) {
        List<TreeNode<K>> open = new ArrayList<>();
        List<ValueMap<K>> acc = new ArrayList<>();
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Object item = stack.pop();
            if (item instanceof Close) {
                int last = open.size() - 1;
                computed.put(open.remove(last), Optional.ofNullable(acc.remove(last)));
                continue;
            }
            @SuppressWarnings("unchecked")
            TreeNode<K> node = (TreeNode<K>) item;
            if (node.isLeaf()) {
                int depth = rootDepth + open.size();
                for (int i = 0; i < acc.size(); i++) {
                    acc.set(i, fold(acc.get(i), node, depth));
                }
                continue;
            }
            open.add(node);
            acc.add(null);
            stack.push(Close.INSTANCE);
            List<TreeNode<K>> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    private ValueMap<K> fold(ValueMap<K> acc, TreeNode<K> leaf, int depth) {
        if (acc == null) {
            return leaf.value();
        }
        try {
            return aggregation.apply(acc, leaf.value());
        } catch (SheetGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TreeOperationException("fold", leaf.getLabel(), depth, e);
        }
    }

    private enum Close {
        INSTANCE
    }
}
