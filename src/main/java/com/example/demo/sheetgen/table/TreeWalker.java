package com.example.demo.sheetgen.table;

import com.example.demo.sheetgen.exception.SheetGenerationException;
import com.example.demo.sheetgen.exception.TreeOperationException;
import com.example.demo.sheetgen.tree.TreeNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Depth first, preorder walk of a tree into table rows.
 *
 * The walk keeps its own work stack instead of recursing, so the depth of the
 * tree is bounded only by memory. All rows are produced before {@code walk}
 * returns; a failing renderer or children supplier surfaces here as a
 * {@link TreeOperationException} naming the node and depth it failed at.
 */
@Slf4j
public final class TreeWalker {

    private TreeWalker() {
    }

    /**
     * Walk a tree whose root acts as a title: the root is not rendered and its
     * children start at depth 0. A root that is itself a leaf renders as one row.
     * A failure expanding the root is reported at depth -1.
     */
    public static <K> List<TableRow<K>> walk(TreeNode<K> root, NodeRenderer<K> renderer) {
        if (root.isLeaf()) {
            return walkForest(List.of(root), renderer);
        }
        return walkForest(children(root, -1), renderer);
    }

    /**
     * Walk with the renderer for the given options' policy.
     */
    public static <K> List<TableRow<K>> walk(TreeNode<K> root, RenderOptions<K> options) {
        return walk(root, NodeRenderers.forOptions(options));
    }

    /**
     * Walk several trees one after the other, each root starting at depth 0.
     */
    public static <K> List<TableRow<K>> walkForest(List<? extends TreeNode<K>> roots, NodeRenderer<K> renderer) {
        List<TableRow<K>> rows = new ArrayList<>();
        Deque<Step<K>> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(Step.visit(roots.get(i), 0));
        }
        while (!stack.isEmpty()) {
            Step<K> step = stack.pop();
            if (step.node == null) {
                rows.addAll(step.rows);
                continue;
            }
            TreeNode<K> node = step.node;
            NodeRendering<K> rendering = render(renderer, node, step.depth);
            rows.addAll(rendering.getLeading());
            if (!rendering.isDescend() || node.isLeaf()) {
                rows.addAll(rendering.getTrailing());
                continue;
            }
            stack.push(Step.emit(rendering.getTrailing()));
            List<TreeNode<K>> children = children(node, step.depth);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(Step.visit(children.get(i), step.depth + 1));
            }
        }
        log.debug("Rendered {} tree(s) into {} rows", roots.size(), rows.size());
        return rows;
    }

    public static <K> List<TableRow<K>> walkForest(List<? extends TreeNode<K>> roots, RenderOptions<K> options) {
        return walkForest(roots, NodeRenderers.forOptions(options));
    }

    private static <K> NodeRendering<K> render(NodeRenderer<K> renderer, TreeNode<K> node, int depth) {
        NodeRendering<K> rendering;
        try {
            rendering = renderer.render(node.getLabel(), node, depth);
        } catch (SheetGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TreeOperationException("render", node.getLabel(), depth, e);
        }
        if (rendering == null) {
            throw new TreeOperationException("render", node.getLabel(), depth,
                    new IllegalStateException("renderer returned no rendering"));
        }
        return rendering;
    }

    private static <K> List<TreeNode<K>> children(TreeNode<K> node, int depth) {
        try {
            return node.getChildren();
        } catch (SheetGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TreeOperationException("children", node.getLabel(), depth, e);
        }
    }

    private static final class Step<K> {
        private final TreeNode<K> node;
        private final int depth;
        private final List<TableRow<K>> rows;

        private Step(TreeNode<K> node, int depth, List<TableRow<K>> rows) {
            this.node = node;
            this.depth = depth;
            this.rows = rows;
        }

        static <K> Step<K> visit(TreeNode<K> node, int depth) {
            return new Step<>(node, depth, null);
        }

        static <K> Step<K> emit(List<TableRow<K>> rows) {
            return new Step<>(null, 0, rows);
        }
    }
}
