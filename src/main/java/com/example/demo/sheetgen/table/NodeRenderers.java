package com.example.demo.sheetgen.table;

import com.example.demo.sheetgen.tree.TreeNode;
import com.example.demo.sheetgen.tree.ValueMap;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The built-in {@link RenderPolicy} renderers.
 *
 * A renderer returned here remembers the branch totals it has computed, so use
 * a fresh one for each walk.
 */
public final class NodeRenderers {

    private NodeRenderers() {
    }

    public static <K> NodeRenderer<K> forOptions(RenderOptions<K> options) {
        if (options.getMinLeafDepth() < 0) {
            throw new IllegalArgumentException("minLeafDepth must be >= 0, got " + options.getMinLeafDepth());
        }
        Subtotals<K> subtotals = new Subtotals<>(options.getAggregation());
        int minLeafDepth = options.getMinLeafDepth();
        switch (options.getPolicy()) {
            case COMBINED_HEADER:
                return combinedHeader(minLeafDepth, subtotals);
            case COMBINED_FOOTER:
                return combinedFooter(minLeafDepth, subtotals);
            case HEADERS_ONLY:
                return headersOnly(minLeafDepth);
            case DEFAULT:
            default:
                return standard(minLeafDepth, subtotals);
        }
    }

    private static <K> NodeRenderer<K> standard(int minLeafDepth, Subtotals<K> subtotals) {
        return (label, node, depth) -> {
            if (node.isLeaf()) {
                return leafRow(label, node, depth, minLeafDepth);
            }
            List<TableRow<K>> trailing = Collections.emptyList();
            if (!hasSingleLeafChild(node)) {
                Optional<ValueMap<K>> total = subtotals.of(node, depth);
                if (total.isPresent()) {
                    trailing = List.of(TableRow.total(depth, total.get()));
                }
            }
            return NodeRendering.around(List.of(TableRow.header(label, depth)), trailing);
        };
    }

    private static <K> NodeRenderer<K> combinedHeader(int minLeafDepth, Subtotals<K> subtotals) {
        return (label, node, depth) -> {
            if (node.isLeaf()) {
                return leafRow(label, node, depth, minLeafDepth);
            }
            ValueMap<K> total = subtotals.of(node, depth).orElse(ValueMap.empty());
            return NodeRendering.around(List.of(TableRow.header(label, depth, total)), Collections.emptyList());
        };
    }

    private static <K> NodeRenderer<K> combinedFooter(int minLeafDepth, Subtotals<K> subtotals) {
        return (label, node, depth) -> {
            if (node.isLeaf()) {
                return leafRow(label, node, depth, minLeafDepth);
            }
            Optional<ValueMap<K>> total = subtotals.of(node, depth);
            if (total.isEmpty()) {
                return NodeRendering.around(List.of(TableRow.header(label, depth)), Collections.emptyList());
            }
            TableRow<K> header = TableRow.header(label, depth, ValueMap.zeros(total.get().keySet()));
            return NodeRendering.around(List.of(header), List.of(TableRow.total(depth, total.get())));
        };
    }

    private static <K> NodeRenderer<K> headersOnly(int minLeafDepth) {
        return (label, node, depth) -> node.isLeaf()
                ? leafRow(label, node, depth, minLeafDepth)
                : NodeRendering.around(List.of(TableRow.header(label, depth)), Collections.emptyList());
    }

    private static <K> NodeRendering<K> leafRow(String label, TreeNode<K> node, int depth, int minLeafDepth) {
        return NodeRendering.row(TableRow.data(label, Math.max(minLeafDepth, depth), node.value()));
    }

    private static boolean hasSingleLeafChild(TreeNode<?> node) {
        List<? extends TreeNode<?>> children = node.getChildren();
        return children.size() == 1 && children.get(0).isLeaf();
    }
}
