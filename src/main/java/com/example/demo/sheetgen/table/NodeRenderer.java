package com.example.demo.sheetgen.table;

import com.example.demo.sheetgen.tree.TreeNode;

/**
 * Turns one tree node into table rows. Called by {@link TreeWalker} for every
 * node in preorder, with the node's own label and the depth it starts at.
 */
@FunctionalInterface
public interface NodeRenderer<K> {

    NodeRendering<K> render(String label, TreeNode<K> node, int depth);
}
