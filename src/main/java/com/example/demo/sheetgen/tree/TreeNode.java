package com.example.demo.sheetgen.tree;

import com.example.demo.sheetgen.exception.MalformedTreeException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A node in a labelled key-value tree. A node is either a {@link Leaf}, which
 * carries a {@link ValueMap}, or a {@link Branch}, which carries an ordered list
 * of children. The kind is an explicit tag, see {@link #getKind()}.
 *
 * Nodes are immutable. A branch never stores an aggregate: its {@link #value()}
 * is recomputed from the leaves beneath it.
 */
@Getter
public abstract class TreeNode<K> implements Valued<K> {

    public enum Kind {
        LEAF,
        BRANCH
    }

    private final String label;

    TreeNode(String label) {
        if (label == null) {
            throw new MalformedTreeException("Tree node has a null label");
        }
        this.label = label;
    }

    public static <K> Leaf<K> leaf(String label, ValueMap<K> values) {
        return new Leaf<>(label, values);
    }

    public static <K> Branch<K> branch(String label, List<? extends TreeNode<K>> children) {
        if (children == null) {
            throw new MalformedTreeException("Branch '" + label + "' has null children");
        }
        List<TreeNode<K>> copy = new ArrayList<>(children);
        return new Branch<>(label, () -> copy);
    }

    @SafeVarargs
    public static <K> Branch<K> branch(String label, TreeNode<K>... children) {
        return branch(label, Arrays.asList(children));
    }

    /**
     * A branch whose children are produced on first access and then memoized.
     * Used to mirror large or unbounded external hierarchies without forcing them.
     */
    public static <K> Branch<K> lazyBranch(String label, Supplier<? extends List<? extends TreeNode<K>>> children) {
        return new Branch<>(label, Objects.requireNonNull(children, "children supplier"));
    }

    public abstract Kind getKind();

    public boolean isLeaf() {
        return getKind() == Kind.LEAF;
    }

    /**
     * The node's children, or an empty list for a leaf.
     */
    public abstract List<TreeNode<K>> getChildren();

    /**
     * Same node kind and contents under a different label.
     */
    public abstract TreeNode<K> withLabel(String newLabel);

    public static final class Leaf<K> extends TreeNode<K> {
        private final ValueMap<K> values;

        private Leaf(String label, ValueMap<K> values) {
            super(label);
            if (values == null) {
                throw new MalformedTreeException("Leaf '" + label + "' has no value map");
            }
            this.values = values;
        }

        @Override
        public Kind getKind() {
            return Kind.LEAF;
        }

        @Override
        public List<TreeNode<K>> getChildren() {
            return Collections.emptyList();
        }

        @Override
        public ValueMap<K> value() {
            return values;
        }

        @Override
        public Leaf<K> withLabel(String newLabel) {
            return new Leaf<>(newLabel, values);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Leaf)) {
                return false;
            }
            Leaf<?> other = (Leaf<?>) o;
            return getLabel().equals(other.getLabel()) && values.equals(other.values);
        }

        @Override
        public int hashCode() {
            return 31 * getLabel().hashCode() + values.hashCode();
        }

        @Override
        public String toString() {
            return "[" + getLabel() + " " + values + "]";
        }
    }

    public static final class Branch<K> extends TreeNode<K> {
        private Supplier<? extends List<? extends TreeNode<K>>> source;
        private volatile List<TreeNode<K>> children;

        private Branch(String label, Supplier<? extends List<? extends TreeNode<K>>> source) {
            super(label);
            this.source = source;
        }

        @Override
        public Kind getKind() {
            return Kind.BRANCH;
        }

        @Override
        public List<TreeNode<K>> getChildren() {
            List<TreeNode<K>> result = children;
            if (result == null) {
                synchronized (this) {
                    result = children;
                    if (result == null) {
                        result = materialize(source.get());
                        children = result;
                        source = null;
                    }
                }
            }
            return result;
        }

        private List<TreeNode<K>> materialize(List<? extends TreeNode<K>> supplied) {
            if (supplied == null) {
                throw new MalformedTreeException("Branch '" + getLabel() + "' produced null children");
            }
            List<TreeNode<K>> copy = new ArrayList<>(supplied.size());
            for (int i = 0; i < supplied.size(); i++) {
                TreeNode<K> child = supplied.get(i);
                if (child == null) {
                    throw new MalformedTreeException(
                            "Branch '" + getLabel() + "' has a null child at position " + i);
                }
                copy.add(child);
            }
            return Collections.unmodifiableList(copy);
        }

        /**
         * Sum of every leaf beneath this branch.
         */
        @Override
        public ValueMap<K> value() {
            return Trees.value(this);
        }

        @Override
        public Branch<K> withLabel(String newLabel) {
            return new Branch<>(newLabel, this::getChildren);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Branch)) {
                return false;
            }
            Branch<?> other = (Branch<?>) o;
            return getLabel().equals(other.getLabel()) && getChildren().equals(other.getChildren());
        }

        @Override
        public int hashCode() {
            return 31 * getLabel().hashCode() + getChildren().hashCode();
        }

        @Override
        public String toString() {
            List<TreeNode<K>> forced = children;
            return "[" + getLabel() + " " + (forced == null ? "<unevaluated>" : forced.toString()) + "]";
        }
    }
}
