package com.example.demo.sheetgen.tree;

import com.example.demo.sheetgen.exception.MalformedTreeException;

import java.util.*;

/**
 * Reads trees from the nested-map form produced by Jackson for JSON or YAML.
 *
 * A node is a map. When every value is a number the node is a leaf and the map
 * is its value map; when every value is a map the node is a branch whose
 * entries are its children, in document order. An empty map is a leaf with no
 * values. Anything else is rejected with a {@link MalformedTreeException}
 * naming the path to the offending node.
 *
 * <pre>
 * Current Assets:
 *   Cash: {2018: 100, 2017: 85}
 *   Accounts Receivable: {2018: 5, 2017: 45}
 * </pre>
 */
public final class TreeJson {

    private TreeJson() {
    }

    /**
     * Read a tree from a single-entry map of root label to root node.
     */
    public static TreeNode<String> fromMap(Map<String, ?> document) {
        if (document == null) {
            throw new MalformedTreeException("A tree document must hold exactly one root entry, found nothing");
        }
        if (document.size() != 1) {
            throw new MalformedTreeException("A tree document must hold exactly one root entry, found "
                    + document.size() + " entries");
        }
        Map.Entry<String, ?> root = document.entrySet().iterator().next();
        return fromEntry(root.getKey(), root.getValue());
    }

    /**
     * Read each entry of the map as a separate tree.
     */
    public static List<TreeNode<String>> forestFromMap(Map<String, ?> document) {
        if (document == null) {
            throw new MalformedTreeException("A forest document must not be null");
        }
        List<TreeNode<String>> out = new ArrayList<>(document.size());
        for (Map.Entry<String, ?> entry : document.entrySet()) {
            out.add(fromEntry(entry.getKey(), entry.getValue()));
        }
        return out;
    }

    public static TreeNode<String> fromEntry(String label, Object node) {
        validate(label, node);
        Map.Entry<String, ?> root = new AbstractMap.SimpleImmutableEntry<>(label, node);
        return TreeBuilder.<Map.Entry<String, ?>, String>build(
                TreeJson::isBranch, TreeJson::children, root, Map.Entry::getKey, TreeJson::leafValues);
    }

    // Walk the whole document once up front so that a bad node fails here and not
    // later, when some lazily built branch is first expanded.
    private static void validate(String rootLabel, Object rootNode) {
        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[]{rootLabel, rootNode});
        while (!stack.isEmpty()) {
            Object[] item = stack.pop();
            String path = (String) item[0];
            Object node = item[1];
            if (!(node instanceof Map)) {
                throw new MalformedTreeException("Node '" + path + "' must be a map, got "
                        + (node == null ? "null" : node.getClass().getSimpleName()));
            }
            Map<?, ?> map = (Map<?, ?>) node;
            int numbers = 0;
            int maps = 0;
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (e.getKey() == null) {
                    throw new MalformedTreeException("Node '" + path + "' has a null key");
                }
                Object v = e.getValue();
                if (v instanceof Number) {
                    numbers++;
                } else if (v instanceof Map) {
                    maps++;
                    stack.push(new Object[]{path + " / " + e.getKey(), v});
                } else {
                    throw new MalformedTreeException("Node '" + path + "' has a value for '" + e.getKey()
                            + "' that is neither a number nor a child node: " + v);
                }
            }
            if (numbers > 0 && maps > 0) {
                throw new MalformedTreeException("Node '" + path + "' mixes numeric values with child nodes");
            }
        }
    }

    private static boolean isBranch(Map.Entry<String, ?> entry) {
        Map<?, ?> map = (Map<?, ?>) entry.getValue();
        return !map.isEmpty() && map.values().iterator().next() instanceof Map;
    }

    private static List<Map.Entry<String, ?>> children(Map.Entry<String, ?> entry) {
        Map<?, ?> map = (Map<?, ?>) entry.getValue();
        List<Map.Entry<String, ?>> out = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> e : map.entrySet()) {
            out.add(new AbstractMap.SimpleImmutableEntry<>(String.valueOf(e.getKey()), e.getValue()));
        }
        return out;
    }

    private static ValueMap<String> leafValues(Map.Entry<String, ?> entry) {
        Map<String, Number> values = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) entry.getValue()).entrySet()) {
            values.put(String.valueOf(e.getKey()), (Number) e.getValue());
        }
        return ValueMap.from(values);
    }
}
