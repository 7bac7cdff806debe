package com.example.demo.sheetgen.tree;

import com.example.demo.sheetgen.exception.MalformedTreeException;
import com.example.demo.sheetgen.exception.TreeOperationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.example.demo.sheetgen.tree.BalanceSheetFixture.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Tree folding and derived trees")
public class TreesTest {

    @Test
    public void testBranchValueSumsLeaves() {
        assertEquals(years(105, 130), currentAssets().value());
        assertEquals(years(217, 148), assets().value());
        assertEquals(years(217, 148), liabilitiesAndEquity().value());
    }

    @Test
    @DisplayName("Branch value equals the additive fold")
    public void testValueEqualsSumFold() {
        for (TreeNode<Integer> t : List.of(currentAssets(), assets(), liabilities(), balanceSheet())) {
            assertEquals(Trees.fold(BigDecimal::add, BigDecimal.ZERO, t), Trees.value(t));
        }
    }

    @Test
    @DisplayName("Folding with subtraction threads left to right: (10 - 4) - 1")
    public void testSubtractionFoldIsLeftToRight() {
        TreeNode<String> t = TreeNode.branch("t",
                TreeNode.leaf("a", ValueMap.of("x", 10)),
                TreeNode.leaf("b", ValueMap.of("x", 4)),
                TreeNode.leaf("c", ValueMap.of("x", 1)));

        ValueMap<String> folded = Trees.fold(BigDecimal::subtract, BigDecimal.ZERO, t);

        assertEquals(0, folded.get("x").compareTo(BigDecimal.valueOf(5)));
    }

    @Test
    public void testFoldOrderFollowsPreorderAcrossNesting() {
        TreeNode<String> t = TreeNode.branch("t",
                TreeNode.branch("left", TreeNode.leaf("a", ValueMap.of("x", 10)), TreeNode.leaf("b", ValueMap.of("x", 4))),
                TreeNode.branch("right", TreeNode.leaf("c", ValueMap.of("x", 3)), TreeNode.leaf("d", ValueMap.of("x", 2))));

        // ((10 - 4) - 3) - 2, not (10 - 4) - (3 - 2)
        assertEquals(ValueMap.of("x", 1), Trees.fold(BigDecimal::subtract, BigDecimal.ZERO, t));
    }

    @Test
    public void testFoldSubstitutesIdentityForMissingKeys() {
        TreeNode<String> t = TreeNode.branch("t",
                TreeNode.leaf("a", ValueMap.of("x", 10)),
                TreeNode.leaf("b", ValueMap.of("y", 3)));

        assertEquals(ValueMap.of("x", 10, "y", -3), Trees.fold(BigDecimal::subtract, BigDecimal.ZERO, t));
    }

    @Test
    public void testFoldWithoutLeavesIsEmpty() {
        TreeNode<String> empty = TreeNode.branch("empty", TreeNode.<String>branch("nested"));

        assertEquals(ValueMap.empty(), Trees.fold(BigDecimal::add, BigDecimal.ZERO, empty));
        assertTrue(Trees.aggregate(empty, ValueMaps::sum).isEmpty());
        assertEquals(ValueMap.empty(), empty.value());
    }

    @Test
    public void testAggregateWrapsOperatorFailures() {
        TreeOperationException e = assertThrows(TreeOperationException.class,
                () -> Trees.aggregate(currentAssets(), (a, b) -> {
                    throw new ArithmeticException("overflow");
                }));

        assertEquals("fold", e.getOperation());
        assertEquals("Accounts Receivable", e.getLabel());
        assertEquals(1, e.getDepth());
        assertTrue(e.getCause() instanceof ArithmeticException);
        assertEquals("TREE_OPERATION_FAILED", e.getCode());
    }

    @Test
    @DisplayName("Merging trees with disjoint labels sums their values")
    public void testMergeTreesValue() {
        TreeNode<Integer> merged = Trees.mergeTrees("root", assets(), liabilitiesAndEquity());

        assertEquals("root", merged.getLabel());
        assertEquals(ValueMaps.sum(assets().value(), liabilitiesAndEquity().value()), merged.value());
        assertEquals(List.of("Current Assets", "Investments", "Other", "Liabilities", "Equity"), labels(merged.getChildren()));
    }

    @Test
    public void testShallowCollapsesOneLevel() {
        TreeNode<Integer> shallowed = Trees.shallow(assets());

        assertEquals("Current Assets & Investments & Other", shallowed.getLabel());
        assertEquals(List.of("Cash", "Accounts Receivable", "Investments", "Other"), labels(shallowed.getChildren()));
        assertEquals(assets().value(), shallowed.value());
    }

    @Test
    public void testShallowLeavesALeafAlone() {
        TreeNode<Integer> leaf = TreeNode.leaf("Cash", years(1, 2));

        assertSame(leaf, Trees.shallow(leaf));
    }

    @Test
    public void testNegateTree() {
        TreeNode<Integer> negated = Trees.negateTree(assets());

        assertEquals("Assets", negated.getLabel());
        assertEquals(ValueMaps.negate(assets().value()), negated.value());
        assertEquals(years(-100, -85), negated.getChildren().get(0).getChildren().get(0).value());
        assertEquals(assets().value(), Trees.negateTree(negated).value());
        assertEquals(assets(), Trees.negateTree(negated));
    }

    @Test
    @DisplayName("Tree math: assets - liabilities = equity, equity + liabilities = assets")
    public void testTreeSumAndSubtract() {
        assertEquals(equity().value(), Trees.treeSubtract(assets(), liabilities()));
        assertEquals(assets().value(), Trees.treeSum(equity(), liabilities()));
        assertEquals(years(207, 138), Trees.treeSum(assets(), years(-10, -10)));
    }

    @Test
    public void testHeadersOrdering() {
        TreeNode<String> t = TreeNode.branch("t",
                TreeNode.leaf("a", ValueMap.of("usd", 1, "mxn", 2)),
                TreeNode.leaf("b", ValueMap.of("eur", 3, "total", 6)));

        assertEquals(List.of("total", "usd", "mxn", "eur"), Trees.headers(t, List.of("total"), List.of()));
        assertEquals(List.of("usd", "eur", "total", "mxn"), Trees.headers(t, List.of("usd", "missing"), List.of("total", "mxn")));
    }

    @Test
    @DisplayName("Flat records group into a forest, one grouping function per level")
    public void testTableToTrees() {
        List<Map<String, Object>> trades = List.of(
                trade("MXN", "AUD", "BrokerA", "0.70"),
                trade("MXN", "USD", "BrokerB", "0.68"),
                trade("MXN", "JPY", "BrokerB", "0.93"),
                trade("USD", "AUD", "BrokerA", "0.20"));
        Function<Map<String, Object>, ValueMap<String>> formatLeaf =
                t -> ValueMap.of("Return", (BigDecimal) t.get("return"));

        List<TreeNode<String>> forest = Trees.tableToTrees(trades, formatLeaf,
                t -> ((BigDecimal) t.get("return")).compareTo(new BigDecimal("0.5")) > 0 ? "High Return" : "Some Return",
                t -> "Trading " + t.get("from"),
                t -> t.get("on"));

        assertEquals(List.of("High Return", "Some Return"), labels(forest));
        TreeNode<String> mxn = forest.get(0).getChildren().get(0);
        assertEquals("Trading MXN", mxn.getLabel());
        TreeNode<String> brokerA = mxn.getChildren().get(0);
        TreeNode<String> brokerB = mxn.getChildren().get(1);
        assertTrue(brokerA.isLeaf());
        assertEquals(ValueMap.of("Return", new BigDecimal("0.70")), brokerA.value());
        assertFalse(brokerB.isLeaf());
        assertEquals(List.of("", ""), labels(brokerB.getChildren()));
        assertEquals(ValueMap.of("Return", new BigDecimal("1.61")), brokerB.value());
        assertEquals("BrokerA", forest.get(1).getChildren().get(0).getChildren().get(0).getLabel());
    }

    @Test
    public void testTableToTreesNeedsAGrouping() {
        assertThrows(IllegalArgumentException.class,
                () -> Trees.tableToTrees(List.of("x"), s -> ValueMap.of("n", 1), List.of()));
    }

    @Test
    public void testMapNodesDoesNotForceLazyChildren() {
        AtomicInteger calls = new AtomicInteger();
        TreeNode<String> lazy = TreeNode.<String>lazyBranch("lazy", () -> {
            calls.incrementAndGet();
            return List.of(TreeNode.leaf("x", ValueMap.of("a", 1)));
        });

        TreeNode<String> negated = Trees.negateTree(lazy);

        assertEquals(0, calls.get());
        assertEquals(ValueMap.of("a", -1), negated.value());
        assertEquals(ValueMap.of("a", -1), negated.value());
        assertEquals(1, calls.get());
    }

    @Test
    public void testMalformedNodesFailFast() {
        assertThrows(MalformedTreeException.class, () -> TreeNode.leaf(null, ValueMap.empty()));
        assertThrows(MalformedTreeException.class, () -> TreeNode.leaf("x", null));
        assertThrows(MalformedTreeException.class, () -> TreeNode.branch("x", (List<TreeNode<String>>) null));

        TreeNode<String> broken = TreeNode.<String>lazyBranch("broken",
                () -> Arrays.<TreeNode<String>>asList(TreeNode.leaf("ok", ValueMap.empty()), null));
        MalformedTreeException e = assertThrows(MalformedTreeException.class, broken::getChildren);
        assertTrue(e.getDescription().contains("broken"));
    }

    @Test
    public void testDeepChainFoldsWithoutRecursion() {
        TreeNode<String> node = TreeNode.leaf("bottom", ValueMap.of("a", 1));
        for (int i = 0; i < 100_000; i++) {
            node = TreeNode.branch("level " + i, node);
        }

        assertEquals(ValueMap.of("a", 1), node.value());
        assertEquals(ValueMap.of("a", 1), Trees.fold(BigDecimal::add, BigDecimal.ZERO, node));
        assertEquals(ValueMap.of("a", -1), Trees.negateTree(node).value());
    }

    private static List<String> labels(List<? extends TreeNode<?>> nodes) {
        return nodes.stream().map(TreeNode::getLabel).collect(Collectors.toList());
    }

    private static Map<String, Object> trade(String from, String to, String on, String ret) {
        Map<String, Object> trade = new LinkedHashMap<>();
        trade.put("from", from);
        trade.put("to", to);
        trade.put("on", on);
        trade.put("return", new BigDecimal(ret));
        return trade;
    }
}
