package com.oracle.optmcts.search;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectorTest {

    private final Selector selector = new Selector();

    @Test
    void emptyTreeExpandsAtRoot() {
        SearchContext context = new SearchContext("minimize cost", null, SearchFixtures.settings().build());

        Selection selection = selector.select(context);

        assertTrue(selection.needsExpansion());
        assertSame(context.getRoot(), selection.getExpansionPoint());
        assertEquals(1, selection.getPath().size());
    }

    @Test
    void neverVisitedChildIsTakenFirst() {
        FormulationNode root = FormulationNode.root();
        FormulationNode visited = root.addChild("linear program");
        FormulationNode fresh = root.addChild("integer program");
        root.setStatistics(4, 0.5);
        visited.setStatistics(4, 0.9);

        assertSame(fresh, Selector.bestChild(root, 2.0));
    }

    @Test
    void unvisitedChildrenKeepTheirOrder() {
        FormulationNode root = FormulationNode.root();
        FormulationNode first = root.addChild("a");
        root.addChild("b");

        assertSame(first, Selector.bestChild(root, 2.0));
    }

    @Test
    void ucbPrefersLessVisitedChildWithEqualValue() {
        FormulationNode root = FormulationNode.root();
        FormulationNode often = root.addChild("a");
        FormulationNode rarely = root.addChild("b");
        root.setStatistics(10, 0.5);
        often.setStatistics(8, 0.5);
        rarely.setStatistics(2, 0.5);

        assertSame(rarely, Selector.bestChild(root, 2.0));
        assertTrue(Selector.ucb(rarely, 10, 2.0) > Selector.ucb(often, 10, 2.0));
    }

    @Test
    void tiesGoToTheFirstChild() {
        FormulationNode root = FormulationNode.root();
        FormulationNode first = root.addChild("a");
        FormulationNode second = root.addChild("b");
        root.setStatistics(6, 0.4);
        first.setStatistics(3, 0.4);
        second.setStatistics(3, 0.4);

        assertSame(first, Selector.bestChild(root, 2.0));
    }

    @Test
    void triggeredNodeWithHighUncertaintyIsReexpandedDespiteVisitedChildren() {
        SearchContext context = new SearchContext("minimize cost", null,
                SearchFixtures.settings().reexpansionThreshold(0.3).build());
        FormulationNode root = context.getRoot();
        FormulationNode type = root.addChild("linear program");
        FormulationNode sets = type.addChild("products and machines");
        root.setStatistics(3, 0.2);
        type.setStatistics(3, 0.2);
        sets.setStatistics(3, 0.2);
        type.applySignal(LayerSignal.builder().trigger(true).localUncertainty(0.5).explanation("should be integer").build());

        Selection selection = selector.select(context);

        assertEquals(NodeState.PENDING_REEXPANSION, type.getState());
        assertSame(type, selection.getExpansionPoint());
        assertEquals(2, selection.getPath().size());
    }

    @Test
    void triggeredNodeWithLowUncertaintyIsDescendedThrough() {
        SearchContext context = new SearchContext("minimize cost", null,
                SearchFixtures.settings().reexpansionThreshold(0.3).build());
        FormulationNode root = context.getRoot();
        FormulationNode type = root.addChild("linear program");
        FormulationNode sets = type.addChild("products and machines");
        root.setStatistics(3, 0.2);
        type.setStatistics(3, 0.2);
        sets.setStatistics(3, 0.2);
        type.applySignal(LayerSignal.builder().trigger(true).localUncertainty(0.2).build());

        Selection selection = selector.select(context);

        assertSame(sets, selection.getExpansionPoint());
    }

    @Test
    void completePathNeedsNoExpansion() {
        SearchContext context = new SearchContext("minimize cost", null, SearchFixtures.settings().build());
        List<FormulationNode> path = SearchFixtures.completePath(context.getRoot(), "only");

        Selection selection = selector.select(context);

        assertFalse(selection.needsExpansion());
        assertTrue(selection.reachesTerminal());
        assertEquals(path, selection.getPath());
    }

    @Test
    void selectFromContinuesBelowTheExpansionPoint() {
        SearchContext context = new SearchContext("minimize cost", null, SearchFixtures.settings().build());
        Selection first = selector.select(context);
        FormulationNode type = context.getRoot().addChild("linear program");

        Selection next = selector.selectFrom(first, context.getSettings());

        assertSame(type, next.getExpansionPoint());
        assertEquals(2, next.getPath().size());
    }
}
