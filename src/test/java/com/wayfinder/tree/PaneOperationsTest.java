package com.wayfinder.tree;

import com.wayfinder.node.AdaptStrategy;
import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneBackBehavior;
import com.wayfinder.node.PaneConfiguration;
import com.wayfinder.node.PaneNode;
import com.wayfinder.node.PaneRole;
import com.wayfinder.node.RouteDestination;
import com.wayfinder.node.StackNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Supplier;

import static com.wayfinder.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for pane focus, pane stacks and pane back behaviors.
 */
public class PaneOperationsTest {

    private Supplier<String> keys;

    @BeforeEach
    void setUp() {
        keys = KeyGenerators.sequential("k");
    }

    private static PaneNode listDetail(PaneRole active, PaneBackBehavior behavior, String... detailRoutes) {
        StackNode supporting = stack("ss", "pane");
        for (int i = 0; i < detailRoutes.length; i++) {
            supporting = supporting.withAppended(screen("d" + i, "ss", detailRoutes[i]));
        }
        return panes("pane", null, active, behavior, null,
            stack("ps", "pane", screen("l", "ps", "list")), supporting);
    }

    private static StackNode supporting(NavNode root) {
        return (StackNode) ((PaneNode) root.findByKey("pane")).paneContent(PaneRole.SUPPORTING);
    }

    private static PaneRole activeRole(NavNode root) {
        return ((PaneNode) root.findByKey("pane")).getActivePaneRole();
    }

    @Test
    void testNavigateToPaneWithoutFocus() {
        PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_LATEST, "detail/1");

        NavNode result = PaneOperations.navigateToPane(pane, "pane", PaneRole.SUPPORTING,
            RouteDestination.of("detail/2"), false, keys);

        assertEquals(List.of("detail/1", "detail/2"), routes(supporting(result)));
        assertEquals(PaneRole.PRIMARY, activeRole(result));
        assertEquals("l", result.activeLeaf().getKey());
    }

    @Test
    void testNavigateToPaneWithFocus() {
        PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_LATEST, "detail/1");

        NavNode result = PaneOperations.navigateToPane(pane, "pane", PaneRole.SUPPORTING,
            RouteDestination.of("detail/2"), true, keys);

        assertEquals(PaneRole.SUPPORTING, activeRole(result));
        assertEquals("k1", result.activeLeaf().getKey());
        assertEquals("ss", result.activeLeaf().getParentKey());
    }

    @Test
    void testNavigateToMissingPaneThrows() {
        PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_LATEST, "detail/1");

        NavigationException e = assertThrows(NavigationException.class,
            () -> PaneOperations.navigateToPane(pane, "pane", PaneRole.EXTRA, RouteDestination.of("x"), true, keys));

        assertEquals(NavigationException.ErrorCode.INVALID_OPERATION, e.getCode());
    }

    @Test
    void testNavigateToPaneWithoutStackThrows() {
        PaneNode pane = panes("pane", null, PaneRole.PRIMARY,
            stack("ps", "pane", screen("l", "ps", "list")), screen("x", "pane", "static"));

        assertThrows(NavigationException.class,
            () -> PaneOperations.navigateToPane(pane, "pane", PaneRole.SUPPORTING, RouteDestination.of("x"), true, keys));
    }

    @Test
    void testSwitchActivePane() {
        PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_LATEST, "detail/1");

        NavNode result = PaneOperations.switchActivePane(pane, "pane", PaneRole.SUPPORTING);

        assertEquals(PaneRole.SUPPORTING, activeRole(result));
        assertSame(pane, PaneOperations.switchActivePane(pane, "pane", PaneRole.PRIMARY));
    }

    @Test
    void testSwitchActivePaneErrors() {
        PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_LATEST, "detail/1");

        assertEquals(NavigationException.ErrorCode.INVALID_OPERATION, assertThrows(NavigationException.class,
            () -> PaneOperations.switchActivePane(pane, "pane", PaneRole.EXTRA)).getCode());
        assertEquals(NavigationException.ErrorCode.INVALID_OPERATION, assertThrows(NavigationException.class,
            () -> PaneOperations.switchActivePane(pane, "ps", PaneRole.PRIMARY)).getCode());
        assertEquals(NavigationException.ErrorCode.NODE_NOT_FOUND, assertThrows(NavigationException.class,
            () -> PaneOperations.switchActivePane(pane, "nope", PaneRole.PRIMARY)).getCode());
    }

    @Test
    void testPopPane() {
        PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_LATEST, "detail/1", "detail/2");

        NavNode result = PaneOperations.popPane(pane, "pane", PaneRole.SUPPORTING);

        assertEquals(List.of("detail/1"), routes(supporting(result)));
        assertNull(PaneOperations.popPane(result, "pane", PaneRole.SUPPORTING));
    }

    @Test
    void testClearPane() {
        PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_LATEST, "detail/1", "detail/2", "detail/3");

        NavNode result = PaneOperations.clearPane(pane, "pane", PaneRole.SUPPORTING);

        assertEquals(List.of("detail/1"), routes(supporting(result)));
        assertSame(result, PaneOperations.clearPane(result, "pane", PaneRole.SUPPORTING));
    }

    @Test
    void testSetPaneConfiguration() {
        PaneNode pane = listDetail(PaneRole.SUPPORTING, PaneBackBehavior.POP_LATEST, "detail/1");

        PaneNode result = (PaneNode) PaneOperations.setPaneConfiguration(pane, "pane", PaneRole.EXTRA,
            new PaneConfiguration(stack("xs", "pane"), AdaptStrategy.LEVITATE));

        assertEquals(3, result.paneCount());
        assertEquals(AdaptStrategy.LEVITATE, result.adaptStrategy(PaneRole.EXTRA));
        assertEquals(PaneRole.SUPPORTING, result.getActivePaneRole());
    }

    @Test
    void testRemovePrimaryPaneThrows() {
        PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_LATEST, "detail/1");

        NavigationException e = assertThrows(NavigationException.class,
            () -> PaneOperations.removePaneConfiguration(pane, "pane", PaneRole.PRIMARY));

        assertEquals(NavigationException.ErrorCode.INVALID_OPERATION, e.getCode());
        assertEquals("Cannot remove Primary pane - it is required", e.getMessage());
    }

    @Test
    @DisplayName("Removing the focused pane moves focus to PRIMARY")
    void testRemoveActivePaneFocusesPrimary() {
        PaneNode pane = listDetail(PaneRole.SUPPORTING, PaneBackBehavior.POP_LATEST, "detail/1");

        PaneNode result = (PaneNode) PaneOperations.removePaneConfiguration(pane, "pane", PaneRole.SUPPORTING);

        assertEquals(PaneRole.PRIMARY, result.getActivePaneRole());
        assertEquals(1, result.paneCount());
        assertSame(pane, PaneOperations.removePaneConfiguration(pane, "pane", PaneRole.EXTRA));
    }

    @Nested
    class PopWithPaneBehavior {

        @Test
        void testWithoutPaneFallsBackToPlainPop() {
            StackNode root = stack("root", null, screen("a", "root", "home"), screen("b", "root", "list"));

            PopResult result = PaneOperations.popWithPaneBehavior(root);

            assertTrue(result.isPopped());
            assertEquals(List.of("home"), routes((StackNode) ((PopResult.Popped) result).newState()));
            assertEquals(new PopResult.CannotPop(), PaneOperations.popWithPaneBehavior(stack("root", null)));
        }

        @Test
        void testActivePaneWithHistoryPops() {
            PaneNode pane = listDetail(PaneRole.SUPPORTING, PaneBackBehavior.POP_UNTIL_SCAFFOLD_VALUE_CHANGE,
                "detail/1", "detail/2");

            PopResult result = PaneOperations.popWithPaneBehavior(pane);

            NavNode newState = ((PopResult.Popped) result).newState();
            assertEquals(List.of("detail/1"), routes(supporting(newState)));
            assertEquals(PaneRole.SUPPORTING, activeRole(newState));
        }

        @Test
        void testPopLatestPopsLastScreen() {
            PaneNode pane = listDetail(PaneRole.SUPPORTING, PaneBackBehavior.POP_LATEST, "detail/1");

            PopResult result = PaneOperations.popWithPaneBehavior(pane);

            assertTrue(supporting(((PopResult.Popped) result).newState()).isEmpty());
        }

        @Test
        void testPopLatestOnEmptyPaneCannotPop() {
            PaneNode pane = listDetail(PaneRole.SUPPORTING, PaneBackBehavior.POP_LATEST);

            assertEquals(new PopResult.CannotPop(), PaneOperations.popWithPaneBehavior(pane));
        }

        @Test
        void testScaffoldValueChangeFocusesPrimary() {
            PaneNode pane = listDetail(PaneRole.SUPPORTING, PaneBackBehavior.POP_UNTIL_SCAFFOLD_VALUE_CHANGE, "detail/1");

            PopResult result = PaneOperations.popWithPaneBehavior(pane);

            NavNode newState = ((PopResult.Popped) result).newState();
            assertEquals(PaneRole.PRIMARY, activeRole(newState));
            assertEquals(List.of("detail/1"), routes(supporting(newState)));
        }

        @Test
        void testScaffoldValueChangeOnPrimaryRequiresScaffoldChange() {
            PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_UNTIL_SCAFFOLD_VALUE_CHANGE, "detail/1");

            assertEquals(new PopResult.RequiresScaffoldChange(), PaneOperations.popWithPaneBehavior(pane));
        }

        @Test
        void testCurrentDestinationChangeFocusesPaneWithContent() {
            PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_UNTIL_CURRENT_DESTINATION_CHANGE,
                "detail/1");

            PopResult result = PaneOperations.popWithPaneBehavior(pane);

            assertEquals(PaneRole.SUPPORTING, activeRole(((PopResult.Popped) result).newState()));
        }

        @Test
        void testCurrentDestinationChangeWithoutOtherContent() {
            PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_UNTIL_CURRENT_DESTINATION_CHANGE);

            assertEquals(new PopResult.PaneEmpty(PaneRole.PRIMARY), PaneOperations.popWithPaneBehavior(pane));
        }

        @Test
        void testContentChangePopsPaneWithHistory() {
            PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_UNTIL_CONTENT_CHANGE,
                "detail/1", "detail/2", "detail/3");

            NavNode newState = ((PopResult.Popped) PaneOperations.popWithPaneBehavior(pane)).newState();

            assertEquals(List.of("detail/1", "detail/2"), routes(supporting(newState)));
            assertEquals(PaneRole.PRIMARY, activeRole(newState));
        }

        @Test
        void testContentChangeCollapsingToRootClearsPane() {
            PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_UNTIL_CONTENT_CHANGE,
                "detail/1", "detail/2");

            NavNode newState = ((PopResult.Popped) PaneOperations.popWithPaneBehavior(pane)).newState();

            assertTrue(supporting(newState).isEmpty());
            assertEquals(PaneRole.PRIMARY, activeRole(newState));
        }

        @Test
        void testContentChangeOnFocusedSecondaryRoot() {
            PaneNode pane = listDetail(PaneRole.SUPPORTING, PaneBackBehavior.POP_UNTIL_CONTENT_CHANGE, "detail/1");

            NavNode newState = ((PopResult.Popped) PaneOperations.popWithPaneBehavior(pane)).newState();

            assertTrue(supporting(newState).isEmpty());
            assertEquals(PaneRole.PRIMARY, activeRole(newState));
        }

        @Test
        void testContentChangeWithNothingToPop() {
            PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_UNTIL_CONTENT_CHANGE, "detail/1");

            assertEquals(new PopResult.PaneEmpty(PaneRole.PRIMARY), PaneOperations.popWithPaneBehavior(pane));
        }

        @Test
        void testDeepestPaneIsUsed() {
            PaneNode inner = panes("pane", "os", PaneRole.SUPPORTING, PaneBackBehavior.POP_UNTIL_SCAFFOLD_VALUE_CHANGE,
                null, stack("ps", "pane", screen("l", "ps", "list")), stack("ss", "pane", screen("d", "ss", "detail")));
            PaneNode outer = panes("outer", null, PaneRole.PRIMARY, PaneBackBehavior.POP_LATEST, null,
                stack("os", "outer", inner), null);

            assertSame(inner, PaneOperations.deepestPaneOnActivePath(outer));
            NavNode newState = ((PopResult.Popped) PaneOperations.popWithPaneBehavior(outer)).newState();
            assertEquals(PaneRole.PRIMARY, activeRole(newState));
        }
    }

    @Nested
    class PopPaneAdaptive {

        @Test
        void testCompactPopsFocusedPane() {
            PaneNode pane = listDetail(PaneRole.SUPPORTING, PaneBackBehavior.POP_UNTIL_SCAFFOLD_VALUE_CHANGE,
                "detail/1", "detail/2");

            NavNode newState = ((PopResult.Popped) PaneOperations.popPaneAdaptive(pane, true)).newState();

            assertEquals(List.of("detail/1"), routes(supporting(newState)));
        }

        @Test
        void testCompactAtSecondaryRootClearsAndFocusesPrimary() {
            PaneNode pane = listDetail(PaneRole.SUPPORTING, PaneBackBehavior.POP_UNTIL_SCAFFOLD_VALUE_CHANGE, "detail/1");

            NavNode newState = ((PopResult.Popped) PaneOperations.popPaneAdaptive(pane, true)).newState();

            assertTrue(supporting(newState).isEmpty());
            assertEquals(PaneRole.PRIMARY, activeRole(newState));
            assertEquals("l", newState.activeLeaf().getKey());
        }

        @Test
        void testCompactAtPrimaryRootIsEmpty() {
            PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_UNTIL_SCAFFOLD_VALUE_CHANGE, "detail/1");

            assertTrue(PaneOperations.isActivePaneExhausted(pane));
            assertEquals(new PopResult.PaneEmpty(PaneRole.PRIMARY), PaneOperations.popPaneAdaptive(pane, true));
        }

        @Test
        void testExpandedUsesPaneBehavior() {
            PaneNode pane = listDetail(PaneRole.PRIMARY, PaneBackBehavior.POP_UNTIL_SCAFFOLD_VALUE_CHANGE, "detail/1");

            assertEquals(new PopResult.RequiresScaffoldChange(), PaneOperations.popPaneAdaptive(pane, false));
        }

        @Test
        void testWithoutPaneFallsBackToPlainPop() {
            StackNode root = stack("root", null, screen("a", "root", "home"), screen("b", "root", "list"));

            assertTrue(PaneOperations.popPaneAdaptive(root, true).isPopped());
        }
    }
}
