package com.wayfinder.node;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.wayfinder.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for active-path resolution and tree queries.
 */
public class NavNodeTest {

    private static StackNode tabbedTree() {
        return stack("root", null,
            screen("s0", "root", "splash"),
            tabs("tabs", "root", 1,
                stack("t0", "tabs", screen("h", "t0", "home")),
                stack("t1", "tabs", screen("p", "t1", "profile"), screen("e", "t1", "edit"))));
    }

    @Test
    void testActiveLeafFollowsSelectedTab() {
        StackNode root = tabbedTree();

        assertEquals("e", root.activeLeaf().getKey());
        assertEquals("t1", root.activeStack().getKey());
    }

    @Test
    void testActivePathToLeaf() {
        List<String> path = tabbedTree().activePathToLeaf().stream()
            .map(NavNode::getKey)
            .collect(Collectors.toList());

        assertEquals(List.of("root", "tabs", "t1", "e"), path);
    }

    @Test
    void testActivePathThroughPane() {
        PaneNode pane = panes("pane", null, PaneRole.SUPPORTING,
            stack("ps", "pane", screen("l", "ps", "list")),
            stack("ss", "pane", screen("d", "ss", "detail")));

        assertEquals("d", pane.activeLeaf().getKey());
        assertEquals("ss", pane.activeStack().getKey());
        assertSame(pane.paneContent(PaneRole.SUPPORTING), pane.paneForRole(PaneRole.SUPPORTING));
    }

    @Test
    void testPaneWithScreenContentHasNoActiveStack() {
        PaneNode pane = panes("pane", null, PaneRole.PRIMARY, screen("x", "pane", "x"), null);

        assertNull(pane.activeStack());
        assertEquals("x", pane.activeLeaf().getKey());
    }

    @Test
    void testEmptyStackHasNoActiveLeaf() {
        StackNode root = stack("r", null);

        assertNull(root.activeLeaf());
        assertSame(root, root.activeStack());
        assertFalse(root.canGoBack());
    }

    @Test
    void testFindByKey() {
        StackNode root = tabbedTree();

        assertEquals("home", ((ScreenNode) root.findByKey("h")).getDestination().getRoute());
        assertSame(root, root.findByKey("root"));
        assertNull(root.findByKey("missing"));
    }

    @Test
    void testTreeQueries() {
        StackNode root = tabbedTree();

        assertEquals(8, root.nodeCount());
        assertEquals(3, root.depth());
        assertEquals(4, root.allScreens().size());
        assertEquals(3, root.allStackNodes().size());
        assertEquals(1, root.allTabNodes().size());
        assertTrue(root.allPaneNodes().isEmpty());
        assertNull(root.paneForRole(PaneRole.PRIMARY));
    }

    @Test
    void testCanHandleBackInternally() {
        StackNode root = tabbedTree();
        TabNode tab = (TabNode) root.findByKey("tabs");

        assertTrue(root.canHandleBackInternally());
        assertTrue(tab.canHandleBackInternally());
        assertFalse(tab.withActiveStackIndex(0).canHandleBackInternally());
        assertFalse(root.findByKey("h").canHandleBackInternally());
    }

    @Test
    void testTabNodeRequiresStacks() {
        assertThrows(IllegalArgumentException.class, () -> new TabNode("t", null, List.of(), 0));
    }

    @Test
    void testTabNodeRejectsOutOfRangeIndex() {
        List<StackNode> stacks = List.of(stack("a", "t"), stack("b", "t"));

        assertThrows(IllegalArgumentException.class, () -> new TabNode("t", null, stacks, 2));
        assertThrows(IllegalArgumentException.class, () -> new TabNode("t", null, stacks, -1));
    }

    @Test
    void testPaneNodeRequiresPrimary() {
        Map<PaneRole, PaneConfiguration> configs = new EnumMap<>(PaneRole.class);
        configs.put(PaneRole.SUPPORTING, new PaneConfiguration(stack("s", "p")));

        assertThrows(IllegalArgumentException.class, () -> new PaneNode("p", null, configs));
    }

    @Test
    void testPaneNodeRequiresConfiguredActiveRole() {
        Map<PaneRole, PaneConfiguration> configs = new EnumMap<>(PaneRole.class);
        configs.put(PaneRole.PRIMARY, new PaneConfiguration(stack("s", "p")));

        assertThrows(IllegalArgumentException.class, () -> new PaneNode("p", null, configs,
            PaneRole.EXTRA, PaneBackBehavior.POP_LATEST, null));
    }

    @Test
    void testPaneChildrenFollowRoleOrder() {
        Map<PaneRole, PaneConfiguration> configs = new EnumMap<>(PaneRole.class);
        configs.put(PaneRole.EXTRA, new PaneConfiguration(stack("x", "p")));
        configs.put(PaneRole.PRIMARY, new PaneConfiguration(stack("a", "p")));
        PaneNode pane = new PaneNode("p", null, configs);

        assertEquals(List.of("a", "x"), pane.children().stream().map(NavNode::getKey).collect(Collectors.toList()));
        assertEquals(AdaptStrategy.HIDE, pane.adaptStrategy(PaneRole.EXTRA));
        assertNull(pane.adaptStrategy(PaneRole.SUPPORTING));
    }

    @Test
    void testStructuralEquality() {
        assertEquals(tabbedTree(), tabbedTree());
        assertEquals(tabbedTree().hashCode(), tabbedTree().hashCode());
        assertNotEquals(tabbedTree(), ((TabNode) tabbedTree().findByKey("tabs")).withActiveStackIndex(0));
    }

    @Test
    void testRouteDestinationKindIsRoute() {
        Destination home = RouteDestination.of("home");

        assertTrue(home.isSameKind(RouteDestination.of("home")));
        assertFalse(home.isSameKind(RouteDestination.of("profile")));
        assertThrows(IllegalArgumentException.class, () -> RouteDestination.of(" "));
    }
}
