package com.wayfinder.tree;

import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneNode;
import com.wayfinder.node.PaneRole;
import com.wayfinder.node.StackNode;
import com.wayfinder.node.TabNode;
import org.junit.jupiter.api.Test;

import static com.wayfinder.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for key-addressed replace and remove.
 */
public class TreeOperationsTest {

    private static StackNode tree() {
        return stack("root", null,
            screen("s0", "root", "splash"),
            tabs("tabs", "root", 1,
                stack("t0", "tabs", screen("h", "t0", "home")),
                stack("t1", "tabs", screen("p", "t1", "profile"), screen("e", "t1", "edit"))),
            panes("pane", "root", PaneRole.PRIMARY,
                stack("ps", "pane", screen("l", "ps", "list")),
                stack("ss", "pane", screen("d", "ss", "detail"))));
    }

    @Test
    void testReplaceRebuildsOnlyThePath() {
        StackNode root = tree();

        StackNode result = (StackNode) TreeOperations.replaceNode(root, "e", screen("e2", "t1", "settings"));

        TabNode oldTabs = (TabNode) root.findByKey("tabs");
        TabNode newTabs = (TabNode) result.findByKey("tabs");
        assertNotSame(oldTabs, newTabs);
        assertSame(oldTabs.stackAt(0), newTabs.stackAt(0));
        assertSame(root.findByKey("s0"), result.findByKey("s0"));
        assertSame(root.findByKey("pane"), result.findByKey("pane"));
        assertNull(result.findByKey("e"));
        assertEquals("e2", result.activeLeaf().getKey());
    }

    @Test
    void testReplaceRoot() {
        StackNode replacement = stack("other", null);

        assertSame(replacement, TreeOperations.replaceNode(tree(), "root", replacement));
    }

    @Test
    void testReplaceInsidePane() {
        NavNode result = TreeOperations.replaceNode(tree(), "d", screen("d2", "ss", "detail/2"));

        PaneNode pane = (PaneNode) result.findByKey("pane");
        assertEquals("d2", ((StackNode) pane.paneContent(PaneRole.SUPPORTING)).getChildren().get(0).getKey());
        assertEquals(PaneRole.PRIMARY, pane.getActivePaneRole());
    }

    @Test
    void testReplaceMissingKeyThrows() {
        NavigationException e = assertThrows(NavigationException.class,
            () -> TreeOperations.replaceNode(tree(), "nope", screen("x", null, "x")));

        assertEquals(NavigationException.ErrorCode.NODE_NOT_FOUND, e.getCode());
        assertEquals("nope", e.getNodeKey());
    }

    @Test
    void testReplaceTabStackWithScreenThrows() {
        NavigationException e = assertThrows(NavigationException.class,
            () -> TreeOperations.replaceNode(tree(), "t0", screen("x", "tabs", "x")));

        assertEquals(NavigationException.ErrorCode.INVALID_OPERATION, e.getCode());
    }

    @Test
    void testRemoveFromStack() {
        StackNode root = tree();

        StackNode result = (StackNode) TreeOperations.removeNode(root, "s0");

        assertEquals(2, result.size());
        assertNull(result.findByKey("s0"));
        assertSame(root.findByKey("tabs"), result.findByKey("tabs"));
    }

    @Test
    void testRemoveNestedScreen() {
        NavNode result = TreeOperations.removeNode(tree(), "p");

        StackNode t1 = (StackNode) result.findByKey("t1");
        assertEquals(1, t1.size());
        assertEquals("e", t1.activeChild().getKey());
    }

    @Test
    void testRemoveRootReturnsNull() {
        assertNull(TreeOperations.removeNode(tree(), "root"));
    }

    @Test
    void testRemoveTabStackThrows() {
        NavigationException e = assertThrows(NavigationException.class,
            () -> TreeOperations.removeNode(tree(), "t1"));

        assertEquals(NavigationException.ErrorCode.INVALID_OPERATION, e.getCode());
        assertTrue(e.getMessage().contains("use switchTab instead"));
    }

    @Test
    void testRemovePaneContentThrows() {
        NavigationException e = assertThrows(NavigationException.class,
            () -> TreeOperations.removeNode(tree(), "ss"));

        assertEquals(NavigationException.ErrorCode.INVALID_OPERATION, e.getCode());
        assertTrue(e.getMessage().contains("removePaneConfiguration"));
    }

    @Test
    void testRemoveMissingKeyThrows() {
        NavigationException e = assertThrows(NavigationException.class,
            () -> TreeOperations.removeNode(tree(), "nope"));

        assertEquals(NavigationException.ErrorCode.NODE_NOT_FOUND, e.getCode());
    }

    @Test
    void testFindParent() {
        StackNode root = tree();

        assertEquals("t1", TreeOperations.findParent(root, "e").getKey());
        assertEquals("pane", TreeOperations.findParent(root, "ss").getKey());
        assertNull(TreeOperations.findParent(root, "root"));
        assertNull(TreeOperations.findParent(root, "nope"));
    }

    @Test
    void testDetailedMessageNamesCodeAndNode() {
        NavigationException e = NavigationException.nodeNotFound("abc");

        assertEquals("[NODE_NOT_FOUND] Node with key 'abc' not found (node: abc)", e.getDetailedMessage());
    }
}
