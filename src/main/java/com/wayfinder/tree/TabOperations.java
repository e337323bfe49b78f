package com.wayfinder.tree;

import com.wayfinder.node.NavNode;
import com.wayfinder.node.TabNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tab selection.
 */
public final class TabOperations {

    private static final Logger LOGGER = LoggerFactory.getLogger(TabOperations.class);

    private TabOperations() {}

    /**
     * Selects a tab of a tab node. Selecting the current tab returns the
     * root unchanged.
     *
     * @param root the tree root
     * @param tabKey key of the tab node
     * @param index tab to select
     * @return the new root
     * @throws NavigationException NODE_NOT_FOUND if no tab node has the key,
     *         INDEX_OUT_OF_BOUNDS if the index is outside the tab range
     */
    public static NavNode switchTab(NavNode root, String tabKey, int index) {
        NavNode node = root.findByKey(tabKey);
        if (!(node instanceof TabNode)) {
            throw new NavigationException(NavigationException.ErrorCode.NODE_NOT_FOUND,
                String.format("TabNode with key '%s' not found", tabKey), tabKey);
        }
        TabNode tab = (TabNode) node;

        if (index < 0 || index >= tab.tabCount()) {
            throw new NavigationException(NavigationException.ErrorCode.INDEX_OUT_OF_BOUNDS,
                String.format("Tab index %d out of bounds for '%s' with %d tabs", index, tabKey, tab.tabCount()),
                tabKey);
        }

        if (tab.getActiveStackIndex() == index) {
            LOGGER.debug("Tab {} of '{}' already selected", index, tabKey);
            return root;
        }

        return TreeOperations.replaceNode(root, tabKey, tab.withActiveStackIndex(index));
    }

    /**
     * Selects a tab of the first tab node on the active path.
     *
     * @throws NavigationException NODE_NOT_FOUND if the active path has no tab node
     */
    public static NavNode switchActiveTab(NavNode root, int index) {
        for (NavNode node : root.activePathToLeaf()) {
            if (node instanceof TabNode) {
                return switchTab(root, node.getKey(), index);
            }
        }
        throw new NavigationException(NavigationException.ErrorCode.NODE_NOT_FOUND,
            "No TabNode found on the active path");
    }
}
