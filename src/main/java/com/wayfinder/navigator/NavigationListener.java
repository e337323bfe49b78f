package com.wayfinder.navigator;

import com.wayfinder.diagnostics.TreeDiff;
import com.wayfinder.node.NavNode;

/**
 * Receives every state change of a {@link Navigator}.
 */
@FunctionalInterface
public interface NavigationListener {
    
    /**
     * Called after the navigator published a new tree.
     * 
     * @param previous the tree before the change, may be null
     * @param current the tree after the change
     * @param diff nodes removed by the change
     */
    void onNavigationChanged(NavNode previous, NavNode current, TreeDiff diff);
}
