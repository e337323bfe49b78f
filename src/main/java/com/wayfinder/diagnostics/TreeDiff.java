package com.wayfinder.diagnostics;

import com.wayfinder.node.NavNode;
import com.wayfinder.node.ScreenNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Nodes that disappear between two snapshots of a tree.
 * 
 * @param removedKeys keys of every node present only in the old tree
 * @param removedScreenKeys keys of the screens among them
 * @param topmostRemovedKeys removed nodes whose parent survived
 */
public record TreeDiff(Set<String> removedKeys, Set<String> removedScreenKeys, Set<String> topmostRemovedKeys) {
    
    /**
     * Computes what the transition from {@code oldRoot} to {@code newRoot} removes.
     * 
     * @param oldRoot the previous tree
     * @param newRoot the next tree, null if the tree is gone
     * @return the removal diff
     */
    public static TreeDiff between(NavNode oldRoot, NavNode newRoot) {
        Set<String> surviving = new LinkedHashSet<>();
        if (newRoot != null) {
            newRoot.forEachNode(node -> surviving.add(node.getKey()));
        }
        
        Set<String> removed = new LinkedHashSet<>();
        Set<String> removedScreens = new LinkedHashSet<>();
        Set<String> topmost = new LinkedHashSet<>();
        collect(oldRoot, true, surviving, removed, removedScreens, topmost);
        
        return new TreeDiff(
            Collections.unmodifiableSet(removed),
            Collections.unmodifiableSet(removedScreens),
            Collections.unmodifiableSet(topmost));
    }
    
    private static void collect(NavNode node, boolean parentSurvived, Set<String> surviving,
                                Set<String> removed, Set<String> removedScreens, Set<String> topmost) {
        boolean survived = surviving.contains(node.getKey());
        if (!survived) {
            removed.add(node.getKey());
            if (node instanceof ScreenNode) {
                removedScreens.add(node.getKey());
            }
            if (parentSurvived) {
                topmost.add(node.getKey());
            }
        }
        for (NavNode child : node.children()) {
            collect(child, survived, surviving, removed, removedScreens, topmost);
        }
    }
    
    public boolean isEmpty() {
        return removedKeys.isEmpty();
    }
}
