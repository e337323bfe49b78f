package com.wayfinder.navigator;

import com.wayfinder.back.BackOperations;
import com.wayfinder.back.BackResult;
import com.wayfinder.back.CascadeBackState;
import com.wayfinder.node.Destination;
import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneConfiguration;
import com.wayfinder.node.PaneRole;
import com.wayfinder.scope.PaneRoleRegistry;
import com.wayfinder.scope.ScopeRegistry;
import com.wayfinder.tree.KeyGenerators;
import com.wayfinder.tree.NavigationException;
import com.wayfinder.tree.PaneOperations;
import com.wayfinder.tree.PopBehavior;
import com.wayfinder.tree.PopOperations;
import com.wayfinder.tree.PopResult;
import com.wayfinder.tree.PushOperations;
import com.wayfinder.tree.TabOperations;
import com.wayfinder.tree.TreeOperations;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Single entry point to every tree operation, with the key generator bound
 * once. Stateless apart from the generator: every call takes a root and
 * returns a new root or a result value.
 */
public class TreeMutator {

    private final Supplier<String> keyGenerator;

    public TreeMutator() {
        this(KeyGenerators.random());
    }

    public TreeMutator(Supplier<String> keyGenerator) {
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "Key generator cannot be null");
    }

    public Supplier<String> getKeyGenerator() {
        return keyGenerator;
    }

    // Structure

    public NavNode replaceNode(NavNode root, String targetKey, NavNode newNode) {
        return TreeOperations.replaceNode(root, targetKey, newNode);
    }

    /**
     * Removes a node and its subtree.
     *
     * @throws NavigationException CANNOT_REMOVE_ROOT if the key names the root
     */
    public NavNode removeNode(NavNode root, String targetKey) {
        NavNode result = TreeOperations.removeNode(root, targetKey);
        if (result == null) {
            throw NavigationException.cannotRemoveRoot(targetKey);
        }
        return result;
    }

    // Push

    public NavNode push(NavNode root, Destination destination) {
        return PushOperations.push(root, destination, keyGenerator);
    }

    public NavNode push(NavNode root, Destination destination, ScopeRegistry scopeRegistry,
                        PaneRoleRegistry paneRoleRegistry) {
        return PushOperations.push(root, destination, scopeRegistry, paneRoleRegistry, keyGenerator);
    }

    public NavNode pushToStack(NavNode root, String stackKey, Destination destination) {
        return PushOperations.pushToStack(root, stackKey, destination, keyGenerator);
    }

    public NavNode pushAll(NavNode root, List<? extends Destination> destinations) {
        return PushOperations.pushAll(root, destinations, keyGenerator);
    }

    public NavNode clearAndPush(NavNode root, Destination destination) {
        return PushOperations.clearAndPush(root, destination, keyGenerator);
    }

    public NavNode clearStackAndPush(NavNode root, String stackKey, Destination destination) {
        return PushOperations.clearStackAndPush(root, stackKey, destination, keyGenerator);
    }

    public NavNode replaceCurrent(NavNode root, Destination destination) {
        return PushOperations.replaceCurrent(root, destination, keyGenerator);
    }

    // Pop

    public NavNode pop(NavNode root) {
        return PopOperations.pop(root);
    }

    public NavNode pop(NavNode root, PopBehavior behavior) {
        return PopOperations.pop(root, behavior);
    }

    public NavNode popTo(NavNode root, boolean inclusive, Predicate<NavNode> predicate) {
        return PopOperations.popTo(root, inclusive, predicate);
    }

    public NavNode popToKey(NavNode root, String key, boolean inclusive) {
        return PopOperations.popToKey(root, key, inclusive);
    }

    public NavNode popToRoute(NavNode root, String route, boolean inclusive) {
        return PopOperations.popToRoute(root, route, inclusive);
    }

    public NavNode popToDestination(NavNode root, Class<? extends Destination> type, boolean inclusive) {
        return PopOperations.popToDestination(root, type, inclusive);
    }

    // Tabs

    public NavNode switchTab(NavNode root, String tabKey, int index) {
        return TabOperations.switchTab(root, tabKey, index);
    }

    public NavNode switchActiveTab(NavNode root, int index) {
        return TabOperations.switchActiveTab(root, index);
    }

    // Panes

    public NavNode navigateToPane(NavNode root, String paneKey, PaneRole role, Destination destination,
                                  boolean switchFocus) {
        return PaneOperations.navigateToPane(root, paneKey, role, destination, switchFocus, keyGenerator);
    }

    public NavNode switchActivePane(NavNode root, String paneKey, PaneRole role) {
        return PaneOperations.switchActivePane(root, paneKey, role);
    }

    public NavNode popPane(NavNode root, String paneKey, PaneRole role) {
        return PaneOperations.popPane(root, paneKey, role);
    }

    public NavNode clearPane(NavNode root, String paneKey, PaneRole role) {
        return PaneOperations.clearPane(root, paneKey, role);
    }

    public NavNode setPaneConfiguration(NavNode root, String paneKey, PaneRole role, PaneConfiguration configuration) {
        return PaneOperations.setPaneConfiguration(root, paneKey, role, configuration);
    }

    public NavNode removePaneConfiguration(NavNode root, String paneKey, PaneRole role) {
        return PaneOperations.removePaneConfiguration(root, paneKey, role);
    }

    public PopResult popWithPaneBehavior(NavNode root) {
        return PaneOperations.popWithPaneBehavior(root);
    }

    public PopResult popPaneAdaptive(NavNode root, boolean isCompact) {
        return PaneOperations.popPaneAdaptive(root, isCompact);
    }

    // Back

    public BackResult popWithTabBehavior(NavNode root, boolean isCompact) {
        return BackOperations.popWithTabBehavior(root, isCompact);
    }

    public boolean canHandleBackNavigation(NavNode root, boolean isCompact) {
        return BackOperations.canHandleBackNavigation(root, isCompact);
    }

    public CascadeBackState calculateCascadeBackState(NavNode root, boolean isCompact) {
        return BackOperations.calculateCascadeBackState(root, isCompact);
    }
}
