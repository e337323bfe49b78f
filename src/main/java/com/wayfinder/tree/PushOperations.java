package com.wayfinder.tree;

import com.wayfinder.node.Destination;
import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneNode;
import com.wayfinder.node.PaneRole;
import com.wayfinder.node.ScreenNode;
import com.wayfinder.node.StackNode;
import com.wayfinder.node.TabNode;
import com.wayfinder.scope.PaneRoleRegistry;
import com.wayfinder.scope.ScopeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Operations that add screens to a tree.
 *
 * Every new {@link ScreenNode} gets its key from the supplied generator and
 * is parented to the stack it lands in.
 */
public final class PushOperations {

    private static final Logger LOGGER = LoggerFactory.getLogger(PushOperations.class);

    private PushOperations() {}

    /**
     * Pushes a destination onto the active stack.
     *
     * @param root the tree root
     * @param destination the destination to show
     * @param keyGenerator source of the new screen's key
     * @return the new root
     * @throws NavigationException NO_ACTIVE_STACK if the active path has no stack
     */
    public static NavNode push(NavNode root, Destination destination, Supplier<String> keyGenerator) {
        StackNode target = requireActiveStack(root);
        return appendToStack(root, target, destination, keyGenerator);
    }

    /**
     * Pushes a destination onto a stack chosen by key, active or not.
     *
     * @throws NavigationException NODE_NOT_FOUND if the key is unknown,
     *         INVALID_OPERATION if the node is not a stack
     */
    public static NavNode pushToStack(NavNode root, String stackKey, Destination destination,
                                      Supplier<String> keyGenerator) {
        StackNode target = TreeOperations.requireNode(root, stackKey, StackNode.class);
        return appendToStack(root, target, destination, keyGenerator);
    }

    /**
     * Pushes a destination while honoring container scopes and pane routing.
     *
     * With {@link ScopeRegistry#EMPTY} and {@link PaneRoleRegistry#EMPTY}
     * this is a plain {@link #push(NavNode, Destination, Supplier)}.
     *
     * @param root the tree root
     * @param destination the destination to show
     * @param scopeRegistry scope membership rules
     * @param paneRoleRegistry pane routing rules
     * @param keyGenerator source of the new screen's key
     * @return the new root
     */
    public static NavNode push(NavNode root, Destination destination, ScopeRegistry scopeRegistry,
                               PaneRoleRegistry paneRoleRegistry, Supplier<String> keyGenerator) {
        if (scopeRegistry == ScopeRegistry.EMPTY && paneRoleRegistry == PaneRoleRegistry.EMPTY) {
            return push(root, destination, keyGenerator);
        }

        PushStrategy strategy = determinePushStrategy(root, destination, scopeRegistry, paneRoleRegistry);
        LOGGER.debug("Push of '{}' resolved to {} on '{}'", destination.getRoute(), strategy.kind(), strategy.targetKey());

        switch (strategy.kind()) {
            case SWITCH_TO_TAB:
                return TabOperations.switchTab(root, strategy.targetKey(), strategy.tabIndex());
            case PUSH_TO_PANE:
                return pushToPaneStack(root, (PaneNode) root.findByKey(strategy.targetKey()),
                    strategy.paneRole(), destination, keyGenerator);
            case PUSH_OUT_OF_SCOPE:
            case PUSH_TO_STACK:
            default:
                StackNode target = (StackNode) root.findByKey(strategy.targetKey());
                return appendToStack(root, target, destination, keyGenerator);
        }
    }

    /**
     * Picks the push strategy by walking the active path from the leaf up.
     * The first container that triggers a strategy wins; containers without
     * a scope key accept every destination.
     *
     * @throws NavigationException NO_ACTIVE_STACK if the active path has no stack
     */
    public static PushStrategy determinePushStrategy(NavNode root, Destination destination,
                                                     ScopeRegistry scopeRegistry,
                                                     PaneRoleRegistry paneRoleRegistry) {
        StackNode activeStack = requireActiveStack(root);
        List<NavNode> path = root.activePathToLeaf();

        for (int i = path.size() - 1; i >= 0; i--) {
            NavNode node = path.get(i);
            NavNode parent = i > 0 ? path.get(i - 1) : null;
            String scopeKey = scopeKeyOf(node);
            if (scopeKey == null && !(node instanceof TabNode)) {
                continue;
            }

            boolean inScope = scopeKey == null || scopeRegistry.isInScope(scopeKey, destination);
            if (!inScope) {
                if (parent instanceof StackNode) {
                    return PushStrategy.outOfScope(parent.getKey());
                }
                continue;
            }

            if (node instanceof TabNode) {
                TabNode tab = (TabNode) node;
                int existing = findTabWithDestination(tab, destination);
                if (existing >= 0 && existing != tab.getActiveStackIndex()) {
                    return PushStrategy.switchToTab(tab.getKey(), existing);
                }
            } else if (node instanceof PaneNode) {
                PaneNode pane = (PaneNode) node;
                PaneRole role = paneRoleRegistry.getPaneRole(scopeKey, destination);
                if (role != null && pane.getPaneConfigurations().containsKey(role)) {
                    return PushStrategy.toPane(pane.getKey(), role);
                }
            }
        }

        return PushStrategy.toStack(activeStack.getKey());
    }

    private static String scopeKeyOf(NavNode node) {
        if (node instanceof StackNode) {
            return ((StackNode) node).getScopeKey();
        } else if (node instanceof TabNode) {
            return ((TabNode) node).getScopeKey();
        } else if (node instanceof PaneNode) {
            return ((PaneNode) node).getScopeKey();
        }
        return null;
    }

    /**
     * Finds the first tab whose stack directly holds a screen of the same
     * kind as the destination.
     *
     * @return the tab index, or -1 if no tab holds one
     */
    private static int findTabWithDestination(TabNode tab, Destination destination) {
        for (int i = 0; i < tab.tabCount(); i++) {
            for (NavNode child : tab.stackAt(i).getChildren()) {
                if (child instanceof ScreenNode
                        && destination.isSameKind(((ScreenNode) child).getDestination())) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static NavNode pushToPaneStack(NavNode root, PaneNode pane, PaneRole role,
                                           Destination destination, Supplier<String> keyGenerator) {
        StackNode paneStack = pane.paneContent(role).activeStack();
        if (paneStack == null) {
            LOGGER.debug("Pane {} of '{}' has no stack, push ignored", role, pane.getKey());
            return root;
        }

        ScreenNode screen = new ScreenNode(keyGenerator.get(), paneStack.getKey(), destination);
        NavNode newContent = TreeOperations.replaceNode(pane.paneContent(role), paneStack.getKey(),
            paneStack.withAppended(screen));
        PaneNode updated = pane.withPaneContent(role, newContent).withActivePaneRole(role);
        return TreeOperations.replaceNode(root, pane.getKey(), updated);
    }

    /**
     * Pushes several destinations onto the active stack, in order.
     *
     * @return the new root, or the same root if the list is empty
     */
    public static NavNode pushAll(NavNode root, List<? extends Destination> destinations,
                                  Supplier<String> keyGenerator) {
        if (destinations.isEmpty()) {
            return root;
        }
        StackNode target = requireActiveStack(root);
        List<NavNode> children = new ArrayList<>(target.getChildren());
        for (Destination destination : destinations) {
            children.add(new ScreenNode(keyGenerator.get(), target.getKey(), destination));
        }
        return TreeOperations.replaceNode(root, target.getKey(), target.withChildren(children));
    }

    /**
     * Replaces the whole content of the active stack with one screen.
     */
    public static NavNode clearAndPush(NavNode root, Destination destination, Supplier<String> keyGenerator) {
        StackNode target = requireActiveStack(root);
        ScreenNode screen = new ScreenNode(keyGenerator.get(), target.getKey(), destination);
        return TreeOperations.replaceNode(root, target.getKey(), target.withChildren(List.of(screen)));
    }

    /**
     * Replaces the whole content of a stack chosen by key with one screen.
     *
     * @throws NavigationException NODE_NOT_FOUND if the key is unknown,
     *         INVALID_OPERATION if the node is not a stack
     */
    public static NavNode clearStackAndPush(NavNode root, String stackKey, Destination destination,
                                            Supplier<String> keyGenerator) {
        StackNode target = TreeOperations.requireNode(root, stackKey, StackNode.class);
        ScreenNode screen = new ScreenNode(keyGenerator.get(), stackKey, destination);
        return TreeOperations.replaceNode(root, stackKey, target.withChildren(List.of(screen)));
    }

    /**
     * Swaps the top of the active stack for a new screen.
     *
     * @throws NavigationException EMPTY_STACK if the active stack has no child
     */
    public static NavNode replaceCurrent(NavNode root, Destination destination, Supplier<String> keyGenerator) {
        StackNode target = requireActiveStack(root);
        if (target.isEmpty()) {
            throw new NavigationException(NavigationException.ErrorCode.EMPTY_STACK,
                "Cannot replace in empty stack", target.getKey());
        }
        ScreenNode screen = new ScreenNode(keyGenerator.get(), target.getKey(), destination);
        return TreeOperations.replaceNode(root, target.getKey(), target.withoutLast().withAppended(screen));
    }

    private static NavNode appendToStack(NavNode root, StackNode target, Destination destination,
                                         Supplier<String> keyGenerator) {
        ScreenNode screen = new ScreenNode(keyGenerator.get(), target.getKey(), destination);
        return TreeOperations.replaceNode(root, target.getKey(), target.withAppended(screen));
    }

    static StackNode requireActiveStack(NavNode root) {
        StackNode stack = root.activeStack();
        if (stack == null) {
            throw NavigationException.noActiveStack();
        }
        return stack;
    }
}
