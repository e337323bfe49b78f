package com.wayfinder.tree;

import com.wayfinder.node.Destination;
import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneBackBehavior;
import com.wayfinder.node.PaneConfiguration;
import com.wayfinder.node.PaneNode;
import com.wayfinder.node.PaneRole;
import com.wayfinder.node.ScreenNode;
import com.wayfinder.node.StackNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Navigation inside multi-pane layouts: pushing into a pane, moving focus,
 * per-pane pops and the configurable back behavior of a {@link PaneNode}.
 */
public final class PaneOperations {

    private static final Logger LOGGER = LoggerFactory.getLogger(PaneOperations.class);

    private PaneOperations() {}

    /**
     * Pushes a destination into a pane. If the pane holds a composite the
     * screen lands on that composite's active stack.
     *
     * @param root the tree root
     * @param paneKey key of the pane node
     * @param role pane to push into
     * @param destination the destination to show
     * @param switchFocus also make the pane the active one
     * @param keyGenerator source of the new screen's key
     * @return the new root
     * @throws NavigationException NODE_NOT_FOUND if the pane node is unknown,
     *         INVALID_OPERATION if the role is not configured or holds no stack
     */
    public static NavNode navigateToPane(NavNode root, String paneKey, PaneRole role, Destination destination,
                                         boolean switchFocus, Supplier<String> keyGenerator) {
        PaneNode pane = TreeOperations.requireNode(root, paneKey, PaneNode.class);
        NavNode content = requirePaneContent(pane, role);
        StackNode stack = content.activeStack();
        if (stack == null) {
            throw NavigationException.invalidOperation(paneKey, String.format(
                "Pane %s of '%s' has no stack to push into", role, paneKey));
        }

        ScreenNode screen = new ScreenNode(keyGenerator.get(), stack.getKey(), destination);
        NavNode newContent = TreeOperations.replaceNode(content, stack.getKey(), stack.withAppended(screen));
        PaneNode updated = pane.withPaneContent(role, newContent);
        if (switchFocus) {
            updated = updated.withActivePaneRole(role);
        }
        return TreeOperations.replaceNode(root, paneKey, updated);
    }

    /**
     * Moves focus to another pane. Focusing the active pane returns the
     * root unchanged.
     *
     * @throws NavigationException NODE_NOT_FOUND if the pane node is unknown,
     *         INVALID_OPERATION if the role is not configured
     */
    public static NavNode switchActivePane(NavNode root, String paneKey, PaneRole role) {
        PaneNode pane = TreeOperations.requireNode(root, paneKey, PaneNode.class);
        requirePaneContent(pane, role);
        if (pane.getActivePaneRole() == role) {
            return root;
        }
        return TreeOperations.replaceNode(root, paneKey, pane.withActivePaneRole(role));
    }

    /**
     * Pops the stack of one pane, active or not.
     *
     * @return the new root, or null if the pane's stack is at its root
     * @throws NavigationException NODE_NOT_FOUND if the pane node is unknown,
     *         INVALID_OPERATION if the role is not configured
     */
    public static NavNode popPane(NavNode root, String paneKey, PaneRole role) {
        PaneNode pane = TreeOperations.requireNode(root, paneKey, PaneNode.class);
        StackNode stack = requirePaneContent(pane, role).activeStack();
        if (stack == null || stack.size() <= 1) {
            return null;
        }
        return TreeOperations.replaceNode(root, stack.getKey(), stack.withoutLast());
    }

    /**
     * Truncates a pane's stack to its first entry.
     *
     * @return the new root, or the same root if the stack has at most one entry
     */
    public static NavNode clearPane(NavNode root, String paneKey, PaneRole role) {
        PaneNode pane = TreeOperations.requireNode(root, paneKey, PaneNode.class);
        StackNode stack = requirePaneContent(pane, role).activeStack();
        if (stack == null || stack.size() <= 1) {
            return root;
        }
        return TreeOperations.replaceNode(root, stack.getKey(), stack.withChildren(stack.getChildren().subList(0, 1)));
    }

    /**
     * Adds or replaces the configuration of a pane.
     *
     * @throws NavigationException NODE_NOT_FOUND if the pane node is unknown
     */
    public static NavNode setPaneConfiguration(NavNode root, String paneKey, PaneRole role,
                                               PaneConfiguration configuration) {
        PaneNode pane = TreeOperations.requireNode(root, paneKey, PaneNode.class);
        Map<PaneRole, PaneConfiguration> configurations = new EnumMap<>(pane.getPaneConfigurations());
        configurations.put(role, configuration);
        return TreeOperations.replaceNode(root, paneKey,
            pane.withPaneConfigurations(configurations, pane.getActivePaneRole()));
    }

    /**
     * Removes a pane. If the removed pane had focus, focus moves to PRIMARY.
     *
     * @return the new root, or the same root if the role was not configured
     * @throws NavigationException INVALID_OPERATION when asked to remove PRIMARY,
     *         NODE_NOT_FOUND if the pane node is unknown
     */
    public static NavNode removePaneConfiguration(NavNode root, String paneKey, PaneRole role) {
        if (role == PaneRole.PRIMARY) {
            throw NavigationException.invalidOperation(paneKey, "Cannot remove Primary pane - it is required");
        }
        PaneNode pane = TreeOperations.requireNode(root, paneKey, PaneNode.class);
        if (!pane.getPaneConfigurations().containsKey(role)) {
            return root;
        }
        Map<PaneRole, PaneConfiguration> configurations = new EnumMap<>(pane.getPaneConfigurations());
        configurations.remove(role);
        PaneRole activeRole = pane.getActivePaneRole() == role ? PaneRole.PRIMARY : pane.getActivePaneRole();
        return TreeOperations.replaceNode(root, paneKey, pane.withPaneConfigurations(configurations, activeRole));
    }

    /**
     * Pops inside the deepest pane node on the active path, applying its
     * {@link PaneBackBehavior} once the focused pane is at its root. Without
     * a pane node this is a plain pop.
     *
     * @param root the tree root
     * @return the outcome
     */
    public static PopResult popWithPaneBehavior(NavNode root) {
        PaneNode pane = deepestPaneOnActivePath(root);
        if (pane == null) {
            return plainPop(root);
        }
        return popWithPaneBehavior(root, pane);
    }

    /**
     * Pops inside the given pane node, applying its {@link PaneBackBehavior}
     * once the focused pane is at its root.
     *
     * @param root the tree root
     * @param pane a pane node of the tree
     * @return the outcome
     */
    public static PopResult popWithPaneBehavior(NavNode root, PaneNode pane) {
        StackNode activeStack = pane.activePaneContent().activeStack();
        if (activeStack != null && activeStack.size() > 1) {
            return new PopResult.Popped(TreeOperations.replaceNode(root, activeStack.getKey(), activeStack.withoutLast()));
        }

        PaneRole activeRole = pane.getActivePaneRole();
        LOGGER.debug("Pane '{}' at root of {}, applying {}", pane.getKey(), activeRole, pane.getBackBehavior());

        switch (pane.getBackBehavior()) {
            case POP_LATEST:
                if (activeStack == null || activeStack.isEmpty()) {
                    return new PopResult.CannotPop();
                }
                return new PopResult.Popped(TreeOperations.replaceNode(root, activeStack.getKey(), activeStack.withoutLast()));

            case POP_UNTIL_SCAFFOLD_VALUE_CHANGE:
                if (activeRole != PaneRole.PRIMARY) {
                    return new PopResult.Popped(switchActivePane(root, pane.getKey(), PaneRole.PRIMARY));
                }
                return new PopResult.RequiresScaffoldChange();

            case POP_UNTIL_CURRENT_DESTINATION_CHANGE:
                for (PaneRole role : pane.configuredRoles()) {
                    if (role == activeRole) {
                        continue;
                    }
                    StackNode stack = pane.paneContent(role).activeStack();
                    if (stack != null && !stack.isEmpty()) {
                        return new PopResult.Popped(switchActivePane(root, pane.getKey(), role));
                    }
                }
                return new PopResult.PaneEmpty(activeRole);

            case POP_UNTIL_CONTENT_CHANGE:
            default:
                return popUntilContentChange(root, pane);
        }
    }

    private static PopResult popUntilContentChange(NavNode root, PaneNode pane) {
        List<PaneRole> withContent = new ArrayList<>();
        for (PaneRole role : pane.configuredRoles()) {
            StackNode stack = pane.paneContent(role).activeStack();
            if (stack != null && stack.size() > 1) {
                withContent.add(role);
            }
        }

        PaneRole activeRole = pane.getActivePaneRole();
        if (withContent.isEmpty()) {
            if (activeRole != PaneRole.PRIMARY) {
                return new PopResult.Popped(clearAndFocusPrimary(root, pane, activeRole));
            }
            return new PopResult.PaneEmpty(activeRole);
        }

        PaneRole target = withContent.contains(activeRole) ? activeRole : withContent.get(0);
        NavNode popped = popPane(root, pane.getKey(), target);
        if (target != PaneRole.PRIMARY) {
            PaneNode updatedPane = (PaneNode) popped.findByKey(pane.getKey());
            StackNode targetStack = updatedPane.paneContent(target).activeStack();
            if (targetStack.size() <= 1) {
                return new PopResult.Popped(clearAndFocusPrimary(popped, updatedPane, target));
            }
        }
        return new PopResult.Popped(popped);
    }

    /**
     * Pops inside the deepest pane node on the active path. Compact layouts
     * show one pane at a time, so they ignore the configured back behavior
     * and use {@link #popFromActivePane(NavNode, PaneNode)}; expanded layouts
     * use {@link #popWithPaneBehavior(NavNode)}.
     */
    public static PopResult popPaneAdaptive(NavNode root, boolean isCompact) {
        if (!isCompact) {
            return popWithPaneBehavior(root);
        }
        PaneNode pane = deepestPaneOnActivePath(root);
        if (pane == null) {
            return plainPop(root);
        }
        return popFromActivePane(root, pane);
    }

    /**
     * Single-pane pop of a pane node's focused pane: pop when the stack has
     * history, otherwise clear a secondary pane and focus PRIMARY. PRIMARY
     * at its root is exhausted.
     *
     * @param root the tree root
     * @param pane a pane node of the tree
     * @return {@link PopResult.Popped} or {@link PopResult.PaneEmpty}
     */
    private static PopResult popFromActivePane(NavNode root, PaneNode pane) {
        PaneRole activeRole = pane.getActivePaneRole();
        if (isActivePaneExhausted(pane)) {
            return new PopResult.PaneEmpty(activeRole);
        }
        StackNode stack = pane.activePaneContent().activeStack();
        if (stack.size() <= 1) {
            return new PopResult.Popped(clearAndFocusPrimary(root, pane, activeRole));
        }
        return new PopResult.Popped(TreeOperations.replaceNode(root, stack.getKey(), stack.withoutLast()));
    }

    /**
     * Checks whether {@link #popFromActivePane(NavNode, PaneNode)} would
     * report the pane as empty.
     */
    public static boolean isActivePaneExhausted(PaneNode pane) {
        StackNode stack = pane.activePaneContent().activeStack();
        if (stack == null) {
            return true;
        }
        return stack.size() <= 1 && pane.getActivePaneRole() == PaneRole.PRIMARY;
    }

    /**
     * Empties the active stack of a pane and moves focus to PRIMARY.
     */
    private static NavNode clearAndFocusPrimary(NavNode root, PaneNode pane, PaneRole role) {
        NavNode result = root;
        StackNode stack = pane.paneContent(role).activeStack();
        if (stack != null && !stack.isEmpty()) {
            result = TreeOperations.replaceNode(result, stack.getKey(), stack.withChildren(List.of()));
        }
        return switchActivePane(result, pane.getKey(), PaneRole.PRIMARY);
    }

    private static PopResult plainPop(NavNode root) {
        NavNode popped = PopOperations.pop(root);
        return popped == null ? new PopResult.CannotPop() : new PopResult.Popped(popped);
    }

    /**
     * Finds the deepest pane node on the active path.
     *
     * @return the pane node, or null if the active path has none
     */
    public static PaneNode deepestPaneOnActivePath(NavNode root) {
        PaneNode found = null;
        for (NavNode node : root.activePathToLeaf()) {
            if (node instanceof PaneNode) {
                found = (PaneNode) node;
            }
        }
        return found;
    }

    private static NavNode requirePaneContent(PaneNode pane, PaneRole role) {
        NavNode content = pane.paneContent(role);
        if (content == null) {
            throw NavigationException.invalidOperation(pane.getKey(), String.format(
                "PaneNode '%s' has no %s pane", pane.getKey(), role));
        }
        return content;
    }
}
