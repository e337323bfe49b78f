package com.wayfinder.navigator;

import com.wayfinder.back.BackOperations;
import com.wayfinder.back.BackResult;
import com.wayfinder.back.CascadeBackState;
import com.wayfinder.config.NavigatorConfig;
import com.wayfinder.diagnostics.TreeDiff;
import com.wayfinder.diagnostics.TreeDumper;
import com.wayfinder.node.Destination;
import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneNode;
import com.wayfinder.node.PaneRole;
import com.wayfinder.node.ScreenNode;
import com.wayfinder.node.StackNode;
import com.wayfinder.scope.PaneRoleRegistry;
import com.wayfinder.scope.ScopeRegistry;
import com.wayfinder.tree.KeyGenerators;
import com.wayfinder.tree.NavigationException;
import com.wayfinder.tree.PaneOperations;
import com.wayfinder.tree.PopResult;
import com.wayfinder.validation.TreeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Holder of the current navigation tree.
 *
 * Each intent is turned into a new tree by a {@link TreeMutator} and
 * published atomically; listeners are told about every change in order.
 * Reads never block.
 */
public class Navigator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Navigator.class);

    private final NavigatorConfig config;
    private final TreeMutator mutator;
    private final ScopeRegistry scopeRegistry;
    private final PaneRoleRegistry paneRoleRegistry;
    private final TreeValidator validator;
    private final List<NavigationListener> listeners = new CopyOnWriteArrayList<>();

    private volatile NavNode state;

    private Navigator(Builder builder) {
        this.config = builder.config;
        Supplier<String> keyGenerator = builder.keyGenerator != null
            ? builder.keyGenerator
            : KeyGenerators.random(config.keyLength());
        this.mutator = new TreeMutator(keyGenerator);
        this.scopeRegistry = builder.scopeRegistry;
        this.paneRoleRegistry = builder.paneRoleRegistry;
        this.validator = new TreeValidator(config);

        if (builder.initialState != null) {
            if (config.validateOnUpdate()) {
                validator.validate(builder.initialState);
            }
            this.state = builder.initialState;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets the current tree.
     *
     * @return the root, or null before the first navigation
     */
    public NavNode getState() {
        return state;
    }

    public NavigatorConfig getConfig() {
        return config;
    }

    public TreeMutator getMutator() {
        return mutator;
    }

    /**
     * Registers a listener.
     *
     * @return action that unregisters the listener
     */
    public Runnable addListener(NavigationListener listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Publishes a new tree.
     *
     * @param newState the new root
     * @throws com.wayfinder.validation.TreeValidationException if validation is on and the tree is malformed
     */
    public synchronized void updateState(NavNode newState) {
        Objects.requireNonNull(newState, "New state cannot be null");
        NavNode previous = state;
        if (previous == newState) {
            return;
        }
        if (config.validateOnUpdate()) {
            validator.validate(newState);
        }

        state = newState;
        TreeDiff diff = previous == null ? TreeDiff.between(newState, newState) : TreeDiff.between(previous, newState);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Navigation state changed, active leaf {} removed screens {}",
                newState.activeLeaf(), diff.removedScreenKeys());
            LOGGER.trace("New tree:\n{}", TreeDumper.toJson(newState));
        }

        for (NavigationListener listener : listeners) {
            try {
                listener.onNavigationChanged(previous, newState, diff);
            } catch (RuntimeException e) {
                LOGGER.error("Navigation listener failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Navigates to a destination using scope-aware push. Without a current
     * tree, or with a tree that has no active stack, a fresh root stack is
     * created.
     */
    public synchronized void navigate(Destination destination) {
        NavNode current = state;
        if (current == null || current.activeStack() == null) {
            Supplier<String> keys = mutator.getKeyGenerator();
            String stackKey = keys.get();
            ScreenNode screen = new ScreenNode(keys.get(), stackKey, destination);
            LOGGER.debug("Creating root stack '{}' for '{}'", stackKey, destination.getRoute());
            updateState(new StackNode(stackKey, null, List.of(screen)));
            return;
        }
        updateState(mutator.push(current, destination, scopeRegistry, paneRoleRegistry));
    }

    /**
     * Handles a back press. Falls back to an adaptive pane pop when the
     * back procedure cannot handle the tree.
     *
     * @return true if the tree changed, false if the host should handle back
     */
    public synchronized boolean navigateBack() {
        NavNode current = requireState();
        BackResult result = mutator.popWithTabBehavior(current, config.compactLayout());
        if (result instanceof BackResult.Handled) {
            updateState(((BackResult.Handled) result).newState());
            return true;
        }
        if (result instanceof BackResult.CannotHandle) {
            LOGGER.debug("Back procedure cannot handle tree '{}', trying pane pop", current.getKey());
            PopResult popResult = mutator.popPaneAdaptive(current, config.compactLayout());
            if (popResult instanceof PopResult.Popped) {
                updateState(((PopResult.Popped) popResult).newState());
                return true;
            }
        }
        return false;
    }

    /**
     * Pops the active stack with the configured empty-stack policy.
     *
     * @return true if something was popped
     */
    public synchronized boolean pop() {
        NavNode popped = mutator.pop(requireState(), config.defaultPopBehavior());
        if (popped == null) {
            return false;
        }
        updateState(popped);
        return true;
    }

    /**
     * Pops back to the most recent screen with a route, then navigates to
     * a destination.
     */
    public synchronized void navigateAndClearTo(Destination destination, String route, boolean inclusive) {
        NavNode popped = mutator.popToRoute(requireState(), route, inclusive);
        updateState(mutator.push(popped, destination, scopeRegistry, paneRoleRegistry));
    }

    /**
     * Replaces the current screen.
     */
    public synchronized void navigateAndReplace(Destination destination) {
        updateState(mutator.replaceCurrent(requireState(), destination));
    }

    /**
     * Clears the active stack and shows a destination.
     */
    public synchronized void navigateAndClearAll(Destination destination) {
        updateState(mutator.clearAndPush(requireState(), destination));
    }

    /**
     * Selects a tab of the first tab node on the active path.
     */
    public synchronized void switchTab(int index) {
        updateState(mutator.switchActiveTab(requireState(), index));
    }

    /**
     * Pushes into a pane of the deepest pane node on the active path.
     */
    public synchronized void navigateToPane(PaneRole role, Destination destination, boolean switchFocus) {
        NavNode current = requireState();
        PaneNode pane = requirePane(current);
        updateState(mutator.navigateToPane(current, pane.getKey(), role, destination, switchFocus));
    }

    /**
     * Pops one pane of the deepest pane node on the active path.
     *
     * @return true if the pane had history to pop
     */
    public synchronized boolean navigateBackInPane(PaneRole role) {
        NavNode current = requireState();
        NavNode popped = mutator.popPane(current, requirePane(current).getKey(), role);
        if (popped == null) {
            return false;
        }
        updateState(popped);
        return true;
    }

    /**
     * Truncates one pane of the deepest pane node on the active path to its
     * first entry.
     */
    public synchronized void clearPane(PaneRole role) {
        NavNode current = requireState();
        updateState(mutator.clearPane(current, requirePane(current).getKey(), role));
    }

    /**
     * Previews the next back press without changing state.
     */
    public CascadeBackState previewBack() {
        return mutator.calculateCascadeBackState(requireState(), config.compactLayout());
    }

    public boolean canNavigateBack() {
        NavNode current = state;
        return current != null && mutator.canHandleBackNavigation(current, config.compactLayout());
    }

    public Destination currentDestination() {
        NavNode current = state;
        return current == null ? null : BackOperations.currentDestination(current);
    }

    public Destination previousDestination() {
        NavNode current = state;
        return current == null ? null : BackOperations.previousDestination(current);
    }

    private NavNode requireState() {
        NavNode current = state;
        if (current == null) {
            throw NavigationException.noActiveStack();
        }
        return current;
    }

    private static PaneNode requirePane(NavNode root) {
        PaneNode pane = PaneOperations.deepestPaneOnActivePath(root);
        if (pane == null) {
            throw new NavigationException(NavigationException.ErrorCode.NODE_NOT_FOUND,
                "No PaneNode found on the active path");
        }
        return pane;
    }

    /**
     * Builder for navigators.
     */
    public static class Builder {
        private NavNode initialState;
        private NavigatorConfig config = NavigatorConfig.defaults();
        private Supplier<String> keyGenerator;
        private ScopeRegistry scopeRegistry = ScopeRegistry.EMPTY;
        private PaneRoleRegistry paneRoleRegistry = PaneRoleRegistry.EMPTY;

        public Builder initialState(NavNode initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder config(NavigatorConfig config) {
            this.config = Objects.requireNonNull(config, "Config cannot be null");
            return this;
        }

        /**
         * Overrides the key generator. Defaults to random keys of the
         * configured length.
         */
        public Builder keyGenerator(Supplier<String> keyGenerator) {
            this.keyGenerator = keyGenerator;
            return this;
        }

        public Builder scopeRegistry(ScopeRegistry scopeRegistry) {
            this.scopeRegistry = Objects.requireNonNull(scopeRegistry, "Scope registry cannot be null");
            return this;
        }

        public Builder paneRoleRegistry(PaneRoleRegistry paneRoleRegistry) {
            this.paneRoleRegistry = Objects.requireNonNull(paneRoleRegistry, "Pane role registry cannot be null");
            return this;
        }

        public Navigator build() {
            return new Navigator(this);
        }
    }
}
