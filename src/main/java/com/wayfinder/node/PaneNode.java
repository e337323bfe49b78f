package com.wayfinder.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Multi-pane layout mapping pane roles to content subtrees.
 *
 * The {@link PaneRole#PRIMARY} role is always configured and the active role
 * always refers to a configured pane. Pane maps iterate in role order.
 */
public final class PaneNode extends NavNode {

    private final Map<PaneRole, PaneConfiguration> paneConfigurations;
    private final PaneRole activePaneRole;
    private final PaneBackBehavior backBehavior;
    private final String scopeKey;

    public PaneNode(String key, String parentKey, Map<PaneRole, PaneConfiguration> paneConfigurations) {
        this(key, parentKey, paneConfigurations, PaneRole.PRIMARY,
            PaneBackBehavior.POP_UNTIL_SCAFFOLD_VALUE_CHANGE, null);
    }

    /**
     * Creates a pane node.
     *
     * @param key unique node key
     * @param parentKey key of the parent container, null for a root
     * @param paneConfigurations pane contents by role, PRIMARY required
     * @param activePaneRole the focused pane
     * @param backBehavior policy applied when the focused pane is at its root
     * @param scopeKey scope consulted by scope-aware pushes, may be null
     * @throws IllegalArgumentException if PRIMARY is missing or the active role is not configured
     */
    public PaneNode(String key, String parentKey, Map<PaneRole, PaneConfiguration> paneConfigurations,
                    PaneRole activePaneRole, PaneBackBehavior backBehavior, String scopeKey) {
        super(key, parentKey);
        Objects.requireNonNull(paneConfigurations, "Pane configurations cannot be null");
        if (!paneConfigurations.containsKey(PaneRole.PRIMARY)) {
            throw new IllegalArgumentException(
                String.format("PaneNode '%s' must have a PRIMARY pane", key)
            );
        }
        if (!paneConfigurations.containsKey(activePaneRole)) {
            throw new IllegalArgumentException(
                String.format("PaneNode '%s' active role %s is not configured", key, activePaneRole)
            );
        }
        this.paneConfigurations = Collections.unmodifiableMap(new EnumMap<>(paneConfigurations));
        this.activePaneRole = activePaneRole;
        this.backBehavior = Objects.requireNonNull(backBehavior, "Back behavior cannot be null");
        this.scopeKey = scopeKey;
    }

    public Map<PaneRole, PaneConfiguration> getPaneConfigurations() {
        return paneConfigurations;
    }

    public PaneRole getActivePaneRole() {
        return activePaneRole;
    }

    public PaneBackBehavior getBackBehavior() {
        return backBehavior;
    }

    public String getScopeKey() {
        return scopeKey;
    }

    /**
     * Gets the content of a pane.
     *
     * @return the content, or null if the role is not configured
     */
    public NavNode paneContent(PaneRole role) {
        PaneConfiguration config = paneConfigurations.get(role);
        return config == null ? null : config.content();
    }

    /**
     * Gets the adapt strategy of a pane.
     *
     * @return the strategy, or null if the role is not configured
     */
    public AdaptStrategy adaptStrategy(PaneRole role) {
        PaneConfiguration config = paneConfigurations.get(role);
        return config == null ? null : config.adaptStrategy();
    }

    public NavNode activePaneContent() {
        return paneContent(activePaneRole);
    }

    public int paneCount() {
        return paneConfigurations.size();
    }

    public Set<PaneRole> configuredRoles() {
        return paneConfigurations.keySet();
    }

    @Override
    public Type getType() {
        return Type.PANE;
    }

    @Override
    public List<NavNode> children() {
        List<NavNode> contents = new ArrayList<>(paneConfigurations.size());
        for (PaneConfiguration config : paneConfigurations.values()) {
            contents.add(config.content());
        }
        return Collections.unmodifiableList(contents);
    }

    @Override
    public NavNode activeChild() {
        return activePaneContent();
    }

    @Override
    public StackNode activeStack() {
        return activePaneContent().activeStack();
    }

    public PaneNode withActivePaneRole(PaneRole role) {
        return new PaneNode(getKey(), getParentKey(), paneConfigurations, role, backBehavior, scopeKey);
    }

    public PaneNode withPaneConfigurations(Map<PaneRole, PaneConfiguration> configurations, PaneRole activeRole) {
        return new PaneNode(getKey(), getParentKey(), configurations, activeRole, backBehavior, scopeKey);
    }

    /**
     * Returns a copy of this pane node with the content of one role replaced.
     */
    public PaneNode withPaneContent(PaneRole role, NavNode content) {
        PaneConfiguration existing = paneConfigurations.get(role);
        if (existing == null) {
            throw new IllegalArgumentException(
                String.format("PaneNode '%s' has no %s pane", getKey(), role)
            );
        }
        Map<PaneRole, PaneConfiguration> newConfigurations = new EnumMap<>(paneConfigurations);
        newConfigurations.put(role, existing.withContent(content));
        return withPaneConfigurations(newConfigurations, activePaneRole);
    }

    @Override
    public PaneNode withParentKey(String newParentKey) {
        return new PaneNode(getKey(), newParentKey, paneConfigurations, activePaneRole, backBehavior, scopeKey);
    }

    @Override
    public boolean canHandleBackInternally() {
        for (PaneConfiguration config : paneConfigurations.values()) {
            StackNode stack = config.content().activeStack();
            if (stack != null && stack.canGoBack()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PaneNode)) return false;
        PaneNode other = (PaneNode) obj;
        return getKey().equals(other.getKey())
            && Objects.equals(getParentKey(), other.getParentKey())
            && activePaneRole == other.activePaneRole
            && backBehavior == other.backBehavior
            && Objects.equals(scopeKey, other.scopeKey)
            && paneConfigurations.equals(other.paneConfigurations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKey(), getParentKey(), activePaneRole, backBehavior, scopeKey, paneConfigurations);
    }

    @Override
    public String toString() {
        return "Pane(" + getKey() + ", active=" + activePaneRole + ", " + paneConfigurations.keySet() + ")";
    }
}
