package com.wayfinder.tree;

import com.wayfinder.node.PaneRole;

import java.util.Objects;

/**
 * Where a scope-aware push lands.
 *
 * @param kind the chosen strategy
 * @param targetKey key of the stack to push onto, or of the tab/pane node to act on
 * @param tabIndex tab to select for {@link Kind#SWITCH_TO_TAB}, otherwise -1
 * @param paneRole pane to push into for {@link Kind#PUSH_TO_PANE}, otherwise null
 */
public record PushStrategy(Kind kind, String targetKey, int tabIndex, PaneRole paneRole) {

    /**
     * Strategies in the order a container can trigger them.
     */
    public enum Kind {
        /** Push on top of a scoped container, into its parent stack. */
        PUSH_OUT_OF_SCOPE,
        /** Select a tab that already shows a destination of the same kind. */
        SWITCH_TO_TAB,
        /** Push into a pane's stack and focus that pane. */
        PUSH_TO_PANE,
        /** Push onto the deepest active stack. */
        PUSH_TO_STACK
    }

    public PushStrategy {
        Objects.requireNonNull(kind, "Strategy kind cannot be null");
        Objects.requireNonNull(targetKey, "Strategy target cannot be null");
    }

    static PushStrategy outOfScope(String parentStackKey) {
        return new PushStrategy(Kind.PUSH_OUT_OF_SCOPE, parentStackKey, -1, null);
    }

    static PushStrategy switchToTab(String tabKey, int index) {
        return new PushStrategy(Kind.SWITCH_TO_TAB, tabKey, index, null);
    }

    static PushStrategy toPane(String paneKey, PaneRole role) {
        return new PushStrategy(Kind.PUSH_TO_PANE, paneKey, -1, role);
    }

    static PushStrategy toStack(String stackKey) {
        return new PushStrategy(Kind.PUSH_TO_STACK, stackKey, -1, null);
    }
}
