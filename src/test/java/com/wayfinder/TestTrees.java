package com.wayfinder;

import com.wayfinder.node.Destination;
import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneBackBehavior;
import com.wayfinder.node.PaneConfiguration;
import com.wayfinder.node.PaneNode;
import com.wayfinder.node.PaneRole;
import com.wayfinder.node.RouteDestination;
import com.wayfinder.node.ScreenNode;
import com.wayfinder.node.StackNode;
import com.wayfinder.node.TabNode;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Small builders for test trees. Parent keys are passed explicitly so that
 * fixtures read like the trees they describe.
 */
public final class TestTrees {
    
    private TestTrees() {}
    
    /** Destination kind used by type-based matching tests. */
    public static final class HomeDestination implements Destination {
        @Override
        public String getRoute() {
            return "home";
        }
        
        @Override
        public boolean equals(Object obj) {
            return obj instanceof HomeDestination;
        }
        
        @Override
        public int hashCode() {
            return 1;
        }
    }
    
    /** Second destination kind, parameterized by id. */
    public static final class DetailDestination implements Destination {
        private final String id;
        
        public DetailDestination(String id) {
            this.id = id;
        }
        
        @Override
        public String getRoute() {
            return "detail/" + id;
        }
        
        @Override
        public boolean equals(Object obj) {
            return obj instanceof DetailDestination && ((DetailDestination) obj).id.equals(id);
        }
        
        @Override
        public int hashCode() {
            return id.hashCode();
        }
    }
    
    public static ScreenNode screen(String key, String parentKey, String route) {
        return new ScreenNode(key, parentKey, RouteDestination.of(route));
    }
    
    public static ScreenNode screen(String key, String parentKey, Destination destination) {
        return new ScreenNode(key, parentKey, destination);
    }
    
    public static StackNode stack(String key, String parentKey, NavNode... children) {
        return new StackNode(key, parentKey, Arrays.asList(children));
    }
    
    public static StackNode scopedStack(String key, String parentKey, String scopeKey, NavNode... children) {
        return new StackNode(key, parentKey, Arrays.asList(children), scopeKey);
    }
    
    public static TabNode tabs(String key, String parentKey, int activeIndex, StackNode... stacks) {
        return new TabNode(key, parentKey, List.of(stacks), activeIndex);
    }
    
    public static TabNode scopedTabs(String key, String parentKey, String scopeKey, int activeIndex, StackNode... stacks) {
        return new TabNode(key, parentKey, List.of(stacks), activeIndex, scopeKey);
    }
    
    /**
     * Pane node with PRIMARY and, when {@code supporting} is non-null, SUPPORTING content.
     */
    public static PaneNode panes(String key, String parentKey, PaneRole active, PaneBackBehavior behavior,
                                 String scopeKey, NavNode primary, NavNode supporting) {
        Map<PaneRole, PaneConfiguration> configs = new EnumMap<>(PaneRole.class);
        configs.put(PaneRole.PRIMARY, new PaneConfiguration(primary));
        if (supporting != null) {
            configs.put(PaneRole.SUPPORTING, new PaneConfiguration(supporting));
        }
        return new PaneNode(key, parentKey, configs, active, behavior, scopeKey);
    }
    
    public static PaneNode panes(String key, String parentKey, PaneRole active, NavNode primary, NavNode supporting) {
        return panes(key, parentKey, active, PaneBackBehavior.POP_UNTIL_SCAFFOLD_VALUE_CHANGE, null, primary, supporting);
    }
    
    /**
     * Routes of the direct screen children of a stack.
     */
    public static List<String> routes(StackNode stack) {
        return stack.getChildren().stream()
            .map(child -> ((ScreenNode) child).getDestination().getRoute())
            .collect(Collectors.toList());
    }
}
