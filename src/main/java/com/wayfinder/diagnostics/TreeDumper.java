package com.wayfinder.diagnostics;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneConfiguration;
import com.wayfinder.node.PaneNode;
import com.wayfinder.node.PaneRole;
import com.wayfinder.node.ScreenNode;
import com.wayfinder.node.StackNode;
import com.wayfinder.node.TabNode;

import java.util.Map;

/**
 * Renders navigation trees as JSON for debug logs and error snippets.
 * 
 * The output is for humans; nothing reads it back.
 */
public final class TreeDumper {
    
    private static final Gson PRETTY = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .create();
    private static final Gson COMPACT = new Gson();
    
    private TreeDumper() {}
    
    /**
     * Renders a subtree as indented JSON.
     */
    public static String toJson(NavNode node) {
        return PRETTY.toJson(toJsonTree(node));
    }
    
    /**
     * Renders a subtree as single-line JSON.
     */
    public static String toCompactJson(NavNode node) {
        return COMPACT.toJson(toJsonTree(node));
    }
    
    /**
     * Renders one node without its descendants, used in error messages.
     */
    public static String summarize(NavNode node) {
        JsonObject json = describe(node);
        json.addProperty("childCount", node.children().size());
        return COMPACT.toJson(json);
    }
    
    /**
     * Builds the JSON tree of a subtree.
     */
    public static JsonObject toJsonTree(NavNode node) {
        JsonObject json = describe(node);
        
        if (node instanceof StackNode || node instanceof TabNode) {
            JsonArray children = new JsonArray();
            for (NavNode child : node.children()) {
                children.add(toJsonTree(child));
            }
            json.add(node instanceof TabNode ? "stacks" : "children", children);
        } else if (node instanceof PaneNode) {
            JsonObject panes = new JsonObject();
            for (Map.Entry<PaneRole, PaneConfiguration> entry : ((PaneNode) node).getPaneConfigurations().entrySet()) {
                JsonObject pane = new JsonObject();
                pane.addProperty("adaptStrategy", entry.getValue().adaptStrategy().name());
                pane.add("content", toJsonTree(entry.getValue().content()));
                panes.add(entry.getKey().name(), pane);
            }
            json.add("panes", panes);
        }
        return json;
    }
    
    private static JsonObject describe(NavNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("type", node.getType().name());
        json.addProperty("key", node.getKey());
        json.addProperty("parentKey", node.getParentKey());
        
        if (node instanceof ScreenNode) {
            json.addProperty("route", ((ScreenNode) node).getDestination().getRoute());
        } else if (node instanceof StackNode) {
            json.addProperty("scopeKey", ((StackNode) node).getScopeKey());
        } else if (node instanceof TabNode) {
            TabNode tab = (TabNode) node;
            json.addProperty("scopeKey", tab.getScopeKey());
            json.addProperty("activeStackIndex", tab.getActiveStackIndex());
        } else if (node instanceof PaneNode) {
            PaneNode pane = (PaneNode) node;
            json.addProperty("scopeKey", pane.getScopeKey());
            json.addProperty("activePaneRole", pane.getActivePaneRole().name());
            json.addProperty("backBehavior", pane.getBackBehavior().name());
        }
        return json;
    }
}
