package com.wayfinder.node;

/**
 * How a pane behaves when the window is too small to show it side by side.
 * 
 * The engine only stores this value; the renderer interprets it.
 */
public enum AdaptStrategy {
    HIDE,
    LEVITATE,
    REFLOW
}
