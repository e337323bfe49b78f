package com.wayfinder.node;

import java.util.Objects;

/**
 * Content and adaptation settings of one pane slot.
 * 
 * @param content the subtree shown in the pane, usually a {@link StackNode}
 * @param adaptStrategy how the pane adapts on small windows
 */
public record PaneConfiguration(NavNode content, AdaptStrategy adaptStrategy) {
    
    public PaneConfiguration {
        Objects.requireNonNull(content, "Pane content cannot be null");
        Objects.requireNonNull(adaptStrategy, "Adapt strategy cannot be null");
    }
    
    public PaneConfiguration(NavNode content) {
        this(content, AdaptStrategy.HIDE);
    }
    
    /**
     * Returns a copy of this configuration with different content.
     */
    public PaneConfiguration withContent(NavNode newContent) {
        return new PaneConfiguration(newContent, adaptStrategy);
    }
}
