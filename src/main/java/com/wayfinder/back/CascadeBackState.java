package com.wayfinder.back;

import com.wayfinder.node.NavNode;

/**
 * Preview of what a back press would do, for gesture-driven back.
 * 
 * @param sourceNode the node shown before back
 * @param exitingNode the topmost node that back removes; the source itself
 *        when back only moves pane focus or is delegated to the host
 * @param targetNode the active leaf after back, null when delegating
 * @param animatingContainerKey key of the container hosting the transition,
 *        null when delegating
 * @param cascadeDepth number of exhausted containers collapsed by back,
 *        0 for a pop inside the current container
 * @param delegatesToSystem true if the host platform has to handle back
 */
public record CascadeBackState(
    NavNode sourceNode,
    NavNode exitingNode,
    NavNode targetNode,
    String animatingContainerKey,
    int cascadeDepth,
    boolean delegatesToSystem
) {
    
    /**
     * Checks whether back removes a whole container rather than one screen.
     */
    public boolean wouldCascade() {
        return !delegatesToSystem && cascadeDepth > 0;
    }
}
