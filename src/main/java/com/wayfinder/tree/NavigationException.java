package com.wayfinder.tree;

/**
 * Exception thrown when a tree operation is asked to do something the tree
 * cannot support: a missing node, a missing active stack, or an operation
 * that would break a container invariant.
 * 
 * Exhausted-navigation outcomes (nothing left to pop, delegate to the host)
 * are reported as result values instead.
 */
public class NavigationException extends RuntimeException {
    
    /**
     * Failure categories.
     */
    public enum ErrorCode {
        /** No node in the tree has the requested key. */
        NODE_NOT_FOUND,
        /** The active path contains no stack to operate on. */
        NO_ACTIVE_STACK,
        /** The operation would remove the root node. */
        CANNOT_REMOVE_ROOT,
        /** The operation would break a container invariant. */
        INVALID_OPERATION,
        /** The target stack has no child to replace. */
        EMPTY_STACK,
        /** A tab index outside the tab node's range. */
        INDEX_OUT_OF_BOUNDS
    }
    
    private final ErrorCode code;
    private final String nodeKey;
    
    /**
     * Creates a new navigation exception.
     * 
     * @param code the failure category
     * @param message human-readable error message
     */
    public NavigationException(ErrorCode code, String message) {
        this(code, message, null);
    }
    
    /**
     * Creates a new navigation exception tied to a node.
     * 
     * @param code the failure category
     * @param message human-readable error message
     * @param nodeKey key of the node involved, may be null
     */
    public NavigationException(ErrorCode code, String message, String nodeKey) {
        super(message);
        this.code = code;
        this.nodeKey = nodeKey;
    }
    
    public static NavigationException nodeNotFound(String nodeKey) {
        return new NavigationException(ErrorCode.NODE_NOT_FOUND,
            String.format("Node with key '%s' not found", nodeKey), nodeKey);
    }
    
    public static NavigationException noActiveStack() {
        return new NavigationException(ErrorCode.NO_ACTIVE_STACK, "No active stack found in tree");
    }
    
    public static NavigationException cannotRemoveRoot(String nodeKey) {
        return new NavigationException(ErrorCode.CANNOT_REMOVE_ROOT,
            String.format("Cannot remove root node '%s'", nodeKey), nodeKey);
    }
    
    public static NavigationException invalidOperation(String nodeKey, String message) {
        return new NavigationException(ErrorCode.INVALID_OPERATION, message, nodeKey);
    }
    
    public ErrorCode getCode() {
        return code;
    }
    
    /**
     * Gets the key of the node involved in the failure.
     * 
     * @return the node key, or null if the failure is not tied to one node
     */
    public String getNodeKey() {
        return nodeKey;
    }
    
    /**
     * Returns a detailed error message suitable for logging.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder("[").append(code).append("] ").append(getMessage());
        if (nodeKey != null) {
            sb.append(" (node: ").append(nodeKey).append(")");
        }
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return "NavigationException: " + getDetailedMessage();
    }
}
