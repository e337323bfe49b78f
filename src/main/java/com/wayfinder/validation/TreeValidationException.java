package com.wayfinder.validation;

/**
 * Exception thrown when a navigation tree is not well formed.
 * 
 * Carries the key path from the root to the offending node and a JSON
 * summary of that node for debugging.
 */
public class TreeValidationException extends RuntimeException {
    
    private final String nodePath;
    private final String nodeSnippet;
    
    /**
     * Creates a new tree validation exception.
     * 
     * @param message human-readable error message
     */
    public TreeValidationException(String message) {
        this(message, null, null);
    }
    
    /**
     * Creates a new tree validation exception with node context.
     * 
     * @param message human-readable error message
     * @param nodePath slash-separated key path of the offending node
     * @param nodeSnippet JSON summary of the offending node
     */
    public TreeValidationException(String message, String nodePath, String nodeSnippet) {
        super(message);
        this.nodePath = nodePath;
        this.nodeSnippet = nodeSnippet;
    }
    
    /**
     * Gets the key path of the offending node.
     * 
     * @return the path, or null if not available
     */
    public String getNodePath() {
        return nodePath;
    }
    
    /**
     * Gets the JSON summary of the offending node.
     * 
     * @return the snippet, or null if not available
     */
    public String getNodeSnippet() {
        return nodeSnippet;
    }
    
    /**
     * Returns a detailed error message suitable for logging.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        
        if (nodePath != null) {
            sb.append(" at path: ").append(nodePath);
        }
        
        if (nodeSnippet != null) {
            sb.append(" | Node: ").append(nodeSnippet);
        }
        
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return "TreeValidationException: " + getDetailedMessage();
    }
}
