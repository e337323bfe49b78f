package com.wayfinder.validation;

import com.wayfinder.config.NavigatorConfig;
import com.wayfinder.diagnostics.TreeDumper;
import com.wayfinder.node.NavNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Checks the structural invariants of a navigation tree:
 * - the root has no parent key
 * - keys are unique within the tree
 * - every child names its container as parent
 * - nesting depth and node count stay within limits
 * 
 * Variant-level rules (tab index range, PRIMARY pane present) are enforced
 * by the node constructors already.
 */
public class TreeValidator {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeValidator.class);
    
    private final int maxDepth;
    private final int maxNodeCount;
    
    public TreeValidator(NavigatorConfig config) {
        this(config.maxDepth(), config.maxNodeCount());
    }
    
    public TreeValidator(int maxDepth, int maxNodeCount) {
        this.maxDepth = maxDepth;
        this.maxNodeCount = maxNodeCount;
    }
    
    /**
     * Validates a tree.
     * 
     * @param root the tree root
     * @throws TreeValidationException describing the first violation found
     */
    public void validate(NavNode root) {
        Objects.requireNonNull(root, "Root cannot be null");
        
        if (root.getParentKey() != null) {
            fail(String.format("Root '%s' must not have a parent key, found '%s'", root.getKey(), root.getParentKey()),
                root.getKey(), root);
        }
        
        Set<String> seenKeys = new HashSet<>();
        int count = validateNode(root, root.getKey(), 0, seenKeys);
        LOGGER.debug("Tree '{}' is valid: {} nodes", root.getKey(), count);
    }
    
    private int validateNode(NavNode node, String path, int depth, Set<String> seenKeys) {
        // Check depth limit
        if (depth > maxDepth) {
            fail(String.format("Maximum depth of %d exceeded", maxDepth), path, node);
        }
        
        if (!seenKeys.add(node.getKey())) {
            fail(String.format("Duplicate node key '%s'", node.getKey()), path, node);
        }
        
        // Check node count limit
        if (seenKeys.size() > maxNodeCount) {
            fail(String.format("Maximum node count of %d exceeded", maxNodeCount), path, node);
        }
        
        int count = 1;
        for (NavNode child : node.children()) {
            String childPath = path + "/" + child.getKey();
            if (!node.getKey().equals(child.getParentKey())) {
                fail(String.format("Node '%s' names parent '%s' but is held by '%s'",
                    child.getKey(), child.getParentKey(), node.getKey()), childPath, child);
            }
            count += validateNode(child, childPath, depth + 1, seenKeys);
        }
        return count;
    }
    
    private static void fail(String message, String path, NavNode node) {
        TreeValidationException error = new TreeValidationException(message, path, TreeDumper.summarize(node));
        LOGGER.error(error.getDetailedMessage());
        throw error;
    }
}
