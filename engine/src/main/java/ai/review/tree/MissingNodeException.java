package ai.review.tree;

import ai.review.ReviewException;

/**
 * Raised when an id referenced by an event or by a parent link is not present in the tree.
 * Usually a stale event or a corrupted snapshot.
 */
public class MissingNodeException extends ReviewException {

    private final String nodeId;

    public MissingNodeException(String nodeId) {
        super("Node not found in tree: " + nodeId);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
