package ai.review.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Arena holding every {@link Node} of one review's search tree, keyed by id.
 *
 * <p><b>Ownership:</b> the tree is the only container of nodes. Relationships are ids, so a
 * snapshot can be copied wholesale with {@link #copy()} and handed to the next phase without
 * any shared mutable state between phases.
 *
 * <p><b>Ids:</b> fresh ids come from an internal sequence and are zero padded
 * ({@code n000000}, {@code n000001}, ...). Lexical order therefore equals creation order, which
 * the selection tie-break relies on. The root is always the first id handed out.
 *
 * <p><b>Walks:</b> every walk over parent links is bounded by {@link #size()}. A longer walk
 * can only mean a cycle and fails with {@link TreeCorruptionException} instead of looping.
 */
public final class ReviewTree {

    private static final String ID_FORMAT = "n%06d";

    private final Map<String, Node> nodes;
    private final String rootId;
    private long nextSequence;

    @JsonCreator
    ReviewTree(
            @JsonProperty("nodes") Map<String, Node> nodes,
            @JsonProperty("rootId") String rootId,
            @JsonProperty("nextSequence") long nextSequence) {
        this.nodes = new LinkedHashMap<>(Objects.requireNonNull(nodes, "nodes"));
        this.rootId = Objects.requireNonNull(rootId, "rootId");
        if (!this.nodes.containsKey(rootId)) {
            throw new MissingNodeException(rootId);
        }
        this.nextSequence = Math.max(nextSequence, this.nodes.size());
    }

    /**
     * Creates a tree holding only a root node. The root starts with one visit and zero value,
     * matching the bootstrap evaluation that produced its state.
     *
     * @param rootState the initial context summary
     * @return a new single-node tree
     */
    public static ReviewTree withRoot(String rootState) {
        String id = String.format(ID_FORMAT, 0);
        Map<String, Node> nodes = new LinkedHashMap<>();
        nodes.put(id, new Node(id, null, List.of(), 1, 0.0, rootState, false));
        return new ReviewTree(nodes, id, 1);
    }

    @JsonProperty("rootId")
    public String getRootId() {
        return rootId;
    }

    @JsonProperty("nextSequence")
    public long getNextSequence() {
        return nextSequence;
    }

    /**
     * @return read-only view of every node, in creation order
     */
    @JsonProperty("nodes")
    public Map<String, Node> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    @JsonIgnore
    public Node root() {
        return nodes.get(rootId);
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Bounds-checked lookup.
     *
     * @param id the node id
     * @return the node
     * @throws MissingNodeException if the id is not in this tree
     */
    public Node node(String id) {
        Node node = id == null ? null : nodes.get(id);
        if (node == null) {
            throw new MissingNodeException(id);
        }
        return node;
    }

    public Optional<Node> findNode(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
    }

    /**
     * Adds a new unvisited child under {@code parentId}. This is the only way nodes other than
     * the root come into existence.
     *
     * @param parentId id of the node being expanded
     * @param state reasoning content of the new node
     * @param terminal whether the new node can never be expanded
     * @return the created child
     */
    public Node addChild(String parentId, String state, boolean terminal) {
        Node parent = node(parentId);
        String id = String.format(ID_FORMAT, nextSequence++);
        Node child = new Node(id, parent.getId(), List.of(), 0, 0.0, state, terminal);
        nodes.put(id, child);
        parent.addChildId(id);
        return child;
    }

    /**
     * Depth of a node, the root being 0.
     *
     * @throws MissingNodeException if the node or one of its ancestors is missing
     * @throws TreeCorruptionException if the parent chain is longer than the tree
     */
    public int depthOf(String id) {
        return ancestry(id).size() - 1;
    }

    /**
     * Ids from the given node up to the root, inclusive on both ends.
     *
     * @throws MissingNodeException if the node or one of its ancestors is missing
     * @throws TreeCorruptionException if the parent chain is longer than the tree
     */
    public List<String> ancestry(String id) {
        List<String> path = new ArrayList<>();
        Node current = node(id);
        path.add(current.getId());
        while (current.getParentId() != null) {
            if (path.size() > nodes.size()) {
                throw new TreeCorruptionException(
                        "Parent chain from " + id + " exceeds tree size " + nodes.size() + "; cycle suspected");
            }
            current = node(current.getParentId());
            path.add(current.getId());
        }
        return path;
    }

    /**
     * Checks the structural invariants of the arena: a single parentless node which is the
     * root, parents present, children lists that mirror parent links, and no cycles.
     *
     * @return human readable violations, empty when the tree is consistent
     */
    public List<String> invariantViolations() {
        List<String> violations = new ArrayList<>();
        for (Node node : nodes.values()) {
            String parentId = node.getParentId();
            if (parentId == null) {
                if (!node.getId().equals(rootId)) {
                    violations.add("second parentless node " + node.getId());
                }
                continue;
            }
            Node parent = nodes.get(parentId);
            if (parent == null) {
                violations.add("parent " + parentId + " of " + node.getId() + " missing");
            } else if (!parent.getChildren().contains(node.getId())) {
                violations.add(parentId + " does not list child " + node.getId());
            }
        }
        for (Node node : nodes.values()) {
            Set<String> seen = new HashSet<>();
            for (String childId : node.getChildren()) {
                Node child = nodes.get(childId);
                if (child == null) {
                    violations.add("child " + childId + " of " + node.getId() + " missing");
                } else if (!node.getId().equals(child.getParentId())) {
                    violations.add(childId + " listed under " + node.getId() + " but parent is " + child.getParentId());
                }
                if (!seen.add(childId)) {
                    violations.add("duplicate child " + childId + " under " + node.getId());
                }
            }
            try {
                ancestry(node.getId());
            } catch (TreeCorruptionException | MissingNodeException e) {
                violations.add(e.getMessage());
            }
        }
        return violations;
    }

    /**
     * Deep copy. Mutating the copy never affects this tree.
     */
    public ReviewTree copy() {
        Map<String, Node> copied = new LinkedHashMap<>();
        for (Map.Entry<String, Node> entry : nodes.entrySet()) {
            copied.put(entry.getKey(), entry.getValue().copy());
        }
        return new ReviewTree(copied, rootId, nextSequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReviewTree)) {
            return false;
        }
        ReviewTree other = (ReviewTree) o;
        return nextSequence == other.nextSequence && rootId.equals(other.rootId) && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, rootId, nextSequence);
    }

    @Override
    public String toString() {
        return "ReviewTree{root=" + rootId + ", nodes=" + nodes.size() + "}";
    }
}
