package ai.review.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single reasoning state in the review search tree.
 *
 * <p>Nodes never hold references to other nodes. Parent and children are expressed as ids and
 * resolved through the owning {@link ReviewTree}. This keeps the tree trivially copyable and
 * serialisable, which matters because every phase receives its own snapshot.
 *
 * <p>MCTS statistics:
 * <ul>
 *   <li>{@code visits}: number of backpropagated simulations that passed through this node
 *   <li>{@code value}: running sum of rewards from those simulations
 * </ul>
 * The mean quality is {@code value / visits} once the node has been visited.
 */
public final class Node {

    private final String id;
    private final String parent;
    private final List<String> children;
    private int visits;
    private double value;
    private final String state;
    private boolean terminal;

    @JsonCreator
    Node(
            @JsonProperty("id") String id,
            @JsonProperty("parent") String parent,
            @JsonProperty("children") List<String> children,
            @JsonProperty("visits") int visits,
            @JsonProperty("value") double value,
            @JsonProperty("state") String state,
            @JsonProperty("terminal") boolean terminal) {
        this.id = Objects.requireNonNull(id, "id");
        this.parent = parent;
        this.children = children == null ? new ArrayList<>() : new ArrayList<>(children);
        if (visits < 0) {
            throw new IllegalArgumentException("visits must be non-negative for node " + id + ": " + visits);
        }
        this.visits = visits;
        this.value = value;
        this.state = state == null ? "" : state;
        this.terminal = terminal;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    /**
     * Parent id as stored, {@code null} for the root. Kept for serialisation; callers should
     * prefer {@link #parent()}.
     */
    @JsonProperty("parent")
    public String getParentId() {
        return parent;
    }

    /**
     * @return the parent id, or empty if this is the root
     */
    @JsonIgnore
    public Optional<String> parent() {
        return Optional.ofNullable(parent);
    }

    @JsonIgnore
    public boolean isRoot() {
        return parent == null;
    }

    /**
     * @return child ids in expansion order (read-only view)
     */
    @JsonProperty("children")
    public List<String> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @JsonProperty("visits")
    public int getVisits() {
        return visits;
    }

    @JsonProperty("value")
    public double getValue() {
        return value;
    }

    @JsonProperty("state")
    public String getState() {
        return state;
    }

    @JsonProperty("terminal")
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Mean reward, or 0.0 if the node has never been visited.
     */
    @JsonIgnore
    public double getMeanValue() {
        if (visits == 0) {
            return 0.0;
        }
        return value / visits;
    }

    /**
     * Records one backpropagated simulation: one more visit and the full reward.
     *
     * @param reward the simulation reward
     */
    public void recordVisit(double reward) {
        this.visits++;
        this.value += reward;
    }

    /**
     * Marks this node as a leaf that cannot be expanded any further.
     */
    public void markTerminal() {
        this.terminal = true;
    }

    void addChildId(String childId) {
        if (!children.contains(childId)) {
            children.add(childId);
        }
    }

    Node copy() {
        return new Node(id, parent, children, visits, value, state, terminal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node)) {
            return false;
        }
        Node other = (Node) o;
        return visits == other.visits
                && Double.compare(value, other.value) == 0
                && terminal == other.terminal
                && id.equals(other.id)
                && Objects.equals(parent, other.parent)
                && children.equals(other.children)
                && state.equals(other.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, parent, children, visits, value, state, terminal);
    }

    @Override
    public String toString() {
        return "Node{" + id + ", parent=" + parent + ", children=" + children.size()
                + ", visits=" + visits + ", value=" + String.format("%.4f", value)
                + (terminal ? ", terminal" : "") + "}";
    }
}
