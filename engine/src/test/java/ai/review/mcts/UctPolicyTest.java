package ai.review.mcts;

import static org.junit.jupiter.api.Assertions.*;

import ai.review.tree.IterationContext;
import ai.review.tree.Node;
import ai.review.tree.ReviewTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * UCT scoring and the selection walk.
 *
 * <p>Tests cover the formula, unexplored-first behaviour, lowest-id tie-break, and the three
 * stop conditions of the walk (leaf, terminal node, depth limit).
 */
class UctPolicyTest {

    private static final double C = 1.414;

    private static IterationContext context(int maxDepth) {
        return new IterationContext(10, 0, C, maxDepth);
    }

    @Nested
    @DisplayName("uct")
    class UctTests {

        @Test
        void unvisitedChildHasInfinitePriority() {
            ReviewTree tree = ReviewTree.withRoot("root");
            Node child = tree.addChild(tree.getRootId(), "a", false);

            assertEquals(Double.POSITIVE_INFINITY, UctPolicy.uct(child, 5, C));
        }

        @Test
        void matchesMeanPlusExplorationBonus() {
            ReviewTree tree = ReviewTree.withRoot("root");
            Node child = tree.addChild(tree.getRootId(), "a", false);
            child.recordVisit(0.8);
            child.recordVisit(0.4);

            double expected = 0.6 + C * Math.sqrt(Math.log(10) / 2);
            assertEquals(expected, UctPolicy.uct(child, 10, C), 1e-12);
        }
    }

    @Nested
    @DisplayName("bestChild")
    class BestChildTests {

        @Test
        void prefersUnexploredChildOverStrongVisitedOne() {
            ReviewTree tree = ReviewTree.withRoot("root");
            Node strong = tree.addChild(tree.getRootId(), "strong", false);
            Node fresh = tree.addChild(tree.getRootId(), "fresh", false);
            strong.recordVisit(1.0);

            assertEquals(fresh.getId(), UctPolicy.bestChild(tree, tree.root(), C).getId());
        }

        @Test
        void tiesGoToLowestId() {
            ReviewTree tree = ReviewTree.withRoot("root");
            Node first = tree.addChild(tree.getRootId(), "first", false);
            tree.addChild(tree.getRootId(), "second", false);
            tree.addChild(tree.getRootId(), "third", false);

            // all unvisited: every score is +Infinity
            assertEquals(first.getId(), UctPolicy.bestChild(tree, tree.root(), C).getId());
        }

        @Test
        void higherMeanWinsAtEqualVisits() {
            ReviewTree tree = ReviewTree.withRoot("root");
            Node weak = tree.addChild(tree.getRootId(), "weak", false);
            Node good = tree.addChild(tree.getRootId(), "good", false);
            weak.recordVisit(0.2);
            good.recordVisit(0.9);
            tree.root().recordVisit(0.2);
            tree.root().recordVisit(0.9);

            assertEquals(good.getId(), UctPolicy.bestChild(tree, tree.root(), C).getId());
        }
    }

    @Nested
    @DisplayName("select")
    class SelectTests {

        @Test
        void rootWithoutChildrenIsSelected() {
            ReviewTree tree = ReviewTree.withRoot("root");

            assertEquals(tree.getRootId(), UctPolicy.select(tree, context(5)));
        }

        @Test
        void descendsToUnexploredLeaf() {
            ReviewTree tree = ReviewTree.withRoot("root");
            Node a = tree.addChild(tree.getRootId(), "a", false);
            a.recordVisit(0.5);
            tree.root().recordVisit(0.5);
            Node a1 = tree.addChild(a.getId(), "a1", false);

            // a is the only child; below it a1 is unvisited
            assertEquals(a1.getId(), UctPolicy.select(tree, context(5)));
        }

        @Test
        void stopsAtTerminalNode() {
            ReviewTree tree = ReviewTree.withRoot("root");
            Node a = tree.addChild(tree.getRootId(), "a", false);
            tree.addChild(a.getId(), "a1", false);
            tree.node(a.getId()).markTerminal();

            assertEquals(a.getId(), UctPolicy.select(tree, context(5)));
        }

        @Test
        void stopsAtDepthLimit() {
            ReviewTree tree = ReviewTree.withRoot("root");
            Node a = tree.addChild(tree.getRootId(), "a", false);
            tree.addChild(a.getId(), "a1", false);

            assertEquals(a.getId(), UctPolicy.select(tree, context(1)));
            assertEquals(tree.getRootId(), UctPolicy.select(tree, context(0)));
        }
    }
}
