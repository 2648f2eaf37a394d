package ai.review.report;

import static org.junit.jupiter.api.Assertions.*;

import ai.review.events.ReviewMetadata;
import ai.review.events.SearchEvents.SimulationResult;
import ai.review.mcts.BackpropagationStep;
import ai.review.tree.Node;
import ai.review.tree.ReviewTree;
import java.util.List;
import org.junit.jupiter.api.Test;

class BestPathSelectorTest {

    private static final ReviewMetadata META = new ReviewMetadata("r-best", "owner/repo", "main", "Check errors", null, 4);

    @Test
    void rootOnlyTreeSelectsRoot() {
        ReviewTree tree = ReviewTree.withRoot("summary");

        ReviewOutcome outcome = BestPathSelector.outcome(META, tree, 0);

        assertEquals(tree.getRootId(), outcome.selectedNodeId());
        assertEquals("summary", outcome.state());
        assertEquals(List.of(tree.getRootId()), outcome.path());
        assertEquals(new ReviewStats(1, 0.0, 1, 0), outcome.stats());
        assertEquals(1, outcome.allNodes().size());
        assertEquals(4, outcome.commitsAnalyzed());
        assertEquals("owner/repo", outcome.repository());
    }

    @Test
    void followsMostVisitedChildNotHighestMean() {
        ReviewTree tree = ReviewTree.withRoot("root");
        Node lucky = tree.addChild(tree.getRootId(), "lucky", false);
        Node robust = tree.addChild(tree.getRootId(), "robust", false);
        lucky.recordVisit(1.0);
        robust.recordVisit(0.6);
        robust.recordVisit(0.6);
        robust.recordVisit(0.6);
        Node deeper = tree.addChild(robust.getId(), "deeper", false);
        deeper.recordVisit(0.6);

        assertEquals(List.of(tree.getRootId(), robust.getId(), deeper.getId()), BestPathSelector.bestPath(tree));
    }

    @Test
    void tieGoesToLowestIdAndUnvisitedChildrenEndThePath() {
        ReviewTree tree = ReviewTree.withRoot("root");
        Node a = tree.addChild(tree.getRootId(), "a", false);
        Node b = tree.addChild(tree.getRootId(), "b", false);
        a.recordVisit(0.1);
        b.recordVisit(0.9);
        tree.addChild(a.getId(), "unvisited", false);

        ReviewOutcome outcome = BestPathSelector.outcome(META, tree, 2);

        assertEquals(List.of(tree.getRootId(), a.getId()), outcome.path());
        assertEquals(a.getId(), outcome.selectedNodeId());
        assertEquals(1, outcome.stats().childrenCount());
        assertEquals(tree.root().getVisits(), outcome.stats().totalVisits());
        assertTrue(outcome.reasoning().startsWith("0. [n000000"));
        assertTrue(outcome.reasoning().contains("1. [n000001 visits=1 mean=0.1000] a"));
    }

    @Test
    void totalVisitsCountsSimulationsOnceWhateverTheirDepth() {
        ReviewTree tree = ReviewTree.withRoot("root");
        Node child = tree.addChild(tree.getRootId(), "child", false);
        Node grandchild = tree.addChild(child.getId(), "grandchild", false);
        SimulationResult deep = new SimulationResult(grandchild.getId(), 0.5, "scored 0.5000");
        tree = BackpropagationStep.backpropagate(tree, deep).value().tree();
        tree = BackpropagationStep.backpropagate(tree, deep).value().tree();

        ReviewOutcome outcome = BestPathSelector.outcome(META, tree, 2);

        assertEquals(grandchild.getId(), outcome.selectedNodeId());
        assertEquals(3, outcome.stats().totalVisits(), "initial evaluation plus two simulations");
    }

    @Test
    void outcomeSnapshotIsDetachedFromTree() {
        ReviewTree tree = ReviewTree.withRoot("root");

        ReviewOutcome outcome = BestPathSelector.outcome(META, tree, 0);
        tree.root().recordVisit(1.0);

        assertEquals(1, outcome.allNodes().get(tree.getRootId()).getVisits());
    }
}
