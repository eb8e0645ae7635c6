package com.maogame.automaton;

import com.maogame.errors.InvalidChoiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.maogame.automaton.ActionToken.DO_ACTION;
import static com.maogame.automaton.ActionToken.SELECT_CARD;
import static com.maogame.automaton.ActionToken.SELECT_DRAWABLE_STACK;
import static com.maogame.automaton.ActionToken.SELECT_PLAYABLE_STACK;
import static com.maogame.automaton.ActionToken.SELECT_PLAYER;
import static com.maogame.automaton.ActionToken.SELECT_RULE;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Automaton Tests")
class AutomatonTest {

    private final InteractionHandler play = (player, core, steps) -> List.of();
    private final InteractionHandler draw = (player, core, steps) -> List.of();
    private final InteractionHandler gesture = (player, core, steps) -> List.of();
    private final InteractionHandler ruleAction = (player, core, steps) -> List.of();

    private Automaton automaton;

    @BeforeEach
    void setUp() {
        automaton = new Automaton();
    }

    private List<List<AutomatonNode>> basicPaths() {
        return List.of(
                List.of(AutomatonNode.branch(SELECT_CARD), AutomatonNode.leaf(SELECT_PLAYABLE_STACK, play)),
                List.of(AutomatonNode.leaf(SELECT_DRAWABLE_STACK, draw)),
                List.of(AutomatonNode.branch(SELECT_PLAYER), AutomatonNode.leaf(DO_ACTION, gesture)));
    }

    @Nested
    @DisplayName("Insertion")
    class Insertion {

        @Test
        @DisplayName("Should reject an empty path")
        void rejectsEmptyPath() {
            assertThrows(IllegalArgumentException.class, () -> automaton.insert(List.of()));
        }

        @Test
        @DisplayName("Should reject a handler before the last node")
        void rejectsHandlerInsidePath() {
            List<AutomatonNode> path = List.of(
                    AutomatonNode.leaf(SELECT_CARD, play),
                    AutomatonNode.leaf(SELECT_PLAYABLE_STACK, play));

            assertThrows(IllegalArgumentException.class, () -> automaton.insert(path));
        }

        @Test
        @DisplayName("Should reject a path ending on a branch")
        void rejectsPathWithoutLeaf() {
            List<AutomatonNode> path = List.of(AutomatonNode.branch(SELECT_CARD));

            assertThrows(IllegalArgumentException.class, () -> automaton.insert(path));
        }

        @Test
        @DisplayName("Should share branches with the same token")
        void sharesBranches() {
            automaton.insert(List.of(AutomatonNode.branch(SELECT_CARD), AutomatonNode.leaf(SELECT_PLAYABLE_STACK, play)));
            automaton.insert(List.of(AutomatonNode.branch(SELECT_CARD), AutomatonNode.leaf(DO_ACTION, gesture)));

            assertEquals(3, automaton.nodeCount());
        }

        @Test
        @DisplayName("Should reject a second leaf with the same token and rule under one parent")
        void rejectsDuplicateLeaf() {
            automaton.insert(List.of(AutomatonNode.leaf(SELECT_DRAWABLE_STACK, "Rule A", draw)));

            assertThrows(IllegalArgumentException.class,
                    () -> automaton.insert(List.of(AutomatonNode.leaf(SELECT_DRAWABLE_STACK, "Rule A", play))));
        }

        @Test
        @DisplayName("Should accept leaves with the same token for different rules")
        void acceptsLeavesOfDifferentRules() {
            automaton.insert(List.of(AutomatonNode.leaf(SELECT_DRAWABLE_STACK, draw)));
            automaton.insert(List.of(AutomatonNode.leaf(SELECT_DRAWABLE_STACK, "Rule A", ruleAction)));

            assertEquals(2, automaton.nodeCount());
        }

        @Test
        @DisplayName("Should drop the rule tag of intermediate nodes")
        void stripsRuleOfBranches() {
            AutomatonNode taggedBranch = AutomatonNode.branch(SELECT_CARD).withRule("Rule A");
            automaton.insert(List.of(taggedBranch, AutomatonNode.leaf(SELECT_PLAYABLE_STACK, play)));
            automaton.insert(List.of(AutomatonNode.branch(SELECT_CARD), AutomatonNode.leaf(DO_ACTION, gesture)));

            automaton.onAction(InteractionStep.of(SELECT_CARD, 0));

            assertNull(automaton.currentNode().orElseThrow().rule());
            assertEquals(3, automaton.nodeCount());
        }
    }

    @Nested
    @DisplayName("Feeding steps")
    class FeedingSteps {

        @BeforeEach
        void insertBasicPaths() {
            automaton.extend(basicPaths());
        }

        @Test
        @DisplayName("Should advance on branches and resolve the leaf with the full sequence")
        void replaysEveryPath() {
            for (List<AutomatonNode> path : basicPaths()) {
                List<InteractionStep> sent = new ArrayList<>();
                for (int i = 0; i < path.size(); i++) {
                    InteractionStep step = InteractionStep.of(path.get(i).token(), i);
                    sent.add(step);
                    InteractionResult result = automaton.onAction(step);
                    if (i < path.size() - 1) {
                        assertInstanceOf(InteractionResult.AdvancedNextState.class, result);
                    } else {
                        InteractionResult.Leaf leaf = assertInstanceOf(InteractionResult.Leaf.class, result);
                        assertEquals(sent, leaf.steps());
                        assertSame(path.get(i).handler(), leaf.handler());
                    }
                }
                assertTrue(automaton.currentNode().isEmpty(), "cursor should be back at the root");
            }
        }

        @Test
        @DisplayName("Should report no interaction for an unknown token without moving")
        void noInteraction() {
            automaton.onAction(InteractionStep.of(SELECT_CARD, 3));

            assertInstanceOf(InteractionResult.NoInteractionFound.class, automaton.onAction(InteractionStep.of(SELECT_RULE)));
            assertEquals(List.of(InteractionStep.of(SELECT_CARD, 3)), automaton.executedSteps());
        }

        @Test
        @DisplayName("Should keep the payload committed on a branch")
        void keepsCommittedPayload() {
            automaton.onAction(InteractionStep.of(SELECT_PLAYER, 2));
            InteractionResult result = automaton.onAction(InteractionStep.of(DO_ACTION, "knock"));

            InteractionResult.Leaf leaf = assertInstanceOf(InteractionResult.Leaf.class, result);
            assertEquals(2, leaf.steps().get(0).expectIndex());
            assertEquals("knock", leaf.steps().get(1).expectText());
        }
    }

    @Nested
    @DisplayName("Ambiguity")
    class Ambiguity {

        @BeforeEach
        void insertAmbiguousPaths() {
            automaton.insert(List.of(AutomatonNode.branch(SELECT_CARD), AutomatonNode.branch(SELECT_PLAYABLE_STACK),
                    AutomatonNode.leaf(DO_ACTION, ruleAction)));
            automaton.insert(List.of(AutomatonNode.branch(SELECT_CARD), AutomatonNode.leaf(SELECT_PLAYABLE_STACK, play)));
            automaton.onAction(InteractionStep.of(SELECT_CARD, 0));
        }

        @Test
        @DisplayName("Should list leaves first and branches last")
        void candidatesBranchesLast() {
            InteractionResult result = automaton.onAction(InteractionStep.of(SELECT_PLAYABLE_STACK, 1));

            InteractionResult.Candidates candidates = assertInstanceOf(InteractionResult.Candidates.class, result);
            assertEquals(2, candidates.nodes().size());
            assertTrue(candidates.nodes().get(0).isLeaf());
            assertFalse(candidates.nodes().get(1).isLeaf());
        }

        @Test
        @DisplayName("Should resolve the chosen leaf and reset")
        void chooseLeaf() {
            InteractionResult result = automaton.onActionIndexed(InteractionStep.of(SELECT_PLAYABLE_STACK, 1), 0);

            InteractionResult.Leaf leaf = assertInstanceOf(InteractionResult.Leaf.class, result);
            assertSame(play, leaf.handler());
            assertEquals(2, leaf.steps().size());
            assertTrue(automaton.currentNode().isEmpty());
        }

        @Test
        @DisplayName("Should enter the chosen branch")
        void chooseBranch() {
            InteractionResult result = automaton.onActionIndexed(InteractionStep.of(SELECT_PLAYABLE_STACK, 1), 1);

            assertInstanceOf(InteractionResult.AdvancedNextState.class, result);
            assertEquals(SELECT_PLAYABLE_STACK, automaton.currentNode().orElseThrow().token());
        }

        @Test
        @DisplayName("Should reject an index past the candidates")
        void rejectsOutOfRangeChoice() {
            InvalidChoiceException error = assertThrows(InvalidChoiceException.class,
                    () -> automaton.onActionIndexed(InteractionStep.of(SELECT_PLAYABLE_STACK), 2));

            assertEquals(2, error.candidateCount());
            assertEquals(SELECT_CARD, automaton.currentNode().orElseThrow().token());
        }

        @Test
        @DisplayName("Should return a non-ambiguous result unchanged")
        void nonAmbiguousIgnoresIndex() {
            automaton.reset();

            assertInstanceOf(InteractionResult.AdvancedNextState.class,
                    automaton.onActionIndexed(InteractionStep.of(SELECT_CARD), 5));
        }
    }

    @Nested
    @DisplayName("Navigation")
    class Navigation {

        @BeforeEach
        void insertBasicPaths() {
            automaton.extend(basicPaths());
        }

        @Test
        @DisplayName("Should do nothing when cancelling at the root")
        void cancelAtRoot() {
            assertTrue(automaton.cancelLast().isEmpty());
        }

        @Test
        @DisplayName("Should step back to the parent and return the undone node")
        void cancelStepsBack() {
            automaton.onAction(InteractionStep.of(SELECT_CARD, 1));

            assertEquals(SELECT_CARD, automaton.cancelLast().orElseThrow().token());
            assertTrue(automaton.currentNode().isEmpty());
            assertTrue(automaton.executedSteps().isEmpty());
        }

        @Test
        @DisplayName("Should check a path prefix from the cursor")
        void pathExists() {
            assertTrue(automaton.pathExists(List.of(SELECT_CARD, SELECT_PLAYABLE_STACK)));
            assertTrue(automaton.pathExists(List.of(SELECT_PLAYER, SELECT_RULE)));
            assertFalse(automaton.pathExists(List.of(SELECT_RULE, SELECT_CARD)));

            automaton.onAction(InteractionStep.of(SELECT_CARD));
            assertFalse(automaton.pathExists(List.of(SELECT_CARD, SELECT_PLAYABLE_STACK)));
        }
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("Should be equal whatever the insertion order")
        void orderIndependent() {
            List<List<AutomatonNode>> reversed = new ArrayList<>(basicPaths());
            Collections.reverse(reversed);
            Automaton other = new Automaton();

            automaton.extend(basicPaths());
            other.extend(reversed);

            assertTrue(automaton.isStructurallyEqualTo(other));
            assertTrue(other.isStructurallyEqualTo(automaton));
        }

        @Test
        @DisplayName("Should tell leaves apart by handler identity")
        void handlerIdentityMatters() {
            Automaton other = new Automaton();
            automaton.insert(List.of(AutomatonNode.leaf(SELECT_DRAWABLE_STACK, draw)));
            other.insert(List.of(AutomatonNode.leaf(SELECT_DRAWABLE_STACK, (player, core, steps) -> List.of())));

            assertFalse(automaton.isStructurallyEqualTo(other));
        }

        @Test
        @DisplayName("Should come back to the same shape after extending and removing paths")
        void extendThenRemove() {
            List<List<AutomatonNode>> rulePaths = List.of(
                    List.of(AutomatonNode.branch(SELECT_CARD), AutomatonNode.leaf(SELECT_PLAYABLE_STACK, "Rule A", ruleAction)),
                    List.of(AutomatonNode.branch(SELECT_RULE), AutomatonNode.branch(SELECT_PLAYER),
                            AutomatonNode.leaf(DO_ACTION, "Rule A", ruleAction)));
            Automaton reference = new Automaton();
            reference.extend(basicPaths());
            automaton.extend(basicPaths());

            automaton.extend(rulePaths);
            assertFalse(automaton.isStructurallyEqualTo(reference));

            automaton.removePaths(rulePaths);
            assertTrue(automaton.isStructurallyEqualTo(reference));
            assertEquals(reference.nodeCount(), automaton.nodeCount());
        }

        @Test
        @DisplayName("Should leave no path behind when extending fails")
        void failedExtendRollsBack() {
            Automaton reference = new Automaton();
            reference.extend(basicPaths());
            automaton.extend(basicPaths());
            List<AutomatonNode> rulePath = List.of(AutomatonNode.branch(SELECT_RULE), AutomatonNode.leaf(DO_ACTION, "Rule A", ruleAction));
            List<AutomatonNode> cardPath = List.of(AutomatonNode.branch(SELECT_CARD), AutomatonNode.leaf(SELECT_RULE, "Rule A", ruleAction));

            assertThrows(IllegalArgumentException.class, () -> automaton.extend(List.of(rulePath, cardPath, rulePath)));

            assertTrue(automaton.isStructurallyEqualTo(reference));
            assertEquals(reference.nodeCount(), automaton.nodeCount());
        }

        @Test
        @DisplayName("Should reset the cursor when its node is removed")
        void removalResetsCursor() {
            List<AutomatonNode> path = List.of(AutomatonNode.branch(SELECT_RULE), AutomatonNode.leaf(DO_ACTION, ruleAction));
            automaton.insert(path);
            automaton.onAction(InteractionStep.of(SELECT_RULE));

            automaton.removePaths(List.of(path));

            assertTrue(automaton.currentNode().isEmpty());
            assertEquals(0, automaton.nodeCount());
        }

        @Test
        @DisplayName("Should ignore the removal of a missing path")
        void removeMissingPath() {
            automaton.extend(basicPaths());

            automaton.removePaths(List.of(List.of(AutomatonNode.leaf(SELECT_RULE, ruleAction))));

            assertEquals(5, automaton.nodeCount());
        }
    }
}
