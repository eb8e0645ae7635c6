package com.maogame.automaton;

import com.maogame.errors.InvalidChoiceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Prefix tree over interaction steps.
 * <p>
 * Paths are sequences of {@link AutomatonNode}s where every node but the last is a branch and the
 * last one is a leaf carrying the handler to run. Players feed steps one at a time through
 * {@link #onAction(InteractionStep)}; the automaton keeps a cursor on the node reached so far and
 * answers whether the step advanced, was ambiguous, resolved a leaf, or matched nothing.
 * <p>
 * Nodes live in a flat arena addressed by stable ids. Removed nodes keep their slot and are
 * flagged, so ids held elsewhere never point at a different node.
 */
public class Automaton {

    private static final Logger logger = Logger.getLogger(Automaton.class.getName());

    private static final int ROOT = 0;

    private static final Comparator<AutomatonNode> CHILD_ORDER = Comparator
            .comparing(AutomatonNode::token)
            .thenComparing(AutomatonNode::isLeaf)
            .thenComparing(AutomatonNode::rule, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final List<Entry> entries = new ArrayList<>();
    private int cursor = ROOT;

    private static final class Entry {
        private AutomatonNode node;
        private final int parent;
        private final List<Integer> children = new ArrayList<>();
        private boolean removed;

        private Entry(AutomatonNode node, int parent) {
            this.node = node;
            this.parent = parent;
        }
    }

    public Automaton() {
        entries.add(new Entry(null, -1));
    }

    /**
     * Inserts one path.
     *
     * @param path the nodes from the first step to the leaf
     * @throws IllegalArgumentException if the path is malformed or its leaf already exists
     */
    public void insert(List<AutomatonNode> path) {
        List<AutomatonNode> nodes = normalize(path);
        int current = ROOT;
        for (int i = 0; i < nodes.size() - 1; i++) {
            AutomatonNode node = nodes.get(i);
            Integer existing = findChild(current, node);
            current = existing != null ? existing : addChild(current, node);
        }
        AutomatonNode leaf = nodes.get(nodes.size() - 1);
        if (findChild(current, leaf) != null) {
            throw new IllegalArgumentException("Leaf " + leaf + " already exists at this position");
        }
        addChild(current, leaf);
        logger.fine("Inserted path: " + nodes);
    }

    public void extend(List<List<AutomatonNode>> paths) {
        List<List<AutomatonNode>> inserted = new ArrayList<>();
        try {
            for (List<AutomatonNode> path : paths) {
                insert(path);
                inserted.add(path);
            }
        } catch (IllegalArgumentException e) {
            removePaths(inserted);
            throw e;
        }
    }

    /**
     * Removes the given paths. Shared prefixes still used by other paths are kept.
     * A path that does not fully exist is left untouched.
     *
     * @param paths the paths to remove
     * @throws IllegalArgumentException if a path is malformed
     */
    public void removePaths(List<List<AutomatonNode>> paths) {
        for (List<AutomatonNode> path : paths) {
            removePath(normalize(path));
        }
        if (entries.get(cursor).removed) {
            reset();
        }
    }

    private void removePath(List<AutomatonNode> nodes) {
        List<Integer> chain = new ArrayList<>();
        int current = ROOT;
        for (AutomatonNode node : nodes) {
            Integer id = findChild(current, node);
            if (id == null) {
                logger.fine("Path not present, nothing to remove: " + nodes);
                return;
            }
            chain.add(id);
            current = id;
        }
        for (int i = chain.size() - 1; i >= 0; i--) {
            int id = chain.get(i);
            Entry entry = entries.get(id);
            if (!entry.children.isEmpty()) {
                break;
            }
            entry.removed = true;
            entries.get(entry.parent).children.remove(Integer.valueOf(id));
        }
        logger.fine("Removed path: " + nodes);
    }

    /**
     * Feeds one step to the automaton.
     *
     * @param step the incoming step
     * @return the outcome; see {@link InteractionResult}
     */
    public InteractionResult onAction(InteractionStep step) {
        List<Integer> matching = matchingChildren(step.token());
        if (matching.isEmpty()) {
            return new InteractionResult.NoInteractionFound();
        }
        if (matching.size() == 1) {
            return enter(matching.get(0), step);
        }
        return new InteractionResult.Candidates(matching.stream().map(id -> entries.get(id).node).toList());
    }

    /**
     * Feeds one step and resolves an ambiguity with the given candidate index.
     * Non-ambiguous outcomes are returned unchanged and the index is not used.
     *
     * @param step the incoming step
     * @param index the position in the {@link InteractionResult.Candidates} list
     * @return the outcome of entering the chosen candidate
     * @throws InvalidChoiceException if the step is ambiguous and the index is out of range
     */
    public InteractionResult onActionIndexed(InteractionStep step, int index) {
        List<Integer> matching = matchingChildren(step.token());
        if (matching.size() <= 1) {
            return onAction(step);
        }
        if (index < 0 || index >= matching.size()) {
            throw new InvalidChoiceException(index, matching.size());
        }
        return enter(matching.get(index), step);
    }

    /**
     * Steps back to the parent of the current node.
     *
     * @return the node that was undone, or empty when the cursor is already at the root
     */
    public Optional<AutomatonNode> cancelLast() {
        if (cursor == ROOT) {
            return Optional.empty();
        }
        Entry entry = entries.get(cursor);
        cursor = entry.parent;
        return Optional.of(entry.node);
    }

    /**
     * Checks, from the current node, that every token but the last leads through a branch.
     *
     * @param tokens the tokens to try
     * @return true if the prefix can be walked
     */
    public boolean pathExists(List<ActionToken> tokens) {
        int current = cursor;
        for (int i = 0; i < tokens.size() - 1; i++) {
            ActionToken token = tokens.get(i);
            Integer next = null;
            for (int child : entries.get(current).children) {
                AutomatonNode node = entries.get(child).node;
                if (node.token() == token && !node.isLeaf()) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return false;
            }
            current = next;
        }
        return true;
    }

    public void reset() {
        cursor = ROOT;
    }

    public Optional<AutomatonNode> currentNode() {
        return cursor == ROOT ? Optional.empty() : Optional.of(entries.get(cursor).node);
    }

    /**
     * @return the steps committed from the root down to the current node
     */
    public List<InteractionStep> executedSteps() {
        List<InteractionStep> steps = new ArrayList<>();
        int current = cursor;
        while (current != ROOT) {
            Entry entry = entries.get(current);
            steps.add(entry.node.step());
            current = entry.parent;
        }
        Collections.reverse(steps);
        return steps;
    }

    /**
     * @return the number of live nodes, root excluded
     */
    public int nodeCount() {
        return (int) entries.stream().skip(1).filter(entry -> !entry.removed).count();
    }

    /**
     * Compares the shape of two automata, ignoring child order and committed payloads.
     * Branches match by token; leaves by token, owning rule and handler identity.
     *
     * @param other the automaton to compare with
     * @return true if both trees have the same shape
     */
    public boolean isStructurallyEqualTo(Automaton other) {
        return sameSubtree(this, ROOT, other, ROOT);
    }

    private static boolean sameSubtree(Automaton left, int leftId, Automaton right, int rightId) {
        List<Integer> leftChildren = left.sortedChildren(leftId);
        List<Integer> rightChildren = right.sortedChildren(rightId);
        if (leftChildren.size() != rightChildren.size()) {
            return false;
        }
        for (int i = 0; i < leftChildren.size(); i++) {
            AutomatonNode a = left.entries.get(leftChildren.get(i)).node;
            AutomatonNode b = right.entries.get(rightChildren.get(i)).node;
            if (a.token() != b.token() || a.isLeaf() != b.isLeaf()) {
                return false;
            }
            if (a.isLeaf()) {
                if (!Objects.equals(a.rule(), b.rule()) || a.handler() != b.handler()) {
                    return false;
                }
            } else if (!sameSubtree(left, leftChildren.get(i), right, rightChildren.get(i))) {
                return false;
            }
        }
        return true;
    }

    private List<Integer> sortedChildren(int id) {
        List<Integer> children = new ArrayList<>(entries.get(id).children);
        children.sort(Comparator.comparing(child -> entries.get(child).node, CHILD_ORDER));
        return children;
    }

    private InteractionResult enter(int id, InteractionStep step) {
        Entry entry = entries.get(id);
        if (entry.node.isLeaf()) {
            List<InteractionStep> steps = executedSteps();
            steps.add(step);
            reset();
            logger.fine("Resolved leaf " + entry.node + " with steps " + steps);
            return new InteractionResult.Leaf(steps, entry.node.handler());
        }
        entry.node = entry.node.withStep(step);
        cursor = id;
        return new InteractionResult.AdvancedNextState();
    }

    /**
     * Children of the cursor accepting the token, leaves first and branches last,
     * each group keeping insertion order.
     */
    private List<Integer> matchingChildren(ActionToken token) {
        List<Integer> leaves = new ArrayList<>();
        List<Integer> branches = new ArrayList<>();
        for (int child : entries.get(cursor).children) {
            AutomatonNode node = entries.get(child).node;
            if (node.token() == token) {
                (node.isLeaf() ? leaves : branches).add(child);
            }
        }
        leaves.addAll(branches);
        return leaves;
    }

    private Integer findChild(int parent, AutomatonNode template) {
        for (int child : entries.get(parent).children) {
            if (entries.get(child).node.sameSlotAs(template)) {
                return child;
            }
        }
        return null;
    }

    private int addChild(int parent, AutomatonNode node) {
        int id = entries.size();
        entries.add(new Entry(node, parent));
        entries.get(parent).children.add(id);
        return id;
    }

    private static List<AutomatonNode> normalize(List<AutomatonNode> path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one node");
        }
        List<AutomatonNode> nodes = new ArrayList<>(path.size());
        for (int i = 0; i < path.size() - 1; i++) {
            AutomatonNode node = path.get(i);
            if (node.isLeaf()) {
                throw new IllegalArgumentException("Only the last node of a path may hold a handler: " + path);
            }
            nodes.add(node.rule() == null ? node : node.withRule(null));
        }
        AutomatonNode last = path.get(path.size() - 1);
        if (!last.isLeaf()) {
            throw new IllegalArgumentException("The last node of a path must hold a handler: " + path);
        }
        nodes.add(last);
        return nodes;
    }
}
