package com.maogame.engine;

import com.maogame.automaton.AutomatonNode;
import com.maogame.config.CardEffects;

import java.util.List;

/**
 * Static description of a rule module.
 *
 * @param name unique name, also used to tag the module's automaton leaves
 * @param author the author, may be null
 * @param description what the rule does, may be null
 * @param automatonPaths interaction paths the rule adds while active
 * @param cardEffects card effects the rule adds while active
 */
public record RuleData(
        String name,
        String author,
        String description,
        List<List<AutomatonNode>> automatonPaths,
        CardEffects cardEffects) {

    public RuleData {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("A rule needs a name");
        }
        automatonPaths = automatonPaths == null ? List.of() : List.copyOf(automatonPaths);
        cardEffects = cardEffects == null ? new CardEffects() : cardEffects;
    }

    public static RuleData named(String name) {
        return new RuleData(name, null, null, List.of(), new CardEffects());
    }

    /**
     * @return the automaton paths with every leaf tagged with this rule's name
     */
    public List<List<AutomatonNode>> taggedPaths() {
        return automatonPaths.stream()
                .map(path -> path.stream()
                        .map(node -> node.isLeaf() && node.rule() == null ? node.withRule(name) : node)
                        .toList())
                .toList();
    }

    @Override
    public String toString() {
        return "RuleData[name=" + name + ", author=" + author + ", paths=" + automatonPaths.size() + "]";
    }
}
