package com.maogame.errors;

/**
 * Candidate index outside the list of ambiguous continuations.
 */
public class InvalidChoiceException extends GameException {

    private final int choice;
    private final int candidateCount;

    public InvalidChoiceException(int choice, int candidateCount) {
        super("Choice " + choice + " is not one of the " + candidateCount + " candidates");
        this.choice = choice;
        this.candidateCount = candidateCount;
    }

    public int choice() {
        return choice;
    }

    public int candidateCount() {
        return candidateCount;
    }
}
