package com.maogame.events;

public record GameStart() implements Occurrence {

    @Override
    public String toString() {
        return "GameStart";
    }
}
