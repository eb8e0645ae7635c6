package com.maogame.domain;

public enum StackType {
    DRAWABLE,
    PLAYABLE,
    DISCARDABLE
}
