package com.maogame.domain;

public enum CardColor {
    RED,
    BLACK,
    UNDEFINED
}
