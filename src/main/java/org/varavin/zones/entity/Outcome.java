package org.varavin.zones.entity;

public enum Outcome {
    WIN_G0, WIN_G1, LOSS, NO_DATA;

    public boolean isWin() {
        return this == WIN_G0 || this == WIN_G1;
    }

    public boolean isEvaluated() {
        return this != NO_DATA;
    }
}
