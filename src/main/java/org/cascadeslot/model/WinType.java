package org.cascadeslot.model;

public enum WinType {
    NONE, SMALL, MEDIUM, BIG, JACKPOT;

    public static WinType classify(long win, long bet) {
        if (win <= 0 || bet <= 0) return NONE;
        double ratio = (double) win / bet;
        if (ratio >= 100) return JACKPOT;
        if (ratio >= 20) return BIG;
        if (ratio >= 5) return MEDIUM;
        return SMALL;
    }
}
