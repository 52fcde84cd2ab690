package org.cascadeslot.model;

public enum MatchStrategy {
    /** 1024 ways, ancré sur la colonne de gauche. */
    WAYS,
    /** Groupes adjacents (flood fill). */
    CLUSTER
}
