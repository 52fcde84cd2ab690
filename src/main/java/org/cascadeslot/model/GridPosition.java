package org.cascadeslot.model;

public record GridPosition(int row, int reel) {}
