package org.cascadeslot.model;

public enum DrawLean { TOWARD_WIN, TOWARD_LOSS, NONE }
