package org.cascadeslot.service.engine;

public enum CascadePhase { IDLE, MATCHING, REMOVING, REFILLING }
