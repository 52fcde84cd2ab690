package org.cascadeslot.model;

public enum BonusType { NORMAL, SUPER }
