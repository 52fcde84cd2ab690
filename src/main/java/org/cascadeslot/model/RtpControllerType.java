package org.cascadeslot.model;

public enum RtpControllerType { DYNAMIC, FIXED }
