package org.hexabets.model;

public enum CrashPhase { IDLE, RUNNING, ENDED }
