package com.pivotbot.backend.model;

public enum DecisionState {
    IDLE,
    POSITION_OPEN
}
