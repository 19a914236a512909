package com.mouse.apex.enums;

public enum PipelineState {
    SCANNING,
    DEEP_DIVING,
    BUILDING_NARRATIVE,
    SELECTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
