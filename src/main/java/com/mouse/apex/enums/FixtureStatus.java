package com.mouse.apex.enums;

public enum FixtureStatus {
    UPCOMING,
    LIVE,
    FINISHED
}
