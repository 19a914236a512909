package com.mouse.apex.enums;

public enum Popularity {
    HIGH,
    MEDIUM,
    LOW
}
