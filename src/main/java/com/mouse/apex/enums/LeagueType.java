package com.mouse.apex.enums;

public enum LeagueType {
    LEAGUE,
    CUP,
    TOURNAMENT,
    INTERNATIONAL
}
