package com.mouse.apex.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum MarketCategory {
    MONEYLINE("moneyline"),
    SPREAD("spread"),
    TOTALS("totals"),
    BTTS("btts"),
    DOUBLE_CHANCE("double_chance"),
    FIRST_HALF("first_half"),
    CORRECT_SCORE("correct_score"),
    CORNERS("corners"),
    CARDS("cards"),
    OTHER("other");

    private final String key;
}
