package com.mouse.apex.model;

/** Handicap line for the home side and its price. */
public record SpreadPrice(double line, double odds) {
}
