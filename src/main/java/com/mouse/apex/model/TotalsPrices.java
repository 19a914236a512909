package com.mouse.apex.model;

public record TotalsPrices(double line, double over, double under) {
}
