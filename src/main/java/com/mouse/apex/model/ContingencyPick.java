package com.mouse.apex.model;

public record ContingencyPick(String selection, double odds, double stake, String rationale) {
}
