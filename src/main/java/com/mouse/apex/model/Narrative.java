package com.mouse.apex.model;

public record Narrative(String summary, String gameScript, String marketEdge, String failurePoint) {
}
