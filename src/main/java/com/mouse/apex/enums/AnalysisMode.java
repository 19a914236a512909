package com.mouse.apex.enums;

public enum AnalysisMode {
    /** Deep-dive the top candidates and return the single best expected value. */
    BEST_PICK,
    /** Deep-dive every shortlisted fixture and return them ranked by edge. */
    ANALYZE_ALL
}
