package com.mouse.apex.interfaces;

import com.mouse.apex.model.Fixture;
import com.mouse.apex.model.FactorObservation;

import java.util.List;

/**
 * Produces contextual factor observations for a fixture. A partial or empty list is a
 * valid answer; missing categories count as zero impact.
 */
public interface SignalAggregator {

    List<FactorObservation> getSignals(Fixture fixture);
}
