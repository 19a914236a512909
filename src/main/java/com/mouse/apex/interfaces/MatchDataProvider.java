package com.mouse.apex.interfaces;

import com.mouse.apex.model.Fixture;
import com.mouse.apex.model.MatchContext;

/** Team averages and officiating context used by the specialty markets. */
public interface MatchDataProvider {

    MatchContext getMatchContext(Fixture fixture);
}
