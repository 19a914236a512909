package com.mouse.apex.interfaces;

import com.mouse.apex.enums.SportEnum;
import com.mouse.apex.exception.CollaboratorUnavailableException;
import com.mouse.apex.model.OddsQuote;

import java.util.List;

/**
 * Source of bookmaker prices. Implementations may apply their own fallback chain;
 * callers only see the resulting quotes and their provenance.
 */
public interface OddsSourceAdapter {

    /**
     * @param sport sport to fetch
     * @return current quotes, possibly empty
     * @throws CollaboratorUnavailableException when no quotes could be obtained at all
     */
    List<OddsQuote> getOdds(SportEnum sport);

    /** Provenance label for telemetry. */
    String sourceName();
}
