package com.mouse.apex.interfaces;

import com.mouse.apex.model.LeagueMetadata;

public interface LeagueMetadataLookup {

    /** Never fails: unknown leagues resolve to default metadata. */
    LeagueMetadata lookup(String leagueName);
}
