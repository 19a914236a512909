package com.mouse.apex.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.apex.interfaces.LeagueMetadataLookup;
import com.mouse.apex.model.LeagueMetadata;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * League lookup by exact name, lowercase name or lowercase display name, with a
 * partial-match fallback. Unknown leagues get default metadata.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeagueMetadataService implements LeagueMetadataLookup {

    static final String LEAGUES_RESOURCE = "leagues.json";

    private final ObjectMapper objectMapper;

    private final Map<String, LeagueMetadata> leagueMap = new LinkedHashMap<>();
    private List<LeagueMetadata> leagues = List.of();

    @PostConstruct
    public void init() {
        try (InputStream in = new ClassPathResource(LEAGUES_RESOURCE).getInputStream()) {
            register(objectMapper.readValue(in, new TypeReference<List<LeagueMetadata>>() {}));
        } catch (IOException e) {
            throw new IllegalStateException("Could not load league metadata from " + LEAGUES_RESOURCE, e);
        }
    }

    void register(Collection<LeagueMetadata> entries) {
        leagueMap.clear();
        for (LeagueMetadata league : entries) {
            leagueMap.put(league.getName(), league);
            leagueMap.put(league.getName().toLowerCase(Locale.ROOT), league);
            leagueMap.put(league.getDisplayName().toLowerCase(Locale.ROOT), league);
        }
        leagues = List.copyOf(entries);
        log.info("League metadata loaded | Leagues: {} | Keys: {}", leagues.size(), leagueMap.size());
    }

    @Override
    public LeagueMetadata lookup(String leagueName) {
        if (leagueName == null || leagueName.isBlank()) {
            return LeagueMetadata.unknown(leagueName);
        }
        LeagueMetadata exact = leagueMap.get(leagueName);
        if (exact != null) {
            return exact;
        }
        String lower = leagueName.trim().toLowerCase(Locale.ROOT);
        LeagueMetadata byLower = leagueMap.get(lower);
        if (byLower != null) {
            return byLower;
        }
        // Longest matching key wins so "WNBA Playoffs" does not resolve to NBA.
        LeagueMetadata partial = null;
        int bestLength = 0;
        for (Map.Entry<String, LeagueMetadata> entry : leagueMap.entrySet()) {
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            if ((lower.contains(key) || key.contains(lower)) && key.length() > bestLength) {
                partial = entry.getValue();
                bestLength = key.length();
            }
        }
        if (partial != null) {
            return partial;
        }
        log.debug("Unknown league, using defaults | League: {}", leagueName);
        return LeagueMetadata.unknown(leagueName);
    }

    public List<LeagueMetadata> getLeaguesBySport(String sport) {
        return leagues.stream().filter(l -> l.getSport().equalsIgnoreCase(sport)).toList();
    }

    public List<LeagueMetadata> getAllLeagues() {
        return leagues;
    }
}
