package dev.oppscanner.service;

import dev.oppscanner.model.DiscoveryProfile;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keyword-based match score (0-100) of an opportunity against a caller profile.
 * Advisory: sources only drop candidates on it when a min-match-score is configured.
 */
@Service
public class RelevanceScorer {

    private static final int POINTS_PER_SKILL = 20;
    private static final int MAX_SKILL_POINTS = 60;
    private static final int POINTS_PER_KIT = 20;
    private static final int BUDGET_SWEET_SPOT_POINTS = 20;
    private static final int BUDGET_HIGH_POINTS = 10;

    private static final int SWEET_SPOT_MIN = 500;
    private static final int SWEET_SPOT_MAX = 5000;

    public int score(String title, String description, int estimatedValue, DiscoveryProfile profile) {
        String text = ((title == null ? "" : title) + " " + (description == null ? "" : description))
                .toLowerCase(Locale.ROOT);
        int score = 0;

        // 1. Skills: whole-word matches
        Set<String> words = Arrays.stream(text.split("\\W+"))
                .filter(w -> !w.isBlank())
                .collect(Collectors.toSet());
        long skillMatches = lower(profile == null ? null : profile.getSkills()).stream()
                .filter(words::contains)
                .count();
        score += (int) Math.min(skillMatches * POINTS_PER_SKILL, MAX_SKILL_POINTS);

        // 2. Kits: phrase matches
        for (String kit : lower(profile == null ? null : profile.getKits())) {
            if (!kit.isBlank() && text.contains(kit)) {
                score += POINTS_PER_KIT;
            }
        }

        // 3. Budget fit
        if (estimatedValue >= SWEET_SPOT_MIN && estimatedValue <= SWEET_SPOT_MAX) {
            score += BUDGET_SWEET_SPOT_POINTS;
        } else if (estimatedValue > SWEET_SPOT_MAX) {
            score += BUDGET_HIGH_POINTS;
        }

        return Math.min(score, 100);
    }

    private List<String> lower(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}
