package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.KnowledgeMetadata;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RankingServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MemoryProperties properties;
    private RankingService rankingService;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        rankingService = new RankingService(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ===== Priority =====

    @ParameterizedTest
    @CsvSource({
            "critical, 1.0",
            "pinned, 0.9",
            "reinforced, 0.75",
            "normal, 0.5",
            "archived, 0.1",
            "' CRITICAL ', 1.0",
            "Pinned, 0.9",
            "bogus, 0.5"
    })
    void shouldResolvePriorityScoresCaseInsensitively(String priority, double expected) {
        assertEquals(expected, rankingService.resolvePriorityScore(priority), 1e-9);
    }

    @Test
    void shouldTreatMissingPriorityAsNormal() {
        assertEquals(0.5, rankingService.resolvePriorityScore(null), 1e-9);
    }

    @Test
    void shouldApplyMinPriorityCutoff() {
        assertTrue(rankingService.meetsMinPriority("critical", "pinned"));
        assertTrue(rankingService.meetsMinPriority("pinned", "pinned"));
        assertFalse(rankingService.meetsMinPriority("normal", "pinned"));
        assertFalse(rankingService.meetsMinPriority(null, "reinforced"));
        assertTrue(rankingService.meetsMinPriority("archived", null));
        assertTrue(rankingService.meetsMinPriority("archived", " "));
    }

    // ===== Composite score =====

    @Test
    void shouldKeepScoreWithinUnitInterval() {
        assertEquals(1.0, rankingService.rankScore(1.0, 1.0, 1.0, 1.0, 1.0, "critical"), 1e-9);
        assertEquals(0.025, rankingService.rankScore(0.0, 0.0, 0.0, 0.0, 0.0, "unknown"), 1e-9);
        double outOfRange = rankingService.rankScore(7.0, 3.0, -2.0, 9.0, 5.0, "critical");
        assertTrue(outOfRange >= 0.0 && outOfRange <= 1.0);
    }

    @Test
    void shouldUseNeutralValueForMissingScalars() {
        double withNulls = rankingService.rankScore(0.8, null, null, 0.5, null, null);
        double withNeutral = rankingService.rankScore(0.8, 0.5, 0.5, 0.5, 0.5, "normal");

        assertEquals(withNeutral, withNulls, 1e-9);
    }

    @Test
    void shouldBeMonotoneInEveryFactor() {
        double base = rankingService.rankScore(0.5, 0.5, 0.5, 0.5, 0.5, "normal");

        assertTrue(rankingService.rankScore(0.6, 0.5, 0.5, 0.5, 0.5, "normal") > base);
        assertTrue(rankingService.rankScore(0.5, 0.6, 0.5, 0.5, 0.5, "normal") > base);
        assertTrue(rankingService.rankScore(0.5, 0.5, 0.6, 0.5, 0.5, "normal") > base);
        assertTrue(rankingService.rankScore(0.5, 0.5, 0.5, 0.6, 0.5, "normal") > base);
        assertTrue(rankingService.rankScore(0.5, 0.5, 0.5, 0.5, 0.6, "normal") > base);
        assertTrue(rankingService.rankScore(0.5, 0.5, 0.5, 0.5, 0.5, "critical") > base);
    }

    @Test
    void shouldIgnoreNegativeWeights() {
        properties.getRanking().setImportanceWeight(-1.0);

        double low = rankingService.rankScore(0.5, 0.0, 0.5, 0.5, 0.5, "normal");
        double high = rankingService.rankScore(0.5, 1.0, 0.5, 0.5, 0.5, "normal");

        assertEquals(low, high, 1e-9);
    }

    @Test
    void shouldRoundToFourDecimals() {
        double score = rankingService.rankScore(0.123456, 0.3, 0.7, 0.2, 0.9, "pinned");

        assertEquals(score, Math.round(score * 10_000.0) / 10_000.0, 0.0);
    }

    // ===== Relevance blend =====

    @Test
    void shouldBlendSemanticAndKeywordScores() {
        assertEquals(0.84, rankingService.blendRelevance(0.9, 0.6), 1e-9);
    }

    @Test
    void shouldFallBackToSemanticWhenWeightsAreZero() {
        properties.getSearch().setSemanticWeight(0.0);
        properties.getSearch().setKeywordWeight(0.0);

        assertEquals(0.7, rankingService.blendRelevance(0.7, 0.1), 1e-9);
    }

    @Test
    void shouldMeasureKeywordOverlap() {
        assertEquals(1.0, rankingService.keywordOverlap("Dark Mode", "user prefers dark mode"), 1e-9);
        assertEquals(0.5, rankingService.keywordOverlap("dark theme", "user prefers dark mode"), 1e-9);
        assertEquals(0.0, rankingService.keywordOverlap("", "anything"), 1e-9);
        assertEquals(0.0, rankingService.keywordOverlap("query", null), 1e-9);
    }

    // ===== Recency =====

    @Test
    void shouldDecayRecencyOverWindow() {
        KnowledgeMetadata fresh = KnowledgeMetadata.builder().createdAt(NOW).build();
        KnowledgeMetadata halfway = KnowledgeMetadata.builder().createdAt(NOW.minus(Duration.ofDays(15))).build();
        KnowledgeMetadata stale = KnowledgeMetadata.builder().createdAt(NOW.minus(Duration.ofDays(400))).build();

        assertEquals(1.0, rankingService.recency(fresh), 1e-9);
        assertEquals(0.5, rankingService.recency(halfway), 1e-9);
        assertEquals(0.0, rankingService.recency(stale), 1e-9);
    }

    @Test
    void shouldFallBackToNumericTimestampForRecency() {
        KnowledgeMetadata metadata = KnowledgeMetadata.builder()
                .createdTs(NOW.minus(Duration.ofDays(15)).getEpochSecond())
                .build();

        assertEquals(0.5, rankingService.recency(metadata), 1e-9);
    }

    @Test
    void shouldTreatUnknownAgeAsNeutral() {
        assertEquals(RankingService.NEUTRAL, rankingService.recency(new KnowledgeMetadata()), 1e-9);

        properties.getRanking().setRecencyWindowDays(0);
        KnowledgeMetadata fresh = KnowledgeMetadata.builder().createdAt(NOW).build();
        assertEquals(RankingService.NEUTRAL, rankingService.recency(fresh), 1e-9);
    }

    @Test
    void shouldRankFresherEntryHigherWithEqualRelevance() {
        KnowledgeMetadata fresh = KnowledgeMetadata.builder().createdAt(NOW).build();
        KnowledgeMetadata old = KnowledgeMetadata.builder().createdAt(NOW.minus(Duration.ofDays(29))).build();

        assertTrue(rankingService.buildRankScore(0.7, fresh) > rankingService.buildRankScore(0.7, old));
    }
}
