package com.sashkomusic.catalogreconciler.domain.service;

import com.sashkomusic.catalogreconciler.config.ReconciliationConfig;
import com.sashkomusic.catalogreconciler.domain.model.CatalogCandidate;
import com.sashkomusic.catalogreconciler.domain.model.LocalTrackRef;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores how well a catalog candidate matches a local track.
 * <p>
 * The score is a weighted blend of title similarity, artist similarity and duration closeness,
 * each in {@code [0, 1]}. Text is compared token-wise after folding case and diacritics, so
 * "Röyksopp feat. Robyn" and "robyn, royksopp" compare as equal artists. Duration gets full credit
 * inside a small tolerance window and decays smoothly to zero at a cutoff; a missing duration on
 * either side contributes a neutral value instead of zero.
 * <p>
 * Stateless apart from its configuration; every method is deterministic.
 */
@Service
public class CandidateScorer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Set<String> ARTIST_JOINERS = Set.of("feat", "ft", "featuring", "vs", "x", "and", "with");

    private static final Comparator<Scored> RANKING = Comparator
            .comparingDouble((Scored s) -> s.candidate().similarityScore()).reversed()
            .thenComparing(Comparator.comparingDouble(Scored::durationCloseness).reversed())
            .thenComparing(Comparator.comparingDouble(Scored::textScore).reversed())
            .thenComparingLong(s -> s.candidate().catalogId());

    private final ReconciliationConfig.Scoring scoring;

    public CandidateScorer(ReconciliationConfig config) {
        this.scoring = config.getScoring();
    }

    public double score(LocalTrackRef local, CatalogCandidate candidate) {
        return score(local.title(), local.artist(), local.durationSeconds(), candidate);
    }

    public double score(String title, String artist, Double durationSeconds, CatalogCandidate candidate) {
        return breakdown(title, artist, durationSeconds, candidate).total();
    }

    /**
     * Scores every candidate, drops those below {@code minScore} and returns at most
     * {@code maxResults} of them, best first. Equal scores are ordered by duration closeness,
     * then text similarity, then catalog id.
     */
    public List<CatalogCandidate> rank(String title, String artist, Double durationSeconds,
                                       List<CatalogCandidate> candidates, double minScore, int maxResults) {
        if (candidates == null || candidates.isEmpty() || maxResults <= 0) {
            return List.of();
        }

        return candidates.stream()
                .map(candidate -> {
                    Breakdown b = breakdown(title, artist, durationSeconds, candidate);
                    return new Scored(candidate.withScore(b.total()), b.durationCloseness(), b.textScore());
                })
                .filter(scored -> scored.candidate().similarityScore() >= minScore)
                .sorted(RANKING)
                .limit(maxResults)
                .map(Scored::candidate)
                .toList();
    }

    double durationCloseness(Double localSeconds, Double remoteSeconds) {
        if (localSeconds == null || remoteSeconds == null || localSeconds <= 0 || remoteSeconds <= 0) {
            return scoring.getNeutralDurationScore();
        }

        double diff = Math.abs(localSeconds - remoteSeconds);
        double tolerance = scoring.getDurationToleranceSeconds();
        double cutoff = scoring.getDurationCutoffSeconds();

        if (diff <= tolerance) {
            return 1.0;
        }
        if (diff >= cutoff || cutoff <= tolerance) {
            return 0.0;
        }

        double t = (diff - tolerance) / (cutoff - tolerance);
        return 0.5 * (1.0 + Math.cos(Math.PI * t));
    }

    double textSimilarity(List<String> left, List<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        Set<String> leftSet = new HashSet<>(left);
        Set<String> rightSet = new HashSet<>(right);
        if (leftSet.equals(rightSet)) {
            return 1.0;
        }

        Set<String> common = new HashSet<>(leftSet);
        common.retainAll(rightSet);
        double dice = 2.0 * common.size() / (leftSet.size() + rightSet.size());

        String leftSorted = left.stream().sorted().collect(Collectors.joining(" "));
        String rightSorted = right.stream().sorted().collect(Collectors.joining(" "));
        double edit = levenshteinRatio(leftSorted, rightSorted);

        return Math.max(dice, edit);
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String folded = COMBINING_MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
        String cleaned = NON_ALPHANUMERIC.matcher(folded.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(cleaned.split(" "));
    }

    static List<String> artistTokens(String artist) {
        return tokenize(artist).stream()
                .filter(token -> !ARTIST_JOINERS.contains(token))
                .toList();
    }

    static double levenshteinRatio(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        int distance = previous[b.length()];
        return 1.0 - (double) distance / Math.max(a.length(), b.length());
    }

    private Breakdown breakdown(String title, String artist, Double durationSeconds, CatalogCandidate candidate) {
        List<String> localTitle = tokenize(title);
        double titleScore = textSimilarity(localTitle, tokenize(candidate.title()));
        if (candidate.mixName() != null && !candidate.mixName().isBlank()) {
            double withMix = textSimilarity(localTitle, tokenize(candidate.title() + " " + candidate.mixName()));
            titleScore = Math.max(titleScore, withMix);
        }

        double artistScore = textSimilarity(artistTokens(artist), artistTokens(candidate.artistsJoined()));
        double durationScore = durationCloseness(durationSeconds, candidate.durationSeconds());

        double titleWeight = Math.max(0.0, scoring.getTitleWeight());
        double artistWeight = Math.max(0.0, scoring.getArtistWeight());
        double durationWeight = Math.max(0.0, scoring.getDurationWeight());
        double textWeight = titleWeight + artistWeight;
        double weightSum = textWeight + durationWeight;
        if (weightSum == 0.0) {
            return new Breakdown(0.0, 0.0, durationScore);
        }

        double total = (titleWeight * titleScore + artistWeight * artistScore + durationWeight * durationScore) / weightSum;
        double text = textWeight > 0 ? (titleWeight * titleScore + artistWeight * artistScore) / textWeight : 0.0;
        return new Breakdown(clamp(total), text, durationScore);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private record Breakdown(double total, double textScore, double durationCloseness) {
    }

    private record Scored(CatalogCandidate candidate, double durationCloseness, double textScore) {
    }
}
