package com.healthrevo.decision.normalizer;

import com.healthrevo.decision.model.CanonicalDrug;
import com.healthrevo.decision.model.MedicationMention;
import com.healthrevo.decision.vocabulary.VocabularySnapshot;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps free-text medication mentions to canonical vocabulary entries.
 *
 * <p>The result depends only on the mention and the snapshot passed in. Candidates are ranked by
 * similarity; equal similarities are ordered by exact name/alias match, then edit distance, then
 * canonical name and matched term.
 */
public class MedicationNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(MedicationNormalizer.class);

    private static final Comparator<Candidate> RANKING = Comparator
        .comparingDouble(Candidate::getScore).reversed()
        .thenComparing(Candidate::isExact, Comparator.reverseOrder())
        .thenComparingInt(Candidate::getDistance)
        .thenComparing(candidate -> candidate.getDrug().getName())
        .thenComparing(Candidate::getTerm);

    private final StringSimilarity similarity;
    private final NormalizerSettings settings;

    public MedicationNormalizer(StringSimilarity similarity, NormalizerSettings settings) {
        this.similarity = similarity;
        this.settings = settings;
    }

    public List<NormalizationResult> normalizeAll(List<MedicationMention> mentions, VocabularySnapshot snapshot) {
        List<NormalizationResult> results = new ArrayList<>(mentions.size());
        for (MedicationMention mention : mentions) {
            results.add(normalize(mention, snapshot));
        }
        long matched = results.stream().filter(NormalizationResult::isMatched).count();
        logger.info("Normalized {} mentions against vocabulary v{}: {} matched, {} unmatched",
            results.size(), snapshot.getVersion(), matched, results.size() - matched);
        return results;
    }

    public NormalizationResult normalize(MedicationMention mention, VocabularySnapshot snapshot) {
        String cleaned = MentionCleaner.clean(mention.getRawName());
        if (!MentionCleaner.looksLikeName(cleaned)) {
            logger.debug("Mention '{}' has no usable name", mention.getRawName());
            return NormalizationResult.builder()
                .mention(mention)
                .cleanedName(cleaned)
                .status(MatchStatus.UNMATCHED)
                .build();
        }

        List<String> probes = probes(cleaned);
        Candidate best = null;
        for (CanonicalDrug drug : snapshot.drugs()) {
            for (String term : terms(drug)) {
                Candidate candidate = score(drug, term, probes);
                if (best == null || RANKING.compare(candidate, best) < 0) {
                    best = candidate;
                }
            }
        }

        if (best == null) {
            return NormalizationResult.builder()
                .mention(mention)
                .cleanedName(cleaned)
                .status(MatchStatus.UNMATCHED)
                .build();
        }

        MatchStatus status = best.getScore() >= settings.getAcceptanceThreshold() ? MatchStatus.MATCHED : MatchStatus.UNMATCHED;
        logger.debug("Mention '{}' -> '{}' via '{}' ({} {}, {})", mention.getRawName(), best.getDrug().getName(),
            best.getTerm(), similarity.name(), best.getScore(), status);
        return NormalizationResult.builder()
            .mention(mention)
            .cleanedName(cleaned)
            .status(status)
            .drugId(best.getDrug().getId())
            .drugName(best.getDrug().getName())
            .matchedTerm(best.getTerm())
            .confidence(best.getScore())
            .build();
    }

    /**
     * Resolves a canonical id, name or alias to a vocabulary entry without fuzzy matching. An id
     * match wins; otherwise the first drug in id order whose normalized name or alias equals the
     * normalized input.
     */
    public Optional<CanonicalDrug> lookup(String idOrName, VocabularySnapshot snapshot) {
        if (idOrName == null || idOrName.isBlank()) {
            return Optional.empty();
        }
        Optional<CanonicalDrug> byId = snapshot.findDrug(idOrName.trim());
        if (byId.isPresent()) {
            return byId;
        }
        byId = snapshot.findDrug(CanonicalDrug.idFor(idOrName));
        if (byId.isPresent()) {
            return byId;
        }
        String term = MentionCleaner.normalizeTerm(idOrName);
        if (term.isEmpty()) {
            return Optional.empty();
        }
        for (CanonicalDrug drug : snapshot.drugs()) {
            if (terms(drug).contains(term)) {
                return Optional.of(drug);
            }
        }
        return Optional.empty();
    }

    private List<String> probes(String cleaned) {
        Set<String> probes = new LinkedHashSet<>();
        probes.add(cleaned);
        String[] tokens = cleaned.split(" ");
        if (tokens.length > 1) {
            for (String token : tokens) {
                if (token.length() >= settings.getMinTokenLength()) {
                    probes.add(token);
                }
            }
        }
        return new ArrayList<>(probes);
    }

    private static Set<String> terms(CanonicalDrug drug) {
        Set<String> terms = new TreeSet<>();
        terms.add(MentionCleaner.normalizeTerm(drug.getName()));
        for (String alias : drug.getAliases()) {
            terms.add(MentionCleaner.normalizeTerm(alias));
        }
        terms.remove("");
        return terms;
    }

    private Candidate score(CanonicalDrug drug, String term, List<String> probes) {
        double bestScore = 0.0;
        boolean exact = false;
        int distance = Integer.MAX_VALUE;
        for (String probe : probes) {
            exact |= probe.equals(term);
            bestScore = Math.max(bestScore, similarity.similarity(probe, term));
            distance = Math.min(distance, EditDistance.levenshtein(probe, term));
            if (settings.isOcrFolding()) {
                String folded = MentionCleaner.foldOcrDigits(probe);
                if (!folded.equals(probe)) {
                    bestScore = Math.max(bestScore, similarity.similarity(folded, term));
                    distance = Math.min(distance, EditDistance.levenshtein(folded, term));
                }
            }
        }
        return new Candidate(drug, term, bestScore, exact, distance);
    }

    @Value
    private static class Candidate {
        CanonicalDrug drug;
        String term;
        double score;
        boolean exact;
        int distance;
    }
}
