package com.healthrevo.decision.vocabulary;

import com.healthrevo.decision.model.CanonicalDrug;
import com.healthrevo.decision.model.DrugPair;
import com.healthrevo.decision.model.InteractionRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable view of the drug vocabulary and interaction table. A snapshot is captured once per
 * pipeline run so normalization and interaction lookups see a stable reference set.
 */
public final class VocabularySnapshot {

    private static final VocabularySnapshot EMPTY = new VocabularySnapshot(0L, new TreeMap<>(), new TreeMap<>());

    private final long version;
    private final Map<String, CanonicalDrug> drugsById;
    private final Map<String, InteractionRecord> interactionsByPair;

    private VocabularySnapshot(long version, TreeMap<String, CanonicalDrug> drugsById,
                               TreeMap<String, InteractionRecord> interactionsByPair) {
        this.version = version;
        this.drugsById = Collections.unmodifiableMap(drugsById);
        this.interactionsByPair = Collections.unmodifiableMap(interactionsByPair);
    }

    public static VocabularySnapshot empty() {
        return EMPTY;
    }

    public static VocabularySnapshot of(Collection<CanonicalDrug> drugs, Collection<InteractionRecord> interactions) {
        return EMPTY.mergedWith(drugs, interactions);
    }

    /**
     * @return a snapshot holding only the given entries, versioned after {@code previous}
     */
    public static VocabularySnapshot replacing(VocabularySnapshot previous, Collection<CanonicalDrug> drugs,
                                               Collection<InteractionRecord> interactions) {
        VocabularySnapshot fresh = of(drugs, interactions);
        return new VocabularySnapshot(previous.version + 1,
            new TreeMap<>(fresh.drugsById), new TreeMap<>(fresh.interactionsByPair));
    }

    /**
     * @return a new snapshot where incoming drugs and interactions replace entries with the same
     *         id or pair, and everything else is carried over
     */
    public VocabularySnapshot mergedWith(Collection<CanonicalDrug> drugs, Collection<InteractionRecord> interactions) {
        TreeMap<String, CanonicalDrug> mergedDrugs = new TreeMap<>(drugsById);
        for (CanonicalDrug drug : drugs) {
            mergedDrugs.put(drug.getId(), drug);
        }
        TreeMap<String, InteractionRecord> mergedInteractions = new TreeMap<>(interactionsByPair);
        for (InteractionRecord record : interactions) {
            mergedInteractions.put(record.getPair().key(), record);
        }
        return new VocabularySnapshot(version + 1, mergedDrugs, mergedInteractions);
    }

    public long getVersion() {
        return version;
    }

    /**
     * @return drugs ordered by id
     */
    public Collection<CanonicalDrug> drugs() {
        return drugsById.values();
    }

    public List<InteractionRecord> interactions() {
        return List.copyOf(interactionsByPair.values());
    }

    public boolean containsDrug(String drugId) {
        return drugsById.containsKey(drugId);
    }

    public Optional<CanonicalDrug> findDrug(String drugId) {
        return Optional.ofNullable(drugsById.get(drugId));
    }

    /**
     * Symmetric lookup: the argument order does not matter.
     */
    public Optional<InteractionRecord> findInteraction(String drugA, String drugB) {
        if (drugA == null || drugB == null || drugA.equals(drugB)) {
            return Optional.empty();
        }
        return Optional.ofNullable(interactionsByPair.get(DrugPair.of(drugA, drugB).key()));
    }

    public int drugCount() {
        return drugsById.size();
    }

    public int interactionCount() {
        return interactionsByPair.size();
    }
}
