package com.healthrevo.decision.vocabulary;

import com.healthrevo.decision.model.CanonicalDrug;
import com.healthrevo.decision.model.InteractionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link VocabularySnapshot}. Readers take the snapshot once and keep it for a
 * whole run; administrative imports build a new snapshot and swap it in atomically.
 */
public class VocabularyStore {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyStore.class);

    private final AtomicReference<VocabularySnapshot> current;

    public VocabularyStore() {
        this(VocabularySnapshot.empty());
    }

    public VocabularyStore(VocabularySnapshot initial) {
        this.current = new AtomicReference<>(initial);
    }

    public VocabularySnapshot snapshot() {
        return current.get();
    }

    public VocabularySnapshot apply(ImportMode mode, Collection<CanonicalDrug> drugs,
                                    Collection<InteractionRecord> interactions) {
        VocabularySnapshot updated = mode == ImportMode.REPLACE
            ? current.updateAndGet(snapshot -> VocabularySnapshot.replacing(snapshot, drugs, interactions))
            : current.updateAndGet(snapshot -> snapshot.mergedWith(drugs, interactions));
        logger.info("Vocabulary snapshot v{} holds {} drugs and {} interactions (mode={})",
            updated.getVersion(), updated.drugCount(), updated.interactionCount(), mode);
        return updated;
    }
}
