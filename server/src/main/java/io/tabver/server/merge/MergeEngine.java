// file: src/main/java/io/tabver/server/merge/MergeEngine.java
package io.tabver.server.merge;

import io.tabver.core.CellKey;
import io.tabver.core.CellValue;
import io.tabver.core.Fingerprinter;
import io.tabver.core.InvalidResolutionException;
import io.tabver.core.NormalizedTable;
import io.tabver.core.Version;
import io.tabver.core.merge.Conflict;
import io.tabver.core.merge.Decision;
import io.tabver.core.merge.ManualResolution;
import io.tabver.core.merge.Resolution;
import io.tabver.core.merge.Side;
import io.tabver.server.audit.MergeAuditLog;
import io.tabver.storage.PreferenceWeightStore;
import io.tabver.storage.VersionStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Three-way merge orchestration.
 * <p>
 * Flow:
 *  1) {@link ConflictResolver#resolve} classifies every touched location.
 *  2) Manual resolutions are applied to unresolved conflicts; a resolution for any
 *     other location is rejected before anything is written.
 *  3) With unresolved conflicts left and allowPartial off, the merge stops here.
 *  4) Otherwise left's cells are overlaid with every applied value (null removes the
 *     cell) and stored as a new version whose parent is left. A merge that reproduces
 *     left exactly returns left instead of writing.
 *  5) Manual choices feed the preference-weight store, then the outcome is audited.
 * <p>
 * Store errors such as DuplicateVersion propagate unchanged; nothing is retried.
 */
public final class MergeEngine {
    private static final Logger LOG = Logger.getLogger(MergeEngine.class.getName());

    private final ConflictResolver resolver;
    private final VersionStore store;
    private final PreferenceWeightStore weights;
    private final MergeAuditLog audit;
    private final Clock clock;

    public MergeEngine(ConflictResolver resolver, VersionStore store, PreferenceWeightStore weights, MergeAuditLog audit) {
        this(resolver, store, weights, audit, Clock.systemUTC());
    }

    public MergeEngine(ConflictResolver resolver, VersionStore store, PreferenceWeightStore weights,
                       MergeAuditLog audit, Clock clock) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.store = Objects.requireNonNull(store, "store");
        this.weights = Objects.requireNonNull(weights, "weights");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public MergeResult merge(MergeRequest request) {
        Objects.requireNonNull(request, "request");
        ResolutionPlan plan = resolver.resolve(request.baseVersionId(), request.leftVersionId(), request.rightVersionId());
        checkResolutions(plan, request.resolutions());

        Map<CellKey, CellValue> overlay = new HashMap<>();
        List<Conflict> conflicts = new ArrayList<>();
        List<ManualChoice> manualChoices = new ArrayList<>();
        int auto = 0;
        int manual = 0;
        int unresolved = 0;

        for (Decision d : plan.decisions()) {
            if (d instanceof Decision.Apply apply) {
                overlay.put(apply.location(), apply.value());
                auto++;
                continue;
            }
            Conflict c = ((Decision.Contested) d).conflict();
            if (c.resolution() instanceof Resolution.AutoResolved ar) {
                overlay.put(c.location(), ar.value());
                conflicts.add(c);
                auto++;
                continue;
            }
            ManualResolution chosen = request.resolutions().get(c.location());
            if (chosen == null) {
                conflicts.add(c);
                unresolved++;
                continue;
            }
            CellValue value = chosen.apply(c);
            overlay.put(c.location(), value);
            conflicts.add(c.withResolution(new Resolution.Manual(value, chosen.choice())));
            manualChoices.add(new ManualChoice(c.location(), chosen));
            manual++;
        }

        int resolved = auto + manual;
        double confidence = resolved + unresolved == 0 ? 1.0 : (double) resolved / (resolved + unresolved);

        Version left = plan.left();
        String mergedId;
        MergeResult.Outcome outcome;
        if (unresolved > 0 && !request.allowPartial()) {
            mergedId = null;
            outcome = MergeResult.Outcome.BLOCKED;
        } else {
            NormalizedTable leftTable = store.getVersion(left.id()).table();
            NormalizedTable merged = overlay(leftTable, overlay);
            if (plan.nothingTouched() || Fingerprinter.fingerprint(merged).equals(left.contentHash())) {
                mergedId = left.id();
                outcome = MergeResult.Outcome.UNCHANGED;
            } else {
                mergedId = store.createVersion(left.documentId(), left.id(), merged, request.actor()).id();
                outcome = unresolved > 0 ? MergeResult.Outcome.PARTIAL : MergeResult.Outcome.MERGED;
            }
            recordPreferences(plan, manualChoices);
        }

        MergeResult result = new MergeResult(
                mergedId,
                plan.base().id(),
                left.id(),
                plan.right().id(),
                outcome,
                auto,
                manual,
                unresolved,
                conflicts,
                confidence,
                true);
        try {
            audit.append(request, left.documentId(), result);
        } catch (RuntimeException e) {
            // the merged version is already written; report it unaudited
            LOG.log(Level.SEVERE, "Audit append failed for merge of " + left.id() + " and " + plan.right().id()
                    + " (" + outcome + ", merged=" + mergedId + ")", e);
            result = result.withAudited(false);
        }

        LOG.info(String.format("merge %s <- (%s, %s) by %s: %s, auto=%d manual=%d unresolved=%d",
                plan.base().id(), left.id(), plan.right().id(), request.actor(), outcome, auto, manual, unresolved));
        return result;
    }

    // ---------- helpers ----------

    private record ManualChoice(CellKey location, ManualResolution resolution) {}

    private static void checkResolutions(ResolutionPlan plan, Map<CellKey, ManualResolution> resolutions) {
        if (resolutions.isEmpty()) return;
        Map<CellKey, Conflict> open = new HashMap<>();
        for (Conflict c : plan.conflicts()) {
            if (!c.isResolved()) open.put(c.location(), c);
        }
        for (CellKey at : resolutions.keySet()) {
            if (!open.containsKey(at)) {
                throw new InvalidResolutionException("No unresolved conflict at " + at.a1());
            }
        }
    }

    private static NormalizedTable overlay(NormalizedTable left, Map<CellKey, CellValue> changes) {
        if (changes.isEmpty()) return left;
        NormalizedTable.Builder b = left.toBuilder();
        for (Map.Entry<CellKey, CellValue> e : changes.entrySet()) {
            if (e.getValue() == null) b.remove(e.getKey());
            else b.set(e.getKey(), e.getValue());
        }
        return b.build();
    }

    /**
     * Chosen side's author accepted, the other side's rejected. BASE and explicit
     * values reject both. Nothing is recorded when both sides share an author.
     */
    private void recordPreferences(ResolutionPlan plan, List<ManualChoice> choices) {
        if (choices.isEmpty()) return;
        String documentId = plan.left().documentId();
        String leftAuthor = plan.left().createdBy();
        String rightAuthor = plan.right().createdBy();
        if (leftAuthor.equals(rightAuthor)) return;

        Instant now = Instant.now(clock);
        for (ManualChoice choice : choices) {
            Side side = choice.resolution().chosenSide();
            weights.recordOutcome(documentId, leftAuthor, side == Side.LEFT, now);
            weights.recordOutcome(documentId, rightAuthor, side == Side.RIGHT, now);
        }
    }
}
