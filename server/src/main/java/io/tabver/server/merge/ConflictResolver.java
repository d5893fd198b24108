// file: src/main/java/io/tabver/server/merge/ConflictResolver.java
package io.tabver.server.merge;

import io.tabver.core.CrossDocumentException;
import io.tabver.core.Version;
import io.tabver.core.diff.DiffOptions;
import io.tabver.core.merge.AuthorHistory;
import io.tabver.core.merge.DefaultThreeWayMerger;
import io.tabver.core.merge.Decision;
import io.tabver.core.merge.ResolverSettings;
import io.tabver.core.merge.ThreeWayMerger;
import io.tabver.server.diff.DiffEngine;
import io.tabver.server.diff.DiffReport;
import io.tabver.storage.PreferenceWeight;
import io.tabver.storage.PreferenceWeightStore;
import io.tabver.storage.VersionStore;

import java.util.List;
import java.util.Objects;

/**
 * Classifies every location changed relative to a common base.
 * <p>
 * Responsibilities:
 *  - Load base, left and right and check they share a document.
 *  - Diff base->left and base->right (positional, changes only, resolver epsilon).
 *  - Look up each side's author history for the document.
 *  - Hand both diffs to the {@link ThreeWayMerger}.
 * <p>
 * Read-only: neither versions nor preference weights are mutated here.
 */
public final class ConflictResolver {
    private final VersionStore store;
    private final DiffEngine diffs;
    private final PreferenceWeightStore weights;
    private final ThreeWayMerger merger;
    private final DiffOptions diffOptions;

    public ConflictResolver(VersionStore store, DiffEngine diffs, PreferenceWeightStore weights, ResolverSettings settings) {
        this(store, diffs, weights, settings, new DefaultThreeWayMerger(settings));
    }

    public ConflictResolver(VersionStore store, DiffEngine diffs, PreferenceWeightStore weights,
                            ResolverSettings settings, ThreeWayMerger merger) {
        this.store = Objects.requireNonNull(store, "store");
        this.diffs = Objects.requireNonNull(diffs, "diffs");
        this.weights = Objects.requireNonNull(weights, "weights");
        this.merger = Objects.requireNonNull(merger, "merger");
        this.diffOptions = DiffOptions.defaults().withNumericEpsilon(settings.numericEpsilon());
    }

    /**
     * @throws io.tabver.core.VersionNotFoundException if any id is unknown
     * @throws CrossDocumentException                  if the three versions do not share a document
     */
    public ResolutionPlan resolve(String baseVersionId, String leftVersionId, String rightVersionId) {
        Version base = store.getVersion(baseVersionId).version();
        Version left = store.getVersion(leftVersionId).version();
        Version right = store.getVersion(rightVersionId).version();
        requireSameDocument(base, left);
        requireSameDocument(base, right);

        DiffReport baseToLeft = diffs.compare(base.id(), left.id(), diffOptions);
        DiffReport baseToRight = diffs.compare(base.id(), right.id(), diffOptions);

        String documentId = base.documentId();
        List<Decision> decisions = merger.merge(
                baseToLeft.entries(),
                baseToRight.entries(),
                history(documentId, left.createdBy()),
                history(documentId, right.createdBy()));
        return new ResolutionPlan(base, left, right, decisions);
    }

    private AuthorHistory history(String documentId, String actor) {
        PreferenceWeight w = weights.get(documentId, actor);
        return new AuthorHistory(actor, w.weight(), w.total());
    }

    private static void requireSameDocument(Version a, Version b) {
        if (!a.documentId().equals(b.documentId())) {
            throw new CrossDocumentException(a.id(), a.documentId(), b.id(), b.documentId());
        }
    }
}
