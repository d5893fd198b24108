// file: src/main/java/io/tabver/server/dto/JsonMapping.java
package io.tabver.server.dto;

import io.tabver.core.CellKey;
import io.tabver.core.CellValue;
import io.tabver.core.NormalizedTable;
import io.tabver.core.Value;
import io.tabver.core.Version;
import io.tabver.core.diff.DiffEntry;
import io.tabver.core.diff.DiffOptions;
import io.tabver.core.diff.DiffSummary;
import io.tabver.core.merge.Conflict;
import io.tabver.core.merge.ManualResolution;
import io.tabver.core.merge.Resolution;
import io.tabver.server.merge.MergeRequest;
import io.tabver.server.merge.MergeResult;
import io.tabver.storage.VersionPage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Conversions between the DTOs and the domain types.
 * <p>
 * Every malformed input surfaces as {@link IllegalArgumentException}, which the
 * HTTP layer maps to 400.
 */
public final class JsonMapping {

    private JsonMapping() {
        // utility
    }

    // ---------- tables ----------

    public static NormalizedTable toTable(TableJson json) {
        if (json == null) throw new IllegalArgumentException("table is required");
        NormalizedTable.Builder b = NormalizedTable.builder();
        if (json.sheets == null) return b.build();
        for (SheetJson sheet : json.sheets) {
            if (sheet == null || sheet.name == null) throw new IllegalArgumentException("sheet name is required");
            b.sheet(sheet.name);
            if (sheet.cells == null) continue;
            for (CellJson cell : sheet.cells) {
                if (cell == null) throw new IllegalArgumentException("null cell in sheet " + sheet.name);
                b.put(sheet.name, cell.row, cell.column, toCellValue(cell));
            }
        }
        return b.build();
    }

    public static TableJson fromTable(NormalizedTable table) {
        TableJson out = new TableJson();
        out.sheets = new ArrayList<>(table.sheets().size());
        for (String name : table.sheets()) {
            SheetJson sheet = new SheetJson();
            sheet.name = name;
            NavigableMap<CellKey, CellValue> cells = table.sheetCells(name);
            sheet.cells = new ArrayList<>(cells.size());
            for (Map.Entry<CellKey, CellValue> e : cells.entrySet()) {
                CellJson cell = new CellJson();
                cell.row = e.getKey().row();
                cell.column = e.getKey().column();
                fill(cell, e.getValue());
                sheet.cells.add(cell);
            }
            out.sheets.add(sheet);
        }
        return out;
    }

    // ---------- values ----------

    public static CellValue toCellValue(ValueJson json) {
        if (json == null || json.type == null) throw new IllegalArgumentException("cell type is required");
        String type = json.type.toLowerCase(Locale.ROOT);
        if ("formula".equals(type)) {
            if (json.formula == null || json.formula.isBlank()) {
                throw new IllegalArgumentException("formula cell needs a formula");
            }
            String cachedType = json.cachedType == null ? "empty" : json.cachedType.toLowerCase(Locale.ROOT);
            Value cached = payload(cachedType, json.value);
            return new CellValue(new Value.Formula(json.formula, cached), json.raw != null ? json.raw : "=" + json.formula);
        }
        Value value = payload(type, json.value);
        if (json.raw != null) return new CellValue(value, json.raw);
        return switch (value.type()) {
            case TEXT -> CellValue.text(((Value.Text) value).text());
            case NUMBER -> CellValue.number(((Value.Numeric) value).number());
            case BOOLEAN -> CellValue.bool(((Value.Bool) value).bool());
            default -> CellValue.empty();
        };
    }

    public static ValueJson toValueJson(CellValue value) {
        if (value == null) return null;
        ValueJson out = new ValueJson();
        fill(out, value);
        return out;
    }

    private static void fill(ValueJson out, CellValue cv) {
        Value v = cv.value();
        out.raw = cv.rawText();
        if (v instanceof Value.Formula f) {
            out.type = "formula";
            out.formula = f.expression();
            out.cachedType = typeName(f.cached().type());
            out.value = payloadOf(f.cached());
        } else {
            out.type = typeName(v.type());
            out.value = payloadOf(v);
        }
    }

    private static Value payload(String type, Object raw) {
        return switch (type) {
            case "text" -> {
                if (!(raw instanceof String s)) throw new IllegalArgumentException("text cell needs a string value");
                yield new Value.Text(s);
            }
            case "number" -> {
                if (!(raw instanceof Number n)) throw new IllegalArgumentException("number cell needs a numeric value");
                yield new Value.Numeric(n.doubleValue());
            }
            case "boolean" -> {
                if (!(raw instanceof Boolean b)) throw new IllegalArgumentException("boolean cell needs true or false");
                yield new Value.Bool(b);
            }
            case "empty" -> Value.Empty.INSTANCE;
            default -> throw new IllegalArgumentException("unknown cell type: " + type);
        };
    }

    private static Object payloadOf(Value v) {
        if (v instanceof Value.Text t) return t.text();
        if (v instanceof Value.Numeric n) return n.number();
        if (v instanceof Value.Bool b) return b.bool();
        return null;
    }

    private static String typeName(Value.Type type) {
        return type.name().toLowerCase(Locale.ROOT);
    }

    // ---------- versions ----------

    public static VersionJson fromVersion(Version v) {
        VersionJson out = new VersionJson();
        out.id = v.id();
        out.documentId = v.documentId();
        out.versionNumber = v.versionNumber();
        out.parentVersionId = v.parentVersionId();
        out.contentHash = v.contentHash();
        out.createdAt = v.createdAt().toString();
        out.createdBy = v.createdBy();
        out.tag = v.tag();
        out.cellCount = v.cellCount();
        return out;
    }

    public static VersionPageResponse fromPage(VersionPage page) {
        VersionPageResponse out = new VersionPageResponse();
        out.versions = page.versions().stream().map(JsonMapping::fromVersion).toList();
        out.nextCursor = page.nextCursor();
        return out;
    }

    // ---------- diffs ----------

    public static DiffOptions toOptions(DiffOptionsJson json) {
        DiffOptions o = DiffOptions.defaults();
        if (json == null) return o;
        if (json.ignoreWhitespace != null) o = o.withIgnoreWhitespace(json.ignoreWhitespace);
        if (json.ignoreCase != null) o = o.withIgnoreCase(json.ignoreCase);
        if (json.structuralAware != null) o = o.withStructuralAware(json.structuralAware);
        if (json.includeUnchanged != null) o = o.withIncludeUnchanged(json.includeUnchanged);
        if (json.numericEpsilon != null) o = o.withNumericEpsilon(json.numericEpsilon);
        return o;
    }

    public static CompareResponse fromDiff(List<DiffEntry> entries, DiffSummary summary) {
        CompareResponse out = new CompareResponse();
        out.diffs = new ArrayList<>(entries.size());
        for (DiffEntry e : entries) {
            DiffEntryJson d = new DiffEntryJson();
            d.sheet = e.location().sheet();
            d.row = e.location().row();
            d.column = e.location().column();
            d.ref = e.location().a1();
            d.kind = e.kind().name().toLowerCase(Locale.ROOT);
            d.oldValue = toValueJson(e.oldValue());
            d.newValue = toValueJson(e.newValue());
            d.originRow = e.originRow();
            out.diffs.add(d);
        }
        SummaryJson s = new SummaryJson();
        s.added = summary.added();
        s.removed = summary.removed();
        s.modified = summary.modified();
        s.unchanged = summary.unchanged();
        s.rowsInserted = summary.rowsInserted();
        s.rowsDeleted = summary.rowsDeleted();
        s.total = summary.total();
        out.summary = s;
        return out;
    }

    // ---------- merges ----------

    public static MergeRequest toMergeRequest(MergeRequestJson json) {
        if (json == null) throw new IllegalArgumentException("request body is required");
        Map<CellKey, ManualResolution> resolutions = new LinkedHashMap<>();
        if (json.resolutions != null) {
            for (ResolutionJson r : json.resolutions) {
                if (r == null || r.sheet == null || r.choice == null) {
                    throw new IllegalArgumentException("resolution needs sheet, row, column and choice");
                }
                CellKey at = CellKey.of(r.sheet, r.row, r.column);
                if (resolutions.put(at, toResolution(r)) != null) {
                    throw new IllegalArgumentException("more than one resolution for " + at.a1());
                }
            }
        }
        return new MergeRequest(
                json.baseVersionId,
                json.leftVersionId,
                json.rightVersionId,
                json.actor,
                Boolean.TRUE.equals(json.allowPartial),
                resolutions);
    }

    private static ManualResolution toResolution(ResolutionJson r) {
        ManualResolution.Choice choice;
        try {
            choice = ManualResolution.Choice.valueOf(r.choice.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown resolution choice: " + r.choice, e);
        }
        if (choice == ManualResolution.Choice.VALUE) {
            return ManualResolution.value(toCellValue(r.value));
        }
        return new ManualResolution(choice, null);
    }

    public static MergeResponse fromMerge(MergeResult result) {
        MergeResponse out = new MergeResponse();
        out.mergedVersionId = result.mergedVersionId();
        out.baseVersionId = result.baseVersionId();
        out.leftVersionId = result.leftVersionId();
        out.rightVersionId = result.rightVersionId();
        out.outcome = result.outcome().name().toLowerCase(Locale.ROOT);
        out.autoResolvedCount = result.autoResolvedCount();
        out.manuallyResolvedCount = result.manuallyResolvedCount();
        out.unresolvedCount = result.unresolvedCount();
        out.conflicts = result.conflicts().stream().map(JsonMapping::fromConflict).toList();
        out.confidenceScore = result.confidenceScore();
        out.audited = result.audited();
        return out;
    }

    public static ConflictJson fromConflict(Conflict c) {
        ConflictJson out = new ConflictJson();
        out.sheet = c.location().sheet();
        out.row = c.location().row();
        out.column = c.location().column();
        out.ref = c.location().a1();
        out.kind = c.kind().name().toLowerCase(Locale.ROOT);
        out.baseValue = toValueJson(c.baseValue());
        out.leftValue = toValueJson(c.leftValue());
        out.rightValue = toValueJson(c.rightValue());
        out.confidence = c.resolution().confidence();
        out.reason = c.reason();
        Resolution r = c.resolution();
        if (r instanceof Resolution.AutoResolved auto) {
            out.resolution = "auto";
            out.resolvedValue = toValueJson(auto.value());
            out.winner = auto.winner().name().toLowerCase(Locale.ROOT);
        } else if (r instanceof Resolution.Manual manual) {
            out.resolution = "manual";
            out.resolvedValue = toValueJson(manual.value());
            out.choice = manual.choice().name().toLowerCase(Locale.ROOT);
        } else {
            out.resolution = "unresolved";
        }
        return out;
    }
}
