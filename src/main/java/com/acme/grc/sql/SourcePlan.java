package com.acme.grc.sql;

import com.acme.grc.model.Enums.FieldType;
import com.acme.grc.model.Enums.JoinStrategy;
import com.acme.grc.model.EvidenceSchema;
import com.acme.grc.model.EvidenceSource;
import com.acme.grc.model.SchemaField;

import java.util.*;

/**
 * How the evidence tables of one traversal are combined into a single row source, and how field names resolve
 * against it.
 */
final class SourcePlan {
    static final String EVIDENCE_SOURCE_COLUMN = "evidence_source";

    record Column(String name, String expr, FieldType type) {}

    private final JoinStrategy strategy;
    private final List<EvidenceSource> sources;
    private final String joinKey;
    private final Dialect dialect;

    private SourcePlan(JoinStrategy strategy, List<EvidenceSource> sources, String joinKey, Dialect dialect) {
        this.strategy = strategy;
        this.sources = List.copyOf(sources);
        this.joinKey = joinKey;
        this.dialect = dialect;
    }

    static SourcePlan single(EvidenceSource source, Dialect dialect) {
        return new SourcePlan(JoinStrategy.SINGLE, List.of(source), null, dialect);
    }

    /**
     * Picks the combining strategy: a shared KEY field joins, otherwise identical schemas union, otherwise a
     * shared {@code groupBy} field joins. Anything else stays separate.
     */
    static SourcePlan plan(List<EvidenceSource> sources, List<String> groupBy, Dialect dialect) {
        if (sources.isEmpty()) return new SourcePlan(JoinStrategy.NONE, List.of(), null, dialect);
        if (sources.size() == 1) return single(sources.get(0), dialect);

        String key = sharedKey(sources);
        if (key != null) return new SourcePlan(JoinStrategy.JOIN, sources, key, dialect);

        Map<String, FieldType> signature = sources.get(0).schema().signature();
        boolean unionCompatible = sources.stream().allMatch(s -> s.schema().signature().equals(signature));
        if (unionCompatible) return new SourcePlan(JoinStrategy.UNION, sources, null, dialect);

        key = sharedGroupField(sources, groupBy);
        if (key != null) return new SourcePlan(JoinStrategy.JOIN, sources, key, dialect);
        return new SourcePlan(JoinStrategy.SEPARATE, sources, null, dialect);
    }

    private static String sharedKey(List<EvidenceSource> sources) {
        for (SchemaField f : sources.get(0).schema().fields()) {
            if (!f.isKey()) continue;
            boolean shared = sources.stream().allMatch(s -> s.schema().field(f.name())
                    .filter(o -> o.isKey() && o.type() == f.type()).isPresent());
            if (shared) return f.name();
        }
        return null;
    }

    private static String sharedGroupField(List<EvidenceSource> sources, List<String> groupBy) {
        EvidenceSchema first = sources.get(0).schema();
        for (String g : groupBy) {
            Optional<SchemaField> f = first.field(g);
            if (f.isEmpty()) continue;
            FieldType type = f.get().type();
            boolean shared = sources.stream().allMatch(s -> s.schema().field(g).filter(o -> o.type() == type).isPresent());
            if (shared) return f.get().name();
        }
        return null;
    }

    JoinStrategy strategy() { return strategy; }
    String joinKey() { return joinKey; }

    List<String> tables() {
        return sources.stream().map(EvidenceSource::evidenceName).toList();
    }

    String from() {
        return switch (strategy) {
            case SINGLE -> dialect.quote(sources.get(0).evidenceName());
            case UNION -> unionFrom();
            case JOIN -> joinFrom();
            default -> throw new IllegalStateException("No combined row source for strategy " + strategy);
        };
    }

    private String unionFrom() {
        List<SchemaField> canonical = sources.get(0).schema().fields();
        StringJoiner union = new StringJoiner(" UNION ALL ", "(", ") u");
        for (EvidenceSource s : sources) {
            StringJoiner cols = new StringJoiner(", ");
            for (SchemaField f : canonical) {
                String actual = s.schema().field(f.name()).map(SchemaField::name).orElseThrow();
                cols.add(actual.equals(f.name())
                        ? dialect.quote(actual)
                        : dialect.quote(actual) + " AS " + dialect.quote(f.name()));
            }
            cols.add(dialect.stringLiteral(s.evidenceName()) + " AS " + EVIDENCE_SOURCE_COLUMN);
            union.add("SELECT " + cols + " FROM " + dialect.quote(s.evidenceName()));
        }
        return union.toString();
    }

    private String joinFrom() {
        StringBuilder sb = new StringBuilder(dialect.quote(sources.get(0).evidenceName())).append(" t1");
        String leftKey = "t1." + dialect.quote(sources.get(0).schema().field(joinKey).orElseThrow().name());
        for (int i = 1; i < sources.size(); i++) {
            EvidenceSource s = sources.get(i);
            String alias = "t" + (i + 1);
            String rightKey = alias + "." + dialect.quote(s.schema().field(joinKey).orElseThrow().name());
            sb.append(" JOIN ").append(dialect.quote(s.evidenceName())).append(' ').append(alias)
                    .append(" ON ").append(leftKey).append(" = ").append(rightKey);
        }
        return sb.toString();
    }

    /** Resolves {@code field} against the row source; the first evidence defining it wins for joins. */
    Column resolve(String field) {
        if (field == null || field.isBlank()) throw new UndefinedFieldReferenceException(String.valueOf(field), tables());
        if (strategy == JoinStrategy.UNION && field.equalsIgnoreCase(EVIDENCE_SOURCE_COLUMN)) {
            return new Column(EVIDENCE_SOURCE_COLUMN, EVIDENCE_SOURCE_COLUMN, FieldType.TEXT);
        }
        for (int i = 0; i < sources.size(); i++) {
            Optional<SchemaField> f = sources.get(i).schema().field(field);
            if (f.isEmpty()) continue;
            String quoted = dialect.quote(f.get().name());
            String expr = strategy == JoinStrategy.JOIN ? "t" + (i + 1) + "." + quoted : quoted;
            return new Column(f.get().name(), expr, f.get().type());
        }
        throw new UndefinedFieldReferenceException(field, tables());
    }

    /** Every field the row source exposes, first definition of each name only. */
    List<Column> allColumns() {
        List<Column> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int upTo = strategy == JoinStrategy.JOIN ? sources.size() : 1;
        for (int i = 0; i < upTo; i++) {
            for (SchemaField f : sources.get(i).schema().fields()) {
                if (seen.add(f.name().toLowerCase(Locale.ROOT))) out.add(resolve(f.name()));
            }
        }
        if (strategy == JoinStrategy.UNION) out.add(resolve(EVIDENCE_SOURCE_COLUMN));
        return out;
    }
}
