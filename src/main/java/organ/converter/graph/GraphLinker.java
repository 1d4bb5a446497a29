package organ.converter.graph;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import organ.converter.ProgressListener;
import organ.converter.model.ConversionLog;
import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;

/**
 * Turns id attributes into parent/child edges between source records.
 * <p>
 * Three passes: the plain rules in table order, the derived rules, then root attachment of the
 * remaining parentless records of {@link LinkageRules#ROOT_ATTACHED_TYPES}.
 */
public final class GraphLinker {

    private final List<LinkageRule> rules;
    private final List<DerivedLinkageRule> derivedRules;
    private final Set<String> excluded;
    private final ConversionLog log;
    private final ProgressListener progress;

    public GraphLinker(Set<String> excluded, ConversionLog log, ProgressListener progress) {
        this(LinkageRules.RULES, LinkageRules.DERIVED_RULES, excluded, log, progress);
    }

    public GraphLinker(List<LinkageRule> rules, List<DerivedLinkageRule> derivedRules, Set<String> excluded,
                       ConversionLog log, ProgressListener progress) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.derivedRules = List.copyOf(Objects.requireNonNull(derivedRules, "derivedRules"));
        this.excluded = Set.copyOf(Objects.requireNonNull(excluded, "excluded"));
        this.log = Objects.requireNonNull(log, "log");
        this.progress = progress == null ? ProgressListener.NONE : progress;
    }

    /**
     * Links every record of {@code store}.
     *
     * @return number of edges created
     */
    public int link(RecordStore store) {
        Objects.requireNonNull(store, "store");
        int edges = 0;

        // Step 1: plain rules
        String currentType = null;
        for (LinkageRule rule : rules) {
            if (!rule.recordType().equals(currentType)) {
                currentType = rule.recordType();
                if (store.hasType(currentType)) {
                    progress.onProgress("linking " + currentType);
                }
            }
            if (excluded.contains(rule.name())) {
                if (store.hasType(rule.recordType())) {
                    log.info("linkage " + rule.name() + " excluded");
                }
                continue;
            }
            edges += apply(rule, store);
        }

        // Step 2: derived rules
        for (DerivedLinkageRule rule : derivedRules) {
            if (excluded.contains(rule.name())) {
                log.info("linkage " + rule.name() + " excluded");
                continue;
            }
            edges += apply(rule, store);
        }

        // Step 3: root attachment
        final SourceRecord root = store.root();
        if (root == null) {
            log.internal("no root record to attach parentless records to");
        } else {
            for (String type : LinkageRules.ROOT_ATTACHED_TYPES) {
                for (SourceRecord r : store.ofType(type)) {
                    if (r.parents().isEmpty() && SourceRecord.link(root, r)) {
                        edges++;
                    }
                }
            }
        }

        log.info("linked " + edges + " edges");
        return edges;
    }

    private int apply(LinkageRule rule, RecordStore store) {
        int edges = 0;
        boolean targetMissingReported = false;
        for (SourceRecord record : store.ofType(rule.recordType())) {
            final String raw = record.attr(rule.attribute());
            final Integer id = Ids.parsePositiveInt(raw);
            if (id == null) {
                if (rule.mandatory()) {
                    log.warn(record.key() + ": " + (raw == null ? "missing " : "invalid ") + rule.attribute()
                            + (raw == null ? "" : "=" + raw));
                }
                continue;
            }
            if (!store.hasType(rule.targetType())) {
                if (!targetMissingReported) {
                    log.internal("linkage " + rule.name() + " references type " + rule.targetType()
                            + " which was never loaded");
                    targetMissingReported = true;
                }
                continue;
            }
            final SourceRecord target = store.find(rule.targetType(), id);
            if (target == null) {
                if (rule.mandatory()) {
                    log.warn(record.key() + ": " + rule.attribute() + "=" + id + " references no "
                            + rule.targetType());
                }
                continue;
            }
            final boolean created = rule.direction() == LinkDirection.TO_PARENT
                    ? SourceRecord.link(target, record)
                    : SourceRecord.link(record, target);
            if (created) {
                edges++;
            }
        }
        return edges;
    }

    private int apply(DerivedLinkageRule rule, RecordStore store) {
        int edges = 0;
        for (SourceRecord record : store.ofType(rule.recordType())) {
            if (rule.onlyIfUnlinked() && record.firstParent(rule.targetType()) != null) {
                continue;
            }
            final List<SourceRecord> vias = rule.viaIsParent()
                    ? record.parents(rule.viaType())
                    : record.children(rule.viaType());
            for (SourceRecord via : vias) {
                for (SourceRecord target : via.parents(rule.targetType())) {
                    if (SourceRecord.link(target, record)) {
                        edges++;
                    }
                }
            }
        }
        return edges;
    }
}
