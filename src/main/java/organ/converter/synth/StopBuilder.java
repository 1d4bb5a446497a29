package organ.converter.synth;

import static organ.converter.model.SourceAttributes.STOP_NAME;
import static organ.converter.model.SourceAttributes.STOP_RANK_ACTION_TYPE;
import static organ.converter.model.SourceAttributes.STOP_RANK_FIRST_NOTE;
import static organ.converter.model.SourceAttributes.STOP_RANK_LAYER;
import static organ.converter.model.SourceAttributes.STOP_RANK_NODE_COUNT;
import static organ.converter.model.SourceAttributes.STOP_RANK_NOTE_INCREMENT;
import static organ.converter.model.SourceAttributes.STOP_RANK_RANK;
import static organ.converter.model.SourceAttributes.SWITCH_NAME;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import organ.converter.graph.ControlNetwork;
import organ.converter.graph.TraceDirection;
import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;
import organ.converter.model.TargetRecord;

/**
 * Pipe-bearing stops. Stop-ranks with a normal action code map a key range of the manual onto a pipe range of
 * a target rank; ranks are shared between stops.
 */
final class StopBuilder {

    static final int ACTION_NORMAL = 1;

    /**
     * One stop-rank mapping, in manual key numbers (MIDI).
     */
    record RankRange(SourceRecord stopRank, SourceRecord rank, int layer, int increment, int firstKey, int lastKey) {
    }

    private StopBuilder() {
    }

    static void build(SynthesisContext ctx) {
        for (SourceRecord stop : ctx.source.ofType(SourceTypes.STOP)) {
            if (stop.hasTarget()) {
                continue;
            }
            ctx.progress.onProgress("stop " + stop.key());
            convert(ctx, stop);
        }
    }

    private static void convert(SynthesisContext ctx, SourceRecord stop) {
        final List<SourceRecord> normal = new ArrayList<>();
        boolean noise = false;
        for (SourceRecord stopRank : stopRanks(stop)) {
            final int code = ctx.attrs.integer(stopRank, STOP_RANK_ACTION_TYPE, ACTION_NORMAL);
            if (code == ACTION_NORMAL) {
                normal.add(stopRank);
            } else if (NoiseBuilder.isNoiseCode(code)) {
                noise = true;
            } else {
                ctx.log.warn(stopRank.key() + ": unsupported action type code " + code + ", ignored");
            }
        }
        if (normal.isEmpty()) {
            if (!noise) {
                stop.assignTarget(SourceRecord.NO_TARGET);
                ctx.log.info(stop.key() + ": no pipe-bearing rank, stop skipped");
            }
            return;
        }

        final ControlNetwork network = ctx.resolver.resolve(stop, TraceDirection.UPSTREAM).orElseGet(ControlNetwork::new);
        if (network.isEmpty()) {
            stop.assignTarget(SourceRecord.NO_TARGET);
            ctx.log.info(stop.key() + ": no controlling switch, stop dropped");
            return;
        }

        final SourceRecord division = stop.firstParent(SourceTypes.DIVISION);
        final TargetRecord manual = ctx.manualForDivision(division);
        if (division != null) {
            ctx.lastDivision = division;
        }
        final int manualFirst = ManualBuilder.firstNote(manual);
        final int manualCount = Math.max(1, ManualBuilder.keyCount(manual));

        final List<RankRange> ranges = new ArrayList<>();
        for (SourceRecord stopRank : normal) {
            final RankRange range = rangeOf(ctx, stopRank, manualFirst, manualCount);
            if (range != null) {
                ranges.add(range);
            }
        }
        if (ranges.isEmpty()) {
            ctx.discard(network);
            stop.assignTarget(SourceRecord.NO_TARGET);
            ctx.log.info(stop.key() + ": no rank reaches the keys of " + manual.id() + ", stop skipped");
            return;
        }

        final TargetRecord target = ctx.target.create("Stop");
        stop.assignTarget(target.id());
        target.set("Name", stopName(ctx, stop, network));
        target.set("FirstAccessiblePipeLogicalKeyNumber", 1);
        target.set("NumberOfAccessiblePipes", manualCount);
        target.set("NumberOfRanks", 0);
        for (RankRange range : ranges) {
            addRank(ctx, target, range, manualFirst);
        }
        target.set("DefaultToEngaged", network.defaultEngaged());
        target.set("Displayed", false);
        ctx.gate(target, network, target.get("Name"));
        manual.appendReference("NumberOfStops", "Stop", Ids.targetNumber(target.id()));
    }

    /**
     * Keys of the manual the stop-rank plays, clipped to the manual and to the pipes of the rank; null when
     * nothing is left.
     */
    static RankRange rangeOf(SynthesisContext ctx, SourceRecord stopRank, int manualFirst, int manualCount) {
        final SourceRecord rank = rankOf(ctx, stopRank);
        if (rank == null) {
            return null;
        }
        final int[] pipes = RankBuilder.noteRange(ctx, rank);
        if (pipes == null) {
            ctx.log.info(stopRank.key() + ": " + rank.key() + " has no pipes");
            return null;
        }
        final int increment = ctx.attrs.integer(stopRank, STOP_RANK_NOTE_INCREMENT, 0);
        final int mappedFirst = ctx.attrs.integer(stopRank, STOP_RANK_FIRST_NOTE, manualFirst);
        final int mappedCount = ctx.attrs.integer(stopRank, STOP_RANK_NODE_COUNT, manualCount);
        final int manualLast = manualFirst + manualCount - 1;

        final int firstKey = Math.max(mappedFirst, Math.max(manualFirst, pipes[0] - increment));
        final int lastKey = Math.min(mappedFirst + mappedCount - 1, Math.min(manualLast, pipes[1] - increment));
        if (firstKey > lastKey) {
            ctx.log.warn(stopRank.key() + ": mapped keys " + mappedFirst + ".." + (mappedFirst + mappedCount - 1)
                    + " reach no pipe of " + rank.key() + ", ignored");
            return null;
        }
        final int layer = ctx.attrs.integer(stopRank, STOP_RANK_LAYER, 1);
        return new RankRange(stopRank, rank, layer, increment, firstKey, lastKey);
    }

    private static void addRank(SynthesisContext ctx, TargetRecord stop, RankRange range, int manualFirst) {
        final TargetRecord rank = RankBuilder.rankFor(ctx, range.rank(), range.layer());
        range.stopRank().assignTarget(rank.id());
        final int rankFirst = rank.getInt("FirstMidiNoteNumber", 0);
        final int slot = stop.appendReference("NumberOfRanks", "Rank", Ids.targetNumber(rank.id()));
        final String prefix = "Rank" + Ids.number3(slot);
        stop.set(prefix + "FirstPipeNumber", range.firstKey() + range.increment() - rankFirst + 1);
        stop.set(prefix + "PipeCount", range.lastKey() - range.firstKey() + 1);
        stop.set(prefix + "FirstAccessibleKeyNumber", range.firstKey() - manualFirst + 1);
    }

    /**
     * The rank named by the stop-rank's own rank reference, among its linked ranks.
     */
    private static SourceRecord rankOf(SynthesisContext ctx, SourceRecord stopRank) {
        final Integer id = ctx.attrs.reference(stopRank, STOP_RANK_RANK);
        if (id == null) {
            return null;
        }
        for (SourceRecord rank : stopRank.children(SourceTypes.RANK)) {
            if (rank.id() == id) {
                return rank;
            }
        }
        return null;
    }

    static List<SourceRecord> stopRanks(SourceRecord stop) {
        final List<SourceRecord> out = new ArrayList<>(stop.children(SourceTypes.STOP_RANK));
        out.sort(Comparator.comparingInt(SourceRecord::id));
        return out;
    }

    static String stopName(SynthesisContext ctx, SourceRecord stop, ControlNetwork network) {
        final String name = ctx.attrs.text(stop, STOP_NAME);
        if (name != null) {
            return name;
        }
        for (SourceRecord sw : network.switches()) {
            final String switchName = ctx.attrs.text(sw, SWITCH_NAME);
            if (switchName != null) {
                return switchName;
            }
        }
        return stop.key();
    }
}
