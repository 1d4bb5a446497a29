package organ.converter.synth;

import static organ.converter.model.SourceAttributes.STOP_RANK_ACTION_TYPE;
import static organ.converter.model.SourceAttributes.STOP_RANK_LAYER;
import static organ.converter.model.SourceAttributes.STOP_RANK_RANK;

import java.util.ArrayList;
import java.util.List;

import organ.converter.graph.ControlNetwork;
import organ.converter.graph.TraceDirection;
import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;
import organ.converter.model.TargetRecord;

/**
 * Stop action noises and ambient sounds. Each sound becomes a one-pipe rank sounded by a stop of the noises
 * manual while the stop's switch is engaged.
 * <p>
 * Engage noises and disengage noises are paired by order: the engage sound is the attack, the disengage sound
 * the release. A missing engage side is replaced by the silent loop.
 */
final class NoiseBuilder {

    static final int ACTION_ENGAGE_NOISE = 21;
    static final int ACTION_DISENGAGE_NOISE = 22;
    static final int ACTION_AMBIENT = 23;

    /**
     * One resolved sample and the pipe that carries it.
     */
    record Sound(String path, SourceRecord pipe, SourceRecord layer) {
    }

    private NoiseBuilder() {
    }

    static boolean isNoiseCode(int code) {
        return code == ACTION_ENGAGE_NOISE || code == ACTION_DISENGAGE_NOISE || code == ACTION_AMBIENT;
    }

    static void build(SynthesisContext ctx) {
        for (SourceRecord stop : ctx.source.ofType(SourceTypes.STOP)) {
            if (stop.hasTarget()) {
                continue;
            }
            final List<Sound> engage = new ArrayList<>();
            final List<Sound> disengage = new ArrayList<>();
            final List<Sound> ambient = new ArrayList<>();
            for (SourceRecord stopRank : StopBuilder.stopRanks(stop)) {
                final int code = ctx.attrs.integer(stopRank, STOP_RANK_ACTION_TYPE, StopBuilder.ACTION_NORMAL);
                switch (code) {
                    case ACTION_ENGAGE_NOISE -> engage.addAll(sounds(ctx, stopRank));
                    case ACTION_DISENGAGE_NOISE -> disengage.addAll(sounds(ctx, stopRank));
                    case ACTION_AMBIENT -> ambient.addAll(sounds(ctx, stopRank));
                    default -> {
                    }
                }
            }
            if (engage.isEmpty() && disengage.isEmpty() && ambient.isEmpty()) {
                continue;
            }
            ctx.progress.onProgress("noise " + stop.key());
            convert(ctx, stop, engage, disengage, ambient);
        }
    }

    private static void convert(SynthesisContext ctx, SourceRecord stop, List<Sound> engage, List<Sound> disengage,
                                List<Sound> ambient) {
        final ControlNetwork network = ctx.resolver.resolve(stop, TraceDirection.UPSTREAM).orElseGet(ControlNetwork::new);
        if (network.isEmpty()) {
            stop.assignTarget(SourceRecord.NO_TARGET);
            ctx.log.info(stop.key() + ": no controlling switch, noise dropped");
            return;
        }
        final SourceRecord division = stop.firstParent(SourceTypes.DIVISION);
        if (division != null) {
            ctx.lastDivision = division;
        }
        final TargetRecord manual = ctx.noisesManual();
        final String name = StopBuilder.stopName(ctx, stop, network);

        final TargetRecord target = ctx.target.create("Stop");
        stop.assignTarget(target.id());
        target.set("Name", name);
        target.set("FirstAccessiblePipeLogicalKeyNumber", 1);
        target.set("NumberOfAccessiblePipes", 1);
        target.set("NumberOfRanks", 0);

        final int pairs = Math.max(engage.size(), disengage.size());
        for (int i = 0; i < pairs; i++) {
            final Sound on = i < engage.size() ? engage.get(i) : null;
            final Sound off = i < disengage.size() ? disengage.get(i) : null;
            final TargetRecord rank = noiseRank(ctx, name + " noise " + (i + 1), on != null ? on : off);
            if (on != null) {
                rank.set("Pipe001", on.path());
            } else {
                rank.set("Pipe001", ctx.silentLoop());
            }
            if (off != null) {
                rank.set("Pipe001ReleaseCount", 1);
                rank.set("Pipe001Release001", off.path());
            } else {
                rank.set("Pipe001Percussive", true);
            }
            addRank(target, rank);
        }
        for (int i = 0; i < ambient.size(); i++) {
            final Sound sound = ambient.get(i);
            final TargetRecord rank = noiseRank(ctx, name + " ambient " + (i + 1), sound);
            rank.set("Pipe001", sound.path());
            addRank(target, rank);
        }

        target.set("DefaultToEngaged", network.defaultEngaged());
        target.set("Displayed", false);
        ctx.gate(target, network, name);
        manual.appendReference("NumberOfStops", "Stop", Ids.targetNumber(target.id()));
    }

    private static TargetRecord noiseRank(SynthesisContext ctx, String name, Sound sound) {
        final TargetRecord rank = ctx.target.create("Rank");
        rank.set("Name", name);
        rank.set("FirstMidiNoteNumber", ManualBuilder.firstNote(ctx.noisesManual()));
        rank.set("NumberOfLogicalPipes", 1);
        final TargetRecord chest = ctx.windchests.windchestFor(sound.pipe(), sound.layer());
        rank.set("WindchestGroup", Ids.number3(Ids.targetNumber(chest.id())));
        rank.set("Percussive", false);
        return rank;
    }

    private static void addRank(TargetRecord stop, TargetRecord rank) {
        final int slot = stop.appendReference("NumberOfRanks", "Rank", Ids.targetNumber(rank.id()));
        final String prefix = "Rank" + Ids.number3(slot);
        stop.set(prefix + "FirstPipeNumber", 1);
        stop.set(prefix + "PipeCount", 1);
        stop.set(prefix + "FirstAccessibleKeyNumber", 1);
    }

    /**
     * Attack samples of the stop-rank's rank, by pipe note.
     */
    private static List<Sound> sounds(SynthesisContext ctx, SourceRecord stopRank) {
        final List<Sound> out = new ArrayList<>();
        final Integer rankId = ctx.attrs.reference(stopRank, STOP_RANK_RANK);
        SourceRecord rank = null;
        for (SourceRecord candidate : stopRank.children(SourceTypes.RANK)) {
            if (rankId != null && candidate.id() == rankId) {
                rank = candidate;
            }
        }
        if (rank == null) {
            return out;
        }
        final int layerNumber = ctx.attrs.integer(stopRank, STOP_RANK_LAYER, 1);
        for (SourceRecord pipe : RankBuilder.pipesByNote(ctx, rank).values()) {
            final SourceRecord layer = RankBuilder.layerOf(ctx, pipe, layerNumber);
            if (layer == null) {
                continue;
            }
            for (String path : RankBuilder.attackPaths(ctx, layer)) {
                out.add(new Sound(path, pipe, layer));
            }
        }
        return out;
    }
}
