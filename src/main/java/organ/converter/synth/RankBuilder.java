package organ.converter.synth;

import static organ.converter.model.SourceAttributes.LAYER_GAIN;
import static organ.converter.model.SourceAttributes.LAYER_NUMBER;
import static organ.converter.model.SourceAttributes.PIPE_NOTE;
import static organ.converter.model.SourceAttributes.RANK_NAME;
import static organ.converter.model.SourceAttributes.RELEASE_MAX_KEY_TIME;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;

import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;
import organ.converter.model.TargetRecord;

/**
 * Source ranks to target ranks, one per (rank, pipe layer). Notes without a pipe become {@code DUMMY}.
 */
final class RankBuilder {

    static final String SOURCE_ATTRIBUTE = "_SourceRank";

    private RankBuilder() {
    }

    /**
     * Target rank for the given layer of {@code rank}, created on first use.
     */
    static TargetRecord rankFor(SynthesisContext ctx, SourceRecord rank, int layerNumber) {
        final String key = rank.key() + "/" + layerNumber;
        for (TargetRecord existing : ctx.target.withPrefix("Rank")) {
            if (key.equals(existing.get(SOURCE_ATTRIBUTE))) {
                return existing;
            }
        }

        final TreeMap<Integer, SourceRecord> pipes = pipesByNote(ctx, rank);
        final TargetRecord target = ctx.target.create("Rank");
        rank.assignTarget(target.id());
        final String name = ctx.attrs.text(rank, RANK_NAME);
        target.set("Name", (name != null ? name : rank.key()) + (layerNumber == 1 ? "" : " (layer " + layerNumber + ")"));
        final int first = pipes.firstKey();
        final int last = pipes.lastKey();
        target.set("FirstMidiNoteNumber", first);
        target.set("NumberOfLogicalPipes", last - first + 1);

        final SourceRecord firstPipe = pipes.firstEntry().getValue();
        final TargetRecord rankChest = ctx.windchests.windchestFor(firstPipe, layerOf(ctx, firstPipe, layerNumber));
        target.set("WindchestGroup", Ids.number3(Ids.targetNumber(rankChest.id())));
        target.set("Percussive", false);
        target.set(SOURCE_ATTRIBUTE, key);

        for (int note = first; note <= last; note++) {
            final String prefix = "Pipe" + Ids.number3(note - first + 1);
            final SourceRecord pipe = pipes.get(note);
            if (pipe == null) {
                target.set(prefix, SynthesisContext.DUMMY_PIPE);
                continue;
            }
            final SourceRecord layer = layerOf(ctx, pipe, layerNumber);
            if (layer == null) {
                ctx.log.warn(pipe.key() + ": no layer " + layerNumber + ", pipe left silent");
                target.set(prefix, SynthesisContext.DUMMY_PIPE);
                continue;
            }
            writePipe(ctx, target, prefix, layer);
            final TargetRecord chest = ctx.windchests.windchestFor(pipe, layer);
            if (chest != rankChest) {
                target.set(prefix + "WindchestGroup", Ids.number3(Ids.targetNumber(chest.id())));
            }
        }
        ctx.log.info(rank.key() + " layer " + layerNumber + ": " + target.id() + " with " + pipes.size() + " pipes");
        return target;
    }

    /**
     * {first, last} MIDI note of the pipes of {@code rank}, or null when it has none.
     */
    static int[] noteRange(SynthesisContext ctx, SourceRecord rank) {
        final TreeMap<Integer, SourceRecord> pipes = pipesByNote(ctx, rank);
        return pipes.isEmpty() ? null : new int[] {pipes.firstKey(), pipes.lastKey()};
    }

    static TreeMap<Integer, SourceRecord> pipesByNote(SynthesisContext ctx, SourceRecord rank) {
        final TreeMap<Integer, SourceRecord> out = new TreeMap<>();
        for (SourceRecord pipe : rank.children(SourceTypes.PIPE)) {
            final Integer note = ctx.attrs.integer(pipe, PIPE_NOTE);
            if (note == null) {
                continue;
            }
            final SourceRecord previous = out.putIfAbsent(note, pipe);
            if (previous != null) {
                ctx.log.warn(pipe.key() + ": note " + note + " already played by " + previous.key() + ", pipe ignored");
            }
        }
        return out;
    }

    static SourceRecord layerOf(SynthesisContext ctx, SourceRecord pipe, int layerNumber) {
        for (SourceRecord layer : pipe.children(SourceTypes.PIPE_LAYER)) {
            if (ctx.attrs.integer(layer, LAYER_NUMBER, 1) == layerNumber) {
                return layer;
            }
        }
        return null;
    }

    /**
     * Resolved paths of the attack samples of a layer, by sample record id.
     */
    static List<String> attackPaths(SynthesisContext ctx, SourceRecord layer) {
        return samplePaths(ctx, layer, SourceTypes.ATTACK_SAMPLE);
    }

    private static List<String> samplePaths(SynthesisContext ctx, SourceRecord layer, String type) {
        final List<String> out = new ArrayList<>();
        for (SourceRecord ref : sorted(layer.children(type))) {
            final String path = ctx.samplePath(ref.firstChild(SourceTypes.SAMPLE));
            if (path != null) {
                out.add(path);
            }
        }
        return out;
    }

    private static void writePipe(SynthesisContext ctx, TargetRecord target, String prefix, SourceRecord layer) {
        final List<String> attacks = attackPaths(ctx, layer);
        if (attacks.isEmpty()) {
            target.set(prefix, SynthesisContext.DUMMY_PIPE);
            return;
        }
        target.set(prefix, attacks.get(0));
        if (attacks.size() > 1) {
            target.set(prefix + "AttackCount", attacks.size() - 1);
            for (int i = 1; i < attacks.size(); i++) {
                target.set(prefix + "Attack" + Ids.number3(i), attacks.get(i));
            }
        }
        final Double gain = ctx.attrs.decimal(layer, LAYER_GAIN);
        if (gain != null && gain != 0.0) {
            target.set(prefix + "Gain", decimal(gain));
        }

        int releases = 0;
        for (SourceRecord ref : sorted(layer.children(SourceTypes.RELEASE_SAMPLE))) {
            final String path = ctx.samplePath(ref.firstChild(SourceTypes.SAMPLE));
            if (path == null) {
                continue;
            }
            releases++;
            final String release = prefix + "Release" + Ids.number3(releases);
            target.set(release, path);
            final Integer maxKeyTime = ctx.attrs.integer(ref, RELEASE_MAX_KEY_TIME);
            if (maxKeyTime != null && maxKeyTime > 0) {
                target.set(release + "MaxKeyPressTime", maxKeyTime);
            }
        }
        if (releases > 0) {
            target.set(prefix + "ReleaseCount", releases);
        }
    }

    private static List<SourceRecord> sorted(List<SourceRecord> records) {
        final List<SourceRecord> out = new ArrayList<>(records);
        out.sort(Comparator.comparingInt(SourceRecord::id));
        return out;
    }

    static String decimal(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
