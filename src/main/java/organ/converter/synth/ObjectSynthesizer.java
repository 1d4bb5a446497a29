package organ.converter.synth;

import static organ.converter.model.SourceAttributes.ORGAN_BUILDER;
import static organ.converter.model.SourceAttributes.ORGAN_BUILD_DATE;
import static organ.converter.model.SourceAttributes.ORGAN_COMMENTS;
import static organ.converter.model.SourceAttributes.ORGAN_INFO_FILENAME;
import static organ.converter.model.SourceAttributes.ORGAN_LOCATION;
import static organ.converter.model.SourceAttributes.ORGAN_NAME;
import static organ.converter.model.SourceAttributes.ORGAN_RECORDING_DETAILS;

import java.util.Objects;

import organ.converter.ProgressListener;
import organ.converter.graph.RecordStore;
import organ.converter.graph.TargetStore;
import organ.converter.model.AttrSpec;
import organ.converter.model.ConversionLog;
import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.TargetRecord;
import organ.converter.scan.MediaResolver;

/**
 * Builds the target records from a linked record store.
 * <p>
 * Phases run in a fixed order; later phases skip every source record an earlier phase already converted or
 * discarded.
 */
public final class ObjectSynthesizer {

    public static final String ORGAN_ID = "Organ";
    public static final String SILENT_LOOP_FILE = "GOSilentLoop.wav";

    private final ConversionLog log;
    private final ProgressListener progress;
    private final MediaResolver media;
    private final String mediaPrefix;
    private boolean silentLoopUsed;

    /**
     * @param mediaPrefix prepended to every sample-set relative media path written to the target
     */
    public ObjectSynthesizer(ConversionLog log, ProgressListener progress, MediaResolver media, String mediaPrefix) {
        this.log = Objects.requireNonNull(log, "log");
        this.progress = progress == null ? ProgressListener.NONE : progress;
        this.media = Objects.requireNonNull(media, "media");
        this.mediaPrefix = mediaPrefix;
    }

    public void synthesize(RecordStore source, TargetStore target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        target.clear();
        final SynthesisContext ctx = new SynthesisContext(source, target, log, progress, media, mediaPrefix);

        // Step 1: organ-wide attributes
        progress.onProgress("organ");
        ctx.organ = target.createReserved(ORGAN_ID);
        writeOrganAttributes(ctx, source.root());

        // Step 2: display pages
        PanelBuilder.build(ctx);

        // Step 3: keyboards
        ManualBuilder.build(ctx);

        // Step 4: devices
        CouplerBuilder.build(ctx);
        StopBuilder.build(ctx);
        NoiseBuilder.build(ctx);
        SwitchBuilder.convertRemaining(ctx);

        // Step 5: counts
        finish(ctx);
        silentLoopUsed = ctx.silentLoopUsed();
        log.info("synthesized " + target.size() + " target objects");
    }

    /**
     * Whether the last run referenced the generated silent loop sample.
     */
    public boolean silentLoopUsed() {
        return silentLoopUsed;
    }

    private static void writeOrganAttributes(SynthesisContext ctx, SourceRecord root) {
        final TargetRecord organ = ctx.organ;
        final String name = ctx.attrs.text(root, ORGAN_NAME);
        organ.set("ChurchName", name != null ? name : "Organ");
        // required by GrandOrgue, written empty when the source has no location
        organ.set("ChurchAddress", ctx.attrs.text(root, ORGAN_LOCATION));
        optional(ctx, organ, "OrganBuilder", root, ORGAN_BUILDER);
        optional(ctx, organ, "OrganBuildDate", root, ORGAN_BUILD_DATE);
        optional(ctx, organ, "OrganComments", root, ORGAN_COMMENTS);
        optional(ctx, organ, "RecordingDetails", root, ORGAN_RECORDING_DETAILS);
        optional(ctx, organ, "InfoFilename", root, ORGAN_INFO_FILENAME);
        organ.set("HasPedals", false);
        organ.set("DivisionalsStoreIntermanualCouplers", true);
        organ.set("DivisionalsStoreIntramanualCouplers", true);
        organ.set("DivisionalsStoreTremulants", true);
        organ.set("GeneralsStoreDivisionalCouplers", true);
        organ.set("CombinationsStoreNonDisplayedDrawstops", false);
    }

    private static void optional(SynthesisContext ctx, TargetRecord organ, String attribute, SourceRecord root,
                                 AttrSpec spec) {
        final String value = ctx.attrs.text(root, spec);
        if (value != null) {
            organ.set(attribute, value);
        }
    }

    private static void finish(SynthesisContext ctx) {
        final TargetStore target = ctx.target;
        final TargetRecord organ = ctx.organ;
        final boolean pedals = target.contains("Manual000");
        organ.set("HasPedals", pedals);
        organ.set("NumberOfManuals", countNumbered(target, "Manual"));
        organ.set("NumberOfEnclosures", target.count("Enclosure"));
        organ.set("NumberOfTremulants", 0);
        organ.set("NumberOfWindchestGroups", target.count("WindchestGroup"));
        organ.set("NumberOfReversiblePistons", 0);
        organ.set("NumberOfGenerals", 0);
        organ.set("NumberOfDivisionalCouplers", 0);
        organ.set("NumberOfPanels", countNumbered(target, "Panel"));
        organ.set("NumberOfSwitches", target.count("Switch"));
        organ.set("NumberOfRanks", target.count("Rank"));
        final TargetRecord mainPanel = ctx.defaultPanel();
        if (mainPanel != null) {
            mainPanel.set("HasPedals", pedals);
        }
        target.finishAll();
    }

    /**
     * Objects of the prefix excluding the reserved {@code 000} slot.
     */
    private static int countNumbered(TargetStore target, String prefix) {
        int n = 0;
        for (TargetRecord record : target.withPrefix(prefix)) {
            if (Ids.targetNumber(record.id()) > 0) {
                n++;
            }
        }
        return n;
    }
}
