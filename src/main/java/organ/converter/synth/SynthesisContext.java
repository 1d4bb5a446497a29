package organ.converter.synth;

import static organ.converter.model.SourceAttributes.IMAGE_ELEMENT_BITMAP;
import static organ.converter.model.SourceAttributes.IMAGE_ELEMENT_INDEX;
import static organ.converter.model.SourceAttributes.IMAGE_SET_HEIGHT;
import static organ.converter.model.SourceAttributes.IMAGE_SET_MASK;
import static organ.converter.model.SourceAttributes.IMAGE_SET_PACKAGE;
import static organ.converter.model.SourceAttributes.IMAGE_SET_WIDTH;
import static organ.converter.model.SourceAttributes.SAMPLE_FILENAME;
import static organ.converter.model.SourceAttributes.SAMPLE_PACKAGE;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import organ.converter.ProgressListener;
import organ.converter.graph.ControlNetwork;
import organ.converter.graph.ControlNetworkResolver;
import organ.converter.graph.RecordStore;
import organ.converter.graph.TargetStore;
import organ.converter.model.AttributeReader;
import organ.converter.model.ConversionLog;
import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;
import organ.converter.model.TargetRecord;
import organ.converter.scan.MediaResolver;

/**
 * State shared by the synthesis phases of one run.
 */
final class SynthesisContext {

    static final String DUMMY_PIPE = "DUMMY";
    static final String SILENT_LOOP = ObjectSynthesizer.SILENT_LOOP_FILE;
    static final String NOISES_MANUAL_NAME = "Noises";

    final RecordStore source;
    final TargetStore target;
    final AttributeReader attrs;
    final ConversionLog log;
    final ProgressListener progress;
    final ControlNetworkResolver resolver;
    final MediaResolver media;
    final String mediaPrefix;
    final WindchestRegistry windchests;

    TargetRecord organ;
    final Map<SourceRecord, TargetRecord> panelsByPage = new LinkedHashMap<>();
    final Map<SourceRecord, TargetRecord> manualsByKeyboard = new LinkedHashMap<>();
    final Map<SourceRecord, TargetRecord> manualsByDivision = new HashMap<>();
    SourceRecord lastDivision;
    private TargetRecord noisesManual;
    private boolean silentLoopUsed;

    /**
     * @param mediaPrefix prefix turning a sample-set relative path into one relative to the target document
     */
    SynthesisContext(RecordStore source, TargetStore target, ConversionLog log, ProgressListener progress,
                     MediaResolver media, String mediaPrefix) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.log = Objects.requireNonNull(log, "log");
        this.progress = progress == null ? ProgressListener.NONE : progress;
        this.media = Objects.requireNonNull(media, "media");
        this.mediaPrefix = mediaPrefix == null ? "" : mediaPrefix;
        this.attrs = new AttributeReader(log);
        this.resolver = new ControlNetworkResolver(attrs);
        this.windchests = new WindchestRegistry(this);
    }

    // --- panels ---

    TargetRecord defaultPanel() {
        return target.get("Panel000");
    }

    /**
     * Target panel of a display page, falling back to the default panel.
     */
    TargetRecord panelFor(SourceRecord page) {
        final TargetRecord panel = page == null ? null : panelsByPage.get(page);
        return panel != null ? panel : defaultPanel();
    }

    TargetRecord addPanelElement(TargetRecord panel, String type) {
        final TargetRecord element = target.create(panel.id() + "Element");
        panel.increment("NumberOfGUIElements");
        element.set("Type", type);
        return element;
    }

    TargetRecord addPanelImage(TargetRecord panel) {
        final TargetRecord image = target.create(panel.id() + "Image");
        panel.increment("NumberOfImages");
        return image;
    }

    // --- manuals ---

    /**
     * Manual receiving the stops of a division; the noises manual when no keyboard plays it.
     */
    TargetRecord manualForDivision(SourceRecord division) {
        final TargetRecord manual = division == null ? null : manualsByDivision.get(division);
        return manual != null ? manual : noisesManual();
    }

    TargetRecord noisesManual() {
        if (noisesManual == null) {
            noisesManual = target.create("Manual");
            noisesManual.set("Name", NOISES_MANUAL_NAME);
            noisesManual.set("NumberOfLogicalKeys", 1);
            noisesManual.set("FirstAccessibleKeyLogicalKeyNumber", 1);
            noisesManual.set("FirstAccessibleKeyMIDINoteNumber", 36);
            noisesManual.set("NumberOfAccessibleKeys", 0);
            noisesManual.set("MIDIInputNumber", 0);
            noisesManual.set("Displayed", false);
            ManualBuilder.initCounters(noisesManual);
            log.info("manual " + noisesManual.id() + " created for noises and keyboard-less divisions");
        }
        return noisesManual;
    }

    // --- switches ---

    /**
     * Target switch of a control network, created on first use. Every switch of the network gets it as
     * back-reference.
     */
    TargetRecord switchFor(ControlNetwork network, String fallbackName) {
        final String existing = network.existingTarget("Switch");
        if (existing != null && target.contains(existing)) {
            network.assignTarget(existing);
            return target.get(existing);
        }
        return SwitchBuilder.create(this, network, fallbackName);
    }

    /**
     * Makes {@code device} follow the network's target switch: {@code Function=And} of one switch, or
     * {@code Not} for an inverting network.
     */
    void gate(TargetRecord device, ControlNetwork network, String fallbackName) {
        final TargetRecord sw = switchFor(network, fallbackName);
        device.set("Function", network.inverting() ? "Not" : "And");
        device.set("SwitchCount", 1);
        device.set("Switch001", Ids.number3(Ids.targetNumber(sw.id())));
    }

    /**
     * Marks the switches of a dropped device so later phases skip them.
     */
    void discard(ControlNetwork network) {
        network.assignTarget(SourceRecord.NO_TARGET);
    }

    // --- media ---

    /**
     * Path of a sample in the target document, or null if the file is missing.
     */
    String samplePath(SourceRecord sample) {
        if (sample == null) {
            return null;
        }
        final Integer pkg = attrs.reference(sample, SAMPLE_PACKAGE);
        final String file = attrs.text(sample, SAMPLE_FILENAME);
        if (pkg == null || file == null) {
            log.warn(sample.key() + ": sample without installation package or file name");
            return null;
        }
        return mediaPath(MediaResolver.packagePath(pkg, file));
    }

    /**
     * Path of the bitmap with the given element index of an image set, or null.
     */
    String imagePath(SourceRecord imageSet, int elementIndex) {
        if (imageSet == null) {
            return null;
        }
        for (SourceRecord element : imageSet.children(SourceTypes.IMAGE_SET_ELEMENT)) {
            if (attrs.integer(element, IMAGE_ELEMENT_INDEX, 1) == elementIndex) {
                return packageFile(imageSet, attrs.text(element, IMAGE_ELEMENT_BITMAP));
            }
        }
        return null;
    }

    String maskPath(SourceRecord imageSet) {
        if (imageSet == null || !attrs.isSet(imageSet, IMAGE_SET_MASK)) {
            return null;
        }
        return packageFile(imageSet, attrs.text(imageSet, IMAGE_SET_MASK));
    }

    int imageWidth(SourceRecord imageSet, int fallback) {
        return imageSet == null ? fallback : attrs.integer(imageSet, IMAGE_SET_WIDTH, fallback);
    }

    int imageHeight(SourceRecord imageSet, int fallback) {
        return imageSet == null ? fallback : attrs.integer(imageSet, IMAGE_SET_HEIGHT, fallback);
    }

    private String packageFile(SourceRecord imageSet, String file) {
        final Integer pkg = attrs.reference(imageSet, IMAGE_SET_PACKAGE);
        if (file == null) {
            return null;
        }
        if (pkg == null) {
            log.warn(imageSet.key() + ": image set without installation package");
            return null;
        }
        return mediaPath(MediaResolver.packagePath(pkg, file));
    }

    private String mediaPath(String sampleSetRelative) {
        final String resolved = media.resolve(sampleSetRelative);
        return resolved == null ? null : mediaPrefix + resolved;
    }

    /**
     * Path of the generated silent loop, relative to the target document.
     */
    String silentLoop() {
        silentLoopUsed = true;
        return SILENT_LOOP;
    }

    boolean silentLoopUsed() {
        return silentLoopUsed;
    }
}
