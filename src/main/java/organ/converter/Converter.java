package organ.converter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import organ.converter.check.OdfObjectGraph;
import organ.converter.graph.GraphLinker;
import organ.converter.graph.RecordStore;
import organ.converter.graph.TargetStore;
import organ.converter.io.OdfWriter;
import organ.converter.io.SilentLoopWriter;
import organ.converter.model.ConversionLog;
import organ.converter.model.Ids;
import organ.converter.model.TargetRecord;
import organ.converter.scan.AttributeDictionary;
import organ.converter.scan.MediaResolver;
import organ.converter.scan.SourceLoader;
import organ.converter.synth.ObjectSynthesizer;

/**
 * Converts one source document into an organ definition file.
 * Every run starts from empty stores; data-quality issues go to the caller's log.
 */
public final class Converter {

    private final ConversionLog log;
    private final RecordStore source = new RecordStore();
    private final TargetStore target = new TargetStore();

    public Converter(ConversionLog log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public ConversionResult convert(Path sourceDocument, ConversionOptions options, ProgressListener listener)
            throws IOException, ConversionException {
        Objects.requireNonNull(sourceDocument, "sourceDocument");
        Objects.requireNonNull(options, "options");
        final ProgressListener progress = listener == null ? ProgressListener.NONE : listener;

        // Step 1: attribute table
        final AttributeDictionary dictionary = options.attributeTable() == null
                ? AttributeDictionary.bundled()
                : AttributeDictionary.load(options.attributeTable());

        // Step 2: load and link
        progress.onProgress("loading " + sourceDocument.getFileName());
        new SourceLoader(dictionary, log).load(sourceDocument, source);
        new GraphLinker(options.excludedLinks(), log, progress).link(source);

        // Step 3: synthesize
        final Path sampleSetRoot = MediaResolver.sampleSetRootOf(sourceDocument);
        final Path targetFile = targetFile(sourceDocument, sampleSetRoot, options);
        final MediaResolver media = new MediaResolver(sampleSetRoot, options.checkFiles(), log);
        final ObjectSynthesizer synthesizer = new ObjectSynthesizer(log, progress, media,
                mediaPrefix(targetFile, sampleSetRoot));
        synthesizer.synthesize(source, target);

        // Step 4: check and write
        progress.onProgress("checking");
        final OdfObjectGraph graph = OdfObjectGraph.build(target.all(), log);
        progress.onProgress("writing " + targetFile);
        new OdfWriter(sourceDocument.getFileName().toString()).write(targetFile, target.all());
        Path silentLoop = null;
        if (synthesizer.silentLoopUsed()) {
            silentLoop = targetFile.toAbsolutePath().resolveSibling(ObjectSynthesizer.SILENT_LOOP_FILE);
            SilentLoopWriter.write(silentLoop);
        }

        return new ConversionResult(sourceDocument, targetFile, silentLoop, sourceCounts(), targetCounts(), graph, log);
    }

    static Path targetFile(Path sourceDocument, Path sampleSetRoot, ConversionOptions options) {
        if (options.targetFile() != null) {
            return OdfWriter.withOrganExtension(options.targetFile());
        }
        String base = sourceDocument.getFileName().toString();
        final int dot = base.indexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        return sampleSetRoot.resolve(base + OdfWriter.EXTENSION);
    }

    /**
     * Relative path from the target document's directory to the sample set root, with trailing slash,
     * or empty when they coincide.
     */
    static String mediaPrefix(Path targetFile, Path sampleSetRoot) {
        final Path targetDir = targetFile.toAbsolutePath().normalize().getParent();
        final Path root = sampleSetRoot.toAbsolutePath().normalize();
        if (targetDir == null || targetDir.equals(root)) {
            return "";
        }
        if (targetDir.getRoot() != null && !targetDir.getRoot().equals(root.getRoot())) {
            return root.toString().replace('\\', '/') + "/";
        }
        final String rel = targetDir.relativize(root).toString().replace('\\', '/');
        return rel.isEmpty() ? "" : rel + "/";
    }

    private Map<String, Integer> sourceCounts() {
        final Map<String, Integer> out = new LinkedHashMap<>();
        for (String type : source.types()) {
            out.put(type, source.count(type));
        }
        return out;
    }

    private Map<String, Integer> targetCounts() {
        final Map<String, Integer> out = new TreeMap<>();
        for (TargetRecord r : target.all()) {
            out.merge(Ids.targetPrefix(r.id()), 1, Integer::sum);
        }
        return out;
    }
}
