package organ.converter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import organ.converter.io.ReportWriter;
import organ.converter.model.ConversionLog;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path source = null;
        Path target = null;
        Path attributeTable = null;
        Path excludeFile = null;
        Path report = null;
        boolean checkFiles = true;
        boolean verbose = false;
        Set<String> excluded = null;

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage(out);
                    return 0;
                }
                if (arg.startsWith("--out=")) {
                    target = Paths.get(arg.substring("--out=".length()));
                    continue;
                }
                if (arg.startsWith("--checkFiles=")) {
                    checkFiles = Boolean.parseBoolean(arg.substring("--checkFiles=".length()));
                    continue;
                }
                if (arg.startsWith("--attributeTable=")) {
                    attributeTable = Paths.get(arg.substring("--attributeTable=".length()));
                    continue;
                }
                if (arg.startsWith("--excludeLinks=")) {
                    excluded = new LinkedHashSet<>();
                    final String list = arg.substring("--excludeLinks=".length()).trim();
                    if (!list.isEmpty()) {
                        Arrays.stream(list.split(","))
                                .map(String::trim)
                                .filter(s -> !s.isEmpty())
                                .forEach(excluded::add);
                    }
                    continue;
                }
                if (arg.startsWith("--excludeLinksFile=")) {
                    excludeFile = Paths.get(arg.substring("--excludeLinksFile=".length()));
                    continue;
                }
                if (arg.startsWith("--report=")) {
                    report = Paths.get(arg.substring("--report=".length()));
                    continue;
                }
                if (arg.startsWith("--verbose=")) {
                    verbose = Boolean.parseBoolean(arg.substring("--verbose=".length()));
                    continue;
                }
                if (arg.startsWith("--")) {
                    err.println("ERROR: unknown argument: " + arg);
                    printUsage(out);
                    return 2;
                }
                if (source == null) {
                    source = Paths.get(arg);
                    continue;
                }
                err.println("ERROR: unexpected argument: " + arg);
                printUsage(out);
                return 2;
            }

            if (source == null) {
                err.println("ERROR: no source document given");
                printUsage(out);
                return 2;
            }
            source = source.toAbsolutePath().normalize();

            if (excluded == null) {
                excluded = new LinkedHashSet<>();
                excluded.add(ConversionOptions.DEFAULT_EXCLUDED_LINK);
            }
            if (excludeFile != null) {
                loadLinksFromFile(excludeFile, excluded);
            }

            final ConversionOptions options = new ConversionOptions(target, checkFiles, attributeTable, excluded, report);
            final ConversionLog log = new ConversionLog();
            final ProgressListener progress = verbose ? msg -> out.println("... " + msg) : ProgressListener.NONE;
            final ConversionResult result = new Converter(log).convert(source, options, progress);

            if (options.reportFile() != null) {
                new ReportWriter().write(options.reportFile(), result, Instant.now().toString());
            }

            for (ConversionLog.Entry e : log.entries()) {
                switch (e.severity()) {
                    case WARNING -> err.println("WARN: " + e.message());
                    case ERROR, INTERNAL -> err.println("ERROR: " + e.message());
                    default -> {
                        if (verbose) {
                            out.println(e.message());
                        }
                    }
                }
            }
            out.println("Organ definition written to: " + result.targetFile());
            if (result.silentLoopFile() != null) {
                out.println("Silent loop written to: " + result.silentLoopFile());
            }
            if (report != null) {
                out.println("Report: " + report + " (schema " + ReportWriter.SCHEMA_VERSION + ")");
            }
            out.println("Manuals: " + (result.targetCount("Manual"))
                    + ", stops: " + result.targetCount("Stop")
                    + ", couplers: " + result.targetCount("Coupler")
                    + ", ranks: " + result.targetCount("Rank")
                    + ", warnings: " + log.count(ConversionLog.Severity.WARNING)
                    + ", errors: " + (log.count(ConversionLog.Severity.ERROR) + log.count(ConversionLog.Severity.INTERNAL)));
            return 0;
        } catch (IOException ex) {
            err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (ConversionException ex) {
            err.println("ERROR: conversion failed: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (RuntimeException ex) {
            err.println("ERROR: conversion failed: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    static void loadLinksFromFile(Path file, Set<String> links) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Link exclusion file not found: " + file);
        }
        try (var br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                final int hash = trimmed.indexOf('#');
                if (hash >= 0) {
                    trimmed = trimmed.substring(0, hash).trim();
                }
                if (trimmed.isEmpty()) {
                    continue;
                }
                for (String token : trimmed.split("[,\\s]+")) {
                    final String t = token.trim();
                    if (!t.isEmpty()) {
                        links.add(t);
                    }
                }
            }
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: odf-converter <source.Organ_Hauptwerk_xml> [options]");
        out.println("Options:");
        out.println("  --out=<path>              Target .organ file (default: <sampleSetRoot>/<sourceName>.organ)");
        out.println("  --checkFiles=<bool>       Verify referenced samples and images on disk (default: true)");
        out.println("  --attributeTable=<path>   Attribute lookup table (default: bundled)");
        out.println("  --excludeLinks=<T.A,...>  Linkage rules to skip (default: " + ConversionOptions.DEFAULT_EXCLUDED_LINK + ")");
        out.println("  --excludeLinksFile=<path> File with linkage rules to skip (one per line, # comments)");
        out.println("  --report=<path>           Write a JSON conversion report");
        out.println("  --verbose=<bool>          Print progress and informational messages (default: false)");
        out.println("  --help, -h                Show this help");
    }

    static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
