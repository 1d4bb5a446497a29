package organ.converter.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a short looped silent WAV: 16-bit mono PCM with a {@code smpl} chunk looping the whole sample.
 */
public final class SilentLoopWriter {

    static final int SAMPLE_RATE = 44100;
    static final int FRAMES = 4410;
    private static final int BITS = 16;
    private static final int FMT_SIZE = 16;
    private static final int SMPL_SIZE = 36 + 24;

    private SilentLoopWriter() {
    }

    public static void write(Path file) throws IOException {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(file, bytes());
    }

    static byte[] bytes() {
        final int dataSize = FRAMES * BITS / 8;
        final int riffSize = 4 + (8 + FMT_SIZE) + (8 + SMPL_SIZE) + (8 + dataSize);
        final ByteBuffer b = ByteBuffer.allocate(8 + riffSize).order(ByteOrder.LITTLE_ENDIAN);

        b.put(ascii("RIFF")).putInt(riffSize).put(ascii("WAVE"));

        b.put(ascii("fmt ")).putInt(FMT_SIZE);
        b.putShort((short) 1);                      // PCM
        b.putShort((short) 1);                      // mono
        b.putInt(SAMPLE_RATE);
        b.putInt(SAMPLE_RATE * BITS / 8);           // byte rate
        b.putShort((short) (BITS / 8));             // block align
        b.putShort((short) BITS);

        b.put(ascii("smpl")).putInt(SMPL_SIZE);
        b.putInt(0).putInt(0);                      // manufacturer, product
        b.putInt(1_000_000_000 / SAMPLE_RATE);      // sample period ns
        b.putInt(60).putInt(0);                     // unity note, pitch fraction
        b.putInt(0).putInt(0);                      // SMPTE format, offset
        b.putInt(1).putInt(0);                      // loops, sampler data
        b.putInt(0).putInt(0);                      // cue point id, forward loop
        b.putInt(0).putInt(FRAMES - 1);             // loop start, end
        b.putInt(0).putInt(0);                      // fraction, infinite

        b.put(ascii("data")).putInt(dataSize);
        b.put(new byte[dataSize]);
        return b.array();
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }
}
