package organ.converter.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;

class AttributeReaderTest {

    private final ConversionLog log = new ConversionLog();
    private final AttributeReader reader = new AttributeReader(log);

    @Test
    void invalidIntegerFallsBackToDefaultWithWarning() {
        final SourceRecord keyboard = new SourceRecord("Keyboard", 1, Map.of("KeyGen_NumberOfKeys", "lots"));
        final AttrSpec keys = AttrSpec.integer("Keyboard", "KeyGen_NumberOfKeys", 61);

        assertThat(reader.integer(keyboard, keys)).isEqualTo(61);
        assertThat(log.contains(ConversionLog.Severity.WARNING, "KeyGen_NumberOfKeys")).isTrue();
    }

    @Test
    void flagAcceptsEitherCaseAndDefaultsOtherwise() {
        final AttrSpec clickable = AttrSpec.flag("Switch", "Clickable", false);
        assertThat(reader.flag(new SourceRecord("Switch", 1, Map.of("Clickable", "y")), clickable)).isTrue();
        assertThat(reader.flag(new SourceRecord("Switch", 2, Map.of()), clickable)).isFalse();
        assertThat(reader.flag(new SourceRecord("Switch", 3, Map.of("Clickable", "maybe")), clickable)).isFalse();
        assertThat(log.count(ConversionLog.Severity.WARNING)).isEqualTo(1);
    }

    @Test
    void referenceReturnsNullForZeroAndWarnsForGarbage() {
        final AttrSpec rank = AttrSpec.reference("Pipe_SoundEngine01", "RankID");
        assertThat(reader.reference(new SourceRecord("Pipe_SoundEngine01", 1, Map.of("RankID", "4")), rank)).isEqualTo(4);
        assertThat(reader.reference(new SourceRecord("Pipe_SoundEngine01", 2, Map.of()), rank)).isNull();
        assertThat(reader.reference(new SourceRecord("Pipe_SoundEngine01", 3, Map.of("RankID", "abc")), rank)).isNull();
        assertThat(log.count(ConversionLog.Severity.WARNING)).isEqualTo(1);
    }

    @Test
    void readingAnotherTypesAttributeIsAnInternalError() {
        final AttrSpec name = AttrSpec.text("Stop", "Name");
        reader.text(new SourceRecord("Rank", 1, Map.of("Name", "x")), name);
        assertThat(log.count(ConversionLog.Severity.INTERNAL)).isEqualTo(1);
    }
}
