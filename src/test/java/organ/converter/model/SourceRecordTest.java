package organ.converter.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class SourceRecordTest {

    private static SourceRecord record(String type, int id) {
        return new SourceRecord(type, id, Map.of());
    }

    @Test
    void linkCreatesBothDirectionsOnce() {
        final SourceRecord stop = record("Stop", 1);
        final SourceRecord sw = record("Switch", 4);

        assertThat(SourceRecord.link(sw, stop)).isTrue();
        assertThat(SourceRecord.link(sw, stop)).isFalse();

        assertThat(sw.children()).containsExactly(stop);
        assertThat(stop.parents()).containsExactly(sw);
        assertThat(stop.firstParent("Switch")).isSameAs(sw);
        assertThat(stop.firstParent("Keyboard")).isNull();
    }

    @Test
    void selfLinkIsIgnored() {
        final SourceRecord sw = record("Switch", 1);
        assertThat(SourceRecord.link(sw, sw)).isFalse();
        assertThat(sw.children()).isEmpty();
    }

    @Test
    void assignTargetNeverOverwrites() {
        final SourceRecord stop = record("Stop", 1);
        assertThat(stop.hasTarget()).isFalse();
        assertThat(stop.assignTarget("Stop001")).isTrue();
        assertThat(stop.assignTarget(SourceRecord.NO_TARGET)).isFalse();
        assertThat(stop.targetId()).isEqualTo("Stop001");
    }

    @Test
    void emptyAttributeValuesAreDropped() {
        final Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("Name", "Principal 8");
        attrs.put("Hint", "");
        final SourceRecord stop = new SourceRecord("Stop", 3, attrs);
        assertThat(stop.hasAttr("Name")).isTrue();
        assertThat(stop.hasAttr("Hint")).isFalse();
        assertThat(stop.key()).isEqualTo("Stop000003");
    }
}
