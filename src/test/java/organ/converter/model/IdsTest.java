package organ.converter.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class IdsTest {

    @Test
    void sourceKeyPadsIdAndKeepsRootBare() {
        assertThat(Ids.sourceKey("Stop", 7)).isEqualTo("Stop000007");
        assertThat(Ids.sourceKey("_General", 0)).isEqualTo("_General");
    }

    @Test
    void targetIdRoundTripsPrefixAndNumber() {
        final String id = Ids.targetId("Manual", 2);
        assertThat(id).isEqualTo("Manual002");
        assertThat(Ids.targetNumber(id)).isEqualTo(2);
        assertThat(Ids.targetPrefix(id)).isEqualTo("Manual");
        assertThat(Ids.targetPrefix("Organ")).isEqualTo("Organ");
        assertThat(Ids.targetNumber("Organ")).isEqualTo(-1);
    }

    @Test
    void parsePositiveIntRejectsZeroNegativeAndGarbage() {
        assertThat(Ids.parsePositiveInt(" 12 ")).isEqualTo(12);
        assertThat(Ids.parsePositiveInt("0")).isNull();
        assertThat(Ids.parsePositiveInt("-3")).isNull();
        assertThat(Ids.parsePositiveInt("x1")).isNull();
        assertThat(Ids.parsePositiveInt("")).isNull();
        assertThat(Ids.parsePositiveInt(null)).isNull();
    }

    @Test
    void normalizePathUsesForwardSlashes() {
        assertThat(Ids.normalizePath("\\Pipes\\\\Open 8\\036.wav")).isEqualTo("Pipes/Open 8/036.wav");
        assertThat(Ids.normalizePath(null)).isEmpty();
    }
}
