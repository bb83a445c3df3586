package ai.gamedata.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PlaceholderProtectorTest {

    @Test
    void replacesPlaceholdersWithNumberedMarkers() {
        PlaceholderProtector.Protected prepared = PlaceholderProtector.protect("Deliver <tons> to <destination>.");

        assertThat(prepared.text()).isEqualTo("Deliver XPHX0XPHX to XPHX1XPHX.");
        assertThat(prepared.tokens()).containsExactly("<tons>", "<destination>");
    }

    @Test
    void restoresMarkersEvenWhenTheTranslatorReordersThem() {
        PlaceholderProtector.Protected prepared = PlaceholderProtector.protect("From <origin> to <destination>");

        assertThat(prepared.restore("В XPHX1XPHX из XPHX0XPHX")).isEqualTo("В <destination> из <origin>");
    }

    @Test
    void textWithoutPlaceholdersIsUnchanged() {
        PlaceholderProtector.Protected prepared = PlaceholderProtector.protect("Plain text $1 \\n");

        assertThat(prepared.text()).isEqualTo("Plain text $1 \\n");
        assertThat(prepared.tokens()).isEmpty();
        assertThat(PlaceholderProtector.restore(null, prepared.tokens())).isNull();
    }
}
