package ai.gamedata.translator.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.gamedata.translator.Fixtures;
import ai.gamedata.translator.translate.TranslationMode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DataFileProcessorTest {

    @TempDir
    Path tempDir;

    @Test
    void writesTranslatedFileToMirroredPath() throws IOException {
        Path data = tempDir.resolve("data");
        Path output = tempDir.resolve("out");
        Path source = PipelineFixtures.write(data, "human/outfits.txt", Fixtures.lines(
                "outfit \"Laser Rifle\"",
                "\tthumbnail \"outfit/laser rifle\"",
                "\tdescription \"A rifle that fires <bright> bolts.\""));
        DataFileProcessor processor = PipelineFixtures.processor(data, output, TranslationMode.MOCK, false);

        FileOutcome outcome = processor.process(source);

        assertThat(outcome.relativePath()).isEqualTo("human/outfits.txt");
        assertThat(outcome.uniqueStrings()).isEqualTo(1);
        assertThat(outcome.written()).isTrue();
        assertThat(outcome.isFailure()).isFalse();
        assertThat(Files.readString(output.resolve("human/outfits.txt"), StandardCharsets.UTF_8)).isEqualTo(Fixtures.lines(
                "outfit \"Laser Rifle\"",
                "\tthumbnail \"outfit/laser rifle\"",
                "\tdescription \"[TR]A rifle that fires <bright> bolts.\""));
    }

    @Test
    void fileWithoutStringsIsCopiedVerbatim() throws IOException {
        Path data = tempDir.resolve("data");
        Path output = tempDir.resolve("out");
        String content = "system \"Sol\"\r\n\tpos 0 0\r\n";
        Path source = PipelineFixtures.write(data, "map.txt", content);

        FileOutcome outcome = PipelineFixtures.processor(data, output, TranslationMode.MOCK, false).process(source);

        assertThat(outcome.uniqueStrings()).isZero();
        assertThat(Files.readString(output.resolve("map.txt"), StandardCharsets.UTF_8)).isEqualTo(content);
    }

    @Test
    void dryRunWritesNothing() {
        Path data = tempDir.resolve("data");
        Path output = tempDir.resolve("out");
        Path source = PipelineFixtures.write(data, "sample.txt", Fixtures.read("sample.txt"));

        FileOutcome outcome = PipelineFixtures.processor(data, output, TranslationMode.DRY_RUN, true).process(source);

        assertThat(outcome.uniqueStrings()).isEqualTo(17);
        assertThat(outcome.written()).isFalse();
        assertThat(output).doesNotExist();
    }

    @Test
    void passThroughTranslationReproducesTheSource() throws IOException {
        Path data = tempDir.resolve("data");
        Path output = tempDir.resolve("out");
        String content = Fixtures.read("sample.txt");
        Path source = PipelineFixtures.write(data, "sample.txt", content);

        FileOutcome outcome = PipelineFixtures.processor(data, output, TranslationMode.DRY_RUN, false).process(source);

        assertThat(Files.readString(output.resolve("sample.txt"), StandardCharsets.UTF_8)).isEqualTo(content);
        assertThat(outcome.missingKeys()).isZero();
    }

    @Test
    void sourceOutsideTheDataRootIsRejected() {
        Path data = tempDir.resolve("data");
        Path output = tempDir.resolve("out");
        Path outside = PipelineFixtures.write(tempDir, "x.txt", Fixtures.lines("mission \"X\"", "\tname \"Escape\""));
        DataFileProcessor processor = PipelineFixtures.processor(data, output, TranslationMode.MOCK, false);

        assertThatThrownBy(() -> processor.process(data.resolve("../x.txt")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outside the data directory");
        assertThat(output.resolve("x.txt")).doesNotExist();
        assertThat(outside).exists();
    }

    @Test
    void missingSourceFails() {
        Path data = tempDir.resolve("data");
        DataFileProcessor processor = PipelineFixtures.processor(data, tempDir.resolve("out"), TranslationMode.MOCK, false);

        assertThatThrownBy(() -> processor.process(data.resolve("absent.txt")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("absent.txt");
    }
}
