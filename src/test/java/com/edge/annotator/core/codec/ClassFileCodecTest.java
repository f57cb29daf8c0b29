package com.edge.annotator.core.codec;

import com.edge.annotator.core.model.ClassRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClassFileCodecTest {

    private final ClassFileCodec codec = new ClassFileCodec("object");

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaultClassNotYetPersisted() throws IOException {
        ClassRegistry registry = codec.read(tempDir.resolve("_darknet.labels"));

        assertThat(registry.names()).containsExactly("object");
        assertThat(registry.hasUnpersistedEntries()).isTrue();
    }

    @Test
    void blankFileGivesDefaultClass() throws IOException {
        Path file = tempDir.resolve("_darknet.labels");
        Files.writeString(file, "\n\n");

        assertThat(codec.read(file).names()).containsExactly("object");
    }

    @Test
    void lineNumberIsClassId() throws IOException {
        Path file = tempDir.resolve("_darknet.labels");
        Files.writeString(file, "car\nperson\n bike \n\n");

        ClassRegistry registry = codec.read(file);

        assertThat(registry.names()).containsExactly("car", "person", "bike");
        assertThat(registry.hasUnpersistedEntries()).isFalse();
    }

    @Test
    void interiorBlankAndDuplicateLinesKeepIdsStable() {
        List<String> names = codec.parse(List.of("car", "", "truck", "car", "bus", "", ""));

        assertThat(names).containsExactly("car", "class_1", "truck", "class_3", "bus");
    }

    @Test
    void undecodableLineBecomesPlaceholder() throws IOException {
        Path file = tempDir.resolve("_darknet.labels");
        byte[] content = {'c', 'a', 'r', '\n', (byte) 0xC4, (byte) 0xE3, '\n', 'b', 'u', 's', '\n'};
        Files.write(file, content);

        assertThat(codec.read(file).names()).containsExactly("car", "class_1", "bus");
    }

    @Test
    void writeThenReadRoundTrips() throws IOException {
        Path file = tempDir.resolve("_darknet.labels");
        ClassRegistry registry = new ClassRegistry(List.of("car", "person"));
        registry.resolve("3");

        codec.write(file, registry);

        assertThat(Files.readString(file)).isEqualTo("car\nperson\nclass_2\nclass_3\n");
        assertThat(registry.hasUnpersistedEntries()).isFalse();
        assertThat(codec.read(file).names()).isEqualTo(registry.names());
    }
}
