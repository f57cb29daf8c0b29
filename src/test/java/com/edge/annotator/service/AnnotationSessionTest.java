package com.edge.annotator.service;

import com.edge.annotator.config.AnnotatorConfig;
import com.edge.annotator.core.codec.AnnotationSaveException;
import com.edge.annotator.core.model.Point;
import com.edge.annotator.core.transform.ImageSize;
import com.edge.annotator.core.transform.ViewportTransform;
import com.edge.annotator.dto.SessionStateResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotationSessionTest {

    private static final ViewportTransform IDENTITY = ViewportTransform.identity();

    @TempDir
    Path dir;

    private AnnotatorConfig config;
    private AnnotationSession session;

    /**
     * 不依赖 OpenCV 的图片来源：目录下的 .png 文件，尺寸固定 100x100
     */
    private static class StubImageSource implements ImageSource {
        @Override
        public List<Path> listImages(Path directory) throws IOException {
            try (Stream<Path> files = Files.list(directory)) {
                return files.filter(p -> p.getFileName().toString().endsWith(".png"))
                    .sorted()
                    .collect(Collectors.toList());
            }
        }

        @Override
        public ImageSize dimensionsOf(Path image) throws IOException {
            return new ImageSize(100, 100);
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        Files.createFile(dir.resolve("a.png"));
        Files.createFile(dir.resolve("b.png"));
        config = new AnnotatorConfig();
        session = new AnnotationSession(config, new StubImageSource());
    }

    private SessionStateResponse drawBox() {
        return session.createBox(new Point(10, 10), new Point(30, 30), IDENTITY);
    }

    @Test
    void openLoadsFirstImageAndItsAnnotations() throws IOException {
        Files.writeString(dir.resolve("a.txt"), "0 0.5 0.5 0.2 0.2\n");

        SessionStateResponse state = session.open(dir);

        assertThat(state.isSuccess()).isTrue();
        assertThat(state.getImageCount()).isEqualTo(2);
        assertThat(state.getImageIndex()).isZero();
        assertThat(state.getImageName()).isEqualTo("a.png");
        assertThat(state.getClasses()).containsExactly("object");
        assertThat(state.getBoxes()).hasSize(1);
        assertThat(state.getBoxes().get(0).getClassName()).isEqualTo("object");
        assertThat(state.isDirty()).isFalse();
    }

    @Test
    void loadThatGrowsRegistryPersistsClassFileImmediately() throws IOException {
        Files.writeString(dir.resolve("_darknet.labels"), "object\n");
        Files.writeString(dir.resolve("a.txt"), "red_ring 0.5 0.5 0.2 0.2\nbroken line\n");

        SessionStateResponse state = session.open(dir);

        assertThat(state.getClasses()).containsExactly("object", "red_ring");
        assertThat(state.getBoxes().get(0).getClassId()).isEqualTo(1);
        assertThat(state.getLoadErrors()).hasSize(1);
        assertThat(Files.readString(dir.resolve("_darknet.labels"))).isEqualTo("object\nred_ring\n");
    }

    @Test
    void saveWritesAnnotationAndClassFiles() throws IOException {
        session.open(dir);
        assertThat(drawBox().isDirty()).isTrue();

        SessionStateResponse state = session.save();

        assertThat(state.isDirty()).isFalse();
        assertThat(Files.readString(dir.resolve("a.txt"))).isEqualTo("0 0.200000 0.200000 0.200000 0.200000\n");
        assertThat(Files.readString(dir.resolve("_darknet.labels"))).isEqualTo("object\n");
    }

    @Test
    void navigationSavesDirtyImageAndResetsUndo() throws IOException {
        session.open(dir);
        drawBox();

        SessionStateResponse state = session.next();

        assertThat(state.getImageIndex()).isEqualTo(1);
        assertThat(state.getUndoDepth()).isZero();
        assertThat(Files.exists(dir.resolve("a.txt"))).isTrue();
        assertThat(session.undo().isChanged()).isFalse();
    }

    @Test
    void navigationDiscardsEditsWhenAutoSaveDisabled() throws IOException {
        config.getSession().setSaveOnNavigate(false);
        session.open(dir);
        drawBox();

        session.next();

        assertThat(Files.exists(dir.resolve("a.txt"))).isFalse();
        assertThat(session.previous().getBoxes()).isEmpty();
    }

    @Test
    void navigationWrapsAround() throws IOException {
        session.open(dir);

        assertThat(session.previous().getImageIndex()).isEqualTo(1);
        assertThat(session.next().getImageIndex()).isZero();
        assertThat(session.goTo(1).getImageName()).isEqualTo("b.png");
        assertThatThrownBy(() -> session.goTo(2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failedSaveKeepsImageActiveAndEditsInMemory() throws IOException {
        session.open(dir);
        drawBox();
        Files.createDirectory(dir.resolve("a.txt"));

        assertThatThrownBy(() -> session.next()).isInstanceOf(AnnotationSaveException.class);

        SessionStateResponse state = session.state(IDENTITY);
        assertThat(state.getImageIndex()).isZero();
        assertThat(state.isDirty()).isTrue();
        assertThat(state.getBoxes()).hasSize(1);
    }

    @Test
    void reloadDiscardsUnsavedEdits() throws IOException {
        Files.writeString(dir.resolve("a.txt"), "0 0.5 0.5 0.2 0.2\n");
        session.open(dir);
        session.selectAt(new Point(50, 50), IDENTITY);
        session.deleteSelected();

        SessionStateResponse state = session.reload();

        assertThat(state.getBoxes()).hasSize(1);
        assertThat(state.isDirty()).isFalse();
    }

    @Test
    void addedClassIsPersistedAndUsedForNewBoxes() throws IOException {
        session.open(dir);

        SessionStateResponse added = session.addClass("car");
        assertThat(added.getCurrentClassId()).isEqualTo(1);
        assertThat(Files.readString(dir.resolve("_darknet.labels"))).isEqualTo("object\ncar\n");

        assertThat(drawBox().getBoxes().get(0).getClassName()).isEqualTo("car");
        assertThat(session.next().getCurrentClassId()).isEqualTo(1);
    }

    @Test
    void pointerGestureReportsModeAndPreview() throws IOException {
        session.open(dir);

        session.pointerDown(new Point(10, 10), IDENTITY);
        SessionStateResponse dragging = session.pointerDrag(new Point(40, 40), IDENTITY);
        assertThat(dragging.getMode()).isEqualTo("CREATING");
        assertThat(dragging.getCreationPreview()).isNotNull();

        SessionStateResponse done = session.pointerUp(new Point(40, 40), IDENTITY);
        assertThat(done.isChanged()).isTrue();
        assertThat(done.getMode()).isEqualTo("NONE");
        assertThat(done.getSelectedIndex()).isZero();
        assertThat(done.getUndoDepth()).isEqualTo(1);
    }

    @Test
    void unknownCurrentClassIsRejected() throws IOException {
        session.open(dir);

        assertThatThrownBy(() -> session.setCurrentClass(3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void editsRequireActiveImage() {
        assertThatThrownBy(() -> session.undo()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.save()).isInstanceOf(IllegalStateException.class);
        assertThat(session.state(IDENTITY).getImageIndex()).isEqualTo(-1);
    }

    @Test
    void emptyDirectoryHasNoActiveImage() throws IOException {
        Path empty = Files.createDirectory(dir.resolve("empty"));

        SessionStateResponse state = session.open(empty);

        assertThat(state.getImageCount()).isZero();
        assertThat(state.getClasses()).containsExactly("object");
        assertThatThrownBy(() -> session.next()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedOpenKeepsPreviousDirectoryActive() throws IOException {
        Path broken = Files.createDirectory(dir.resolve("broken"));
        Files.createFile(broken.resolve("a.png"));
        session = new AnnotationSession(config, new StubImageSource() {
            @Override
            public ImageSize dimensionsOf(Path image) throws IOException {
                if (image.startsWith(broken)) {
                    throw new IOException("Cannot decode image: " + image);
                }
                return super.dimensionsOf(image);
            }
        });
        session.open(dir);
        session.next();

        assertThatThrownBy(() -> session.open(broken)).isInstanceOf(IOException.class);

        SessionStateResponse state = session.state(IDENTITY);
        assertThat(state.getImageIndex()).isEqualTo(1);
        assertThat(state.getImageName()).isEqualTo("b.png");
        assertThat(state.getImageCount()).isEqualTo(2);
        assertThat(session.previous().getImageName()).isEqualTo("a.png");
    }

    @Test
    void failedFirstOpenLeavesSessionClosed() throws IOException {
        session = new AnnotationSession(config, new StubImageSource() {
            @Override
            public ImageSize dimensionsOf(Path image) throws IOException {
                throw new IOException("Cannot decode image: " + image);
            }
        });

        assertThatThrownBy(() -> session.open(dir)).isInstanceOf(IOException.class);

        assertThat(session.state(IDENTITY).getImageIndex()).isEqualTo(-1);
        assertThatThrownBy(() -> session.previous()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.next()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void openingAnotherDirectorySavesDirtyImage() throws IOException {
        Path other = Files.createDirectory(dir.resolve("other"));
        Files.createFile(other.resolve("c.png"));
        session.open(dir);
        drawBox();

        SessionStateResponse state = session.open(other);

        assertThat(state.getImageName()).isEqualTo("c.png");
        assertThat(Files.readString(dir.resolve("a.txt"))).isEqualTo("0 0.200000 0.200000 0.200000 0.200000\n");
    }

    @Test
    void openingAnotherDirectoryDiscardsEditsWhenAutoSaveDisabled() throws IOException {
        config.getSession().setSaveOnNavigate(false);
        Path other = Files.createDirectory(dir.resolve("other"));
        session.open(dir);
        drawBox();

        session.open(other);

        assertThat(Files.exists(dir.resolve("a.txt"))).isFalse();
    }

    @Test
    void initWithoutConfiguredDirectoryStaysIdle() {
        session.init();

        assertThat(session.state(IDENTITY).getDirectory()).isNull();
    }
}
