package com.edge.annotator.core.edit;

import com.edge.annotator.core.hit.HitResult;
import com.edge.annotator.core.model.AnnotationSet;
import com.edge.annotator.core.model.Box;
import com.edge.annotator.core.model.ClassRegistry;
import com.edge.annotator.core.model.Corner;
import com.edge.annotator.core.model.InteractionMode;
import com.edge.annotator.core.model.Point;
import com.edge.annotator.core.transform.ImageSize;
import com.edge.annotator.core.transform.ViewportTransform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EditEngineTest {

    private static final ViewportTransform IDENTITY = ViewportTransform.identity();

    private ClassRegistry registry;
    private EditEngine engine;

    @BeforeEach
    void setUp() {
        registry = new ClassRegistry(List.of("object", "car"));
        engine = newEngine(new AnnotationSet(), 100);
    }

    private EditEngine newEngine(AnnotationSet set, int undoCapacity) {
        return new EditEngine(registry, set, new ImageSize(100, 100), InteractionSettings.defaults(), undoCapacity);
    }

    private AnnotationSet annotations() {
        return engine.getAnnotations();
    }

    private void createAndSelect(double left, double top, double right, double bottom) {
        assertThat(engine.createBox(new Point(left, top), new Point(right, bottom), IDENTITY)).isTrue();
    }

    @Nested
    class Create {

        @Test
        void createsBoxWithCurrentClassAndSelectsIt() {
            engine.setCurrentClassId(1);

            createAndSelect(30, 40, 10, 10);

            Box box = annotations().get(0);
            assertThat(box.getClassId()).isEqualTo(1);
            assertThat(box.getCx()).isCloseTo(0.2, within(1e-9));
            assertThat(box.getCy()).isCloseTo(0.25, within(1e-9));
            assertThat(box.getW()).isCloseTo(0.2, within(1e-9));
            assertThat(box.getH()).isCloseTo(0.3, within(1e-9));
            assertThat(engine.getSelection().snapshot()).isZero();
            assertThat(engine.getUndoStack().size()).isEqualTo(1);
            assertThat(annotations().isDirty()).isTrue();
        }

        @Test
        void dragBelowMinimumCreatesNothing() {
            assertThat(engine.createBox(new Point(10, 10), new Point(14, 40), IDENTITY)).isFalse();

            assertThat(annotations().isEmpty()).isTrue();
            assertThat(engine.getUndoStack().isEmpty()).isTrue();
            assertThat(annotations().isDirty()).isFalse();
        }

        @Test
        void dragOfExactlyMinimumIsAccepted() {
            assertThat(engine.createBox(new Point(10, 10), new Point(16, 16), IDENTITY)).isTrue();
        }

        @Test
        void minimumIsMeasuredOnScreen() {
            ViewportTransform zoomed = new ViewportTransform(2.0, 0, 0);

            // 8 屏幕像素 = 4 图片像素，仍满足 6 屏幕像素的下限
            assertThat(engine.createBox(new Point(20, 20), new Point(28, 28), zoomed)).isTrue();
            assertThat(annotations().get(0).getW()).isCloseTo(0.04, within(1e-9));
        }

        @Test
        void dragIsClampedToImage() {
            createAndSelect(-50, -50, 20, 20);

            Box box = annotations().get(0);
            assertThat(box.getLeft()).isCloseTo(0.0, within(1e-9));
            assertThat(box.getTop()).isCloseTo(0.0, within(1e-9));
            assertThat(box.getRight()).isCloseTo(0.2, within(1e-9));
        }

        @Test
        void currentClassFallsBackWhenUnknown() {
            assertThatThrownBy(() -> engine.setCurrentClassId(7)).isInstanceOf(IllegalArgumentException.class);
            assertThat(engine.getCurrentClassId()).isZero();
        }
    }

    @Nested
    class EditSelected {

        @BeforeEach
        void createBox() {
            createAndSelect(20, 20, 60, 60);
        }

        @Test
        void moveShiftsCenterAndClampsToImage() {
            assertThat(engine.moveSelected(0.1, 0.0)).isTrue();
            assertThat(annotations().get(0).getCx()).isCloseTo(0.5, within(1e-9));

            assertThat(engine.moveSelected(5.0, -5.0)).isTrue();
            assertThat(annotations().get(0).getCx()).isEqualTo(1.0);
            assertThat(annotations().get(0).getCy()).isEqualTo(0.0);
            assertThat(annotations().get(0).getW()).isCloseTo(0.4, within(1e-9));
        }

        @Test
        void moveWithoutSelectionIsNoop() {
            engine.getSelection().clear();

            assertThat(engine.moveSelected(0.1, 0.1)).isFalse();
            assertThat(engine.getUndoStack().size()).isEqualTo(1);
        }

        @Test
        void resizeKeepsOppositeCornerFixed() {
            assertThat(engine.resizeSelected(Corner.BOTTOM_RIGHT, new Point(80, 90), IDENTITY)).isTrue();

            Box box = annotations().get(0);
            assertThat(box.getLeft()).isCloseTo(0.2, within(1e-9));
            assertThat(box.getTop()).isCloseTo(0.2, within(1e-9));
            assertThat(box.getRight()).isCloseTo(0.8, within(1e-9));
            assertThat(box.getBottom()).isCloseTo(0.9, within(1e-9));
        }

        @Test
        void resizePastFixedCornerClampsToMinimumWithoutFlipping() {
            engine.resizeSelected(Corner.BOTTOM_RIGHT, new Point(0, 0), IDENTITY);

            Box box = annotations().get(0);
            assertThat(box.getLeft()).isCloseTo(0.2, within(1e-9));
            assertThat(box.getW()).isCloseTo(0.06, within(1e-9));
            assertThat(box.getH()).isCloseTo(0.06, within(1e-9));
        }

        @Test
        void resizeNearImageEdgeKeepsMinimumInsideImage() {
            engine = newEngine(new AnnotationSet(List.of(Box.fromCorners(0, 0.97, 0.97, 0.99, 0.99))), 100);
            engine.selectAt(new Point(98, 98), IDENTITY);

            assertThat(engine.resizeSelected(Corner.BOTTOM_RIGHT, new Point(0, 0), IDENTITY)).isTrue();

            Box box = annotations().get(0);
            assertThat(box.getRight()).isCloseTo(1.0, within(1e-9));
            assertThat(box.getBottom()).isCloseTo(1.0, within(1e-9));
            assertThat(box.getLeft()).isCloseTo(0.94, within(1e-9));
            assertThat(box.getW()).isCloseTo(0.06, within(1e-9));
            assertThat(box.getH()).isCloseTo(0.06, within(1e-9));
        }

        @Test
        void resizeTopLeftNearOriginKeepsMinimumInsideImage() {
            engine = newEngine(new AnnotationSet(List.of(Box.fromCorners(0, 0.01, 0.01, 0.03, 0.03))), 100);
            engine.selectAt(new Point(2, 2), IDENTITY);

            engine.resizeSelected(Corner.TOP_LEFT, new Point(100, 100), IDENTITY);

            Box box = annotations().get(0);
            assertThat(box.getLeft()).isCloseTo(0.0, within(1e-9));
            assertThat(box.getTop()).isCloseTo(0.0, within(1e-9));
            assertThat(box.getRight()).isCloseTo(0.06, within(1e-9));
        }

        @Test
        void resizeTopLeftOutsideImageIsClamped() {
            engine.resizeSelected(Corner.TOP_LEFT, new Point(-30, -30), IDENTITY);

            Box box = annotations().get(0);
            assertThat(box.getLeft()).isCloseTo(0.0, within(1e-9));
            assertThat(box.getTop()).isCloseTo(0.0, within(1e-9));
            assertThat(box.getRight()).isCloseTo(0.6, within(1e-9));
        }

        @Test
        void deleteAndUndoRestoresBoxAndSelection() {
            Box original = annotations().get(0);

            assertThat(engine.deleteSelected()).isTrue();
            assertThat(annotations().isEmpty()).isTrue();
            assertThat(engine.getSelection().isPresent()).isFalse();

            assertThat(engine.undo()).isTrue();
            assertThat(annotations().boxes()).containsExactly(original);
            assertThat(engine.getSelection().snapshot()).isZero();
        }

        @Test
        void duplicateInsertsCopyAfterOriginalAndSelectsIt() {
            createAndSelect(70, 70, 90, 90);
            engine.getSelection().select(0);

            assertThat(engine.duplicateSelected()).isTrue();

            assertThat(annotations().size()).isEqualTo(3);
            assertThat(annotations().get(1)).isEqualTo(annotations().get(0));
            assertThat(engine.getSelection().snapshot()).isEqualTo(1);

            engine.undo();
            assertThat(annotations().size()).isEqualTo(2);
            assertThat(engine.getSelection().snapshot()).isZero();
        }

        @Test
        void assignClassById() {
            assertThat(engine.assignClass(1)).isTrue();
            assertThat(annotations().get(0).getClassId()).isEqualTo(1);

            assertThat(engine.assignClass(1)).isFalse();
            assertThat(engine.getUndoStack().size()).isEqualTo(2);
        }

        @Test
        void assignClassBeyondRegistryGrowsAndUndoShrinks() {
            assertThat(engine.assignClass(5)).isTrue();
            assertThat(registry.size()).isEqualTo(6);
            assertThat(registry.nameOf(4)).isEqualTo("class_4");

            engine.undo();

            assertThat(annotations().get(0).getClassId()).isZero();
            assertThat(registry.size()).isEqualTo(2);
        }

        @Test
        void assignClassByNameAppendsNewClass() {
            assertThat(engine.assignClass("truck")).isTrue();

            assertThat(annotations().get(0).getClassId()).isEqualTo(2);
            assertThat(registry.nameOf(2)).isEqualTo("truck");
        }

        @Test
        void undoIsStrictlyLastInFirstOut() {
            Box created = annotations().get(0);
            engine.moveSelected(0.1, 0.0);
            Box moved = annotations().get(0);
            engine.resizeSelected(Corner.TOP_LEFT, new Point(10, 10), IDENTITY);

            engine.undo();
            assertThat(annotations().get(0)).isEqualTo(moved);
            engine.undo();
            assertThat(annotations().get(0)).isEqualTo(created);
            engine.undo();
            assertThat(annotations().isEmpty()).isTrue();
            assertThat(engine.undo()).isFalse();
        }
    }

    @Nested
    class Gestures {

        @BeforeEach
        void createBox() {
            createAndSelect(20, 20, 60, 60);
            engine.getSelection().clear();
        }

        @Test
        void dragOnBoxMovesLiveAndCommitsOnce() {
            HitResult hit = engine.pointerDown(new Point(40, 40), IDENTITY);
            assertThat(hit.getType()).isEqualTo(HitResult.Type.BOX);
            assertThat(engine.getSelection().getMode()).isEqualTo(InteractionMode.MOVING);

            engine.pointerDrag(new Point(45, 40), IDENTITY);
            assertThat(annotations().get(0).getCx()).isCloseTo(0.45, within(1e-9));
            assertThat(engine.getUndoStack().size()).isEqualTo(1);

            assertThat(engine.pointerUp(new Point(50, 50), IDENTITY)).isTrue();
            assertThat(annotations().get(0).getCx()).isCloseTo(0.5, within(1e-9));
            assertThat(annotations().get(0).getCy()).isCloseTo(0.5, within(1e-9));
            assertThat(engine.getUndoStack().size()).isEqualTo(2);
            assertThat(engine.getSelection().getMode()).isEqualTo(InteractionMode.NONE);

            engine.undo();
            assertThat(annotations().get(0).getCx()).isCloseTo(0.4, within(1e-9));
            assertThat(engine.getSelection().isPresent()).isFalse();
        }

        @Test
        void clickWithoutMovementRecordsNothing() {
            annotations().markSaved();

            engine.pointerDown(new Point(40, 40), IDENTITY);
            assertThat(engine.pointerUp(new Point(40, 40), IDENTITY)).isFalse();

            assertThat(engine.getSelection().snapshot()).isZero();
            assertThat(engine.getUndoStack().size()).isEqualTo(1);
            assertThat(annotations().isDirty()).isFalse();
        }

        @Test
        void dragOnHandleOfSelectedBoxResizes() {
            engine.getSelection().select(0);

            HitResult hit = engine.pointerDown(new Point(60, 60), IDENTITY);
            assertThat(hit.getType()).isEqualTo(HitResult.Type.HANDLE);
            assertThat(hit.getCorner()).isEqualTo(Corner.BOTTOM_RIGHT);

            assertThat(engine.pointerUp(new Point(80, 70), IDENTITY)).isTrue();
            Box box = annotations().get(0);
            assertThat(box.getLeft()).isCloseTo(0.2, within(1e-9));
            assertThat(box.getRight()).isCloseTo(0.8, within(1e-9));
            assertThat(box.getBottom()).isCloseTo(0.7, within(1e-9));
        }

        @Test
        void dragOnEmptySpaceCreatesBoxWithPreview() {
            engine.pointerDown(new Point(70, 70), IDENTITY);
            engine.pointerDrag(new Point(90, 95), IDENTITY);

            assertThat(engine.creationPreview(IDENTITY)).isPresent();
            assertThat(annotations().size()).isEqualTo(1);

            assertThat(engine.pointerUp(new Point(90, 95), IDENTITY)).isTrue();
            assertThat(annotations().size()).isEqualTo(2);
            assertThat(engine.getSelection().snapshot()).isEqualTo(1);
            assertThat(engine.creationPreview(IDENTITY)).isEmpty();
        }

        @Test
        void tinyDragOnEmptySpaceOnlyClearsSelection() {
            engine.getSelection().select(0);

            engine.pointerDown(new Point(80, 80), IDENTITY);
            assertThat(engine.pointerUp(new Point(82, 82), IDENTITY)).isFalse();

            assertThat(annotations().size()).isEqualTo(1);
            assertThat(engine.getSelection().isPresent()).isFalse();
        }

        @Test
        void directCommandCancelsGestureInProgress() {
            Box original = annotations().get(0);
            engine.pointerDown(new Point(40, 40), IDENTITY);
            engine.pointerDrag(new Point(45, 45), IDENTITY);

            engine.cancelGesture();

            assertThat(annotations().get(0)).isEqualTo(original);
            assertThat(engine.pointerUp(new Point(50, 50), IDENTITY)).isFalse();
        }

        @Test
        void pointerUpWithoutDownIsIgnored() {
            assertThat(engine.pointerDrag(new Point(10, 10), IDENTITY)).isFalse();
            assertThat(engine.pointerUp(new Point(10, 10), IDENTITY)).isFalse();
        }
    }

    @Test
    void undoCapacityDropsOldestEdits() {
        engine = newEngine(new AnnotationSet(), 3);
        for (int i = 0; i < 5; i++) {
            createAndSelect(i * 15, 0, i * 15 + 10, 10);
        }

        int undone = 0;
        while (engine.undo()) {
            undone++;
        }

        assertThat(undone).isEqualTo(3);
        assertThat(annotations().size()).isEqualTo(2);
    }
}
