/*
 * Copyright (C) 2024 pagecurl contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.everydaythings.pagecurl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Drives the controller with a 200x100 viewport, so in one page mode the right page
 * spans the whole view and x=100 is its center.
 */
class CurlControllerTest {

    private static final int NONE = PageProvider.NO_INDEX;

    private FakeClock clock;
    private RecordingSurface surface;
    private CountingPageProvider provider;
    private PageLayout layout;
    private CurlController controller;
    private final List<Integer> notified = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new FakeClock();
        surface = new RecordingSurface();
        provider = new CountingPageProvider(5);
        layout = new PageLayout();
        controller = new CurlController(layout, surface, clock);
        controller.setCurrentIndexChangedListener((c, index) -> notified.add(index));
        controller.setPageProvider(provider);
        layout.setViewport(200, 100);
    }

    private void dragAndRelease(float fromX, float toX) {
        controller.onDragStart(fromX, 50, 0);
        controller.onDragMove((fromX + toX) / 2, 50, 0);
        controller.onDragMove(toX, 50, 0);
        controller.onDragEnd(toX, 50);
    }

    private void finishSnap() {
        clock.advanceMillis(CurlController.DEFAULT_ANIMATION_DURATION_MILLIS + 1);
        controller.onDrawFrame();
    }

    // --- Content ---

    @Test
    void viewportLoadsFirstPage() {
        assertEquals(List.of(controller.mesh(MeshRole.RIGHT)), surface.meshes);
        assertTrue(provider.requested(0, NONE));
        CountingPageProvider.Request request = provider.requests.get(0);
        assertEquals(200, request.width());
        assertEquals(100, request.height());
    }

    @Test
    void setCurrentIndexLoadsNeighbours() {
        controller.setCurrentIndex(2);

        assertEquals(2, controller.currentIndex());
        assertTrue(provider.requested(2, NONE));
        assertTrue(provider.requested(1, 1));
        assertTrue(surface.meshes.contains(controller.mesh(MeshRole.LEFT)));
        assertTrue(surface.meshes.contains(controller.mesh(MeshRole.RIGHT)));
        assertTrue(controller.mesh(MeshRole.LEFT).isFlipTexture());
        assertFalse(controller.mesh(MeshRole.RIGHT).isFlipTexture());
    }

    @Test
    void setCurrentIndexClamps() {
        controller.setCurrentIndex(99);
        assertEquals(5, controller.currentIndex());
        assertEquals(List.of(controller.mesh(MeshRole.LEFT)), surface.meshes);

        controller.setCurrentIndex(-3);
        assertEquals(0, controller.currentIndex());

        controller.setAllowLastPageCurl(false);
        controller.setCurrentIndex(99);
        assertEquals(4, controller.currentIndex());
    }

    @Test
    void setCurrentIndexToShownPageDoesNothing() {
        provider.requests.clear();
        controller.setCurrentIndex(0);

        assertTrue(provider.requests.isEmpty());
    }

    @Test
    void indexChangeIsNotifiedOnceOnNextFrame() {
        controller.setCurrentIndex(3);
        assertTrue(notified.isEmpty());

        controller.onDrawFrame();
        controller.onDrawFrame();

        assertEquals(List.of(3), notified);
    }

    // --- Dragging ---

    @Test
    void dragAcrossPageTurnsForward() {
        controller.onDragStart(190, 50, 0);
        assertEquals(CurlState.CURLING_RIGHT, controller.curlState());
        assertSame(controller.mesh(MeshRole.CURLING), surface.top());
        assertTrue(provider.requested(1, NONE));

        controller.onDragMove(20, 50, 0);
        assertTrue(controller.mesh(MeshRole.CURLING).isCurled());

        controller.onDragEnd(10, 50);
        assertTrue(controller.isAnimating());
        assertEquals(0, controller.currentIndex());

        finishSnap();
        assertEquals(1, controller.currentIndex());
        assertEquals(CurlState.NONE, controller.curlState());
        assertFalse(controller.isAnimating());
        assertTrue(surface.meshes.contains(controller.mesh(MeshRole.LEFT)));
        assertTrue(surface.meshes.contains(controller.mesh(MeshRole.RIGHT)));

        controller.onDrawFrame();
        assertEquals(List.of(1), notified);
    }

    @Test
    void shortDragSnapsBack() {
        PageMesh firstPage = controller.mesh(MeshRole.RIGHT);
        dragAndRelease(190, 150);
        finishSnap();
        controller.onDrawFrame();

        assertEquals(0, controller.currentIndex());
        assertSame(firstPage, controller.mesh(MeshRole.RIGHT));
        assertEquals(List.of(firstPage), surface.meshes);
        assertTrue(notified.isEmpty());
    }

    @Test
    void dragFromLeftHalfTurnsBack() {
        controller.setCurrentIndex(2);
        provider.requests.clear();
        controller.onDragStart(10, 50, 0);
        assertEquals(CurlState.CURLING_LEFT, controller.curlState());
        assertTrue(provider.requested(0, NONE));

        controller.onDragMove(150, 50, 0);
        controller.onDragEnd(190, 50);
        finishSnap();

        assertEquals(1, controller.currentIndex());
        assertEquals(CurlState.NONE, controller.curlState());
    }

    @Test
    void firstPageCannotTurnBack() {
        controller.onDragStart(10, 50, 0);

        assertEquals(CurlState.NONE, controller.curlState());
        assertFalse(controller.isAnimating());
    }

    @Test
    void lastPageStaysWhenLastPageCurlDisabled() {
        controller.setAllowLastPageCurl(false);
        controller.setCurrentIndex(4);
        controller.onDragStart(190, 50, 0);

        assertEquals(CurlState.NONE, controller.curlState());
    }

    @Test
    void dragWithoutProviderIsIgnored() {
        controller.setPageProvider(null);
        controller.onDragStart(190, 50, 0);
        controller.onDragEnd(10, 50);

        assertEquals(CurlState.NONE, controller.curlState());
        assertEquals(0, controller.currentIndex());
    }

    @Test
    void snapFramesRequestRendering() {
        dragAndRelease(190, 10);
        int before = surface.renderRequests;

        clock.advanceMillis(CurlController.DEFAULT_ANIMATION_DURATION_MILLIS / 2);
        controller.onDrawFrame();
        assertTrue(surface.renderRequests > before);

        int mid = surface.renderRequests;
        finishSnap();
        assertTrue(surface.renderRequests > mid);
    }

    @Test
    void zeroSnapDurationSettlesOnNextFrame() {
        controller.setAnimationDurationMillis(0);
        dragAndRelease(190, 10);
        controller.onDrawFrame();

        assertEquals(1, controller.currentIndex());
    }

    @Test
    void twoPageDragTurnsOntoLeftSlot() {
        controller.setViewMode(ViewMode.TWO_PAGES);
        controller.setCurrentIndex(2);
        dragAndRelease(190, 10);
        finishSnap();

        assertEquals(3, controller.currentIndex());
        assertTrue(controller.mesh(MeshRole.LEFT).isFlipTexture());
        assertEquals(layout.pageRect(PageSlot.LEFT), controller.mesh(MeshRole.LEFT).rect());
    }

    // --- Animated jumps ---

    @Test
    void smoothJumpLandsOnTarget() {
        controller.setSmoothCurrentIndex(3);
        assertTrue(controller.isAnimating());
        assertEquals(CurlState.CURLING_RIGHT, controller.curlState());
        // The turning page shows the page before the destination on its back.
        assertTrue(provider.requested(0, 2));
        assertTrue(provider.requested(3, NONE));

        clock.advanceMillis(CurlController.DEFAULT_PAGE_JUMP_DURATION_MILLIS);
        controller.onAnimationFrame();
        finishSnap();

        assertEquals(3, controller.currentIndex());
        assertFalse(controller.isAnimating());
        controller.onDrawFrame();
        controller.onDrawFrame();
        assertEquals(List.of(3), notified);
    }

    @Test
    void smoothJumpBackwards() {
        controller.setCurrentIndex(4);
        controller.setSmoothCurrentIndex(1);
        assertEquals(CurlState.CURLING_LEFT, controller.curlState());

        clock.advanceMillis(CurlController.DEFAULT_PAGE_JUMP_DURATION_MILLIS);
        controller.onAnimationFrame();
        finishSnap();

        assertEquals(1, controller.currentIndex());
    }

    @Test
    void newDragFinishesRunningJump() {
        controller.setSmoothCurrentIndex(3);
        controller.onDragStart(190, 50, 0);

        assertEquals(3, controller.currentIndex());
        assertEquals(CurlState.CURLING_RIGHT, controller.curlState());
    }

    // --- Configuration ---

    @Test
    void tapGoesToClickListener() {
        assertFalse(controller.onSingleTap(10, 10));

        List<Integer> clicks = new ArrayList<>();
        controller.setPageClickListener((c, index) -> clicks.add(index));
        controller.setCurrentIndex(2);

        assertTrue(controller.onSingleTap(10, 10));
        assertEquals(List.of(2), clicks);
    }

    @Test
    void meshOptionsNeedDetachedProvider() {
        MeshOptions options = MeshOptions.builder().maxCurlSplits(4).build();
        assertThrows(IllegalStateException.class, () -> controller.setMeshOptions(options));

        CurlController fresh = new CurlController(new PageLayout(), null, clock);
        fresh.setMeshOptions(options);
        assertEquals(options, fresh.mesh(MeshRole.RIGHT).options());
        assertEquals(options, fresh.mesh(MeshRole.CURLING).options());
        assertThrows(IllegalArgumentException.class, () -> fresh.setMeshOptions(null));
    }

    @Test
    void newMeshOptionsReleaseOldMeshes() {
        PageMesh oldLeft = controller.mesh(MeshRole.LEFT);
        PageMesh oldRight = controller.mesh(MeshRole.RIGHT);
        PageMesh oldCurl = controller.mesh(MeshRole.CURLING);
        controller.setPageProvider(null);

        controller.setMeshOptions(MeshOptions.builder().maxCurlSplits(4).build());

        assertEquals(List.of(oldLeft, oldRight, oldCurl), surface.released);
        assertEquals(List.of(controller.mesh(MeshRole.RIGHT)), surface.meshes);
        assertFalse(surface.meshes.contains(oldRight));
    }

    @Test
    void constructionLogsNothingAtInfo() {
        Logger logger = Logger.getLogger(CurlController.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Level previous = logger.getLevel();
        logger.setLevel(Level.ALL);
        logger.addHandler(handler);
        try {
            new CurlController(new PageLayout(), new RecordingSurface(), clock);
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(previous);
        }

        assertTrue(records.stream().anyMatch(r -> r.getMessage().startsWith("Built page meshes")));
        assertTrue(records.stream().allMatch(r -> r.getLevel().intValue() < Level.INFO.intValue()));
    }

    @Test
    void viewModeSwitchReloadsAtNewPageSize() {
        provider.requests.clear();
        controller.setViewMode(ViewMode.TWO_PAGES);

        assertEquals(ViewMode.TWO_PAGES, layout.viewMode());
        assertEquals(100, provider.requests.get(0).width());
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CurlController(null, surface));
        assertThrows(IllegalArgumentException.class, () -> controller.setAnimationDurationMillis(-1));
        assertThrows(IllegalArgumentException.class, () -> controller.setPageJumpDurationMillis(-5));
    }
}
