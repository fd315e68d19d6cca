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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PageLayoutTest {

    private static final float DELTA = 1e-5f;

    private PageLayout layout;
    private final List<int[]> sizes = new ArrayList<>();

    @BeforeEach
    void setUp() {
        layout = new PageLayout();
        layout.setListener((w, h) -> sizes.add(new int[]{w, h}));
    }

    private static void assertRect(PageRect expected, PageRect actual) {
        assertEquals(expected.left(), actual.left(), DELTA, "left");
        assertEquals(expected.top(), actual.top(), DELTA, "top");
        assertEquals(expected.right(), actual.right(), DELTA, "right");
        assertEquals(expected.bottom(), actual.bottom(), DELTA, "bottom");
    }

    @Test
    void noRectsBeforeViewport() {
        assertFalse(layout.hasPageRects());
        assertEquals(0, layout.pageWidthPixels());
        assertTrue(sizes.isEmpty());
    }

    @Test
    void viewRectFollowsAspectRatio() {
        layout.setViewport(200, 100);

        assertRect(new PageRect(-2, 1, 2, -1), layout.viewRect());
        assertTrue(layout.hasPageRects());
    }

    @Test
    void onePageModeParksLeftSlotOffScreen() {
        layout.setViewport(200, 100);

        assertRect(new PageRect(-2, 1, 2, -1), layout.pageRect(PageSlot.RIGHT));
        assertRect(new PageRect(-6, 1, -2, -1), layout.pageRect(PageSlot.LEFT));
        assertEquals(200, layout.pageWidthPixels());
        assertEquals(100, layout.pageHeightPixels());
    }

    @Test
    void twoPageModeSplitsView() {
        layout.setViewport(200, 100);
        layout.setViewMode(ViewMode.TWO_PAGES);

        assertRect(new PageRect(-2, 1, 0, -1), layout.pageRect(PageSlot.LEFT));
        assertRect(new PageRect(0, 1, 2, -1), layout.pageRect(PageSlot.RIGHT));
        assertEquals(100, layout.pageWidthPixels());
    }

    @Test
    void marginsInsetPages() {
        layout.setViewport(200, 100);
        layout.setProportionalMargins(0.1f, 0.1f, 0.1f, 0.1f);

        assertRect(new PageRect(-1.6f, 0.8f, 1.6f, -0.8f), layout.pageRect(PageSlot.RIGHT));
    }

    @Test
    void marginsOutsideUnitRangeAreRejected() {
        layout.setViewport(200, 100);

        assertThrows(IllegalArgumentException.class, () -> layout.setProportionalMargins(-0.1f, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> layout.setProportionalMargins(0, 0, 0, 1.5f));
        assertThrows(IllegalArgumentException.class, () -> layout.setProportionalMargins(0, Float.NaN, 0, 0));
        assertRect(new PageRect(-2, 1, 2, -1), layout.pageRect(PageSlot.RIGHT));
    }

    @Test
    void pixelMarginsNeedViewport() {
        layout.setMargins(20, 10, 20, 10);
        assertFalse(layout.hasPageRects());

        layout.setViewport(200, 100);
        layout.setMargins(20, 10, 20, 10);
        assertRect(new PageRect(-1.6f, 0.8f, 1.6f, -0.8f), layout.pageRect(PageSlot.RIGHT));
    }

    @Test
    void pixelTransformsMapCorners() {
        layout.setViewport(200, 100);

        assertEquals(-2.0f, layout.translateX(0), DELTA);
        assertEquals(2.0f, layout.translateX(200), DELTA);
        assertEquals(1.0f, layout.translateY(0), DELTA);
        assertEquals(-1.0f, layout.translateY(100), DELTA);
        assertEquals(150.0f, layout.inverseTranslateX(layout.translateX(150)), 1e-3f);
        assertEquals(30.0f, layout.inverseTranslateY(layout.translateY(30)), 1e-3f);
    }

    @Test
    void listenerReceivesPageSizeOnEveryRelayout() {
        layout.setViewport(200, 100);
        layout.setViewMode(ViewMode.TWO_PAGES);

        assertEquals(2, sizes.size());
        assertEquals(200, sizes.get(0)[0]);
        assertEquals(100, sizes.get(1)[0]);
        assertEquals(100, sizes.get(1)[1]);
    }

    @Test
    void nonPositiveViewportIsIgnored() {
        layout.setViewport(200, 100);
        layout.setViewport(0, 50);
        layout.setViewport(50, -1);

        assertEquals(200, layout.viewportWidth());
        assertEquals(100, layout.viewportHeight());
        assertEquals(1, sizes.size());
    }
}
