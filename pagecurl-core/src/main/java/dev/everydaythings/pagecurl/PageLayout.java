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

/**
 * Maps viewport pixels to the normalized view space and computes the left and
 * right page slots.
 *
 * <p>The view rectangle spans {@code [-aspect, aspect]} horizontally and
 * {@code [-1, 1]} vertically with Y pointing up. Pixel coordinates have their
 * origin at the top-left corner of the viewport with Y pointing down.
 *
 * <p>In {@link ViewMode#ONE_PAGE} the right slot covers the whole view minus
 * margins and the left slot is the same rectangle moved one page width to the
 * left, just outside the view. In {@link ViewMode#TWO_PAGES} the marginned
 * rectangle is split in half.
 */
public class PageLayout {

    /** Receives the page slot size in pixels whenever the slots are recomputed. */
    public interface Listener {
        void onPageSizeChanged(int width, int height);
    }

    private int viewportWidth;
    private int viewportHeight;
    private PageRect viewRect = PageRect.EMPTY;

    // Margins as proportions of the view size.
    private float marginLeft;
    private float marginTop;
    private float marginRight;
    private float marginBottom;

    private ViewMode viewMode = ViewMode.ONE_PAGE;
    private PageRect pageRectLeft = PageRect.EMPTY;
    private PageRect pageRectRight = PageRect.EMPTY;

    private Listener listener;

    public void setListener(Listener listener) {
        this.listener = listener;
    }

    /**
     * Set the viewport size in pixels. Non-positive sizes are ignored.
     */
    public void setViewport(int width, int height) {
        if (width <= 0 || height <= 0) {
            return;
        }
        viewportWidth = width;
        viewportHeight = height;

        float ratio = (float) width / (float) height;
        viewRect = new PageRect(-ratio, 1.0f, ratio, -1.0f);
        updatePageRects();
    }

    public int viewportWidth() {
        return viewportWidth;
    }

    public int viewportHeight() {
        return viewportHeight;
    }

    public PageRect viewRect() {
        return viewRect;
    }

    public ViewMode viewMode() {
        return viewMode;
    }

    public void setViewMode(ViewMode viewMode) {
        if (viewMode == null) {
            return;
        }
        this.viewMode = viewMode;
        updatePageRects();
    }

    /**
     * Rectangle of the given slot in normalized space, {@link PageRect#EMPTY}
     * until a viewport is known.
     */
    public PageRect pageRect(PageSlot slot) {
        return slot == PageSlot.LEFT ? pageRectLeft : pageRectRight;
    }

    public boolean hasPageRects() {
        return !pageRectRight.isEmpty();
    }

    /**
     * Set margins in pixels. They are converted to proportions of the current
     * viewport, so this is a no-op until a viewport is known.
     */
    public void setMargins(int left, int top, int right, int bottom) {
        if (viewportWidth <= 0 || viewportHeight <= 0) {
            return;
        }
        setProportionalMargins(
                (float) left / viewportWidth,
                (float) top / viewportHeight,
                (float) right / viewportWidth,
                (float) bottom / viewportHeight);
    }

    /**
     * Set margins as proportions of the view size.
     *
     * @throws IllegalArgumentException if a margin is outside [0, 1]
     */
    public void setProportionalMargins(float left, float top, float right, float bottom) {
        Asserts.assertUnitIn(left, "left");
        Asserts.assertUnitIn(top, "top");
        Asserts.assertUnitIn(right, "right");
        Asserts.assertUnitIn(bottom, "bottom");
        marginLeft = left;
        marginTop = top;
        marginRight = right;
        marginBottom = bottom;
        updatePageRects();
    }

    // ==================================================================================
    // Pixel <-> normalized transforms
    // ==================================================================================

    public float translateX(float x) {
        return viewRect.left() + viewRect.width() * x / viewportWidth;
    }

    public float translateY(float y) {
        return viewRect.top() - viewRect.height() * y / viewportHeight;
    }

    public float inverseTranslateX(float x) {
        return viewportWidth * (x - viewRect.left()) / viewRect.width();
    }

    public float inverseTranslateY(float y) {
        return viewportHeight * (viewRect.top() - y) / viewRect.height();
    }

    /** Width in pixels of one page slot, 0 until a viewport is known. */
    public int pageWidthPixels() {
        if (viewRect.isEmpty()) {
            return 0;
        }
        return (int) ((pageRectRight.width() * viewportWidth) / viewRect.width());
    }

    /** Height in pixels of one page slot, 0 until a viewport is known. */
    public int pageHeightPixels() {
        if (viewRect.isEmpty()) {
            return 0;
        }
        return (int) ((pageRectRight.height() * viewportHeight) / viewRect.height());
    }

    private void updatePageRects() {
        if (viewRect.isEmpty()) {
            return;
        }

        float w = viewRect.width();
        float h = viewRect.height();
        PageRect marginned = new PageRect(
                viewRect.left() + w * marginLeft,
                viewRect.top() - h * marginTop,
                viewRect.right() - w * marginRight,
                viewRect.bottom() + h * marginBottom);

        if (viewMode == ViewMode.ONE_PAGE) {
            pageRectRight = marginned;
            pageRectLeft = marginned.offset(-marginned.width(), 0.0f);
        } else {
            float middle = (marginned.left() + marginned.right()) / 2.0f;
            pageRectLeft = new PageRect(marginned.left(), marginned.top(), middle, marginned.bottom());
            pageRectRight = new PageRect(middle, marginned.top(), marginned.right(), marginned.bottom());
        }

        if (listener != null) {
            listener.onPageSizeChanged(pageWidthPixels(), pageHeightPixels());
        }
    }
}
