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

import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Page-turn state machine.
 *
 * <p>Owns three {@link PageMesh} instances in the roles {@link MeshRole#LEFT},
 * {@link MeshRole#RIGHT} and {@link MeshRole#CURLING}, maps pointer input to curl
 * poses and drives the animations that finish a turn. Page content comes from a
 * {@link PageProvider}; meshes are handed to a {@link CurlSurface} for drawing.
 *
 * <p>Pointer coordinates are viewport pixels, origin top-left. The host must call
 * every method on one thread: pointer callbacks, {@link #onAnimationFrame()} once per
 * frame and {@link #onDrawFrame()} from the render pass, in any interleaving.
 *
 * <p>Usage:
 * <pre>{@code
 * PageLayout layout = new PageLayout();
 * CurlController controller = new CurlController(layout, renderer);
 * controller.setPageProvider(provider);
 * layout.setViewport(width, height);
 * }</pre>
 */
public class CurlController {

    private static final Logger log = Logger.getLogger(CurlController.class.getName());

    /** Snap animation after a drag is released. */
    public static final long DEFAULT_ANIMATION_DURATION_MILLIS = 300;

    /** Animated jump started by {@link #setSmoothCurrentIndex(int)}. */
    public static final long DEFAULT_PAGE_JUMP_DURATION_MILLIS = 500;

    /** Pressure assumed when pressure sensitivity is off. */
    public static final float DEFAULT_PRESSURE = 0.8f;

    public static final MeshOptions DEFAULT_MESH_OPTIONS = MeshOptions.builder()
            .colorFactorOffset(0.3f)
            .build();

    private static final long NANOS_PER_MILLI = 1_000_000L;

    /** Notified once the current index settles on a new value. */
    public interface CurrentIndexChangedListener {
        void onCurrentIndexChanged(CurlController controller, int currentIndex);
    }

    /** Notified on a single tap. */
    public interface PageClickListener {
        boolean onPageClick(CurlController controller, int currentIndex);
    }

    private enum SnapTarget {
        TO_LEFT,
        TO_RIGHT
    }

    private final PageLayout layout;
    private final CurlSurface surface;
    private final LongSupplier clock;
    private final MeshRoles meshes = new MeshRoles();

    private MeshOptions meshOptions = DEFAULT_MESH_OPTIONS;
    private PageProvider pageProvider;
    private CurrentIndexChangedListener currentIndexChangedListener;
    private PageClickListener pageClickListener;

    private CurlState curlState = CurlState.NONE;
    private int currentIndex;
    private int lastNotifiedIndex;
    private int targetIndex = PageProvider.NO_INDEX;

    private int pageWidth = -1;
    private int pageHeight = -1;
    private boolean pagesPopulated;

    private boolean allowLastPageCurl = true;
    private boolean renderLeftPage = true;
    private boolean enableTouchPressure;
    private long animationDurationMillis = DEFAULT_ANIMATION_DURATION_MILLIS;
    private long pageJumpDurationMillis = DEFAULT_PAGE_JUMP_DURATION_MILLIS;

    // Pointer and drag anchor in normalized space.
    private float pointerX;
    private float pointerY;
    private float pointerPressure;
    private float dragStartX;
    private float dragStartY;

    // Snap animation, advanced from onDrawFrame().
    private boolean animate;
    private long animationStartNanos;
    private float animationSourceX;
    private float animationSourceY;
    private float animationTargetX;
    private float animationTargetY;
    private SnapTarget animationTarget = SnapTarget.TO_RIGHT;

    // Drag catch-up or page jump, advanced from onAnimationFrame().
    private ValueAnimation curlAnimator;
    private float scrollX;
    private float scrollY;
    private float scrollPressure;

    public CurlController(PageLayout layout, CurlSurface surface) {
        this(layout, surface, System::nanoTime);
    }

    /**
     * @param layout    page layout, shared with the rendering backend
     * @param surface   surface the meshes are drawn on, may be {@code null}
     * @param nanoClock monotonic time source in nanoseconds
     */
    public CurlController(PageLayout layout, CurlSurface surface, LongSupplier nanoClock) {
        if (layout == null) {
            throw new IllegalArgumentException("layout must not be null");
        }
        this.layout = layout;
        this.surface = surface;
        this.clock = nanoClock == null ? System::nanoTime : nanoClock;
        layout.setListener(this::onPageSizeChanged);
        if (layout.hasPageRects()) {
            pageWidth = layout.pageWidthPixels();
            pageHeight = layout.pageHeightPixels();
        }
        rebuildMeshes();
    }

    // ==================================================================================
    // Pointer input
    // ==================================================================================

    /**
     * First drag event of a gesture. Any turn still in progress is finished first.
     */
    public void onDragStart(float x, float y, float pressure) {
        if (!layout.hasPageRects()) {
            return;
        }
        settleCurl();

        updateFirstCurlPos(x, y, pressure, PageProvider.NO_INDEX);
        if (curlState == CurlState.NONE) {
            return;
        }

        // The curl eases in from the page edge towards the pointer instead of jumping.
        PageRect rightRect = layout.pageRect(PageSlot.RIGHT);
        PageRect leftRect = layout.pageRect(PageSlot.LEFT);
        float edgeX;
        if (curlState == CurlState.CURLING_RIGHT) {
            edgeX = rightRect.right();
        } else if (layout.viewMode() == ViewMode.ONE_PAGE) {
            edgeX = rightRect.left();
        } else {
            edgeX = leftRect.left();
        }
        final float startX = layout.inverseTranslateX(edgeX);
        final float startY = y;
        final float startPressure = pressure;
        scrollX = x;
        scrollY = y;
        scrollPressure = pressure;

        curlAnimator = new ValueAnimation(0.0f, 1.0f, millisToNanos(animationDurationMillis), Easing.LINEAR,
                v -> updateCurlPos(
                        startX * (1.0f - v) + v * scrollX,
                        startY * (1.0f - v) + v * scrollY,
                        startPressure * (1.0f - v) + v * scrollPressure));
        curlAnimator.start(clock.getAsLong());
    }

    /** Subsequent drag event. Ignored while a release snap is animating. */
    public void onDragMove(float x, float y, float pressure) {
        if (animate || !layout.hasPageRects()) {
            return;
        }
        scrollX = x;
        scrollY = y;
        scrollPressure = pressure;
        updateCurlPos(x, y, pressure);
    }

    /** Pointer released after a drag: the page snaps to the nearer edge. */
    public void onDragEnd(float x, float y) {
        cancelCurlAnimator();
        updateLastCurlPos(x, y, 0.0f, PageProvider.NO_INDEX);
    }

    /**
     * Single tap.
     *
     * @return the click listener's result, {@code false} without a listener
     */
    public boolean onSingleTap(float x, float y) {
        PageClickListener listener = pageClickListener;
        if (listener == null) {
            return false;
        }
        return listener.onPageClick(this, currentIndex);
    }

    // ==================================================================================
    // Frame callbacks
    // ==================================================================================

    /** Advance the drag catch-up or page jump animation. Call once per frame. */
    public void onAnimationFrame() {
        ValueAnimation animator = curlAnimator;
        if (animator != null && animator.isRunning()) {
            animator.tick(clock.getAsLong());
        }
    }

    /**
     * Called by the rendering backend before drawing the meshes. Advances the release
     * snap, finishes turns and notifies index changes.
     */
    public void onDrawFrame() {
        if (!animate) {
            if (curlState == CurlState.NONE && currentIndex != lastNotifiedIndex) {
                lastNotifiedIndex = currentIndex;
                log.fine(() -> String.format("Current index settled at %d", currentIndex));
                CurrentIndexChangedListener listener = currentIndexChangedListener;
                if (listener != null) {
                    listener.onCurrentIndexChanged(this, currentIndex);
                }
            }
            return;
        }

        long elapsed = clock.getAsLong() - animationStartNanos;
        long duration = millisToNanos(animationDurationMillis);
        if (elapsed >= duration) {
            completeSnap();
        } else {
            float t = Easing.SNAP.apply((float) elapsed / (float) duration);
            pointerX = animationSourceX + (animationTargetX - animationSourceX) * t;
            pointerY = animationSourceY + (animationTargetY - animationSourceY) * t;
            updateCurlPos();
        }
    }

    // ==================================================================================
    // Index
    // ==================================================================================

    /**
     * Show a page immediately. The index is clamped to the allowed range. Setting the
     * index already shown with nothing in progress does nothing.
     */
    public void setCurrentIndex(int index) {
        int newIndex = clampIndex(index);
        if (newIndex == currentIndex && curlState == CurlState.NONE && !animate && pagesPopulated) {
            return;
        }
        abortCurl();
        currentIndex = newIndex;
        log.fine(() -> String.format("Current index set to %d", newIndex));
        updatePages(PageProvider.NO_INDEX, PageProvider.NO_INDEX);
        requestRender();
    }

    /**
     * Turn to a page with an animation. The destination is loaded before the
     * animation starts and becomes the current index when it completes.
     */
    public void setSmoothCurrentIndex(int index) {
        settleCurl();
        int newIndex = clampIndex(index);
        if (currentIndex < newIndex) {
            animateCurlRight(newIndex);
        } else if (currentIndex > newIndex) {
            animateCurlLeft(newIndex);
        } else {
            requestRender();
        }
    }

    private int clampIndex(int index) {
        PageProvider provider = pageProvider;
        if (provider == null || index < 0) {
            return 0;
        }
        int max = allowLastPageCurl ? provider.getPageCount() : provider.getPageCount() - 1;
        return Math.max(0, Math.min(index, max));
    }

    // ==================================================================================
    // Curl start and completion
    // ==================================================================================

    private void updateFirstCurlPos(float x, float y, float pressure, int newIndex) {
        PageProvider provider = pageProvider;
        if (provider == null || !layout.hasPageRects()) {
            return;
        }
        PageRect rightRect = layout.pageRect(PageSlot.RIGHT);
        PageRect leftRect = layout.pageRect(PageSlot.LEFT);

        storePointer(x, y, pressure);

        // The drag is anchored to the edge of the page it grabs, clamped vertically.
        dragStartX = pointerX;
        dragStartY = Math.max(rightRect.bottom(), Math.min(rightRect.top(), pointerY));

        int pageCount = provider.getPageCount();
        float splitX = layout.viewMode() == ViewMode.TWO_PAGES ? rightRect.left() : rightRect.centerX();
        if (dragStartX < splitX && currentIndex > 0) {
            dragStartX = layout.viewMode() == ViewMode.TWO_PAGES ? leftRect.left() : rightRect.left();
            startCurl(CurlState.CURLING_LEFT, newIndex);
        } else if (dragStartX >= splitX && currentIndex < pageCount) {
            dragStartX = rightRect.right();
            if (!allowLastPageCurl && currentIndex >= pageCount - 1) {
                return;
            }
            startCurl(CurlState.CURLING_RIGHT, newIndex);
        }

        if (curlState == CurlState.NONE) {
            return;
        }
        updateCurlPos();
    }

    private void startCurl(CurlState state, int newIndex) {
        PageMesh left = meshes.get(MeshRole.LEFT);
        PageMesh right = meshes.get(MeshRole.RIGHT);
        PageMesh curl = meshes.get(MeshRole.CURLING);
        removeMesh(left);
        removeMesh(right);
        removeMesh(curl);

        int pageCount = pageProvider == null ? 0 : pageProvider.getPageCount();
        PageRect leftRect = layout.pageRect(PageSlot.LEFT);
        PageRect rightRect = layout.pageRect(PageSlot.RIGHT);

        if (state == CurlState.CURLING_RIGHT) {
            int target = newIndex == PageProvider.NO_INDEX ? currentIndex + 1 : newIndex;

            // The right page starts turning; the next page goes underneath it.
            meshes.swap(MeshRole.RIGHT, MeshRole.CURLING);
            right = meshes.get(MeshRole.RIGHT);
            curl = meshes.get(MeshRole.CURLING);

            if (currentIndex > 0) {
                placeMesh(left, leftRect, true);
                if (renderLeftPage) {
                    addMesh(left);
                }
            }
            if (target < pageCount) {
                updatePage(right.page(), target, PageProvider.NO_INDEX);
                placeMesh(right, rightRect, false);
                addMesh(right);
            }
            placeMesh(curl, rightRect, false);
            addMesh(curl);
        } else {
            int target = newIndex == PageProvider.NO_INDEX ? currentIndex - 1 : newIndex;

            // The left page starts turning back; the page before it goes underneath.
            meshes.swap(MeshRole.LEFT, MeshRole.CURLING);
            left = meshes.get(MeshRole.LEFT);
            curl = meshes.get(MeshRole.CURLING);

            if (target > 0) {
                updatePage(left.page(), target - 1, PageProvider.NO_INDEX);
                placeMesh(left, leftRect, true);
                if (renderLeftPage) {
                    addMesh(left);
                }
            }
            if (currentIndex < pageCount) {
                placeMesh(right, rightRect, false);
                addMesh(right);
            }
            if (layout.viewMode() == ViewMode.ONE_PAGE) {
                placeMesh(curl, rightRect, false);
            } else {
                placeMesh(curl, leftRect, true);
            }
            addMesh(curl);
        }

        curlState = state;
        log.fine(() -> String.format("Start %s at index %d (target %d)", state, currentIndex, newIndex));
    }

    private void updateLastCurlPos(float x, float y, float pressure, int newIndex) {
        if (!layout.hasPageRects()) {
            return;
        }
        storePointer(x, y, pressure);
        if (curlState != CurlState.NONE) {
            startSnap(newIndex);
        }
    }

    /**
     * Start animating from the pointer to the nearer edge. The release is treated like
     * a drag to that edge, so every frame goes through the same pointer mapping.
     */
    private void startSnap(int newIndex) {
        PageRect rightRect = layout.pageRect(PageSlot.RIGHT);
        PageRect leftRect = layout.pageRect(PageSlot.LEFT);

        animationSourceX = pointerX;
        animationSourceY = pointerY;
        animationStartNanos = clock.getAsLong();

        boolean toRight = layout.viewMode() == ViewMode.ONE_PAGE
                ? pointerX > rightRect.centerX()
                : pointerX > rightRect.left();
        animationTargetY = dragStartY;
        if (toRight) {
            animationTargetX = rightRect.right();
            animationTarget = SnapTarget.TO_RIGHT;
        } else {
            if (curlState == CurlState.CURLING_RIGHT || layout.viewMode() == ViewMode.TWO_PAGES) {
                animationTargetX = leftRect.left();
            } else {
                animationTargetX = rightRect.left();
            }
            animationTarget = SnapTarget.TO_LEFT;
        }
        targetIndex = newIndex;
        animate = true;
        requestRender();
    }

    private void completeSnap() {
        PageRect leftRect = layout.pageRect(PageSlot.LEFT);
        PageRect rightRect = layout.pageRect(PageSlot.RIGHT);
        CurlState finished = curlState;
        int target = targetIndex;

        if (animationTarget == SnapTarget.TO_RIGHT) {
            // The turning page lands on the right slot.
            PageMesh oldRight = meshes.get(MeshRole.RIGHT);
            meshes.swap(MeshRole.RIGHT, MeshRole.CURLING);
            placeMesh(meshes.get(MeshRole.RIGHT), rightRect, false);
            removeMesh(oldRight);
            if (finished == CurlState.CURLING_LEFT) {
                currentIndex = target == PageProvider.NO_INDEX ? currentIndex - 1 : target;
            }
        } else {
            // The turning page lands on the left slot.
            PageMesh oldLeft = meshes.get(MeshRole.LEFT);
            meshes.swap(MeshRole.LEFT, MeshRole.CURLING);
            PageMesh left = meshes.get(MeshRole.LEFT);
            placeMesh(left, leftRect, true);
            removeMesh(oldLeft);
            if (!renderLeftPage) {
                removeMesh(left);
            }
            if (finished == CurlState.CURLING_RIGHT) {
                currentIndex = target == PageProvider.NO_INDEX ? currentIndex + 1 : target;
            }
        }
        currentIndex = clampIndex(currentIndex);

        curlState = CurlState.NONE;
        animate = false;
        targetIndex = PageProvider.NO_INDEX;
        log.fine(() -> String.format("%s settled %s, index %d", finished, animationTarget, currentIndex));
        if (target != PageProvider.NO_INDEX) {
            updatePages(PageProvider.NO_INDEX, PageProvider.NO_INDEX);
        }
        requestRender();
    }

    /**
     * Finish whatever turn is in progress right away: a running jump ends at its
     * destination, a drag snaps to the nearer edge.
     */
    private void settleCurl() {
        ValueAnimation animator = curlAnimator;
        curlAnimator = null;
        if (animator != null) {
            animator.end();
        }
        if (curlState != CurlState.NONE && !animate && layout.hasPageRects()) {
            startSnap(PageProvider.NO_INDEX);
        }
        if (animate) {
            completeSnap();
        }
    }

    /** Drop any turn in progress without changing the index. */
    private void abortCurl() {
        cancelCurlAnimator();
        animate = false;
        targetIndex = PageProvider.NO_INDEX;
        if (curlState != CurlState.NONE) {
            log.fine(() -> String.format("Abort %s at index %d", curlState, currentIndex));
            curlState = CurlState.NONE;
        }
    }

    private void cancelCurlAnimator() {
        ValueAnimation animator = curlAnimator;
        if (animator != null) {
            animator.cancel();
        }
        curlAnimator = null;
    }

    // ==================================================================================
    // Animated jumps
    // ==================================================================================

    private void animateCurlRight(int newIndex) {
        if (!layout.hasPageRects()) {
            return;
        }
        PageRect rightRect = layout.pageRect(PageSlot.RIGHT);
        PageRect leftRect = layout.pageRect(PageSlot.LEFT);
        float y = layout.inverseTranslateY(rightRect.centerY());
        float startX = layout.inverseTranslateX(rightRect.right());
        float endX = layout.inverseTranslateX(
                layout.viewMode() == ViewMode.ONE_PAGE ? rightRect.left() : leftRect.left());
        if (newIndex > 0) {
            // The turning page shows the page before the destination on its back.
            updatePages(PageProvider.NO_INDEX, newIndex - 1);
        }
        animateCurl(startX, endX, y, newIndex);
    }

    private void animateCurlLeft(int newIndex) {
        if (!layout.hasPageRects()) {
            return;
        }
        PageRect rightRect = layout.pageRect(PageSlot.RIGHT);
        PageRect leftRect = layout.pageRect(PageSlot.LEFT);
        float y = layout.inverseTranslateY(rightRect.centerY());
        float startX = layout.inverseTranslateX(
                layout.viewMode() == ViewMode.ONE_PAGE ? rightRect.left() : leftRect.left());
        float endX = layout.inverseTranslateX(rightRect.right());
        updatePages(newIndex, PageProvider.NO_INDEX);
        animateCurl(startX, endX, y, newIndex);
    }

    private void animateCurl(float startX, float endX, float y, int newIndex) {
        cancelCurlAnimator();
        updateFirstCurlPos(startX, y, 0.0f, newIndex);
        if (curlState == CurlState.NONE) {
            return;
        }
        log.fine(() -> String.format("Animate jump %d -> %d", currentIndex, newIndex));
        curlAnimator = new ValueAnimation(startX, endX, millisToNanos(pageJumpDurationMillis), Easing.ACCELERATE,
                new ValueAnimation.Listener() {
                    @Override
                    public void onUpdate(float x) {
                        updateCurlPos(x, y, 0.0f);
                    }

                    @Override
                    public void onEnd(float x) {
                        updateLastCurlPos(endX, y, 0.0f, newIndex);
                    }
                });
        curlAnimator.start(clock.getAsLong());
    }

    // ==================================================================================
    // Pointer -> curl pose
    // ==================================================================================

    private void storePointer(float x, float y, float pressure) {
        pointerX = layout.translateX(x);
        pointerY = layout.translateY(y);
        pointerPressure = enableTouchPressure ? pressure : DEFAULT_PRESSURE;
    }

    private void updateCurlPos(float x, float y, float pressure) {
        if (!layout.hasPageRects()) {
            return;
        }
        storePointer(x, y, pressure);
        updateCurlPos();
    }

    /** Map the stored pointer to a curl pose and apply it to the curling mesh. */
    private void updateCurlPos() {
        if (curlState == CurlState.NONE) {
            return;
        }
        PageRect rightRect = layout.pageRect(PageSlot.RIGHT);
        double radius = rightRect.width() / 3.0;
        // Pressure readings are unreliable on most hardware; 1 - pressure is a tunable default.
        radius *= Math.max(1.0f - pointerPressure, 0.0f);

        double curlX = pointerX;
        double curlY = pointerY;
        double dirX;
        double dirY;

        if (curlState == CurlState.CURLING_RIGHT
                || (curlState == CurlState.CURLING_LEFT && layout.viewMode() == ViewMode.TWO_PAGES)) {
            dirX = curlX - dragStartX;
            dirY = curlY - dragStartY;
            double dist = Math.sqrt(dirX * dirX + dirY * dirY);

            // Dragged far enough to the other side, the radius shrinks towards zero.
            double pageWidth = rightRect.width();
            double curlLen = radius * Math.PI;
            if (dist > (pageWidth * 2.0) - curlLen) {
                curlLen = Math.max((pageWidth * 2.0) - dist, 0.0);
                radius = curlLen / Math.PI;
            }

            if (dist >= curlLen) {
                double translate = (dist - curlLen) / 2.0;
                if (layout.viewMode() == ViewMode.TWO_PAGES) {
                    if (dist > 0.0) {
                        curlX -= dirX * translate / dist;
                    }
                } else {
                    radius = Math.max(Math.min(curlX - rightRect.left(), radius), 0.0);
                }
                if (dist > 0.0) {
                    curlY -= dirY * translate / dist;
                }
            } else if (dist > 0.0) {
                double angle = Math.PI * Math.sqrt(dist / curlLen);
                double translate = radius * Math.sin(angle);
                curlX += dirX * translate / dist;
                curlY += dirY * translate / dist;
            }
        } else {
            // One page mode, previous page coming in from the left edge.
            radius = Math.max(Math.min(curlX - rightRect.left(), radius), 0.0);
            curlX -= Math.min(rightRect.right() - curlX, radius);
            dirX = curlX + dragStartX;
            dirY = curlY - dragStartY;
        }

        setCurlPos(curlX, curlY, dirX, dirY, radius);
    }

    private void setCurlPos(double curlX, double curlY, double dirX, double dirY, double radius) {
        PageMesh curl = meshes.get(MeshRole.CURLING);

        // Keep the page attached to the spine.
        if (curlState == CurlState.CURLING_RIGHT
                || (curlState == CurlState.CURLING_LEFT && layout.viewMode() == ViewMode.ONE_PAGE)) {
            PageRect rect = layout.pageRect(PageSlot.RIGHT);
            if (curlX >= rect.right()) {
                curl.reset();
                requestRender();
                return;
            }
            if (curlX < rect.left()) {
                curlX = rect.left();
            }
            if (dirY != 0.0) {
                double diffX = curlX - rect.left();
                double leftY = curlY + (diffX * dirX / dirY);
                if (dirY < 0.0 && leftY < rect.top()) {
                    dirX = curlY - rect.top();
                    dirY = rect.left() - curlX;
                } else if (dirY > 0.0 && leftY > rect.bottom()) {
                    dirX = rect.bottom() - curlY;
                    dirY = curlX - rect.left();
                }
            }
        } else if (curlState == CurlState.CURLING_LEFT) {
            PageRect rect = layout.pageRect(PageSlot.LEFT);
            if (curlX <= rect.left()) {
                curl.reset();
                requestRender();
                return;
            }
            if (curlX > rect.right()) {
                curlX = rect.right();
            }
            if (dirY != 0.0) {
                double diffX = curlX - rect.right();
                double rightY = curlY + (diffX * dirX / dirY);
                if (dirY < 0.0 && rightY < rect.top()) {
                    dirX = rect.top() - curlY;
                    dirY = curlX - rect.right();
                } else if (dirY > 0.0 && rightY > rect.bottom()) {
                    dirX = curlY - rect.bottom();
                    dirY = rect.right() - curlX;
                }
            }
        }

        double dist = Math.sqrt(dirX * dirX + dirY * dirY);
        if (dist != 0.0 && Double.isFinite(dist)) {
            curl.curl(curlX, curlY, dirX / dist, dirY / dist, radius);
        } else {
            curl.reset();
        }
        requestRender();
    }

    // ==================================================================================
    // Content
    // ==================================================================================

    private void onPageSizeChanged(int width, int height) {
        pageWidth = width;
        pageHeight = height;
        pagesPopulated = false;
        updatePages(PageProvider.NO_INDEX, PageProvider.NO_INDEX);
        requestRender();
    }

    private void updatePage(CurlPage page, int index, int backIndex) {
        page.reset();
        pageProvider.updatePage(page, pageWidth, pageHeight, index, backIndex);
    }

    /**
     * Load content for every role from the current index and state.
     *
     * @param targetLeftIndex  front index for the left page, or {@link PageProvider#NO_INDEX}
     * @param targetRightIndex back index for the right page, or {@link PageProvider#NO_INDEX}
     */
    private void updatePages(int targetLeftIndex, int targetRightIndex) {
        PageProvider provider = pageProvider;
        if (pageWidth <= 0 || pageHeight <= 0 || provider == null || !layout.hasPageRects()) {
            return;
        }
        PageMesh left = meshes.get(MeshRole.LEFT);
        PageMesh right = meshes.get(MeshRole.RIGHT);
        PageMesh curl = meshes.get(MeshRole.CURLING);
        removeMesh(left);
        removeMesh(right);
        removeMesh(curl);

        int leftIdx = currentIndex - 1;
        int rightIdx = currentIndex;
        int curlIdx = -1;
        if (curlState == CurlState.CURLING_LEFT) {
            curlIdx = leftIdx;
            leftIdx--;
        } else if (curlState == CurlState.CURLING_RIGHT) {
            curlIdx = rightIdx;
            rightIdx++;
        }

        int pageCount = provider.getPageCount();
        PageRect leftRect = layout.pageRect(PageSlot.LEFT);
        PageRect rightRect = layout.pageRect(PageSlot.RIGHT);

        if (rightIdx >= 0 && rightIdx < pageCount) {
            updatePage(right.page(), rightIdx, targetRightIndex);
            placeMesh(right, rightRect, false);
            addMesh(right);
        }
        if (leftIdx >= 0 && leftIdx < pageCount) {
            int primaryIdx = targetLeftIndex == PageProvider.NO_INDEX ? leftIdx : targetLeftIndex;
            updatePage(left.page(), primaryIdx, leftIdx);
            placeMesh(left, leftRect, true);
            if (renderLeftPage) {
                addMesh(left);
            }
        }
        if (curlIdx >= 0 && curlIdx < pageCount) {
            updatePage(curl.page(), curlIdx, PageProvider.NO_INDEX);
            if (curlState == CurlState.CURLING_RIGHT) {
                placeMesh(curl, rightRect, true);
            } else {
                placeMesh(curl, leftRect, false);
            }
            addMesh(curl);
        }
        pagesPopulated = true;

        int loggedLeft = leftIdx;
        int loggedRight = rightIdx;
        int loggedCurl = curlIdx;
        log.fine(() -> String.format("Populated pages left=%d right=%d curl=%d at %dx%d",
                loggedLeft, loggedRight, loggedCurl, pageWidth, pageHeight));
    }

    private static void placeMesh(PageMesh mesh, PageRect rect, boolean flipTexture) {
        mesh.setRect(rect);
        mesh.setFlipTexture(flipTexture);
        mesh.reset();
    }

    private void rebuildMeshes() {
        boolean hadLeft = releaseMesh(meshes.get(MeshRole.LEFT));
        boolean hadRight = releaseMesh(meshes.get(MeshRole.RIGHT));
        boolean hadCurl = releaseMesh(meshes.get(MeshRole.CURLING));

        PageMesh left = new PageMesh(meshOptions);
        PageMesh right = new PageMesh(meshOptions);
        PageMesh curl = new PageMesh(meshOptions);
        left.setFlipTexture(true);
        right.setFlipTexture(false);
        meshes.set(MeshRole.LEFT, left);
        meshes.set(MeshRole.RIGHT, right);
        meshes.set(MeshRole.CURLING, curl);

        if (hadLeft) {
            addMesh(left);
        }
        if (hadRight) {
            addMesh(right);
        }
        if (hadCurl) {
            addMesh(curl);
        }
        log.fine(() -> "Built page meshes: " + meshOptions);
    }

    private void addMesh(PageMesh mesh) {
        if (surface != null && mesh != null) {
            surface.addMesh(mesh);
        }
    }

    private boolean removeMesh(PageMesh mesh) {
        return surface != null && mesh != null && surface.removeMesh(mesh);
    }

    private boolean releaseMesh(PageMesh mesh) {
        return surface != null && mesh != null && surface.releaseMesh(mesh);
    }

    private void requestRender() {
        if (surface != null) {
            surface.requestRender();
        }
    }

    private static long millisToNanos(long millis) {
        return millis * NANOS_PER_MILLI;
    }

    // ==================================================================================
    // Properties
    // ==================================================================================

    public PageLayout layout() {
        return layout;
    }

    public int currentIndex() {
        return currentIndex;
    }

    public CurlState curlState() {
        return curlState;
    }

    /** Whether a release snap or a jump is in progress. */
    public boolean isAnimating() {
        return animate || (curlAnimator != null && curlAnimator.isRunning());
    }

    /** Mesh currently serving a role. The same mesh moves between roles as pages turn. */
    public PageMesh mesh(MeshRole role) {
        return meshes.get(role);
    }

    public PageProvider pageProvider() {
        return pageProvider;
    }

    /** Attach a content source. The index goes back to 0 and pages are reloaded. */
    public void setPageProvider(PageProvider pageProvider) {
        abortCurl();
        this.pageProvider = pageProvider;
        currentIndex = 0;
        lastNotifiedIndex = 0;
        pagesPopulated = false;
        updatePages(PageProvider.NO_INDEX, PageProvider.NO_INDEX);
        requestRender();
    }

    public MeshOptions meshOptions() {
        return meshOptions;
    }

    /**
     * Replace the mesh options, rebuilding all three meshes when they differ.
     *
     * @throws IllegalStateException if a page provider is attached
     */
    public void setMeshOptions(MeshOptions meshOptions) {
        if (pageProvider != null) {
            throw new IllegalStateException("mesh options cannot change while a page provider is attached");
        }
        if (meshOptions == null) {
            throw new IllegalArgumentException("meshOptions must not be null");
        }
        if (!this.meshOptions.equals(meshOptions)) {
            this.meshOptions = meshOptions;
            rebuildMeshes();
        }
    }

    public ViewMode viewMode() {
        return layout.viewMode();
    }

    /** Switch between one and two visible pages. Pages are reloaded for the new slots. */
    public void setViewMode(ViewMode viewMode) {
        if (viewMode == null || viewMode == layout.viewMode()) {
            return;
        }
        abortCurl();
        layout.setViewMode(viewMode);
        requestRender();
    }

    public boolean isAllowLastPageCurl() {
        return allowLastPageCurl;
    }

    /** Whether the last page can be turned, leaving an empty right slot (default true). */
    public void setAllowLastPageCurl(boolean allowLastPageCurl) {
        this.allowLastPageCurl = allowLastPageCurl;
    }

    public boolean isRenderLeftPage() {
        return renderLeftPage;
    }

    /** Whether the left page is drawn (default true). */
    public void setRenderLeftPage(boolean renderLeftPage) {
        this.renderLeftPage = renderLeftPage;
    }

    public boolean isEnableTouchPressure() {
        return enableTouchPressure;
    }

    /** Whether pointer pressure affects the curl radius (default false, fixed pressure 0.8). */
    public void setEnableTouchPressure(boolean enableTouchPressure) {
        this.enableTouchPressure = enableTouchPressure;
    }

    public long animationDurationMillis() {
        return animationDurationMillis;
    }

    /**
     * @throws IllegalArgumentException if negative
     */
    public void setAnimationDurationMillis(long millis) {
        this.animationDurationMillis = Asserts.assertNonNegative(millis, "animationDurationMillis");
    }

    public long pageJumpDurationMillis() {
        return pageJumpDurationMillis;
    }

    /**
     * @throws IllegalArgumentException if negative
     */
    public void setPageJumpDurationMillis(long millis) {
        this.pageJumpDurationMillis = Asserts.assertNonNegative(millis, "pageJumpDurationMillis");
    }

    public void setCurrentIndexChangedListener(CurrentIndexChangedListener listener) {
        this.currentIndexChangedListener = listener;
    }

    public void setPageClickListener(PageClickListener listener) {
        this.pageClickListener = listener;
    }
}
