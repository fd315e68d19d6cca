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

package dev.everydaythings.pagecurl.examples;

import dev.everydaythings.pagecurl.*;
import dev.everydaythings.pagecurl.gl.GlCurlRenderer;

import org.lwjgl.glfw.*;
import org.lwjgl.opengl.GL;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.lwjgl.glfw.GLFW.*;
import static org.lwjgl.system.MemoryUtil.*;

/**
 * Interactive page curl over a stack of generated pages.
 *
 * Controls:
 *   Left-drag:    Turn a page (press on the right half to go forward, left half to go back)
 *   Click:        Report the clicked page
 *   Left/Right:   Animate to the previous/next page
 *   Home/End:     Jump to the first/last page
 *   T:            Toggle between one and two pages
 */
public class HelloCurl {

    private static final int WINDOW_WIDTH = 1024;
    private static final int WINDOW_HEIGHT = 768;
    private static final int PAGE_COUNT = 12;

    // Movement below this many pixels between press and release is a click
    private static final double TAP_SLOP = 6.0;
    private static final double IDLE_WAIT_SECONDS = 0.1;

    private static final int[] PAGE_COLORS = {
            0xFFE57373, 0xFF64B5F6, 0xFF81C784, 0xFFFFD54F,
            0xFFBA68C8, 0xFF4DB6AC, 0xFFFF8A65, 0xFF90A4AE
    };

    // Pointer state
    private static boolean pressed = false;
    private static boolean dragging = false;
    private static double pressX, pressY;

    public static void main(String[] args) {
        GLFWErrorCallback.createPrint(System.err).set();

        if (!glfwInit()) {
            throw new RuntimeException("Failed to initialize GLFW");
        }

        glfwWindowHint(GLFW_CLIENT_API, GLFW_OPENGL_API);
        glfwWindowHint(GLFW_RESIZABLE, GLFW_TRUE);

        long window = glfwCreateWindow(WINDOW_WIDTH, WINDOW_HEIGHT,
                "pagecurl - Hello Curl", NULL, NULL);
        if (window == NULL) {
            glfwTerminate();
            throw new RuntimeException("Failed to create GLFW window");
        }

        glfwMakeContextCurrent(window);
        glfwSwapInterval(1);
        GL.createCapabilities();

        PageLayout layout = new PageLayout();
        layout.setProportionalMargins(0.05f, 0.05f, 0.05f, 0.05f);

        GlCurlRenderer renderer = new GlCurlRenderer(layout);
        renderer.setBackgroundColor(Argb.of(255, 48, 48, 56));

        CurlController controller = new CurlController(layout, renderer);
        renderer.setObserver(controller::onDrawFrame);

        controller.setPageProvider(new GeneratedPages());
        controller.setCurrentIndexChangedListener((c, index) ->
                System.out.println("Current page: " + index));
        controller.setPageClickListener((c, index) -> {
            System.out.println("Clicked page: " + index);
            return true;
        });

        renderer.onSurfaceCreated();
        int[] fbWidth = new int[1], fbHeight = new int[1];
        glfwGetFramebufferSize(window, fbWidth, fbHeight);
        renderer.onSurfaceChanged(fbWidth[0], fbHeight[0]);

        glfwSetFramebufferSizeCallback(window, (win, width, height) ->
                renderer.onSurfaceChanged(width, height));
        glfwSetWindowRefreshCallback(window, win -> renderer.requestRender());

        setupMouseCallbacks(window, controller);
        setupKeyCallbacks(window, controller);

        System.out.println("Page curl demo.");
        System.out.println("  Left-drag:  Turn page");
        System.out.println("  Left/Right: Previous/next page");
        System.out.println("  Home/End:   First/last page");
        System.out.println("  T:          Toggle two-page view");

        // Render loop, idle until the controller or the window asks for a frame
        while (!glfwWindowShouldClose(window)) {
            glfwPollEvents();
            controller.onAnimationFrame();
            if (renderer.isRenderRequested()) {
                renderer.render();
                glfwSwapBuffers(window);
            } else {
                glfwWaitEventsTimeout(IDLE_WAIT_SECONDS);
            }
        }

        // Cleanup
        renderer.destroy();
        glfwDestroyWindow(window);
        glfwTerminate();
    }

    private static void setupMouseCallbacks(long window, CurlController controller) {
        glfwSetMouseButtonCallback(window, (win, button, action, mods) -> {
            if (button != GLFW_MOUSE_BUTTON_LEFT) {
                return;
            }
            double[] xpos = new double[1], ypos = new double[1];
            glfwGetCursorPos(win, xpos, ypos);
            float x = toFramebufferX(win, xpos[0]);
            float y = toFramebufferY(win, ypos[0]);

            if (action == GLFW_PRESS) {
                pressed = true;
                dragging = false;
                pressX = xpos[0];
                pressY = ypos[0];
            } else if (action == GLFW_RELEASE && pressed) {
                pressed = false;
                if (dragging) {
                    controller.onDragEnd(x, y);
                } else {
                    controller.onSingleTap(x, y);
                }
                dragging = false;
            }
        });

        glfwSetCursorPosCallback(window, (win, xpos, ypos) -> {
            if (!pressed) {
                return;
            }
            float x = toFramebufferX(win, xpos);
            float y = toFramebufferY(win, ypos);
            if (!dragging) {
                if (Math.hypot(xpos - pressX, ypos - pressY) < TAP_SLOP) {
                    return;
                }
                // Start the curl where the button went down
                dragging = true;
                controller.onDragStart(toFramebufferX(win, pressX), toFramebufferY(win, pressY), 0.0f);
            }
            controller.onDragMove(x, y, 0.0f);
        });
    }

    private static void setupKeyCallbacks(long window, CurlController controller) {
        glfwSetKeyCallback(window, (win, key, scancode, action, mods) -> {
            if (action != GLFW_PRESS && action != GLFW_REPEAT) {
                return;
            }
            int index = controller.currentIndex();
            if (key == GLFW_KEY_RIGHT) {
                controller.setSmoothCurrentIndex(index + step(controller));
            } else if (key == GLFW_KEY_LEFT) {
                controller.setSmoothCurrentIndex(index - step(controller));
            } else if (key == GLFW_KEY_HOME) {
                controller.setCurrentIndex(0);
            } else if (key == GLFW_KEY_END) {
                controller.setCurrentIndex(PAGE_COUNT);
            } else if (key == GLFW_KEY_T && action == GLFW_PRESS) {
                ViewMode next = controller.viewMode() == ViewMode.ONE_PAGE
                        ? ViewMode.TWO_PAGES : ViewMode.ONE_PAGE;
                controller.setViewMode(next);
                System.out.println("View mode: " + next);
            } else if (key == GLFW_KEY_ESCAPE) {
                glfwSetWindowShouldClose(win, true);
            }
        });
    }

    private static int step(CurlController controller) {
        return controller.viewMode() == ViewMode.TWO_PAGES ? 2 : 1;
    }

    // Cursor positions are in window coordinates, the layout works in framebuffer pixels
    private static float toFramebufferX(long window, double x) {
        int[] winW = new int[1], winH = new int[1], fbW = new int[1], fbH = new int[1];
        glfwGetWindowSize(window, winW, winH);
        glfwGetFramebufferSize(window, fbW, fbH);
        return winW[0] == 0 ? (float) x : (float) (x * fbW[0] / winW[0]);
    }

    private static float toFramebufferY(long window, double y) {
        int[] winW = new int[1], winH = new int[1], fbW = new int[1], fbH = new int[1];
        glfwGetWindowSize(window, winW, winH);
        glfwGetFramebufferSize(window, fbW, fbH);
        return winH[0] == 0 ? (float) y : (float) (y * fbH[0] / winH[0]);
    }

    /**
     * Pages drawn on the fly: a colored header band, ruled lines and a page marker
     * block whose position moves with the index.
     */
    private static class GeneratedPages implements PageProvider {

        @Override
        public int getPageCount() {
            return PAGE_COUNT;
        }

        @Override
        public void updatePage(CurlPage page, int width, int height, int index, int backIndex) {
            PageImage front = render(width, height, index);
            if (backIndex == NO_INDEX) {
                page.setTexture(front, PageSide.BOTH);
                page.setColor(Argb.of(127, 255, 255, 255), PageSide.BACK);
            } else {
                page.setTexture(front, PageSide.FRONT);
                page.setTexture(render(width, height, backIndex), PageSide.BACK);
            }
        }

        private static PageImage render(int width, int height, int index) {
            int accent = PAGE_COLORS[index % PAGE_COLORS.length];
            int header = Math.max(1, height / 8);
            int margin = Math.max(1, width / 12);
            int lineGap = Math.max(4, height / 24);
            int marker = Math.max(2, width / 16);
            int markerX = margin + (index * marker * 2) % Math.max(1, width - 2 * margin - marker);

            ByteBuffer pixels = ByteBuffer.allocateDirect(width * height * 4)
                    .order(ByteOrder.nativeOrder());
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    int argb;
                    if (y < header) {
                        argb = accent;
                    } else if (y > height - header && x >= markerX && x < markerX + marker) {
                        argb = accent;
                    } else if (x >= margin && x < width - margin && (y - header) % lineGap == 0) {
                        argb = 0xFFB0BEC5;
                    } else {
                        argb = 0xFFFAFAFA;
                    }
                    pixels.put((byte) Argb.red(argb))
                            .put((byte) Argb.green(argb))
                            .put((byte) Argb.blue(argb))
                            .put((byte) Argb.alpha(argb));
                }
            }
            pixels.flip();
            return PageImage.of(width, height, pixels);
        }
    }
}
