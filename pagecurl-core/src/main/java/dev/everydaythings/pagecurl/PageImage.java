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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * An RGBA8 pixel image, rows top to bottom, 4 bytes per pixel in R, G, B, A order.
 *
 * <p>Pixels live in a direct buffer so they can be handed to a graphics API as-is.
 * Identity matters: a page has a distinct back texture only when its front and back
 * images are different objects.
 */
public final class PageImage {

    private static final int BYTES_PER_PIXEL = 4;

    private final int width;
    private final int height;
    private final ByteBuffer pixels;

    private PageImage(int width, int height, ByteBuffer pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * Wrap existing RGBA8 pixels. The buffer is copied, so the caller may reuse it.
     *
     * @throws IllegalArgumentException if a dimension is not positive or the buffer is too small
     */
    public static PageImage of(int width, int height, ByteBuffer rgba) {
        Asserts.assertPositive(width, "width");
        Asserts.assertPositive(height, "height");
        int size = width * height * BYTES_PER_PIXEL;
        if (rgba == null || rgba.remaining() < size) {
            throw new IllegalArgumentException(String.format(
                    "expected %d bytes of RGBA pixels for %dx%d", size, width, height));
        }
        ByteBuffer copy = allocate(size);
        ByteBuffer src = rgba.duplicate();
        src.limit(src.position() + size);
        copy.put(src);
        copy.flip();
        return new PageImage(width, height, copy);
    }

    /** Image of the given size filled with one {@code 0xAARRGGBB} color. */
    public static PageImage filled(int width, int height, int argb) {
        Asserts.assertPositive(width, "width");
        Asserts.assertPositive(height, "height");
        ByteBuffer buf = allocate(width * height * BYTES_PER_PIXEL);
        byte r = (byte) Argb.red(argb);
        byte g = (byte) Argb.green(argb);
        byte b = (byte) Argb.blue(argb);
        byte a = (byte) Argb.alpha(argb);
        for (int i = 0; i < width * height; i++) {
            buf.put(r).put(g).put(b).put(a);
        }
        buf.flip();
        return new PageImage(width, height, buf);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Read-only view of the pixels positioned at 0. */
    public ByteBuffer pixels() {
        return pixels.asReadOnlyBuffer().order(ByteOrder.nativeOrder());
    }

    /** Pixel at (x, y) as {@code 0xAARRGGBB}. */
    public int argbAt(int x, int y) {
        int i = (y * width + x) * BYTES_PER_PIXEL;
        return Argb.of(pixels.get(i + 3), pixels.get(i), pixels.get(i + 1), pixels.get(i + 2));
    }

    public boolean isPowerOfTwo() {
        return nextPowerOfTwo(width) == width && nextPowerOfTwo(height) == height;
    }

    /**
     * Copy this image into the top-left corner of a transparent image whose sides are
     * the next powers of two. Returns {@code this} when already power-of-two sized.
     */
    public PageImage padToPowerOfTwo() {
        if (isPowerOfTwo()) {
            return this;
        }
        int newW = nextPowerOfTwo(width);
        int newH = nextPowerOfTwo(height);
        ByteBuffer buf = allocate(newW * newH * BYTES_PER_PIXEL);
        int rowBytes = width * BYTES_PER_PIXEL;
        for (int y = 0; y < height; y++) {
            ByteBuffer row = pixels.duplicate();
            row.position(y * rowBytes);
            row.limit(y * rowBytes + rowBytes);
            buf.position(y * newW * BYTES_PER_PIXEL);
            buf.put(row);
        }
        buf.position(0);
        return new PageImage(newW, newH, buf);
    }

    /** Smallest power of two that is at least {@code n}; 1 for {@code n <= 1}. */
    public static int nextPowerOfTwo(int n) {
        if (n <= 1) {
            return 1;
        }
        int v = n - 1;
        v |= v >> 1;
        v |= v >> 2;
        v |= v >> 4;
        v |= v >> 8;
        v |= v >> 16;
        return v + 1;
    }

    private static ByteBuffer allocate(int size) {
        return ByteBuffer.allocateDirect(size).order(ByteOrder.nativeOrder());
    }

    @Override
    public String toString() {
        return "PageImage[" + width + "x" + height + "]";
    }
}
