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
 * Helpers for packed {@code 0xAARRGGBB} colors.
 */
public final class Argb {

    public static final int WHITE = 0xFFFFFFFF;
    public static final int BLACK = 0xFF000000;
    public static final int TRANSPARENT = 0x00000000;

    private Argb() {
    }

    public static int alpha(int argb) {
        return (argb >>> 24) & 0xFF;
    }

    public static int red(int argb) {
        return (argb >> 16) & 0xFF;
    }

    public static int green(int argb) {
        return (argb >> 8) & 0xFF;
    }

    public static int blue(int argb) {
        return argb & 0xFF;
    }

    public static int of(int a, int r, int g, int b) {
        return ((a & 0xFF) << 24) | ((r & 0xFF) << 16) | ((g & 0xFF) << 8) | (b & 0xFF);
    }

    /** Write {@code r, g, b, a} floats in [0, 1] into {@code out} at {@code offset}. */
    public static void toFloats(int argb, float[] out, int offset) {
        out[offset] = red(argb) / 255.0f;
        out[offset + 1] = green(argb) / 255.0f;
        out[offset + 2] = blue(argb) / 255.0f;
        out[offset + 3] = alpha(argb) / 255.0f;
    }
}
