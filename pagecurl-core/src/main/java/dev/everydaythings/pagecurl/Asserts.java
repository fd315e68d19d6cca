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

final class Asserts {
    private Asserts() {
    }

    static float[] assertColor4In(float[] in, String name) {
        if (in == null || in.length != 4) {
            throw new IllegalArgumentException(name + " must have exactly 4 components");
        }
        for (float c : in) {
            if (!(c >= 0.0f && c <= 1.0f)) {
                throw new IllegalArgumentException(name + " components must be in [0, 1]");
            }
        }
        return in.clone();
    }

    static float assertUnitIn(float value, String name) {
        if (!(value >= 0.0f && value <= 1.0f)) {
            throw new IllegalArgumentException(name + " must be in [0, 1]: " + value);
        }
        return value;
    }

    static int assertPositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1: " + value);
        }
        return value;
    }

    static long assertNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }
}
