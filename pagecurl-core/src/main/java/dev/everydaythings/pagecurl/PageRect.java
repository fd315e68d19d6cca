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
 * Axis-aligned rectangle in normalized view space. Y grows upwards, so
 * {@code top >= bottom} for any non-empty rectangle.
 */
public record PageRect(float left, float top, float right, float bottom) {

    public static final PageRect EMPTY = new PageRect(0.0f, 0.0f, 0.0f, 0.0f);

    public float width() {
        return right - left;
    }

    public float height() {
        return top - bottom;
    }

    public float centerX() {
        return (left + right) / 2.0f;
    }

    public float centerY() {
        return (top + bottom) / 2.0f;
    }

    public boolean isEmpty() {
        return width() == 0.0f || height() == 0.0f;
    }

    public PageRect offset(float dx, float dy) {
        return new PageRect(left + dx, top + dy, right + dx, bottom + dy);
    }
}
