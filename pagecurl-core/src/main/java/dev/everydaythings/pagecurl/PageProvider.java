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
 * Supplies page content to a {@link CurlController}.
 *
 * <p>Called synchronously on the controller's thread; implementations must not call
 * back into the controller.
 */
public interface PageProvider {

    /** Passed as {@code backIndex} when the back side has no page of its own. */
    int NO_INDEX = -1;

    /** Number of pages available. */
    int getPageCount();

    /**
     * Fill a page with images and colors. The page has been reset to white on both
     * sides before this call.
     *
     * @param page      page to fill
     * @param width     page width in pixels
     * @param height    page height in pixels
     * @param index     index of the page to show on the front
     * @param backIndex index of the page to show on the back, or {@link #NO_INDEX}
     */
    void updatePage(CurlPage page, int width, int height, int index, int backIndex);
}
