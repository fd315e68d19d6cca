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


/**
 * Page curl geometry and page-turn state machine.
 *
 * <p>Has no graphics API dependency. A rendering backend draws the buffers of each
 * {@link dev.everydaythings.pagecurl.PageMesh} registered on its
 * {@link dev.everydaythings.pagecurl.CurlSurface}.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * PageLayout layout = new PageLayout();
 * CurlController controller = new CurlController(layout, surface);
 * controller.setPageProvider(provider);
 * layout.setViewport(1024, 768);
 *
 * // pointer callbacks
 * controller.onDragStart(x, y, pressure);
 * controller.onDragMove(x, y, pressure);
 * controller.onDragEnd(x, y);
 *
 * // every frame
 * controller.onAnimationFrame();
 * controller.onDrawFrame();   // usually from the backend's render pass
 * }</pre>
 *
 * <h2>Coordinates</h2>
 * <p>Meshes live in a normalized space where the viewport spans {@code [-1, 1]}
 * vertically and {@code [-aspect, aspect]} horizontally, Y up. Pointer input is in
 * viewport pixels, Y down; {@link dev.everydaythings.pagecurl.PageLayout} converts
 * between the two.
 *
 * <h2>Texture Convention</h2>
 * <p>Page images are stored top row first and texture V grows downwards, V=0 at the
 * top edge of the page.
 *
 * <h2>Threading</h2>
 * <p>Nothing here is thread-safe. Pointer events, animation ticks and draw callbacks
 * must all arrive on the same thread.
 */
package dev.everydaythings.pagecurl;
