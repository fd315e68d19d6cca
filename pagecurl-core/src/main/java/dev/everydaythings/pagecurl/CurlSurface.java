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
 * Host surface that draws page meshes.
 *
 * <p>Meshes are drawn in the order they were added, later meshes on top.
 */
public interface CurlSurface {

    /** Add a mesh to the end of the draw list, moving it there if already present. */
    void addMesh(PageMesh mesh);

    /** Remove a mesh from the draw list. Returns whether it was present. */
    boolean removeMesh(PageMesh mesh);

    /**
     * Remove a mesh that will never be drawn again and free what the surface holds for
     * it. Returns whether it was in the draw list.
     */
    default boolean releaseMesh(PageMesh mesh) {
        return removeMesh(mesh);
    }

    /** Ask for a new frame. */
    void requestRender();
}
