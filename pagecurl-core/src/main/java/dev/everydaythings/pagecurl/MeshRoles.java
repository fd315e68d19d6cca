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
 * The three controller meshes, indexed by role. Roles move between meshes by
 * swapping slots; meshes are never recreated on a page turn.
 */
final class MeshRoles {

    private final PageMesh[] meshes = new PageMesh[MeshRole.values().length];

    PageMesh get(MeshRole role) {
        return meshes[role.ordinal()];
    }

    void set(MeshRole role, PageMesh mesh) {
        meshes[role.ordinal()] = mesh;
    }

    /** Exchange the meshes held by two roles. */
    void swap(MeshRole a, MeshRole b) {
        PageMesh tmp = meshes[a.ordinal()];
        meshes[a.ordinal()] = meshes[b.ordinal()];
        meshes[b.ordinal()] = tmp;
    }
}
