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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.FloatBuffer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PageMeshTest {

    private static final float DELTA = 1e-5f;
    private static final PageRect SQUARE = new PageRect(0.0f, 5.0f, 5.0f, 0.0f);

    private PageMesh mesh;

    @BeforeEach
    void setUp() {
        mesh = new PageMesh(10);
        mesh.setRect(SQUARE);
        mesh.reset();
    }

    private static float[] read(FloatBuffer buffer, int floats) {
        float[] out = new float[floats];
        for (int i = 0; i < floats; i++) {
            out[i] = buffer.get(i);
        }
        return out;
    }

    // --- Flat state ---

    @Test
    void flatMeshIsOneStripOfFourCorners() {
        assertEquals(4, mesh.frontCount());
        assertEquals(0, mesh.backCount());
        assertEquals(0, mesh.dropShadowCount());
        assertEquals(0, mesh.selfShadowCount());
        assertFalse(mesh.isCurled());

        assertArrayEquals(new float[]{
                0, 5, 0,
                0, 0, 0,
                5, 5, 0,
                5, 0, 0
        }, read(mesh.vertices(), 12), DELTA);
        assertArrayEquals(new float[]{0, 0, 0, 1, 1, 0, 1, 1}, read(mesh.texCoords(), 8), DELTA);
    }

    @Test
    void resetRestoresFlatBuffersAfterCurl() {
        float[] flat = read(mesh.vertices(), 12);
        float[] flatColors = read(mesh.colors(), 16);

        mesh.curl(2.5, 2.5, 1.0, 0.0, 1.0);
        assertTrue(mesh.isCurled());
        mesh.reset();
        mesh.reset();

        assertFalse(mesh.isCurled());
        assertEquals(4, mesh.frontCount());
        assertEquals(0, mesh.backCount());
        assertArrayEquals(flat, read(mesh.vertices(), 12), DELTA);
        assertArrayEquals(flatColors, read(mesh.colors(), 16), DELTA);
    }

    @Test
    void flippedMeshMirrorsTextureAndUsesBackColor() {
        mesh.page().setColor(Argb.of(255, 255, 0, 0), PageSide.FRONT);
        mesh.page().setColor(Argb.of(255, 0, 0, 255), PageSide.BACK);
        mesh.setFlipTexture(true);
        mesh.reset();

        assertTrue(mesh.isFlipTexture());
        assertArrayEquals(new float[]{1, 0, 1, 1, 0, 0, 0, 1}, read(mesh.texCoords(), 8), DELTA);
        assertArrayEquals(new float[]{0, 0, 1, 1}, read(mesh.colors(), 4), DELTA);
    }

    @Test
    void textureRectScalesCoordinates() {
        mesh.setTextureRect(PageSide.FRONT, 0.5f, 0.25f);
        mesh.reset();

        float[] tex = read(mesh.texCoords(), 8);
        assertEquals(0.5f, tex[6], DELTA);
        assertEquals(0.25f, tex[7], DELTA);
    }

    // --- Curl ---

    @Test
    void curlFarOutsidePageOnlyLiftsIt() {
        mesh.curl(10.0, 0.0, 1.0, 0.0, 100.0);

        assertEquals(4, mesh.frontCount());
        assertEquals(0, mesh.backCount());
        assertEquals(8, mesh.dropShadowCount());
        assertEquals(0, mesh.selfShadowCount());

        float[] v = read(mesh.vertices(), 12);
        for (int i = 0; i < 4; i++) {
            float z = v[i * 3 + 2];
            assertTrue(z > 0.0f && z < 100.0f, "z=" + z);
        }
    }

    @Test
    void curlFarPastPageTurnsItOver() {
        mesh.curl(200.0, 0.0, 1.0, 0.0, 100.0);

        assertEquals(0, mesh.frontCount());
        assertEquals(4, mesh.backCount());
        assertEquals(0, mesh.dropShadowCount());
        assertEquals(8, mesh.selfShadowCount());
    }

    @Test
    void curlThroughMiddleWrapsAroundCylinder() {
        mesh.curl(2.5, 2.5, 1.0, 0.0, 1.0);

        // Flat half, then one vertex pair per scan line crossing the page.
        assertEquals(12, mesh.frontCount());
        assertEquals(8, mesh.backCount());
        assertEquals(16, mesh.dropShadowCount());
        assertEquals(16, mesh.selfShadowCount());

        float[] v = read(mesh.vertices(), (mesh.frontCount() + mesh.backCount()) * 3);
        // The first strip vertices lie flat at the right edge.
        assertEquals(5.0f, v[0], DELTA);
        assertEquals(0.0f, v[2], DELTA);
        for (int i = 0; i < mesh.frontCount() + mesh.backCount(); i++) {
            float z = v[i * 3 + 2];
            assertTrue(z >= 0.0f && z <= 2.0f + DELTA, "z=" + z);
        }
    }

    @Test
    void vertexCountStaysWithinBudget() {
        int[] splits = {1, 2, 5, 10};
        double[] radii = {0.0, 0.05, 0.5, 1.0, 3.0};
        for (int m : splits) {
            PageMesh m2 = new PageMesh(m);
            m2.setRect(SQUARE);
            for (double r : radii) {
                for (int step = 0; step < 24; step++) {
                    double angle = step * Math.PI / 12.0 + 0.01;
                    for (double pos = -1.0; pos <= 6.0; pos += 0.7) {
                        m2.curl(pos, pos * 0.5, Math.cos(angle), Math.sin(angle), r);
                        int total = m2.frontCount() + m2.backCount();
                        assertTrue(total >= 4, "total=" + total);
                        assertTrue(total <= m2.maxVertices(), "total=" + total + " max=" + m2.maxVertices());
                        assertTrue(m2.dropShadowCount() + m2.selfShadowCount() <= 2 * m2.maxVertices());
                    }
                }
            }
            assertEquals(0, m2.degenerateClipCount(), "splits=" + m);
        }
    }

    @Test
    void negativeRadiusIsTreatedAsZero() {
        mesh.curl(2.5, 2.5, 1.0, 0.0, -3.0);

        assertEquals(0.0, mesh.curlRadius());
        assertTrue(mesh.frontCount() >= 4);
    }

    @Test
    void curlRecordsPose() {
        mesh.curl(1.0, 2.0, 0.0, 1.0, 0.5);

        assertEquals(1.0, mesh.curlX());
        assertEquals(2.0, mesh.curlY());
        assertEquals(0.0, mesh.curlDirX());
        assertEquals(1.0, mesh.curlDirY());
        assertEquals(0.5, mesh.curlRadius());
    }

    // --- Options ---

    @Test
    void disabledFeaturesHaveNoBuffers() {
        PageMesh plain = new PageMesh(MeshOptions.builder()
                .drawShadow(false)
                .drawTexture(false)
                .build());
        plain.setRect(SQUARE);
        plain.curl(2.5, 2.5, 1.0, 0.0, 1.0);

        assertNull(plain.texCoords());
        assertNull(plain.shadowVertices());
        assertNull(plain.shadowColors());
        assertNull(plain.curlPositionLines());
        assertEquals(0, plain.dropShadowCount());
        assertEquals(0, plain.selfShadowCount());
        assertEquals(20, plain.frontCount() + plain.backCount());
    }

    @Test
    void curlPositionLinesFollowCurl() {
        PageMesh debug = new PageMesh(MeshOptions.builder().drawCurlPosition(true).build());
        debug.setRect(SQUARE);
        debug.curl(1.0, 2.0, 1.0, 0.0, 0.5);

        assertNotNull(debug.curlPositionLines());
        assertEquals(3, debug.curlPositionLinesCount());
        float[] lines = read(debug.curlPositionLines(), 12);
        assertArrayEquals(new float[]{1, 1, 1, 3}, new float[]{lines[0], lines[1], lines[2], lines[3]}, DELTA);
        assertArrayEquals(new float[]{1, 2, 3, 2}, new float[]{lines[8], lines[9], lines[10], lines[11]}, DELTA);
    }

    @Test
    void invalidOptionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PageMesh(0));
        assertThrows(IllegalArgumentException.class, () -> new PageMesh((MeshOptions) null));
    }
}
