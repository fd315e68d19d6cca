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
import java.nio.FloatBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Curl geometry of one page rectangle.
 *
 * <p>{@link #curl(double, double, double, double, double)} wraps the part of the
 * rectangle behind the curl position around a half cylinder of the given radius and
 * writes the result as triangle strips:
 * <ul>
 *   <li>vertices {@code [0, frontCount)} form the front facing strip,</li>
 *   <li>vertices {@code [max(0, frontCount - 2), frontCount + backCount)} form the back
 *       facing strip, sharing the crest edge with the front one,</li>
 *   <li>shadow vertices {@code [0, dropShadowCount)} form the drop shadow strip and
 *       {@code [dropShadowCount, dropShadowCount + selfShadowCount)} the self shadow strip.</li>
 * </ul>
 *
 * <p>Every buffer and working vertex is allocated up front from
 * {@link MeshOptions#maxCurlSplits()}; curling never allocates. Buffers are positioned at
 * 0 after each update and must be treated as read-only by callers.
 *
 * <p>Not thread-safe. A mesh is owned by the thread that drives rendering.
 */
public class PageMesh {

    private static final Logger log = Logger.getLogger(PageMesh.class.getName());

    private static final int CURL_POSITION_LINES = 3;
    private static final int TEMP_VERTICES = 11;
    private static final int OUTPUT_VERTICES = 7;

    private final MeshOptions options;
    private final CurlPage page = new CurlPage();
    private final float colorFactorOffset;
    private final float[] shadowInnerColor;
    private final float[] shadowOuterColor;

    // Index 0 top-left, 1 bottom-left, 2 top-right, 3 bottom-right.
    private final Vertex[] rectangle = new Vertex[4];
    private PageRect rect = PageRect.EMPTY;

    private final int[][] lines = new int[4][2];
    private final double[] scanLines;

    private final BoundedArray<Vertex> tempVertices = new BoundedArray<>(TEMP_VERTICES);
    private final BoundedArray<Vertex> outputVertices = new BoundedArray<>(OUTPUT_VERTICES);
    private final BoundedArray<Vertex> rotatedVertices = new BoundedArray<>(4);
    private final BoundedArray<Vertex> intersections = new BoundedArray<>(2);
    private final Vertex scratch = new Vertex();

    private final BoundedArray<ShadowVertex> tempShadowVertices;
    private final BoundedArray<ShadowVertex> dropShadowVertices;
    private final BoundedArray<ShadowVertex> selfShadowVertices;

    private final FloatBuffer vertices;
    private final FloatBuffer colors;
    private final FloatBuffer texCoords;
    private final FloatBuffer shadowVertices;
    private final FloatBuffer shadowColors;
    private final FloatBuffer curlPositionLines;

    private int frontCount;
    private int backCount;
    private int dropShadowCount;
    private int selfShadowCount;

    private boolean flipTexture;
    private float textureFrontMaxU = 1.0f;
    private float textureFrontMaxV = 1.0f;
    private float textureBackMaxU = 1.0f;
    private float textureBackMaxV = 1.0f;

    private boolean curled;
    private double curlX;
    private double curlY;
    private double curlDirX;
    private double curlDirY;
    private double curlRadius;

    private long degenerateClipCount;

    /**
     * Create a mesh with default options and the given polygon budget.
     *
     * @throws IllegalArgumentException if {@code maxCurlSplits < 1}
     */
    public PageMesh(int maxCurlSplits) {
        this(MeshOptions.builder().maxCurlSplits(maxCurlSplits).build());
    }

    public PageMesh(MeshOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
        this.colorFactorOffset = options.colorFactorOffset();
        this.shadowInnerColor = options.shadowInnerColor();
        this.shadowOuterColor = options.shadowOuterColor();

        int splits = options.maxCurlSplits();
        scanLines = new double[splits + 1];

        for (int i = 0; i < TEMP_VERTICES; i++) {
            tempVertices.add(new Vertex());
        }

        // 4 rectangle corners, at most 2 corner intersections and 2 per scan line.
        int maxVertices = options.maxVertices();
        if (options.drawShadow()) {
            tempShadowVertices = new BoundedArray<>(maxVertices);
            dropShadowVertices = new BoundedArray<>(maxVertices);
            selfShadowVertices = new BoundedArray<>(maxVertices);
            for (int i = 0; i < maxVertices; i++) {
                tempShadowVertices.add(new ShadowVertex());
            }
            // Each shadow vertex is written as an inner/outer pair.
            shadowVertices = floatBuffer(maxVertices * 2 * 3);
            shadowColors = floatBuffer(maxVertices * 2 * 4);
        } else {
            tempShadowVertices = null;
            dropShadowVertices = null;
            selfShadowVertices = null;
            shadowVertices = null;
            shadowColors = null;
        }

        for (int i = 0; i < 4; i++) {
            rectangle[i] = new Vertex();
        }
        // Penumbra direction seeds, used for the self shadow falloff.
        rectangle[0].penumbraX = -1.0;
        rectangle[0].penumbraY = 1.0;
        rectangle[1].penumbraX = -1.0;
        rectangle[1].penumbraY = -1.0;
        rectangle[2].penumbraX = 1.0;
        rectangle[2].penumbraY = 1.0;
        rectangle[3].penumbraX = 1.0;
        rectangle[3].penumbraY = -1.0;

        curlPositionLines = options.drawCurlPosition()
                ? floatBuffer(CURL_POSITION_LINES * 2 * 2)
                : null;

        vertices = floatBuffer(maxVertices * 3);
        colors = floatBuffer(maxVertices * 4);
        texCoords = options.drawTexture() ? floatBuffer(maxVertices * 2) : null;

        setFlipTexture(false);
        reset();
    }

    // ==================================================================================
    // Curl
    // ==================================================================================

    /**
     * Regenerate all buffers for a curl pose.
     *
     * @param posX   curl position X
     * @param posY   curl position Y
     * @param dirX   curl direction X, expected unit length
     * @param dirY   curl direction Y, expected unit length
     * @param radius curl radius, negative values are treated as 0
     */
    public void curl(double posX, double posY, double dirX, double dirY, double radius) {
        double r = Math.max(radius, 0.0);
        curled = true;
        curlX = posX;
        curlY = posY;
        curlDirX = dirX;
        curlDirY = dirY;
        curlRadius = r;

        if (curlPositionLines != null) {
            writeCurlPositionLines(posX, posY, dirX, dirY);
        }

        vertices.position(0);
        colors.position(0);
        if (texCoords != null) {
            texCoords.position(0);
        }

        double curlAngle = -Math.atan2(dirY, dirX);

        // Move the rectangle into curl space: curl position at the origin, direction
        // along +X. Sorted by descending X, larger Y first on ties.
        tempVertices.addAll(rotatedVertices);
        rotatedVertices.clear();
        for (int i = 0; i < 4; i++) {
            Vertex v = tempVertices.remove(0);
            v.set(rectangle[i]);
            v.translate(-posX, -posY);
            v.rotateZ(-curlAngle);
            int j = 0;
            for (; j < rotatedVertices.size(); j++) {
                Vertex v2 = rotatedVertices.get(j);
                if (v.posX > v2.posX) {
                    break;
                }
                if (v.posX == v2.posX && v.posY > v2.posY) {
                    break;
                }
            }
            rotatedVertices.add(j, v);
        }

        // Edges as pairs of rotated vertex indices, each pair ordered by descending X.
        // Vertex 3 is not always the corner opposite vertex 0 once rounding kicks in,
        // so pick the diagonal by squared distance.
        lines[0][0] = 0;
        lines[0][1] = 1;
        lines[1][0] = 0;
        lines[1][1] = 2;
        lines[2][0] = 1;
        lines[2][1] = 3;
        lines[3][0] = 2;
        lines[3][1] = 3;
        Vertex v0 = rotatedVertices.get(0);
        Vertex v2 = rotatedVertices.get(2);
        Vertex v3 = rotatedVertices.get(3);
        double dx2 = v0.posX - v2.posX;
        double dy2 = v0.posY - v2.posY;
        double dx3 = v0.posX - v3.posX;
        double dy3 = v0.posY - v3.posY;
        if (dx2 * dx2 + dy2 * dy2 > dx3 * dx3 + dy3 * dy3) {
            lines[1][1] = 3;
            lines[2][1] = 2;
        }

        frontCount = 0;
        backCount = 0;

        if (tempShadowVertices != null) {
            tempShadowVertices.addAll(dropShadowVertices);
            tempShadowVertices.addAll(selfShadowVertices);
            dropShadowVertices.clear();
            selfShadowVertices.clear();
        }

        double curlLength = Math.PI * r;
        int splits = options.maxCurlSplits();
        int scanLineCount = 0;
        scanLines[scanLineCount++] = 0.0;
        for (int i = 1; i < splits; i++) {
            scanLines[scanLineCount++] = (-curlLength * i) / (splits - 1);
        }
        // Sweeps up everything rotated past the curl.
        scanLines[scanLineCount++] = rotatedVertices.get(3).posX - 1.0;

        double scanXmax = rotatedVertices.get(0).posX + 1.0;
        for (int i = 0; i < scanLineCount; i++) {
            double scanXmin = scanLines[i];

            // Bands after the first are open at the top, the shared scan line belongs
            // to the previous band.
            for (int j = 0; j < rotatedVertices.size(); j++) {
                Vertex v = rotatedVertices.get(j);
                if (v.posX < scanXmin || v.posX > scanXmax || (i > 0 && v.posX == scanXmax)) {
                    continue;
                }
                Vertex n = tempVertices.remove(0);
                n.set(v);
                BoundedArray<Vertex> hits = findIntersections(n.posX);
                if (hits.size() == 1 && hits.get(0).posY > v.posY) {
                    outputVertices.addAll(hits);
                    outputVertices.add(n);
                } else if (hits.size() <= 1) {
                    outputVertices.add(n);
                    outputVertices.addAll(hits);
                } else {
                    tempVertices.add(n);
                    tempVertices.addAll(hits);
                    recordDegenerateClip(hits.size());
                }
            }

            BoundedArray<Vertex> hits = findIntersections(scanXmin);
            if (hits.size() == 2) {
                Vertex a = hits.get(0);
                Vertex b = hits.get(1);
                if (a.posY < b.posY) {
                    outputVertices.add(b);
                    outputVertices.add(a);
                } else {
                    outputVertices.add(a);
                    outputVertices.add(b);
                }
            } else if (hits.size() != 0) {
                // A corner sits exactly on the scan line and was emitted above.
                tempVertices.addAll(hits);
            }

            while (outputVertices.size() > 0) {
                Vertex v = outputVertices.remove(0);
                tempVertices.add(v);
                emit(v, i, scanLineCount, curlLength, r, curlAngle, posX, posY, dirX, dirY);
            }

            scanXmax = scanXmin;
        }

        vertices.position(0);
        colors.position(0);
        if (texCoords != null) {
            texCoords.position(0);
        }

        if (tempShadowVertices != null) {
            writeShadows();
        }
    }

    private void emit(Vertex v, int band, int bandCount, double curlLength, double radius,
                      double curlAngle, double posX, double posY, double dirX, double dirY) {
        boolean textureFront;
        if (band == 0) {
            textureFront = true;
            frontCount++;
        } else if (band == bandCount - 1 || curlLength == 0.0) {
            v.posX = -(curlLength + v.posX);
            v.posZ = 2.0 * radius;
            v.penumbraX = -v.penumbraX;
            textureFront = false;
            backCount++;
        } else {
            // posX is within [-curlLength, 0] here.
            double rotY = Math.PI * (v.posX / curlLength);
            double sin = Math.sin(rotY);
            double cos = Math.cos(rotY);
            v.posX = radius * sin;
            v.posZ = radius - (radius * cos);
            v.penumbraX *= cos;
            v.colorFactor = (float) (colorFactorOffset + (1.0f - colorFactorOffset) * Math.sqrt(sin + 1.0));
            if (v.posZ >= radius) {
                textureFront = false;
                backCount++;
            } else {
                textureFront = true;
                frontCount++;
            }
        }

        if (textureFront != flipTexture) {
            v.texX *= textureFrontMaxU;
            v.texY *= textureFrontMaxV;
            v.color = page.getColor(PageSide.FRONT);
        } else {
            v.texX *= textureBackMaxU;
            v.texY *= textureBackMaxV;
            v.color = page.getColor(PageSide.BACK);
        }

        v.rotateZ(curlAngle);
        v.translate(posX, posY);
        addVertex(v);

        if (tempShadowVertices == null) {
            return;
        }
        if (v.posZ > 0.0 && v.posZ <= radius) {
            ShadowVertex sv = tempShadowVertices.remove(0);
            sv.posX = v.posX;
            sv.posY = v.posY;
            sv.posZ = v.posZ;
            double len = v.posZ / 2.0;
            sv.penumbraX = -dirX * len;
            sv.penumbraY = -dirY * len;
            sv.penumbraColor = v.posZ / radius;
            dropShadowVertices.add((dropShadowVertices.size() + 1) / 2, sv);
        }
        if (v.posZ > radius) {
            ShadowVertex sv = tempShadowVertices.remove(0);
            sv.posX = v.posX;
            sv.posY = v.posY;
            sv.posZ = v.posZ;
            double len = (v.posZ - radius) / 3.0;
            sv.penumbraX = v.penumbraX * len;
            sv.penumbraY = v.penumbraY * len;
            sv.penumbraColor = (v.posZ - radius) / (2.0 * radius);
            selfShadowVertices.add((selfShadowVertices.size() + 1) / 2, sv);
        }
    }

    private void writeShadows() {
        shadowVertices.position(0);
        shadowColors.position(0);
        dropShadowCount = 0;
        for (int i = 0; i < dropShadowVertices.size(); i++) {
            putShadow(dropShadowVertices.get(i));
            dropShadowCount += 2;
        }
        selfShadowCount = 0;
        for (int i = 0; i < selfShadowVertices.size(); i++) {
            putShadow(selfShadowVertices.get(i));
            selfShadowCount += 2;
        }
        shadowVertices.position(0);
        shadowColors.position(0);
    }

    private void putShadow(ShadowVertex sv) {
        shadowVertices.put((float) sv.posX);
        shadowVertices.put((float) sv.posY);
        shadowVertices.put((float) sv.posZ);
        shadowVertices.put((float) (sv.posX + sv.penumbraX));
        shadowVertices.put((float) (sv.posY + sv.penumbraY));
        shadowVertices.put((float) sv.posZ);
        for (int j = 0; j < 4; j++) {
            double c = shadowOuterColor[j] + (shadowInnerColor[j] - shadowOuterColor[j]) * sv.penumbraColor;
            shadowColors.put((float) c);
        }
        shadowColors.put(shadowOuterColor);
    }

    private void writeCurlPositionLines(double posX, double posY, double dirX, double dirY) {
        float x = (float) posX;
        float y = (float) posY;
        curlPositionLines.position(0);
        curlPositionLines.put(x).put(y - 1.0f).put(x).put(y + 1.0f);
        curlPositionLines.put(x - 1.0f).put(y).put(x + 1.0f).put(y);
        curlPositionLines.put(x).put(y).put((float) (posX + dirX * 2)).put((float) (posY + dirY * 2));
        curlPositionLines.position(0);
    }

    /**
     * Intersections of the vertical line {@code x = scanX} with the rotated rectangle
     * edges. Only strict crossings count, an edge ending on the line does not.
     */
    private BoundedArray<Vertex> findIntersections(double scanX) {
        intersections.clear();
        for (int[] line : lines) {
            Vertex v1 = rotatedVertices.get(line[0]);
            Vertex v2 = rotatedVertices.get(line[1]);
            if (v1.posX > scanX && v2.posX < scanX) {
                if (intersections.size() == intersections.capacity()) {
                    // A convex quad crosses a line at most twice.
                    break;
                }
                double c = (scanX - v2.posX) / (v1.posX - v2.posX);
                Vertex n = tempVertices.remove(0);
                n.set(v2);
                n.posX = scanX;
                n.posY += (v1.posY - v2.posY) * c;
                if (texCoords != null) {
                    n.texX += (v1.texX - v2.texX) * c;
                    n.texY += (v1.texY - v2.texY) * c;
                }
                if (tempShadowVertices != null) {
                    n.penumbraX += (v1.penumbraX - v2.penumbraX) * c;
                    n.penumbraY += (v1.penumbraY - v2.penumbraY) * c;
                }
                intersections.add(n);
            }
        }
        return intersections;
    }

    private void recordDegenerateClip(int intersectionCount) {
        degenerateClipCount++;
        if (degenerateClipCount == 1) {
            log.warning(() -> String.format(
                    "Degenerate clip: %d scan line intersections at one corner, vertices dropped "
                            + "(curl pos=%.4f,%.4f dir=%.4f,%.4f radius=%.4f)",
                    intersectionCount, curlX, curlY, curlDirX, curlDirY, curlRadius));
        } else {
            log.fine(() -> String.format("Degenerate clip #%d: %d intersections",
                    degenerateClipCount, intersectionCount));
        }
    }

    private void addVertex(Vertex v) {
        vertices.put((float) v.posX);
        vertices.put((float) v.posY);
        vertices.put((float) v.posZ);
        colors.put(v.colorFactor * Argb.red(v.color) / 255.0f);
        colors.put(v.colorFactor * Argb.green(v.color) / 255.0f);
        colors.put(v.colorFactor * Argb.blue(v.color) / 255.0f);
        colors.put(Argb.alpha(v.color) / 255.0f);
        if (texCoords != null) {
            texCoords.put((float) v.texX);
            texCoords.put((float) v.texY);
        }
    }

    // ==================================================================================
    // Flat state and configuration
    // ==================================================================================

    /**
     * Back to the flat rectangle: one front strip of the 4 corners, no shadows.
     */
    public void reset() {
        vertices.position(0);
        colors.position(0);
        if (texCoords != null) {
            texCoords.position(0);
        }
        for (int i = 0; i < 4; i++) {
            scratch.set(rectangle[i]);
            if (flipTexture) {
                scratch.texX *= textureBackMaxU;
                scratch.texY *= textureBackMaxV;
                scratch.color = page.getColor(PageSide.BACK);
            } else {
                scratch.texX *= textureFrontMaxU;
                scratch.texY *= textureFrontMaxV;
                scratch.color = page.getColor(PageSide.FRONT);
            }
            addVertex(scratch);
        }
        frontCount = 4;
        backCount = 0;
        dropShadowCount = 0;
        selfShadowCount = 0;
        curled = false;
        vertices.position(0);
        colors.position(0);
        if (texCoords != null) {
            texCoords.position(0);
        }
    }

    /** Set the page rectangle. Takes effect on the next {@link #curl} or {@link #reset()}. */
    public void setRect(PageRect r) {
        if (r == null) {
            return;
        }
        rect = r;
        rectangle[0].posX = r.left();
        rectangle[0].posY = r.top();
        rectangle[1].posX = r.left();
        rectangle[1].posY = r.bottom();
        rectangle[2].posX = r.right();
        rectangle[2].posY = r.top();
        rectangle[3].posX = r.right();
        rectangle[3].posY = r.bottom();
    }

    /**
     * Mirror texture coordinates horizontally and swap which image faces the viewer.
     * A flipped mesh shows the back image on its flat side.
     */
    public void setFlipTexture(boolean flipTexture) {
        this.flipTexture = flipTexture;
        double left = flipTexture ? 1.0 : 0.0;
        double right = flipTexture ? 0.0 : 1.0;
        rectangle[0].texX = left;
        rectangle[0].texY = 0.0;
        rectangle[1].texX = left;
        rectangle[1].texY = 1.0;
        rectangle[2].texX = right;
        rectangle[2].texY = 0.0;
        rectangle[3].texX = right;
        rectangle[3].texY = 1.0;
    }

    /**
     * Set the valid sub-rectangle {@code [0, maxU] x [0, maxV]} of a side's texture.
     * Both default to 1.
     */
    public void setTextureRect(PageSide side, float maxU, float maxV) {
        if (side != PageSide.BACK) {
            textureFrontMaxU = maxU;
            textureFrontMaxV = maxV;
        }
        if (side != PageSide.FRONT) {
            textureBackMaxU = maxU;
            textureBackMaxV = maxV;
        }
    }

    // ==================================================================================
    // Accessors
    // ==================================================================================

    public MeshOptions options() {
        return options;
    }

    /** Content shown on this mesh. */
    public CurlPage page() {
        return page;
    }

    public PageRect rect() {
        return rect;
    }

    public boolean isFlipTexture() {
        return flipTexture;
    }

    public int maxVertices() {
        return options.maxVertices();
    }

    public int frontCount() {
        return frontCount;
    }

    public int backCount() {
        return backCount;
    }

    public int dropShadowCount() {
        return dropShadowCount;
    }

    public int selfShadowCount() {
        return selfShadowCount;
    }

    /** Number of debug line segments, 0 unless curl position drawing is enabled. */
    public int curlPositionLinesCount() {
        return curlPositionLines == null ? 0 : CURL_POSITION_LINES;
    }

    /** {@code x, y, z} per vertex. */
    public FloatBuffer vertices() {
        return vertices;
    }

    /** {@code r, g, b, a} per vertex. */
    public FloatBuffer colors() {
        return colors;
    }

    /** {@code u, v} per vertex, or {@code null} when textures are disabled. */
    public FloatBuffer texCoords() {
        return texCoords;
    }

    /** {@code x, y, z} per shadow vertex, or {@code null} when shadows are disabled. */
    public FloatBuffer shadowVertices() {
        return shadowVertices;
    }

    /** {@code r, g, b, a} per shadow vertex, or {@code null} when shadows are disabled. */
    public FloatBuffer shadowColors() {
        return shadowColors;
    }

    /** {@code x, y} pairs of the debug lines, or {@code null} when disabled. */
    public FloatBuffer curlPositionLines() {
        return curlPositionLines;
    }

    /** Whether the buffers hold a curl rather than the flat rectangle. */
    public boolean isCurled() {
        return curled;
    }

    public double curlX() {
        return curlX;
    }

    public double curlY() {
        return curlY;
    }

    public double curlDirX() {
        return curlDirX;
    }

    public double curlDirY() {
        return curlDirY;
    }

    /** Radius of the last curl, never negative. */
    public double curlRadius() {
        return curlRadius;
    }

    /** Times a corner produced more than one intersection and its vertices were dropped. */
    public long degenerateClipCount() {
        return degenerateClipCount;
    }

    private static FloatBuffer floatBuffer(int floats) {
        FloatBuffer buf = ByteBuffer.allocateDirect(floats * Float.BYTES)
                .order(ByteOrder.nativeOrder())
                .asFloatBuffer();
        buf.position(0);
        return buf;
    }

    // ==================================================================================
    // Working types
    // ==================================================================================

    private static final class Vertex {
        double posX;
        double posY;
        double posZ;
        double texX;
        double texY;
        double penumbraX;
        double penumbraY;
        float colorFactor = 1.0f;
        int color;

        void set(Vertex v) {
            posX = v.posX;
            posY = v.posY;
            posZ = v.posZ;
            texX = v.texX;
            texY = v.texY;
            penumbraX = v.penumbraX;
            penumbraY = v.penumbraY;
            colorFactor = v.colorFactor;
            color = v.color;
        }

        void translate(double dx, double dy) {
            posX += dx;
            posY += dy;
        }

        /** Rotate position and penumbra by {@code -theta} around Z. */
        void rotateZ(double theta) {
            double cos = Math.cos(theta);
            double sin = Math.sin(theta);
            double x = posX * cos + posY * sin;
            double y = posX * -sin + posY * cos;
            posX = x;
            posY = y;
            double px = penumbraX * cos + penumbraY * sin;
            double py = penumbraX * -sin + penumbraY * cos;
            penumbraX = px;
            penumbraY = py;
        }
    }

    private static final class ShadowVertex {
        double posX;
        double posY;
        double posZ;
        double penumbraX;
        double penumbraY;
        double penumbraColor;
    }

    /**
     * Fixed-capacity list used as a vertex pool. Exceeding the capacity is a bug in the
     * pool sizing and throws {@link IndexOutOfBoundsException}.
     */
    private static final class BoundedArray<T> {
        private final List<T> items;
        private final int capacity;

        BoundedArray(int capacity) {
            this.items = new ArrayList<>(capacity);
            this.capacity = capacity;
        }

        int size() {
            return items.size();
        }

        int capacity() {
            return capacity;
        }

        T get(int index) {
            return items.get(index);
        }

        void add(T item) {
            checkRoom(1);
            items.add(item);
        }

        void add(int index, T item) {
            checkRoom(1);
            items.add(index, item);
        }

        void addAll(BoundedArray<T> other) {
            checkRoom(other.size());
            for (int i = 0; i < other.size(); i++) {
                items.add(other.get(i));
            }
        }

        T remove(int index) {
            return items.remove(index);
        }

        private void checkRoom(int count) {
            if (items.size() + count > capacity) {
                throw new IndexOutOfBoundsException(items.size() + count);
            }
        }

        void clear() {
            items.clear();
        }
    }
}
