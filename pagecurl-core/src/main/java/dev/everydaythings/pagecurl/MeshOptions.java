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

import java.util.Arrays;

/**
 * Immutable configuration of a {@link PageMesh}: polygon budget, visual flags and
 * shadow colors.
 *
 * <p>Usage:
 * <pre>{@code
 * MeshOptions options = MeshOptions.builder()
 *     .maxCurlSplits(20)
 *     .drawShadow(false)
 *     .build();
 * }</pre>
 *
 * @param maxCurlSplits       number of scan lines across the curl, at least 1
 * @param drawCurlPosition    fill the debug line buffer marking the curl position
 * @param drawPolygonOutlines draw the front strip as an outline
 * @param drawShadow          generate drop and self shadow strips
 * @param drawTexture         generate texture coordinates
 * @param shadowInnerColor    RGBA shadow color next to the page, components in [0, 1]
 * @param shadowOuterColor    RGBA shadow color at the penumbra edge, components in [0, 1]
 * @param colorFactorOffset   darkest color multiplier at the curl crest, in [0, 1]
 */
public record MeshOptions(
        int maxCurlSplits,
        boolean drawCurlPosition,
        boolean drawPolygonOutlines,
        boolean drawShadow,
        boolean drawTexture,
        float[] shadowInnerColor,
        float[] shadowOuterColor,
        float colorFactorOffset
) {

    public static final int DEFAULT_MAX_CURL_SPLITS = 10;
    public static final float DEFAULT_COLOR_FACTOR_OFFSET = 0.1f;

    private static final float[] SHADOW_INNER_COLOR = {0.0f, 0.0f, 0.0f, 0.5f};
    private static final float[] SHADOW_OUTER_COLOR = {0.0f, 0.0f, 0.0f, 0.0f};

    /** Default options. */
    public static final MeshOptions DEFAULTS = builder().build();

    /**
     * @throws IllegalArgumentException if a value is out of range or a color is not
     *                                  four components in [0, 1]
     */
    public MeshOptions {
        Asserts.assertPositive(maxCurlSplits, "maxCurlSplits");
        shadowInnerColor = Asserts.assertColor4In(shadowInnerColor, "shadowInnerColor");
        shadowOuterColor = Asserts.assertColor4In(shadowOuterColor, "shadowOuterColor");
        Asserts.assertUnitIn(colorFactorOffset, "colorFactorOffset");
    }

    @Override
    public float[] shadowInnerColor() {
        return shadowInnerColor.clone();
    }

    @Override
    public float[] shadowOuterColor() {
        return shadowOuterColor.clone();
    }

    /** Vertices a mesh built with these options can emit for its page strip. */
    public int maxVertices() {
        return 6 + 2 * maxCurlSplits;
    }

    public Builder toBuilder() {
        return new Builder()
                .maxCurlSplits(maxCurlSplits)
                .drawCurlPosition(drawCurlPosition)
                .drawPolygonOutlines(drawPolygonOutlines)
                .drawShadow(drawShadow)
                .drawTexture(drawTexture)
                .shadowInnerColor(shadowInnerColor)
                .shadowOuterColor(shadowOuterColor)
                .colorFactorOffset(colorFactorOffset);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MeshOptions)) {
            return false;
        }
        MeshOptions other = (MeshOptions) o;
        return maxCurlSplits == other.maxCurlSplits
                && drawCurlPosition == other.drawCurlPosition
                && drawPolygonOutlines == other.drawPolygonOutlines
                && drawShadow == other.drawShadow
                && drawTexture == other.drawTexture
                && Float.compare(colorFactorOffset, other.colorFactorOffset) == 0
                && Arrays.equals(shadowInnerColor, other.shadowInnerColor)
                && Arrays.equals(shadowOuterColor, other.shadowOuterColor);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(maxCurlSplits);
        result = 31 * result + Boolean.hashCode(drawCurlPosition);
        result = 31 * result + Boolean.hashCode(drawPolygonOutlines);
        result = 31 * result + Boolean.hashCode(drawShadow);
        result = 31 * result + Boolean.hashCode(drawTexture);
        result = 31 * result + Arrays.hashCode(shadowInnerColor);
        result = 31 * result + Arrays.hashCode(shadowOuterColor);
        result = 31 * result + Float.hashCode(colorFactorOffset);
        return result;
    }

    @Override
    public String toString() {
        return String.format(
                "MeshOptions[maxCurlSplits=%d, drawCurlPosition=%b, drawPolygonOutlines=%b, "
                        + "drawShadow=%b, drawTexture=%b, shadowInnerColor=%s, shadowOuterColor=%s, "
                        + "colorFactorOffset=%s]",
                maxCurlSplits, drawCurlPosition, drawPolygonOutlines, drawShadow, drawTexture,
                Arrays.toString(shadowInnerColor), Arrays.toString(shadowOuterColor), colorFactorOffset);
    }

    /**
     * Fluent builder. Values are validated by {@link #build()}.
     */
    public static class Builder {
        private int maxCurlSplits = DEFAULT_MAX_CURL_SPLITS;
        private boolean drawCurlPosition;
        private boolean drawPolygonOutlines;
        private boolean drawShadow = true;
        private boolean drawTexture = true;
        private float[] shadowInnerColor = SHADOW_INNER_COLOR;
        private float[] shadowOuterColor = SHADOW_OUTER_COLOR;
        private float colorFactorOffset = DEFAULT_COLOR_FACTOR_OFFSET;

        /** Scan lines across the curl (default 10). More splits give a rounder curl. */
        public Builder maxCurlSplits(int maxCurlSplits) {
            this.maxCurlSplits = maxCurlSplits;
            return this;
        }

        public Builder drawCurlPosition(boolean drawCurlPosition) {
            this.drawCurlPosition = drawCurlPosition;
            return this;
        }

        public Builder drawPolygonOutlines(boolean drawPolygonOutlines) {
            this.drawPolygonOutlines = drawPolygonOutlines;
            return this;
        }

        public Builder drawShadow(boolean drawShadow) {
            this.drawShadow = drawShadow;
            return this;
        }

        public Builder drawTexture(boolean drawTexture) {
            this.drawTexture = drawTexture;
            return this;
        }

        /** RGBA in [0, 1] (default translucent black). */
        public Builder shadowInnerColor(float[] rgba) {
            this.shadowInnerColor = rgba;
            return this;
        }

        /** RGBA in [0, 1] (default transparent black). */
        public Builder shadowOuterColor(float[] rgba) {
            this.shadowOuterColor = rgba;
            return this;
        }

        /** Darkest color multiplier at the crest of the curl (default 0.1). */
        public Builder colorFactorOffset(float colorFactorOffset) {
            this.colorFactorOffset = colorFactorOffset;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public MeshOptions build() {
            return new MeshOptions(maxCurlSplits, drawCurlPosition, drawPolygonOutlines,
                    drawShadow, drawTexture, shadowInnerColor, shadowOuterColor, colorFactorOffset);
        }
    }
}
