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
 * Content of one page mesh: front and back images plus a tint color per side.
 *
 * <p>A {@link PageProvider} fills this in through
 * {@link #setTexture(PageImage, PageSide)} and {@link #setColor(int, PageSide)}.
 * The rendering backend uploads the images once {@link #texturesChanged()} is set
 * and then calls {@link #recycle()} to drop them.
 */
public class CurlPage {

    private int colorFront;
    private int colorBack;
    private PageImage textureFront;
    private PageImage textureBack;
    private boolean texturesChanged;

    public CurlPage() {
        reset();
    }

    /** Whether images were set since the last {@link #recycle()}. */
    public boolean texturesChanged() {
        return texturesChanged;
    }

    /** Whether the back face shows its own image rather than the front one. */
    public boolean hasBackTexture() {
        return textureFront != textureBack;
    }

    /** Tint color of a side; {@link PageSide#BOTH} reads the back. */
    public int getColor(PageSide side) {
        return side == PageSide.FRONT ? colorFront : colorBack;
    }

    public void setColor(int argb, PageSide side) {
        if (side != PageSide.BACK) {
            colorFront = argb;
        }
        if (side != PageSide.FRONT) {
            colorBack = argb;
        }
    }

    /** Raw image of a side; {@link PageSide#BOTH} reads the back. */
    public PageImage getImage(PageSide side) {
        return side == PageSide.FRONT ? textureFront : textureBack;
    }

    /**
     * Set the image for a side. A {@code null} image becomes a 1x1 image of that
     * side's tint color.
     */
    public void setTexture(PageImage image, PageSide side) {
        PageImage texture = image;
        if (texture == null) {
            texture = PageImage.filled(1, 1, side == PageSide.BACK ? colorBack : colorFront);
        }
        if (side != PageSide.BACK) {
            textureFront = texture;
        }
        if (side != PageSide.FRONT) {
            textureBack = texture;
        }
        texturesChanged = true;
    }

    /**
     * Image of a side padded to power-of-two dimensions, with the sub-rectangle that
     * holds the original pixels.
     */
    public PageTexture getTexture(PageSide side) {
        PageImage image = getImage(side);
        PageImage padded = image.padToPowerOfTwo();
        return new PageTexture(padded,
                (float) image.width() / padded.width(),
                (float) image.height() / padded.height());
    }

    /** Replace both images with 1x1 images of the tint colors. */
    public void recycle() {
        textureFront = PageImage.filled(1, 1, colorFront);
        textureBack = PageImage.filled(1, 1, colorBack);
        texturesChanged = false;
    }

    /** White tint on both sides, images recycled. */
    public void reset() {
        colorFront = Argb.WHITE;
        colorBack = Argb.WHITE;
        recycle();
    }
}
