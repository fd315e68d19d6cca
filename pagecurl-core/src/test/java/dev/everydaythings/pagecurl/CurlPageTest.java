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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CurlPageTest {

    @Test
    void freshPageIsWhiteWithNoPendingTextures() {
        CurlPage page = new CurlPage();

        assertEquals(Argb.WHITE, page.getColor(PageSide.FRONT));
        assertEquals(Argb.WHITE, page.getColor(PageSide.BACK));
        assertFalse(page.texturesChanged());
        assertEquals(1, page.getImage(PageSide.FRONT).width());
    }

    @Test
    void colorForBothSidesSetsEach() {
        CurlPage page = new CurlPage();
        page.setColor(Argb.BLACK, PageSide.BOTH);

        assertEquals(Argb.BLACK, page.getColor(PageSide.FRONT));
        assertEquals(Argb.BLACK, page.getColor(PageSide.BACK));

        page.setColor(Argb.WHITE, PageSide.FRONT);
        assertEquals(Argb.WHITE, page.getColor(PageSide.FRONT));
        assertEquals(Argb.BLACK, page.getColor(PageSide.BACK));
    }

    @Test
    void sharedTextureMeansNoBackTexture() {
        CurlPage page = new CurlPage();
        PageImage image = PageImage.filled(3, 5, Argb.BLACK);
        page.setTexture(image, PageSide.BOTH);

        assertTrue(page.texturesChanged());
        assertFalse(page.hasBackTexture());
        assertSame(image, page.getImage(PageSide.BACK));

        page.setTexture(PageImage.filled(3, 5, Argb.WHITE), PageSide.BACK);
        assertTrue(page.hasBackTexture());
    }

    @Test
    void nullTextureUsesSideColor() {
        CurlPage page = new CurlPage();
        int red = Argb.of(255, 255, 0, 0);
        page.setColor(red, PageSide.BACK);
        page.setTexture(null, PageSide.BACK);

        PageImage back = page.getImage(PageSide.BACK);
        assertEquals(1, back.width());
        assertEquals(red, back.argbAt(0, 0));
    }

    @Test
    void textureIsPaddedWithValidRegion() {
        CurlPage page = new CurlPage();
        page.setTexture(PageImage.filled(3, 5, Argb.BLACK), PageSide.FRONT);

        PageTexture texture = page.getTexture(PageSide.FRONT);
        assertEquals(4, texture.image().width());
        assertEquals(8, texture.image().height());
        assertEquals(0.75f, texture.maxU(), 1e-6f);
        assertEquals(0.625f, texture.maxV(), 1e-6f);
    }

    @Test
    void recycleDropsImagesButKeepsColors() {
        CurlPage page = new CurlPage();
        page.setColor(Argb.BLACK, PageSide.FRONT);
        page.setTexture(PageImage.filled(16, 16, Argb.WHITE), PageSide.FRONT);
        page.recycle();

        assertFalse(page.texturesChanged());
        assertEquals(1, page.getImage(PageSide.FRONT).width());
        assertEquals(Argb.BLACK, page.getImage(PageSide.FRONT).argbAt(0, 0));
        assertEquals(Argb.BLACK, page.getColor(PageSide.FRONT));

        page.reset();
        assertEquals(Argb.WHITE, page.getColor(PageSide.FRONT));
    }
}
