package dev.everydaythings.pagecurl.gl;

import dev.everydaythings.pagecurl.CurlPage;
import dev.everydaythings.pagecurl.PageMesh;
import dev.everydaythings.pagecurl.PageSide;
import dev.everydaythings.pagecurl.PageTexture;
import org.lwjgl.opengl.GL11;
import org.lwjgl.opengl.GL12;

import java.util.logging.Logger;

/**
 * Front and back GL texture objects of one {@link PageMesh}.
 *
 * <p>Textures are re-uploaded whenever the mesh's page reports changed images. After
 * an upload the page drops its pixels and the mesh is reset, so the new texture
 * rectangles take effect.
 */
class GlPageTextures {

    private static final Logger log = Logger.getLogger(GlPageTextures.class.getName());

    private final int frontId;
    private final int backId;
    private boolean hasBackTexture;

    GlPageTextures() {
        frontId = createTexture();
        backId = createTexture();
    }

    /** Upload the page images if they changed since the last call. */
    void update(PageMesh mesh) {
        CurlPage page = mesh.page();
        if (!page.texturesChanged()) {
            return;
        }

        PageTexture front = page.getTexture(PageSide.FRONT);
        upload(frontId, front);
        mesh.setTextureRect(PageSide.FRONT, front.maxU(), front.maxV());

        hasBackTexture = page.hasBackTexture();
        if (hasBackTexture) {
            PageTexture back = page.getTexture(PageSide.BACK);
            upload(backId, back);
            mesh.setTextureRect(PageSide.BACK, back.maxU(), back.maxV());
        } else {
            mesh.setTextureRect(PageSide.BACK, front.maxU(), front.maxV());
        }

        page.recycle();
        mesh.reset();
    }

    /** Texture for the flat, unturned side of the mesh. */
    int frontFacingId(boolean flipTexture) {
        return !flipTexture || !hasBackTexture ? frontId : backId;
    }

    /** Texture for the side rotated past the curl. */
    int backFacingId(boolean flipTexture) {
        return flipTexture || !hasBackTexture ? frontId : backId;
    }

    void destroy() {
        GL11.glDeleteTextures(frontId);
        GL11.glDeleteTextures(backId);
    }

    private static int createTexture() {
        int id = GL11.glGenTextures();
        GL11.glBindTexture(GL11.GL_TEXTURE_2D, id);
        GL11.glTexParameteri(GL11.GL_TEXTURE_2D, GL11.GL_TEXTURE_MIN_FILTER, GL11.GL_NEAREST);
        GL11.glTexParameteri(GL11.GL_TEXTURE_2D, GL11.GL_TEXTURE_MAG_FILTER, GL11.GL_NEAREST);
        GL11.glTexParameteri(GL11.GL_TEXTURE_2D, GL11.GL_TEXTURE_WRAP_S, GL12.GL_CLAMP_TO_EDGE);
        GL11.glTexParameteri(GL11.GL_TEXTURE_2D, GL11.GL_TEXTURE_WRAP_T, GL12.GL_CLAMP_TO_EDGE);
        GL11.glBindTexture(GL11.GL_TEXTURE_2D, 0);
        return id;
    }

    private static void upload(int id, PageTexture texture) {
        int width = texture.image().width();
        int height = texture.image().height();
        GL11.glBindTexture(GL11.GL_TEXTURE_2D, id);
        GL11.glTexImage2D(GL11.GL_TEXTURE_2D, 0, GL11.GL_RGBA8, width, height, 0,
                GL11.GL_RGBA, GL11.GL_UNSIGNED_BYTE, texture.image().pixels());
        GL11.glBindTexture(GL11.GL_TEXTURE_2D, 0);

        int error = GL11.glGetError();
        if (error != GL11.GL_NO_ERROR) {
            log.warning(() -> String.format("Texture upload %dx%d failed: GL error 0x%04X", width, height, error));
        } else {
            log.info(() -> String.format("Uploaded page texture %d: %dx%d", id, width, height));
        }
    }
}
