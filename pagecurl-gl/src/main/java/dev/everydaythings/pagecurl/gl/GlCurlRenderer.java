package dev.everydaythings.pagecurl.gl;

import dev.everydaythings.pagecurl.Argb;
import dev.everydaythings.pagecurl.CurlSurface;
import dev.everydaythings.pagecurl.MeshOptions;
import dev.everydaythings.pagecurl.PageLayout;
import dev.everydaythings.pagecurl.PageMesh;
import dev.everydaythings.pagecurl.PageRect;
import org.lwjgl.opengl.GL11;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Fixed-function OpenGL backend for page meshes.
 *
 * <p>Draws every registered {@link PageMesh} in registration order. A GL context must
 * be current on the calling thread for every method except the {@link CurlSurface}
 * ones.
 *
 * <p>Usage:
 * <pre>{@code
 * PageLayout layout = new PageLayout();
 * GlCurlRenderer renderer = new GlCurlRenderer(layout);
 * CurlController controller = new CurlController(layout, renderer);
 * renderer.setObserver(controller::onDrawFrame);
 *
 * renderer.onSurfaceCreated();
 * renderer.onSurfaceChanged(width, height);
 * while (running) {
 *     controller.onAnimationFrame();
 *     renderer.render();
 * }
 * renderer.destroy();
 * }</pre>
 */
public class GlCurlRenderer implements CurlSurface {

    private static final Logger log = Logger.getLogger(GlCurlRenderer.class.getName());

    private static final float FIELD_OF_VIEW_DEGREES = 20.0f;
    private static final float NEAR = 0.1f;
    private static final float FAR = 100.0f;
    private static final float CAMERA_DISTANCE = 6.0f;

    /** Called at the start of every frame, before any mesh is drawn. */
    public interface Observer {
        void onDrawFrame();
    }

    private final PageLayout layout;
    private final boolean usePerspectiveProjection;
    private final List<PageMesh> meshes = new ArrayList<>();
    private final Map<PageMesh, GlPageTextures> textures = new IdentityHashMap<>();
    private final float[] clearColor = new float[4];

    private Observer observer;
    private int backgroundColor = Argb.TRANSPARENT;
    private boolean renderRequested = true;

    public GlCurlRenderer(PageLayout layout) {
        this(layout, false);
    }

    /**
     * @param layout                   layout receiving the viewport size
     * @param usePerspectiveProjection view the pages through a narrow perspective camera
     *                                 instead of an orthographic projection
     */
    public GlCurlRenderer(PageLayout layout, boolean usePerspectiveProjection) {
        this.layout = layout;
        this.usePerspectiveProjection = usePerspectiveProjection;
    }

    public void setObserver(Observer observer) {
        this.observer = observer;
    }

    /** Background color, {@code 0xAARRGGBB} (default transparent). */
    public void setBackgroundColor(int argb) {
        this.backgroundColor = argb;
        renderRequested = true;
    }

    public int backgroundColor() {
        return backgroundColor;
    }

    // ==================================================================================
    // CurlSurface
    // ==================================================================================

    @Override
    public void addMesh(PageMesh mesh) {
        removeMesh(mesh);
        meshes.add(mesh);
        renderRequested = true;
    }

    @Override
    public boolean removeMesh(PageMesh mesh) {
        boolean removed = false;
        while (meshes.remove(mesh)) {
            removed = true;
        }
        return removed;
    }

    /** Also deletes the mesh's texture objects. Call on the GL thread. */
    @Override
    public boolean releaseMesh(PageMesh mesh) {
        boolean removed = removeMesh(mesh);
        GlPageTextures meshTextures = textures.remove(mesh);
        if (meshTextures != null) {
            meshTextures.destroy();
        }
        renderRequested = true;
        return removed;
    }

    @Override
    public void requestRender() {
        renderRequested = true;
    }

    /** Whether a frame was requested since the last {@link #render()}. */
    public boolean isRenderRequested() {
        return renderRequested;
    }

    // ==================================================================================
    // Surface lifecycle
    // ==================================================================================

    /**
     * Set up GL state for a new context. Texture objects of a previous context are
     * forgotten and recreated on demand.
     */
    public void onSurfaceCreated() {
        GL11.glClearColor(0.0f, 0.0f, 0.0f, 1.0f);
        GL11.glShadeModel(GL11.GL_SMOOTH);
        GL11.glHint(GL11.GL_PERSPECTIVE_CORRECTION_HINT, GL11.GL_NICEST);
        GL11.glHint(GL11.GL_LINE_SMOOTH_HINT, GL11.GL_NICEST);
        GL11.glHint(GL11.GL_POLYGON_SMOOTH_HINT, GL11.GL_NICEST);
        GL11.glEnable(GL11.GL_LINE_SMOOTH);
        GL11.glDisable(GL11.GL_DEPTH_TEST);
        GL11.glDisable(GL11.GL_CULL_FACE);
        textures.clear();
        renderRequested = true;
        log.info(() -> String.format("Surface created: %s, %s",
                GL11.glGetString(GL11.GL_VENDOR), GL11.glGetString(GL11.GL_VERSION)));
    }

    /** Resize the viewport, update the layout and rebuild the projection. */
    public void onSurfaceChanged(int width, int height) {
        if (width <= 0 || height <= 0) {
            return;
        }
        GL11.glViewport(0, 0, width, height);
        layout.setViewport(width, height);

        PageRect view = layout.viewRect();
        float ratio = (float) width / (float) height;
        GL11.glMatrixMode(GL11.GL_PROJECTION);
        GL11.glLoadIdentity();
        if (usePerspectiveProjection) {
            double top = NEAR * Math.tan(Math.toRadians(FIELD_OF_VIEW_DEGREES / 2.0));
            double right = top * ratio;
            GL11.glFrustum(-right, right, -top, top, NEAR, FAR);
        } else {
            GL11.glOrtho(view.left(), view.right(), view.bottom(), view.top(), -10.0, 10.0);
        }
        GL11.glMatrixMode(GL11.GL_MODELVIEW);
        GL11.glLoadIdentity();
        renderRequested = true;
        log.info(() -> String.format("Surface changed: %dx%d", width, height));
    }

    /** Draw one frame. */
    public void render() {
        renderRequested = false;
        if (observer != null) {
            observer.onDrawFrame();
        }

        Argb.toFloats(backgroundColor, clearColor, 0);
        GL11.glClearColor(clearColor[0], clearColor[1], clearColor[2], clearColor[3]);
        GL11.glClear(GL11.GL_COLOR_BUFFER_BIT);
        GL11.glLoadIdentity();
        if (usePerspectiveProjection) {
            GL11.glTranslatef(0.0f, 0.0f, -CAMERA_DISTANCE);
        }

        for (PageMesh mesh : meshes) {
            drawMesh(mesh);
        }
    }

    /** Delete all texture objects. */
    public void destroy() {
        for (GlPageTextures t : textures.values()) {
            t.destroy();
        }
        textures.clear();
        meshes.clear();
    }

    // ==================================================================================
    // Mesh drawing
    // ==================================================================================

    private void drawMesh(PageMesh mesh) {
        MeshOptions options = mesh.options();
        GlPageTextures meshTextures = null;
        if (options.drawTexture()) {
            meshTextures = textures.computeIfAbsent(mesh, m -> new GlPageTextures());
            meshTextures.update(mesh);
        }

        int frontCount = mesh.frontCount();
        int backCount = mesh.backCount();
        boolean flip = mesh.isFlipTexture();

        GL11.glEnableClientState(GL11.GL_VERTEX_ARRAY);

        // Drop shadow goes underneath the page.
        if (options.drawShadow() && mesh.dropShadowCount() > 0) {
            GL11.glDisable(GL11.GL_TEXTURE_2D);
            GL11.glEnable(GL11.GL_BLEND);
            GL11.glBlendFunc(GL11.GL_SRC_ALPHA, GL11.GL_ONE_MINUS_SRC_ALPHA);
            GL11.glEnableClientState(GL11.GL_COLOR_ARRAY);
            GL11.glColorPointer(4, GL11.GL_FLOAT, 0, mesh.shadowColors());
            GL11.glVertexPointer(3, GL11.GL_FLOAT, 0, mesh.shadowVertices());
            GL11.glDrawArrays(GL11.GL_TRIANGLE_STRIP, 0, mesh.dropShadowCount());
            GL11.glDisableClientState(GL11.GL_COLOR_ARRAY);
            GL11.glDisable(GL11.GL_BLEND);
        }

        if (meshTextures != null) {
            GL11.glEnableClientState(GL11.GL_TEXTURE_COORD_ARRAY);
            GL11.glTexCoordPointer(2, GL11.GL_FLOAT, 0, mesh.texCoords());
        }
        GL11.glVertexPointer(3, GL11.GL_FLOAT, 0, mesh.vertices());
        GL11.glEnableClientState(GL11.GL_COLOR_ARRAY);
        GL11.glColorPointer(4, GL11.GL_FLOAT, 0, mesh.colors());

        // Front: tint first, then the texture blended over it.
        GL11.glDisable(GL11.GL_TEXTURE_2D);
        GL11.glDrawArrays(GL11.GL_TRIANGLE_STRIP, 0, frontCount);
        if (meshTextures != null) {
            drawTextured(meshTextures.frontFacingId(flip), 0, frontCount);
        }

        // Back strip shares the crest edge with the front one.
        int backStart = Math.max(0, frontCount - 2);
        int backStripCount = frontCount + backCount - backStart;
        GL11.glDrawArrays(GL11.GL_TRIANGLE_STRIP, backStart, backStripCount);
        if (meshTextures != null) {
            drawTextured(meshTextures.backFacingId(flip), backStart, backStripCount);
        }

        GL11.glDisableClientState(GL11.GL_TEXTURE_COORD_ARRAY);
        GL11.glDisableClientState(GL11.GL_COLOR_ARRAY);

        if (options.drawPolygonOutlines()) {
            GL11.glEnable(GL11.GL_BLEND);
            GL11.glBlendFunc(GL11.GL_SRC_ALPHA, GL11.GL_ONE_MINUS_SRC_ALPHA);
            GL11.glLineWidth(1.0f);
            GL11.glColor4f(0.5f, 0.5f, 1.0f, 1.0f);
            GL11.glVertexPointer(3, GL11.GL_FLOAT, 0, mesh.vertices());
            GL11.glDrawArrays(GL11.GL_LINE_STRIP, 0, frontCount);
            GL11.glDisable(GL11.GL_BLEND);
        }

        if (options.drawCurlPosition()) {
            GL11.glEnable(GL11.GL_BLEND);
            GL11.glBlendFunc(GL11.GL_SRC_ALPHA, GL11.GL_ONE_MINUS_SRC_ALPHA);
            GL11.glLineWidth(1.0f);
            GL11.glColor4f(1.0f, 0.5f, 0.5f, 1.0f);
            GL11.glVertexPointer(2, GL11.GL_FLOAT, 0, mesh.curlPositionLines());
            GL11.glDrawArrays(GL11.GL_LINES, 0, mesh.curlPositionLinesCount() * 2);
            GL11.glDisable(GL11.GL_BLEND);
        }

        // Self shadow goes over the rotated part.
        if (options.drawShadow() && mesh.selfShadowCount() > 0) {
            GL11.glEnable(GL11.GL_BLEND);
            GL11.glBlendFunc(GL11.GL_SRC_ALPHA, GL11.GL_ONE_MINUS_SRC_ALPHA);
            GL11.glEnableClientState(GL11.GL_COLOR_ARRAY);
            GL11.glColorPointer(4, GL11.GL_FLOAT, 0, mesh.shadowColors());
            GL11.glVertexPointer(3, GL11.GL_FLOAT, 0, mesh.shadowVertices());
            GL11.glDrawArrays(GL11.GL_TRIANGLE_STRIP, mesh.dropShadowCount(), mesh.selfShadowCount());
            GL11.glDisableClientState(GL11.GL_COLOR_ARRAY);
            GL11.glDisable(GL11.GL_BLEND);
        }

        GL11.glDisableClientState(GL11.GL_VERTEX_ARRAY);
    }

    private static void drawTextured(int textureId, int first, int count) {
        GL11.glEnable(GL11.GL_BLEND);
        GL11.glEnable(GL11.GL_TEXTURE_2D);
        GL11.glBindTexture(GL11.GL_TEXTURE_2D, textureId);
        GL11.glBlendFunc(GL11.GL_SRC_ALPHA, GL11.GL_ONE_MINUS_SRC_ALPHA);
        GL11.glDrawArrays(GL11.GL_TRIANGLE_STRIP, first, count);
        GL11.glDisable(GL11.GL_BLEND);
        GL11.glDisable(GL11.GL_TEXTURE_2D);
    }
}
