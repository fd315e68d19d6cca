/**
 * OpenGL rendering backend for page curl meshes, on LWJGL's fixed-function {@code GL11}
 * bindings.
 *
 * <h2>Draw Order</h2>
 * <p>Per mesh: drop shadow, front strip (tint then texture), back strip (tint then
 * texture), polygon outlines, curl position lines, self shadow. Meshes are drawn in the
 * order they were added to the renderer, so the turning page always ends up on top.
 *
 * <h2>Textures</h2>
 * <p>Page images are padded to power-of-two sizes on upload and sampled with
 * {@code GL_NEAREST} filtering and {@code GL_CLAMP_TO_EDGE} wrapping.
 *
 * @see dev.everydaythings.pagecurl.gl.GlCurlRenderer
 */
package dev.everydaythings.pagecurl.gl;
