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
 * Eased float animation driven by an external clock.
 *
 * <p>Nothing runs on its own: the owner calls {@link #tick(long)} with the current time
 * in nanoseconds, usually once per frame.
 */
public final class ValueAnimation {

    /** Receives animated values. */
    public interface Listener {
        void onUpdate(float value);

        /** Called once with the final value when the animation finishes or is ended. */
        default void onEnd(float value) {
        }
    }

    private final float from;
    private final float to;
    private final long durationNanos;
    private final Easing easing;
    private final Listener listener;

    private long startNanos;
    private boolean running;

    /**
     * @throws IllegalArgumentException if the duration is negative
     */
    public ValueAnimation(float from, float to, long durationNanos, Easing easing, Listener listener) {
        this.from = from;
        this.to = to;
        this.durationNanos = Asserts.assertNonNegative(durationNanos, "durationNanos");
        this.easing = easing == null ? Easing.LINEAR : easing;
        this.listener = listener;
    }

    public void start(long nowNanos) {
        startNanos = nowNanos;
        running = true;
    }

    public boolean isRunning() {
        return running;
    }

    /** Linear progress in [0, 1] at the given time. */
    public float fraction(long nowNanos) {
        if (durationNanos == 0) {
            return 1.0f;
        }
        float f = (float) (nowNanos - startNanos) / (float) durationNanos;
        return Math.max(0.0f, Math.min(1.0f, f));
    }

    /** Eased value at the given time. */
    public float valueAt(long nowNanos) {
        return from + (to - from) * easing.apply(fraction(nowNanos));
    }

    /**
     * Advance to {@code nowNanos}, notifying the listener.
     *
     * @return whether the animation is still running afterwards
     */
    public boolean tick(long nowNanos) {
        if (!running) {
            return false;
        }
        float f = fraction(nowNanos);
        listener.onUpdate(from + (to - from) * easing.apply(f));
        if (f >= 1.0f) {
            running = false;
            listener.onEnd(to);
        }
        return running;
    }

    /** Jump to the final value and finish. No-op when not running. */
    public void end() {
        if (!running) {
            return;
        }
        running = false;
        listener.onUpdate(to);
        listener.onEnd(to);
    }

    /** Stop without reaching the end. The end callback is not called. */
    public void cancel() {
        running = false;
    }
}
