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
 * Maps linear animation progress in [0, 1] to eased progress.
 */
public enum Easing {

    LINEAR {
        @Override
        public float apply(float fraction) {
            return fraction;
        }
    },

    /** Starts slow and speeds up, {@code t^2}. */
    ACCELERATE {
        @Override
        public float apply(float fraction) {
            return fraction * fraction;
        }
    },

    /** Fast start settling into the target, a mirrored smoothstep. */
    SNAP {
        @Override
        public float apply(float fraction) {
            float t = 1.0f - fraction;
            return 1.0f - (t * t * t * (3.0f - 2.0f * t));
        }
    };

    public abstract float apply(float fraction);
}
