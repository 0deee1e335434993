/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.rasterreader;

/**
 * Raster extent in pixels.
 *
 * @param width number of columns
 * @param height number of rows
 */
public record RasterSize(int width, int height) {

    public RasterSize {
        if (width < 0) {
            throw new IllegalArgumentException("width can't be < 0: " + width);
        }
        if (height < 0) {
            throw new IllegalArgumentException("height can't be < 0: " + height);
        }
    }

    /**
     * @param window the window to test
     * @return {@code true} if the window lies entirely within this extent
     */
    public boolean contains(RasterWindow window) {
        return window.x() >= 0
                && window.y() >= 0
                && (long) window.x() + window.width() <= width
                && (long) window.y() + window.height() <= height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
