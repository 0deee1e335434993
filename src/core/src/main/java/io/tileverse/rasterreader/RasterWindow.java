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
 * Rectangular pixel region defined by its top-left corner and size.
 * <p>
 * The origin may be any integer, a window is only checked against a raster extent when it is read.
 *
 * @param x column of the top-left pixel
 * @param y row of the top-left pixel
 * @param width number of columns, non-negative
 * @param height number of rows, non-negative
 */
public record RasterWindow(int x, int y, int width, int height) {

    public RasterWindow {
        if (width < 0) {
            throw new IllegalArgumentException("width can't be < 0: " + width);
        }
        if (height < 0) {
            throw new IllegalArgumentException("height can't be < 0: " + height);
        }
    }

    /**
     * @return {@code width * height}
     */
    public long pixelCount() {
        return (long) width * height;
    }

    /**
     * @return {@code true} if the window covers no pixel
     */
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * Factory method to create a new {@link RasterWindow}.
     *
     * @param x column of the top-left pixel
     * @param y row of the top-left pixel
     * @param width number of columns
     * @param height number of rows
     * @return a new window
     */
    public static RasterWindow of(int x, int y, int width, int height) {
        return new RasterWindow(x, y, width, height);
    }

    /**
     * @param size a raster extent
     * @return the window covering the whole extent
     */
    public static RasterWindow full(RasterSize size) {
        return new RasterWindow(0, 0, size.width(), size.height());
    }
}
