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
 * Affine transform from pixel/line coordinates to georeferenced coordinates.
 * <p>
 * The coefficients follow the native library's 6-element layout:
 *
 * <pre>
 * xGeo = originX + col * pixelWidth + row * skewX
 * yGeo = originY + col * skewY      + row * pixelHeight
 * </pre>
 *
 * For north-up images both skews are zero and {@code pixelHeight} is negative. Rasters without georeferencing
 * usually report the identity-like transform {@code (0, 1, 0, 0, 0, 1)}.
 *
 * @param originX x coordinate of the top-left corner of the top-left pixel
 * @param pixelWidth pixel width in georeferenced units
 * @param skewX row rotation term
 * @param originY y coordinate of the top-left corner of the top-left pixel
 * @param skewY column rotation term
 * @param pixelHeight pixel height in georeferenced units
 */
public record GeoTransform(
        double originX, double pixelWidth, double skewX, double originY, double skewY, double pixelHeight) {

    /**
     * Number of coefficients of the native representation.
     */
    public static final int COEFFICIENT_COUNT = 6;

    /**
     * Maps a pixel/line coordinate to a georeferenced coordinate.
     * <p>
     * Integer arguments address the top-left corner of a pixel, use {@code col + 0.5, row + 0.5} for its center.
     *
     * @param col pixel (column) coordinate
     * @param row line (row) coordinate
     * @return the georeferenced point
     */
    public GeoPoint toGeo(double col, double row) {
        double x = originX + col * pixelWidth + row * skewX;
        double y = originY + col * skewY + row * pixelHeight;
        return new GeoPoint(x, y);
    }

    /**
     * @return {@code true} if the transform has no rotation terms
     */
    public boolean isNorthUp() {
        return skewX == 0d && skewY == 0d;
    }

    /**
     * @return the coefficients in native order
     */
    public double[] toArray() {
        return new double[] {originX, pixelWidth, skewX, originY, skewY, pixelHeight};
    }

    /**
     * A georeferenced coordinate.
     *
     * @param x easting or longitude
     * @param y northing or latitude
     */
    public record GeoPoint(double x, double y) {}
}
