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
 * The closed set of failure kinds a {@link RasterDataset} reports.
 * <p>
 * Every failure coming out of the native raster library is mapped to exactly one of these kinds, together with a
 * human-readable message, and reported as a {@link RasterException}.
 */
public enum RasterErrorKind {
    /** The file does not exist or cannot be read. */
    NOT_FOUND,
    /** No driver of the native library recognizes the file format. */
    UNSUPPORTED_FORMAT,
    /** Generic I/O failure reported by the native layer, or an operation on a closed dataset. */
    IO_FAILURE,
    /** A band index outside {@code 1..bandCount}. */
    INVALID_BAND_INDEX,
    /** A pixel window that does not fit in the raster extent. */
    WINDOW_OUT_OF_BOUNDS,
    /** The band datatype has no fixed byte width, so reads cannot be sized. */
    UNSUPPORTED_DATATYPE,
    /** The native library returned something other than 6 affine coefficients. */
    MALFORMED_TRANSFORM,
    /** The dataset carries no projection. This is an expected condition, not malformed data. */
    NO_SPATIAL_REFERENCE,
    /** The requested metadata domain does not exist on the dataset. */
    NO_SUCH_DOMAIN
}
