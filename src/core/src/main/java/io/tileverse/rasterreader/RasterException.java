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

import static java.util.Objects.requireNonNull;

import java.io.IOException;

/**
 * Signals a failure of a raster operation, tagged with one {@link RasterErrorKind}.
 * <p>
 * This is the only checked exception crossing the {@link RasterDataset} API for domain failures. Absent values
 * (an unset metadata key, a band without no-data value) are reported through {@code Optional}s instead.
 */
public class RasterException extends IOException {

    private static final long serialVersionUID = 1L;

    private final RasterErrorKind kind;

    /**
     * Creates a new exception of the given kind.
     *
     * @param kind the failure kind
     * @param message the human-readable message
     */
    public RasterException(RasterErrorKind kind, String message) {
        super(message);
        this.kind = requireNonNull(kind, "kind");
    }

    /**
     * Creates a new exception of the given kind with an underlying cause.
     *
     * @param kind the failure kind
     * @param message the human-readable message
     * @param cause the underlying cause
     */
    public RasterException(RasterErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = requireNonNull(kind, "kind");
    }

    /**
     * @return the failure kind, never {@code null}
     */
    public RasterErrorKind kind() {
        return kind;
    }

    /**
     * Creates an {@link RasterErrorKind#INVALID_BAND_INDEX} failure.
     *
     * @param band the offending 1-based band index
     * @param bandCount the number of bands of the dataset
     * @return the exception
     */
    public static RasterException invalidBand(int band, int bandCount) {
        String valid = bandCount == 0 ? "dataset has no bands" : "valid range is 1.." + bandCount;
        return new RasterException(
                RasterErrorKind.INVALID_BAND_INDEX, "Invalid band index %d: %s".formatted(band, valid));
    }

    @Override
    public String toString() {
        return "%s[%s]: %s".formatted(getClass().getSimpleName(), kind, getMessage());
    }
}
