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
 * Normalizes failures escaping a {@link io.tileverse.rasterreader.spi.RasterHandle} into {@link RasterException}s.
 * <p>
 * Handles are expected to report {@code RasterException}s already; these pass through untouched. Anything else, a
 * plain {@link java.io.IOException} or an unchecked exception thrown by a native binding, becomes an
 * {@link RasterErrorKind#IO_FAILURE} keeping the original exception as its cause.
 */
final class RasterErrors {

    private RasterErrors() {
        // utility class
    }

    static RasterException normalize(String operation, String source, Exception cause) {
        if (cause instanceof RasterException rasterException) {
            return rasterException;
        }
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new RasterException(
                RasterErrorKind.IO_FAILURE, "%s failed on %s: %s".formatted(operation, source, message), cause);
    }

    static RasterException closed(String source) {
        return new RasterException(RasterErrorKind.IO_FAILURE, "Dataset is closed: " + source);
    }
}
