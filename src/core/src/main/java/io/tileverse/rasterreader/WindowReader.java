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

import io.tileverse.rasterreader.spi.RasterHandle;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.ReadOnlyBufferException;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates pixel windows and reads them from a {@link RasterHandle}.
 * <p>
 * A read either produces exactly {@code width * height * byteWidth} bytes or fails, it never returns a truncated
 * or zero-padded buffer:
 * <ul>
 * <li>the band index must be in {@code 1..bandCount} ({@link RasterErrorKind#INVALID_BAND_INDEX})</li>
 * <li>the band datatype must have a fixed byte width ({@link RasterErrorKind#UNSUPPORTED_DATATYPE})</li>
 * <li>the window must lie within the raster extent, it is never clamped
 * ({@link RasterErrorKind#WINDOW_OUT_OF_BOUNDS})</li>
 * <li>the handle must write the expected number of bytes ({@link RasterErrorKind#IO_FAILURE})</li>
 * </ul>
 * Bounds errors reported by the native library itself are relayed as they come.
 */
@Slf4j
final class WindowReader {

    // some VMs reserve header words in arrays
    static final int MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;

    private final RasterSize rasterSize;

    private final BandTypeResolver bandTypes;

    WindowReader(RasterSize rasterSize, BandTypeResolver bandTypes) {
        this.rasterSize = requireNonNull(rasterSize);
        this.bandTypes = requireNonNull(bandTypes);
    }

    /**
     * Reads a window into a new heap buffer.
     *
     * @return a buffer in native byte order, positioned at 0 with its limit at the window byte length
     */
    ByteBuffer read(RasterHandle handle, int band, RasterWindow window) throws IOException {
        final int length = validate(handle, band, window);
        ByteBuffer buffer = ByteBuffer.allocate(length).order(ByteOrder.nativeOrder());
        if (length > 0) {
            int read = handle.readWindow(band, window, buffer);
            checkReadCount(handle, window, length, read, buffer.position());
        }
        return buffer.flip();
    }

    /**
     * Reads a window into the target buffer, advancing its position by the number of bytes written. On failure the
     * target position is left where it was.
     *
     * @return the number of bytes written
     */
    int read(RasterHandle handle, int band, RasterWindow window, ByteBuffer target) throws IOException {
        requireNonNull(target, "Target buffer cannot be null");
        if (target.isReadOnly()) {
            throw new ReadOnlyBufferException();
        }
        final int length = validate(handle, band, window);
        if (target.remaining() < length) {
            throw new IllegalArgumentException(
                    "Target buffer has insufficient remaining capacity: " + target.remaining() + " < " + length);
        }
        if (length == 0) {
            return 0;
        }
        final int initialPosition = target.position();
        boolean success = false;
        try {
            int read = handle.readWindow(band, window, target);
            checkReadCount(handle, window, length, read, target.position() - initialPosition);
            success = true;
            return read;
        } finally {
            if (!success) {
                target.position(initialPosition);
            }
        }
    }

    private int validate(RasterHandle handle, int band, RasterWindow window) throws IOException {
        requireNonNull(window, "window");
        RasterDataType type = bandTypes.resolve(handle, band);
        if (!type.isSized()) {
            throw new RasterException(
                    RasterErrorKind.UNSUPPORTED_DATATYPE,
                    "Band %d of %s has a datatype with no fixed byte width"
                            .formatted(band, handle.getSourceIdentifier()));
        }
        if (!rasterSize.contains(window)) {
            throw new RasterException(
                    RasterErrorKind.WINDOW_OUT_OF_BOUNDS,
                    "Window %s is out of the raster extent %s".formatted(window, rasterSize));
        }
        final long length = window.pixelCount() * type.byteWidth();
        if (length > MAX_BUFFER_SIZE) {
            throw new RasterException(
                    RasterErrorKind.IO_FAILURE,
                    "Window %s of band %d (%s) needs %d bytes, which exceeds the maximum buffer size"
                            .formatted(window, band, type, length));
        }
        log.trace("Reading band {} window {} ({} bytes) from {}", band, window, length, handle.getSourceIdentifier());
        return (int) length;
    }

    private static void checkReadCount(RasterHandle handle, RasterWindow window, int expected, int read, int written)
            throws RasterException {
        if (read != expected || written != expected) {
            throw new RasterException(
                    RasterErrorKind.IO_FAILURE,
                    "Truncated read of window %s from %s: expected %d bytes, got %d"
                            .formatted(window, handle.getSourceIdentifier(), expected, Math.min(read, written)));
        }
    }
}
