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
package io.tileverse.rasterreader.spi;

import io.tileverse.rasterreader.RasterDataType;
import io.tileverse.rasterreader.RasterDataset;
import io.tileverse.rasterreader.RasterException;
import io.tileverse.rasterreader.RasterWindow;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * An open raster dataset owned by a native raster library.
 * <p>
 * Implementations are <strong>not</strong> required to be thread-safe, and most native libraries aren't. A
 * {@link RasterDataset} owns exactly one handle and serializes every call to it, so implementations can assume a
 * single caller at a time and never need to synchronize.
 * <p>
 * Band indices are 1-based. Callers validate them against {@link #bandCount()} before calling band-scoped
 * methods, implementations may still reject invalid ones.
 * <p>
 * Implementations should report failures as {@link RasterException}s with the appropriate kind. Any other
 * {@link IOException} or unchecked exception is reported to {@link RasterDataset} callers as an
 * {@link io.tileverse.rasterreader.RasterErrorKind#IO_FAILURE IO_FAILURE}.
 */
public interface RasterHandle extends Closeable {

    /**
     * @return the number of raster bands
     * @throws IOException if the native query fails
     */
    int bandCount() throws IOException;

    /**
     * @return the raster width in pixels
     * @throws IOException if the native query fails
     */
    int rasterWidth() throws IOException;

    /**
     * @return the raster height in pixels
     * @throws IOException if the native query fails
     */
    int rasterHeight() throws IOException;

    /**
     * @return the short name of the driver that opened the dataset, e.g. {@code GTiff}
     * @throws IOException if the native query fails
     */
    String driverShortName() throws IOException;

    /**
     * Returns the pixel datatype of a band. Native types with no portable counterpart map to
     * {@link RasterDataType#UNKNOWN}.
     *
     * @param band 1-based band index
     * @return the band datatype
     * @throws IOException if the native query fails
     */
    RasterDataType dataType(int band) throws IOException;

    /**
     * @param band 1-based band index
     * @return the band no-data value, or empty if the band has none
     * @throws IOException if the native query fails
     */
    OptionalDouble noDataValue(int band) throws IOException;

    /**
     * @param band 1-based band index
     * @return the band description, empty string if unset
     * @throws IOException if the native query fails
     */
    String description(int band) throws IOException;

    /**
     * Reads a pixel window of a band into the target buffer.
     * <p>
     * Pixels are written in the band's native datatype and the platform's native byte order, row-major,
     * top-to-bottom and left-to-right, without padding. Following NIO conventions, the target position is
     * advanced by the number of bytes written and its limit is left unchanged.
     *
     * @param band 1-based band index
     * @param window the pixel window
     * @param target the buffer to write into, starting at its current position
     * @return the number of bytes written
     * @throws IOException if the native read fails
     */
    int readWindow(int band, RasterWindow window, ByteBuffer target) throws IOException;

    /**
     * @return the affine transform coefficients as reported by the native library, expected to hold 6 values
     * @throws IOException if the native query fails
     */
    double[] geoTransform() throws IOException;

    /**
     * @param format the text encoding to export to
     * @return the spatial reference, or empty if the dataset carries no projection
     * @throws IOException if the native query or the export fails
     */
    Optional<String> spatialReference(SpatialReferenceFormat format) throws IOException;

    /**
     * @return the names of the metadata domains of the dataset, as reported by the native library
     * @throws IOException if the native query fails
     */
    List<String> metadataDomains() throws IOException;

    /**
     * @param key metadata key
     * @param domain metadata domain, empty string for the default domain
     * @return the value, or empty if the key is not set in the domain
     * @throws IOException if the native query fails
     */
    Optional<String> metadataItem(String key, String domain) throws IOException;

    /**
     * @param domain metadata domain, empty string for the default domain
     * @return the domain entries as {@code Key=Value} strings in native order, empty if there are none
     * @throws IOException if the native query fails
     */
    List<String> metadata(String domain) throws IOException;

    /**
     * Gets a unique identifier for the dataset, used for logging and debugging purposes.
     *
     * @return the identifier, typically the dataset path
     */
    String getSourceIdentifier();

    /**
     * Releases the native resource. This operation is idempotent.
     */
    @Override
    void close() throws IOException;
}
