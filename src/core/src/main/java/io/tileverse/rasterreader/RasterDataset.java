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

import io.tileverse.rasterreader.ExclusiveAccessGuard.ScopedAccess;
import io.tileverse.rasterreader.spi.RasterDatasetConfig;
import io.tileverse.rasterreader.spi.RasterHandle;
import io.tileverse.rasterreader.spi.RasterHandleProvider;
import io.tileverse.rasterreader.spi.SpatialReferenceFormat;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * A thread-safe, read-only view of a raster dataset opened by a native raster library.
 * <p>
 * A {@code RasterDataset} exclusively owns one native {@link RasterHandle}. Native handles are not safe for
 * concurrent use, so every operation that reaches the handle holds an exclusive guard for its whole duration:
 * operations on the same dataset are serialized, in no particular order among waiting threads, while distinct
 * datasets are fully independent. A single thread's operations observe a linear history.
 * <p>
 * The driver name, band count and raster size are snapshotted when the dataset is opened. Their accessors never
 * block and never touch the native library.
 *
 * <h2>Blocking</h2>
 * <p>Every other operation may perform native file I/O and block, including waiting for the guard. Callers running
 * on latency sensitive threads should dispatch them to an executor meant for blocking work, see
 * {@link #async(Executor)}.
 *
 * <h2>Errors</h2>
 * <p>Failures are reported as {@link RasterException}s tagged with a {@link RasterErrorKind}. Values that may be
 * legitimately absent, like an unset metadata key or a band without no-data value, are reported as empty
 * {@code Optional}s. A failed read never returns partial data.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (RasterDataset dataset = RasterDataset.open("data/dem.tif")) {
 *     RasterSize size = dataset.rasterSize();
 *     RasterDataType type = dataset.bandType(1);
 *     ByteBuffer pixels = dataset.readWindow(1, 0, 0, 256, 256);
 *     GeoTransform transform = dataset.geoTransform();
 * }
 * }</pre>
 *
 * Closing the dataset waits for any in-flight operation, releases the native handle, and makes any further
 * guarded operation fail with {@link RasterErrorKind#IO_FAILURE}.
 */
@Slf4j
public final class RasterDataset implements Closeable {

    private final Path path;

    private final String driverName;

    private final int bandCount;

    private final RasterSize rasterSize;

    private final ExclusiveAccessGuard guard;

    private final BandTypeResolver bandTypes;

    private final WindowReader windowReader;

    private volatile boolean closed;

    private RasterDataset(
            Path path, String driverName, int bandCount, RasterSize rasterSize, ExclusiveAccessGuard guard) {
        this.path = path;
        this.driverName = driverName;
        this.bandCount = bandCount;
        this.rasterSize = rasterSize;
        this.guard = guard;
        this.bandTypes = new BandTypeResolver(bandCount);
        this.windowReader = new WindowReader(rasterSize, bandTypes);
    }

    /**
     * Opens the dataset at the given path with the best available {@link RasterHandleProvider}.
     * <p>
     * A leading {@code ~} is expanded to the user home directory, and the path is made absolute and normalized.
     *
     * @param path the dataset path
     * @return the opened dataset
     * @throws RasterException {@link RasterErrorKind#NOT_FOUND} if the file doesn't exist or can't be read,
     *     {@link RasterErrorKind#UNSUPPORTED_FORMAT} if no driver recognizes it, {@link RasterErrorKind#IO_FAILURE}
     *     for any other native failure
     * @throws IllegalStateException if no raster provider is available
     */
    public static RasterDataset open(String path) throws RasterException {
        requireNonNull(path, "path");
        RasterDatasetConfig config;
        try {
            config = new RasterDatasetConfig().path(path);
        } catch (InvalidPathException e) {
            throw new RasterException(
                    RasterErrorKind.NOT_FOUND, "Invalid path '%s': %s".formatted(path, e.getMessage()), e);
        }
        return open(config);
    }

    /**
     * Opens the dataset at the given path with the best available {@link RasterHandleProvider}.
     *
     * @param path the dataset path
     * @return the opened dataset
     * @throws RasterException if the dataset can't be opened, see {@link #open(String)}
     * @throws IllegalStateException if no raster provider is available
     */
    public static RasterDataset open(Path path) throws RasterException {
        return open(new RasterDatasetConfig().path(path));
    }

    /**
     * Opens a dataset as configured, selecting the provider through {@link RasterDatasetFactory}.
     *
     * @param config the dataset configuration
     * @return the opened dataset
     * @throws RasterException if the dataset can't be opened, see {@link #open(String)}
     * @throws IllegalStateException if no suitable raster provider is found
     */
    public static RasterDataset open(RasterDatasetConfig config) throws RasterException {
        return RasterDatasetFactory.open(config);
    }

    /**
     * Opens the dataset at the given path with a specific provider.
     *
     * @param path the dataset path
     * @param provider the provider to open the native handle with
     * @return the opened dataset
     * @throws RasterException if the dataset can't be opened, see {@link #open(String)}
     */
    public static RasterDataset open(Path path, RasterHandleProvider provider) throws RasterException {
        return open(new RasterDatasetConfig().path(path), provider);
    }

    /**
     * Opens a dataset as configured with a specific provider.
     * <p>
     * The native handle is opened, then the band count, raster size and driver name are read under a single
     * exclusive access and snapshotted. If any of these queries fails, the handle is released before the failure is
     * reported.
     *
     * @param config the dataset configuration, its path must be set
     * @param provider the provider to open the native handle with
     * @return the opened dataset
     * @throws RasterException if the dataset can't be opened, see {@link #open(String)}
     */
    public static RasterDataset open(RasterDatasetConfig config, RasterHandleProvider provider)
            throws RasterException {
        requireNonNull(config, "config");
        requireNonNull(provider, "provider");
        final Path path = requireNonNull(config.path(), "config path is not set");

        RasterHandle handle;
        try {
            handle = requireNonNull(provider.open(config), "provider returned a null handle");
        } catch (RuntimeException e) {
            throw RasterErrors.normalize("open", path.toString(), e);
        }

        ExclusiveAccessGuard guard = new ExclusiveAccessGuard(handle);
        RasterDataset dataset;
        try (ScopedAccess access = guard.acquire()) {
            RasterHandle h = access.handle();
            int bandCount = h.bandCount();
            if (bandCount < 0) {
                throw new RasterException(RasterErrorKind.IO_FAILURE, "Negative band count: " + bandCount);
            }
            RasterSize size = new RasterSize(h.rasterWidth(), h.rasterHeight());
            String driver = requireNonNull(h.driverShortName(), "driver short name");
            dataset = new RasterDataset(path, driver, bandCount, size, guard);
        } catch (IOException | RuntimeException e) {
            RasterException failure = RasterErrors.normalize("open", path.toString(), e);
            release(handle, failure);
            throw failure;
        }
        log.debug(
                "Opened raster dataset {} with {} driver ({}, {} bands) using provider '{}'",
                path,
                dataset.driverName,
                dataset.rasterSize,
                dataset.bandCount,
                provider.getId());
        return dataset;
    }

    private static void release(RasterHandle handle, RasterException failure) {
        try {
            handle.close();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to release native handle of {} after a failed open", handle.getSourceIdentifier(), e);
            failure.addSuppressed(e);
        }
    }

    /**
     * @return the canonical path the dataset was opened from
     */
    public Path path() {
        return path;
    }

    /**
     * @return the short name of the native driver, e.g. {@code GTiff}
     */
    public String driverName() {
        return driverName;
    }

    /**
     * @return the number of bands, fixed at open time
     */
    public int bandCount() {
        return bandCount;
    }

    /**
     * @return the raster extent in pixels, fixed at open time
     */
    public RasterSize rasterSize() {
        return rasterSize;
    }

    /**
     * @return the dataset summary
     */
    public RasterDatasetInfo info() {
        return new RasterDatasetInfo(path, driverName, bandCount, rasterSize);
    }

    /**
     * Returns the pixel datatype of a band.
     *
     * @param band 1-based band index
     * @return the band datatype, {@link RasterDataType#UNKNOWN} for native types with no portable counterpart
     * @throws RasterException {@link RasterErrorKind#INVALID_BAND_INDEX} if {@code band} is out of range
     */
    public RasterDataType bandType(int band) throws RasterException {
        return withHandle("bandType", handle -> bandTypes.resolve(handle, band));
    }

    /**
     * Reads a whole band, equivalent to {@code readWindow(band, 0, 0, width, height)}.
     *
     * @param band 1-based band index
     * @return the pixels, see {@link #readWindow(int, RasterWindow)}
     * @throws RasterException see {@link #readWindow(int, RasterWindow)}
     */
    public ByteBuffer readBand(int band) throws RasterException {
        return readWindow(band, RasterWindow.full(rasterSize));
    }

    /**
     * Reads a rectangular pixel window of a band.
     *
     * @param band 1-based band index
     * @param x column of the top-left pixel
     * @param y row of the top-left pixel
     * @param width number of columns, non-negative
     * @param height number of rows, non-negative
     * @return the pixels, see {@link #readWindow(int, RasterWindow)}
     * @throws RasterException see {@link #readWindow(int, RasterWindow)}
     * @throws IllegalArgumentException if {@code width} or {@code height} is negative
     */
    public ByteBuffer readWindow(int band, int x, int y, int width, int height) throws RasterException {
        return readWindow(band, RasterWindow.of(x, y, width, height));
    }

    /**
     * Reads a rectangular pixel window of a band.
     * <p>
     * The returned buffer holds exactly {@code width * height * bandType(band).byteWidth()} bytes: pixels in the
     * band's native datatype and the platform's native byte order, row-major, top-to-bottom and left-to-right,
     * without unit conversion nor no-data masking. Its byte order is set to {@link java.nio.ByteOrder#nativeOrder()}
     * so typed views like {@link ByteBuffer#asDoubleBuffer()} decode it directly. Reading the same window of an
     * unmodified file twice yields identical bytes.
     *
     * @param band 1-based band index
     * @param window the pixel window
     * @return a buffer positioned at 0 with its limit at the window byte length
     * @throws RasterException {@link RasterErrorKind#INVALID_BAND_INDEX}, {@link RasterErrorKind#WINDOW_OUT_OF_BOUNDS}
     *     if the window exceeds the raster extent, {@link RasterErrorKind#UNSUPPORTED_DATATYPE} if the band datatype
     *     has no fixed width, {@link RasterErrorKind#IO_FAILURE} if the native read fails
     */
    public ByteBuffer readWindow(int band, RasterWindow window) throws RasterException {
        requireNonNull(window, "window");
        return withHandle("readWindow", handle -> windowReader.read(handle, band, window));
    }

    /**
     * Reads a rectangular pixel window of a band into the provided buffer.
     * <p>
     * Following standard NIO conventions, the target position is advanced by the number of bytes written and its
     * limit is left unchanged; the caller must {@code flip()} it before consuming. The bytes are laid out as
     * described in {@link #readWindow(int, RasterWindow)}, and the target byte order is not modified. If the read
     * fails the target position is left unchanged.
     *
     * @param band 1-based band index
     * @param window the pixel window
     * @param target the buffer to write into, starting at its current position
     * @return the number of bytes written
     * @throws RasterException see {@link #readWindow(int, RasterWindow)}
     * @throws IllegalArgumentException if the target has insufficient remaining capacity
     * @throws ReadOnlyBufferException if the target is read-only
     */
    public int readWindow(int band, RasterWindow window, ByteBuffer target) throws RasterException {
        requireNonNull(window, "window");
        requireNonNull(target, "target");
        return withHandle("readWindow", handle -> windowReader.read(handle, band, window, target));
    }

    /**
     * @param band 1-based band index
     * @return the band no-data value, or empty if the band has none
     * @throws RasterException {@link RasterErrorKind#INVALID_BAND_INDEX} if {@code band} is out of range
     */
    public OptionalDouble noDataValue(int band) throws RasterException {
        return withHandle("noDataValue", handle -> {
            BandIndex.check(band, bandCount);
            OptionalDouble value = handle.noDataValue(band);
            return value == null ? OptionalDouble.empty() : value;
        });
    }

    /**
     * Returns the affine pixel to georeferenced coordinates transform. The coefficients are read from the native
     * library on every call. Datasets without georeferencing report the native default transform.
     *
     * @return the geo transform
     * @throws RasterException {@link RasterErrorKind#MALFORMED_TRANSFORM} if the native library doesn't return
     *     exactly 6 coefficients
     */
    public GeoTransform geoTransform() throws RasterException {
        return withHandle("geoTransform", GeoTransformTranslator::read);
    }

    /**
     * @return the spatial reference as OGC Well Known Text
     * @throws RasterException {@link RasterErrorKind#NO_SPATIAL_REFERENCE} if the dataset has no projection
     */
    public String spatialRefWkt() throws RasterException {
        return withHandle("spatialRefWkt", h -> MetadataAccessor.spatialReference(h, SpatialReferenceFormat.WKT));
    }

    /**
     * @return the spatial reference as a PROJ.4 string
     * @throws RasterException {@link RasterErrorKind#NO_SPATIAL_REFERENCE} if the dataset has no projection
     */
    public String spatialRefProj4() throws RasterException {
        return withHandle("spatialRefProj4", h -> MetadataAccessor.spatialReference(h, SpatialReferenceFormat.PROJ4));
    }

    /**
     * Reads a metadata item of the default domain.
     *
     * @param key metadata key
     * @return the value, or empty if the key is not set
     * @throws RasterException if the native query fails
     */
    public Optional<String> metadataItem(String key) throws RasterException {
        return metadataItem(key, MetadataAccessor.DEFAULT_DOMAIN);
    }

    /**
     * Reads a metadata item.
     *
     * @param key metadata key
     * @param domain metadata domain, empty string for the default domain
     * @return the value, or empty if the key is not set in the domain
     * @throws RasterException {@link RasterErrorKind#NO_SUCH_DOMAIN} if the domain does not exist
     */
    public Optional<String> metadataItem(String key, String domain) throws RasterException {
        requireNonNull(key, "key");
        requireNonNull(domain, "domain");
        return withHandle("metadataItem", handle -> MetadataAccessor.item(handle, key, domain));
    }

    /**
     * Lists the metadata domains of the dataset. The default domain is named by the empty string and is listed
     * whenever it has entries.
     *
     * @return the domain names
     * @throws RasterException if the native query fails
     */
    public List<String> metadataDomains() throws RasterException {
        return withHandle("metadataDomains", MetadataAccessor::domains);
    }

    /**
     * Returns all the entries of a metadata domain.
     *
     * @param domain metadata domain, empty string for the default domain
     * @return the entries as {@code Key=Value} strings in native order, or empty if the domain doesn't exist
     * @throws RasterException if the native query fails
     */
    public Optional<List<String>> metadataDomain(String domain) throws RasterException {
        requireNonNull(domain, "domain");
        return withHandle("metadataDomain", handle -> MetadataAccessor.domain(handle, domain));
    }

    /**
     * Returns the entries of a metadata domain as a map, keeping native order.
     *
     * @param domain metadata domain, empty string for the default domain
     * @return the entries, or empty if the domain doesn't exist
     * @throws RasterException if the native query fails
     */
    public Optional<Map<String, String>> metadata(String domain) throws RasterException {
        return metadataDomain(domain).map(MetadataAccessor::toMap);
    }

    /**
     * @param band 1-based band index
     * @return the band description, empty string if unset
     * @throws RasterException {@link RasterErrorKind#INVALID_BAND_INDEX} if {@code band} is out of range
     */
    public String bandDescription(int band) throws RasterException {
        return withHandle("bandDescription", handle -> MetadataAccessor.description(handle, band, bandCount));
    }

    /**
     * Reads the descriptions of all bands, in ascending band order. Fails on the first band whose description can't
     * be read, rather than returning a partial list.
     *
     * @return the band descriptions
     * @throws RasterException if a native query fails
     */
    public List<String> bandDescriptions() throws RasterException {
        return withHandle("bandDescriptions", handle -> MetadataAccessor.descriptions(handle, bandCount));
    }

    /**
     * Returns a view of this dataset whose blocking operations run on the given executor.
     *
     * @param executor an executor meant for blocking work
     * @return the asynchronous view, sharing this dataset
     */
    public AsyncRasterDataset async(Executor executor) {
        return new AsyncRasterDataset(this, executor);
    }

    /**
     * @return {@code true} once {@link #close()} has been called
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Releases the native handle, waiting for any in-flight operation to complete first. This operation is
     * idempotent.
     *
     * @throws IOException if the native library fails to release the handle
     */
    @Override
    public void close() throws IOException {
        try (ScopedAccess access = guard.acquire()) {
            if (closed) {
                return;
            }
            closed = true;
            try {
                access.handle().close();
            } catch (IOException | RuntimeException e) {
                throw RasterErrors.normalize("close", path.toString(), e);
            }
        }
        log.debug("Closed raster dataset {}", path);
    }

    @Override
    public String toString() {
        return "RasterDataset[%s, %s, %s, %d bands%s]"
                .formatted(path, driverName, rasterSize, bandCount, closed ? ", closed" : "");
    }

    /**
     * Runs an operation against the handle while holding exclusive access, normalizing its failures.
     */
    private <T> T withHandle(String operation, HandleOperation<T> op) throws RasterException {
        try (ScopedAccess access = guard.acquire()) {
            if (closed) {
                throw RasterErrors.closed(path.toString());
            }
            try {
                return op.apply(access.handle());
            } catch (IllegalArgumentException | ReadOnlyBufferException e) {
                // caller errors on the target buffer
                throw e;
            } catch (IOException | RuntimeException e) {
                throw RasterErrors.normalize(operation, path.toString(), e);
            }
        }
    }

    @FunctionalInterface
    private interface HandleOperation<T> {
        T apply(RasterHandle handle) throws IOException;
    }
}
