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
package io.tileverse.rasterreader.gdal;

import static java.util.Objects.requireNonNull;

import io.tileverse.rasterreader.RasterDataType;
import io.tileverse.rasterreader.RasterErrorKind;
import io.tileverse.rasterreader.RasterException;
import io.tileverse.rasterreader.RasterWindow;
import io.tileverse.rasterreader.spi.RasterDatasetConfig;
import io.tileverse.rasterreader.spi.RasterHandle;
import io.tileverse.rasterreader.spi.SpatialReferenceFormat;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Vector;
import lombok.extern.slf4j.Slf4j;
import org.gdal.gdal.Band;
import org.gdal.gdal.Dataset;
import org.gdal.gdal.gdal;
import org.gdal.gdalconst.gdalconstConstants;
import org.gdal.osr.SpatialReference;

/**
 * {@link RasterHandle} over a GDAL {@link Dataset} opened read-only.
 * <p>
 * Like the underlying GDAL dataset, instances are not thread-safe. GDAL errors are collected from its last-error
 * state right after each native call, so callers must not interleave calls to a handle with other GDAL calls on the
 * same thread.
 */
@Slf4j
final class GdalRasterHandle implements RasterHandle {

    private static final int CE_NONE = 0;

    private final Path path;

    private Dataset dataset;

    private GdalRasterHandle(Path path, Dataset dataset) {
        this.path = path;
        this.dataset = dataset;
    }

    /**
     * Opens a GDAL raster dataset read-only, restricted to the configured drivers and passing the configured open
     * options.
     *
     * @param config the dataset configuration
     * @return the handle
     * @throws RasterException if GDAL fails to open the dataset
     */
    static GdalRasterHandle open(RasterDatasetConfig config) throws RasterException {
        GdalRuntime.ensureInitialized();
        final Path path = requireNonNull(config.path(), "path");
        final long flags =
                gdalconstConstants.OF_RASTER | gdalconstConstants.OF_READONLY | gdalconstConstants.OF_VERBOSE_ERROR;
        Vector<String> allowedDrivers = toVector(config.allowedDrivers());
        Vector<String> openOptions = toVector(config.openOptions());

        GdalErrors.reset();
        Dataset dataset;
        try {
            dataset = gdal.OpenEx(path.toString(), flags, allowedDrivers, openOptions);
        } catch (RuntimeException e) {
            // raised instead of returning null when GDAL exceptions are enabled
            RasterException failure = GdalErrors.lastOpenFailure(path);
            failure.initCause(e);
            throw failure;
        }
        if (dataset == null) {
            throw GdalErrors.lastOpenFailure(path);
        }
        log.trace("GDAL opened {}", path);
        return new GdalRasterHandle(path, dataset);
    }

    private static Vector<String> toVector(List<String> values) {
        return values.isEmpty() ? null : new Vector<>(values);
    }

    @Override
    public int bandCount() throws RasterException {
        return dataset().getRasterCount();
    }

    @Override
    public int rasterWidth() throws RasterException {
        return dataset().getRasterXSize();
    }

    @Override
    public int rasterHeight() throws RasterException {
        return dataset().getRasterYSize();
    }

    @Override
    public String driverShortName() throws RasterException {
        return dataset().GetDriver().getShortName();
    }

    @Override
    public RasterDataType dataType(int band) throws RasterException {
        return GdalDataTypes.toRasterDataType(band(band).getDataType());
    }

    @Override
    public OptionalDouble noDataValue(int band) throws RasterException {
        Double[] value = new Double[1];
        band(band).GetNoDataValue(value);
        return value[0] == null ? OptionalDouble.empty() : OptionalDouble.of(value[0]);
    }

    @Override
    public String description(int band) throws RasterException {
        String description = band(band).GetDescription();
        return description == null ? "" : description;
    }

    /**
     * Reads through an intermediate array, GDAL writes it in the band datatype and native byte order.
     */
    @Override
    public int readWindow(int band, RasterWindow window, ByteBuffer target) throws RasterException {
        Band rasterBand = band(band);
        final int gdalType = rasterBand.getDataType();
        RasterDataType type = GdalDataTypes.toRasterDataType(gdalType);
        if (!type.isSized()) {
            throw new RasterException(
                    RasterErrorKind.UNSUPPORTED_DATATYPE,
                    "Band %d of %s has unsupported GDAL datatype %s"
                            .formatted(band, path, gdal.GetDataTypeName(gdalType)));
        }
        final byte[] data = new byte[Math.toIntExact(window.pixelCount() * type.byteWidth())];
        GdalErrors.reset();
        int result = rasterBand.ReadRaster(
                window.x(),
                window.y(),
                window.width(),
                window.height(),
                window.width(),
                window.height(),
                gdalType,
                data);
        if (result != CE_NONE) {
            throw GdalErrors.lastReadFailure("Failed to read window %s of band %d of %s".formatted(window, band, path));
        }
        target.put(data);
        return data.length;
    }

    @Override
    public double[] geoTransform() throws RasterException {
        return dataset().GetGeoTransform();
    }

    @Override
    public Optional<String> spatialReference(SpatialReferenceFormat format) throws RasterException {
        final String wkt = dataset().GetProjectionRef();
        if (wkt == null || wkt.isBlank()) {
            return Optional.empty();
        }
        return switch (format) {
            case WKT -> Optional.of(wkt);
            case PROJ4 -> Optional.of(toProj4(wkt));
        };
    }

    private String toProj4(String wkt) throws RasterException {
        SpatialReference srs = new SpatialReference(wkt);
        try {
            return srs.ExportToProj4();
        } catch (RuntimeException e) {
            throw new RasterException(
                    RasterErrorKind.IO_FAILURE,
                    "Failed to export spatial reference of %s to PROJ.4: %s".formatted(path, e.getMessage()),
                    e);
        } finally {
            srs.delete();
        }
    }

    @Override
    public List<String> metadataDomains() throws RasterException {
        return toStringList(dataset().GetMetadataDomainList());
    }

    @Override
    public Optional<String> metadataItem(String key, String domain) throws RasterException {
        return Optional.ofNullable(dataset().GetMetadataItem(key, domain));
    }

    @Override
    public List<String> metadata(String domain) throws RasterException {
        return toStringList(dataset().GetMetadata_List(domain));
    }

    @SuppressWarnings("rawtypes")
    private static List<String> toStringList(Vector values) {
        if (values == null) {
            return List.of();
        }
        List<String> list = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value != null) {
                list.add(value.toString());
            }
        }
        return list;
    }

    @Override
    public String getSourceIdentifier() {
        return path.toString();
    }

    @Override
    public void close() {
        if (dataset != null) {
            dataset.delete();
            dataset = null;
            log.trace("GDAL closed {}", path);
        }
    }

    private Dataset dataset() throws RasterException {
        if (dataset == null) {
            throw new RasterException(RasterErrorKind.IO_FAILURE, "GDAL dataset is closed: " + path);
        }
        return dataset;
    }

    private Band band(int band) throws RasterException {
        Dataset ds = dataset();
        if (band < 1 || band > ds.getRasterCount()) {
            throw RasterException.invalidBand(band, ds.getRasterCount());
        }
        Band rasterBand = ds.GetRasterBand(band);
        if (rasterBand == null) {
            throw GdalErrors.lastReadFailure("Failed to access band %d of %s".formatted(band, path));
        }
        return rasterBand;
    }
}
