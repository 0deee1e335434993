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

import io.tileverse.rasterreader.RasterException;
import io.tileverse.rasterreader.spi.RasterDatasetConfig;
import io.tileverse.rasterreader.spi.RasterHandle;
import io.tileverse.rasterreader.spi.RasterHandleProvider;

/**
 * A {@link RasterHandleProvider} opening datasets with the GDAL Java bindings.
 */
public class GdalRasterHandleProvider implements RasterHandleProvider {

    /**
     * Key used as environment variable name to disable this raster provider
     * <pre>
     * {@code export IO_TILEVERSE_RASTERREADER_GDAL=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_TILEVERSE_RASTERREADER_GDAL";

    /**
     * This provider's {@link #getId() unique identifier}
     */
    public static final String ID = "gdal";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Reads raster datasets in any format supported by the GDAL native library.";
    }

    /**
     * @return {@code true} unless disabled through {@link #ENABLED_KEY} or the GDAL native library can't be loaded
     */
    @Override
    public boolean isAvailable() {
        return RasterHandleProvider.isEnabled(ENABLED_KEY) && GdalRuntime.isAvailable();
    }

    @Override
    public boolean canOpen(RasterDatasetConfig config) {
        if (config.path() == null) {
            return false;
        }
        return config.providerId().map(ID::equalsIgnoreCase).orElse(true);
    }

    @Override
    public RasterHandle open(RasterDatasetConfig config) throws RasterException {
        return GdalRasterHandle.open(config);
    }
}
