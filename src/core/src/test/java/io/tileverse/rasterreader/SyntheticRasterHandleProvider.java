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

import io.tileverse.rasterreader.spi.RasterDatasetConfig;
import io.tileverse.rasterreader.spi.RasterHandle;
import io.tileverse.rasterreader.spi.RasterHandleProvider;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test provider serving {@link SyntheticRasterHandle}s registered by path. Registered through
 * {@code META-INF/services} so {@link RasterHandleProvider} discovery can be exercised without native libraries.
 */
public class SyntheticRasterHandleProvider implements RasterHandleProvider {

    public static final String ID = "synthetic";

    public static final String ENABLED_KEY = "IO_TILEVERSE_RASTERREADER_SYNTHETIC";

    private static final Map<Path, SyntheticRasterHandle> HANDLES = new ConcurrentHashMap<>();

    /**
     * Serves {@code handle} on the next open of {@code path}.
     */
    public static void register(Path path, SyntheticRasterHandle handle) {
        HANDLES.put(path.toAbsolutePath().normalize(), handle);
    }

    public static void clear() {
        HANDLES.clear();
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Serves in-memory test rasters";
    }

    @Override
    public boolean isAvailable() {
        return RasterHandleProvider.isEnabled(ENABLED_KEY);
    }

    @Override
    public boolean canOpen(RasterDatasetConfig config) {
        return config.path() != null;
    }

    @Override
    public RasterHandle open(RasterDatasetConfig config) throws RasterException {
        SyntheticRasterHandle handle = HANDLES.remove(config.path());
        if (handle == null) {
            throw new RasterException(RasterErrorKind.NOT_FOUND, "No synthetic raster registered at " + config.path());
        }
        return handle;
    }
}
