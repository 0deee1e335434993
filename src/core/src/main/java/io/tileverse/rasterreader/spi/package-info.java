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

/**
 * Service provider interface for native raster libraries.
 * <p>
 * A {@link io.tileverse.rasterreader.spi.RasterHandleProvider} opens a
 * {@link io.tileverse.rasterreader.spi.RasterHandle}, the thin, non-thread-safe bridge to one native dataset. Handles
 * are never used directly by applications: {@link io.tileverse.rasterreader.RasterDataset} owns them and serializes
 * every call.
 *
 * <h2>Registering a provider</h2>
 * <p>Providers are discovered with {@link java.util.ServiceLoader}, listing the implementation class in
 * {@code META-INF/services/io.tileverse.rasterreader.spi.RasterHandleProvider}. Each provider can be disabled with a
 * system property or environment variable, see
 * {@link io.tileverse.rasterreader.spi.RasterHandleProvider#isEnabled(String)}.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * RasterDatasetConfig config = new RasterDatasetConfig()
 *         .path("~/data/dem.tif")
 *         .providerId("gdal")
 *         .allowedDrivers("GTiff", "COG")
 *         .openOption("NUM_THREADS", "ALL_CPUS");
 *
 * try (RasterDataset dataset = RasterDatasetFactory.open(config)) {
 *     ...
 * }
 * }</pre>
 */
package io.tileverse.rasterreader.spi;
