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

import io.tileverse.rasterreader.RasterException;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.stream.Stream;

/**
 * Service provider interface for native raster libraries able to open a {@link RasterHandle}.
 * <p>
 * Implementations are discovered through the standard Java {@link ServiceLoader} mechanism, by listing them in
 * {@code META-INF/services/io.tileverse.rasterreader.spi.RasterHandleProvider}.
 */
public interface RasterHandleProvider {

    /**
     * Returns the unique identifier for this provider.
     *
     * @return The unique ID.
     */
    String getId();

    /**
     * Returns a human-readable description of this provider.
     *
     * @return The description.
     */
    String getDescription();

    /**
     * Checks if this provider is available in the current environment, for example whether its native library
     * could be loaded and it hasn't been disabled through a configuration flag.
     *
     * @return {@code true} if available, {@code false} otherwise.
     */
    boolean isAvailable();

    /**
     * Gets the order value of this provider. Lower values have higher priority.
     * The default priority is 0.
     *
     * @return The order value.
     */
    default int getOrder() {
        return 0;
    }

    /**
     * Performs a fast check, without I/O, to see if this provider can likely open the configured dataset.
     *
     * @param config The configuration to check.
     * @return {@code true} if this provider can likely handle the config, {@code false} otherwise.
     */
    boolean canOpen(RasterDatasetConfig config);

    /**
     * Opens the configured dataset.
     * <p>
     * Implementations must not leak the native resource: if anything fails after the native open succeeded, the
     * handle is released before the exception is thrown.
     *
     * @param config The configuration, its {@link RasterDatasetConfig#path() path} is already canonical.
     * @return A new {@link RasterHandle}, exclusively owned by the caller.
     * @throws RasterException If the dataset can't be opened.
     */
    RasterHandle open(RasterDatasetConfig config) throws RasterException;

    /**
     * Checks if a feature is enabled via a system property or environment variable.
     * The check is case-sensitive. The property is checked first, then the environment variable.
     * If neither is set, it defaults to {@code true}.
     *
     * @param key The key for the system property/environment variable.
     * @return {@code true} if enabled, {@code false} otherwise.
     */
    static boolean isEnabled(String key) {
        String enabled = System.getProperty(key);
        if (enabled == null) {
            enabled = System.getenv(key);
        }
        return enabled == null ? true : Boolean.parseBoolean(enabled);
    }

    /**
     * Finds all {@link RasterHandleProvider} implementations using the {@link ServiceLoader}.
     *
     * @return A stream of providers.
     */
    static Stream<RasterHandleProvider> findProviders() {
        ServiceLoader<RasterHandleProvider> loader = ServiceLoader.load(RasterHandleProvider.class);
        return loader.stream().map(Provider::get);
    }

    /**
     * Returns all {@link RasterHandleProvider}s registered through the standard Java SPI mechanism
     * that are {@link RasterHandleProvider#isAvailable() available}.
     *
     * @return A list of available providers.
     */
    static List<RasterHandleProvider> getAvailableProviders() {
        return findProviders().filter(RasterHandleProvider::isAvailable).toList();
    }

    /**
     * Finds a specific {@link RasterHandleProvider} by its ID.
     *
     * @param providerId The ID of the provider to find.
     * @return An {@link Optional} containing the provider if found, otherwise empty.
     */
    static Optional<RasterHandleProvider> findProvider(String providerId) {
        return findProviders()
                .filter(p -> p.getId().equalsIgnoreCase(providerId))
                .findFirst();
    }

    /**
     * Retrieves a specific {@link RasterHandleProvider} by its ID, with an option to check for availability.
     *
     * @param providerId The ID of the provider to retrieve.
     * @param available  If {@code true}, the method will throw an exception if the provider is not available.
     * @return The requested {@link RasterHandleProvider}.
     * @throws IllegalStateException if the provider is not found, or if {@code available} is true and the provider
     *     is not available.
     */
    static RasterHandleProvider getProvider(String providerId, boolean available) {
        RasterHandleProvider provider = findProvider(providerId)
                .orElseThrow(() ->
                        new IllegalStateException("The specified RasterHandleProvider is not found: " + providerId));

        if (available && !provider.isAvailable()) {
            throw new IllegalStateException("The specified RasterHandleProvider is not available: " + providerId);
        }
        return provider;
    }
}
