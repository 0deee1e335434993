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

import io.tileverse.rasterreader.spi.RasterDatasetConfig;
import io.tileverse.rasterreader.spi.RasterHandleProvider;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the {@link RasterHandleProvider} that opens a dataset and opens it.
 * <p>
 * An explicit {@link RasterDatasetConfig#providerId() provider id} always wins. Otherwise the available providers
 * that {@link RasterHandleProvider#canOpen(RasterDatasetConfig) can open} the config are ranked by
 * {@link RasterHandleProvider#getOrder() order}, and the lowest one is used.
 */
public final class RasterDatasetFactory {
    private static final Logger logger = LoggerFactory.getLogger(RasterDatasetFactory.class);

    private RasterDatasetFactory() {
        // Private constructor to prevent instantiation of this utility class.
    }

    /**
     * Opens a dataset from a {@link Properties} configuration, see {@link RasterDatasetConfig#fromProperties}.
     *
     * @param config the configuration properties
     * @return the opened dataset
     * @throws RasterException if the dataset can't be opened
     */
    public static RasterDataset open(Properties config) throws RasterException {
        return open(RasterDatasetConfig.fromProperties(requireNonNull(config)));
    }

    /**
     * Opens a dataset with the best provider for the given configuration.
     *
     * @param config the configuration
     * @return the opened dataset
     * @throws RasterException if the dataset can't be opened
     * @throws IllegalStateException if no suitable provider is found
     */
    public static RasterDataset open(RasterDatasetConfig config) throws RasterException {
        RasterHandleProvider provider = findBestProvider(requireNonNull(config));
        return RasterDataset.open(config, provider);
    }

    /**
     * Finds the provider to open the configured dataset with.
     *
     * @param config the configuration
     * @return the selected provider
     * @throws IllegalStateException if no provider matches, if a forced provider is missing or unavailable, or if
     *     several providers match with the same priority
     */
    public static RasterHandleProvider findBestProvider(RasterDatasetConfig config) {
        requireNonNull(config.path(), "config path is null");

        // Explicit Provider ID is the ultimate override.
        if (config.providerId().isPresent()) {
            return RasterHandleProvider.getProvider(config.providerId().orElseThrow(), true);
        }
        return findBestProvider(config, RasterHandleProvider.getAvailableProviders());
    }

    static RasterHandleProvider findBestProvider(RasterDatasetConfig config, List<RasterHandleProvider> available) {
        List<RasterHandleProvider> candidates =
                available.stream().filter(p -> p.canOpen(config)).toList();

        RasterHandleProvider provider =
                switch (candidates.size()) {
                    case 0 -> throw new IllegalStateException("No suitable provider found for " + config.path());
                    case 1 -> candidates.get(0);
                    default -> resolveByPriority(candidates);
                };
        logger.debug("Selected raster provider '{}' for {}", provider.getId(), config.path());
        return provider;
    }

    private static RasterHandleProvider resolveByPriority(List<RasterHandleProvider> candidates) {
        final int highestPriority = candidates.stream()
                .mapToInt(RasterHandleProvider::getOrder)
                .min()
                .orElseThrow(() -> new IllegalStateException("No candidates to resolve by priority."));
        List<RasterHandleProvider> bestCandidates = candidates.stream()
                .filter(p -> p.getOrder() == highestPriority)
                .toList();

        if (bestCandidates.size() > 1) {
            String conflictingIds =
                    bestCandidates.stream().map(RasterHandleProvider::getId).collect(Collectors.joining(", "));
            throw new IllegalStateException("Ambiguous raster provider. Multiple providers matched with the same "
                    + "priority (" + highestPriority + "): [" + conflictingIds + "]. "
                    + "Please specify a provider ID in the RasterDatasetConfig to resolve this ambiguity.");
        }
        return bestCandidates.get(0);
    }
}
