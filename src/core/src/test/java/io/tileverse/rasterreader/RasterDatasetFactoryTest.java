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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import io.tileverse.rasterreader.spi.RasterDatasetConfig;
import io.tileverse.rasterreader.spi.RasterHandleProvider;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RasterDatasetFactoryTest {

    @TempDir
    Path tempDir;

    @Mock
    private RasterHandleProvider first;

    @Mock
    private RasterHandleProvider second;

    @AfterEach
    void tearDown() {
        SyntheticRasterHandleProvider.clear();
        System.clearProperty(SyntheticRasterHandleProvider.ENABLED_KEY);
    }

    // not every selection path asks for the order or the id
    private static RasterHandleProvider stub(RasterHandleProvider provider, String id, int order, boolean canOpen) {
        lenient().when(provider.getId()).thenReturn(id);
        lenient().when(provider.getOrder()).thenReturn(order);
        lenient().when(provider.canOpen(any())).thenReturn(canOpen);
        return provider;
    }

    @Test
    void testSingleCandidate() {
        RasterHandleProvider gdal = stub(first, "gdal", 0, true);
        RasterHandleProvider other = stub(second, "other", -10, false);
        RasterDatasetConfig config = new RasterDatasetConfig().path(tempDir.resolve("a.tif"));

        assertSame(gdal, RasterDatasetFactory.findBestProvider(config, List.of(other, gdal)));
    }

    @Test
    void testLowestOrderWins() {
        RasterHandleProvider low = stub(first, "low", -1, true);
        RasterHandleProvider high = stub(second, "high", 10, true);
        RasterDatasetConfig config = new RasterDatasetConfig().path(tempDir.resolve("a.tif"));

        assertSame(low, RasterDatasetFactory.findBestProvider(config, List.of(high, low)));
    }

    @Test
    void testAmbiguousProviders() {
        RasterDatasetConfig config = new RasterDatasetConfig().path(tempDir.resolve("a.tif"));
        List<RasterHandleProvider> providers = List.of(stub(first, "one", 0, true), stub(second, "two", 0, true));

        assertThatThrownBy(() -> RasterDatasetFactory.findBestProvider(config, providers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("one, two");
    }

    @Test
    void testNoCandidate() {
        RasterDatasetConfig config = new RasterDatasetConfig().path(tempDir.resolve("a.tif"));
        List<RasterHandleProvider> providers = List.of(stub(first, "one", 0, false));

        assertThatThrownBy(() -> RasterDatasetFactory.findBestProvider(config, providers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No suitable provider");
    }

    @Test
    void testServiceLoaderDiscovery() {
        assertThat(RasterHandleProvider.findProvider("synthetic")).isPresent();
        assertThat(RasterHandleProvider.findProvider("SYNTHETIC")).isPresent();
        assertThat(RasterHandleProvider.getAvailableProviders())
                .extracting(RasterHandleProvider::getId)
                .contains(SyntheticRasterHandleProvider.ID);
    }

    @Test
    void testForcedProvider() {
        RasterDatasetConfig config =
                new RasterDatasetConfig().path(tempDir.resolve("a.tif")).providerId(SyntheticRasterHandleProvider.ID);
        assertEquals(SyntheticRasterHandleProvider.ID, RasterDatasetFactory.findBestProvider(config).getId());
    }

    @Test
    void testForcedProviderNotFound() {
        RasterDatasetConfig config = new RasterDatasetConfig().path(tempDir.resolve("a.tif")).providerId("nope");
        assertThatThrownBy(() -> RasterDatasetFactory.findBestProvider(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void testForcedProviderDisabled() {
        System.setProperty(SyntheticRasterHandleProvider.ENABLED_KEY, "false");
        RasterDatasetConfig config =
                new RasterDatasetConfig().path(tempDir.resolve("a.tif")).providerId(SyntheticRasterHandleProvider.ID);
        assertThatThrownBy(() -> RasterDatasetFactory.findBestProvider(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not available");
    }

    @Test
    void testOpenFromProperties() throws IOException {
        Path path = tempDir.resolve("props.tif");
        SyntheticRasterHandleProvider.register(path, new SyntheticRasterHandle("props.tif").size(10, 20));

        Properties properties = new Properties();
        properties.setProperty(RasterDatasetConfig.PATH_KEY, path.toString());
        try (RasterDataset dataset = RasterDatasetFactory.open(properties)) {
            assertEquals(new RasterSize(10, 20), dataset.rasterSize());
            assertEquals(path, dataset.path());
        }
    }

    @Test
    void testOpenFromPathString() throws IOException {
        Path path = tempDir.resolve("string.tif");
        SyntheticRasterHandle handle = new SyntheticRasterHandle("string.tif");
        SyntheticRasterHandleProvider.register(path, handle);

        try (RasterDataset dataset = RasterDataset.open(path.toString())) {
            assertEquals("SYNTH", dataset.driverName());
        }
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    void testProviderRuntimeFailureIsNormalized() throws RasterException {
        RasterHandleProvider broken = stub(first, "broken", 0, true);
        when(broken.open(any())).thenThrow(new IllegalStateException("native library crashed"));
        RasterDatasetConfig config = new RasterDatasetConfig().path(tempDir.resolve("a.tif"));

        assertThatThrownBy(() -> RasterDataset.open(config, broken))
                .isInstanceOfSatisfying(
                        RasterException.class, e -> assertThat(e.kind()).isEqualTo(RasterErrorKind.IO_FAILURE))
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
