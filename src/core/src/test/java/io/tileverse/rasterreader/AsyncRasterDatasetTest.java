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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AsyncRasterDatasetTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private RasterDataset dataset;
    private AsyncRasterDataset async;

    @BeforeEach
    void setUp() throws RasterException {
        executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "raster-io"));
        Path path = tempDir.resolve("async.tif");
        SyntheticRasterHandleProvider.register(
                path,
                new SyntheticRasterHandle("async.tif")
                        .size(16, 8)
                        .bands(RasterDataType.UINT16)
                        .metadata("", "AREA_OR_POINT=Point")
                        .description(1, "Elevation"));
        dataset = RasterDataset.open(path, new SyntheticRasterHandleProvider());
        async = dataset.async(executor);
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.shutdownNow();
        dataset.close();
        SyntheticRasterHandleProvider.clear();
    }

    @Test
    void testCachedAccessorsAreSynchronous() {
        assertEquals(1, async.bandCount());
        assertEquals(new RasterSize(16, 8), async.rasterSize());
        assertEquals("SYNTH", async.driverName());
        assertThat(async.dataset()).isSameAs(dataset);
    }

    @Test
    void testOperationsRunOnExecutor() throws Exception {
        AtomicInteger dispatched = new AtomicInteger();
        Executor counting = command -> {
            dispatched.incrementAndGet();
            executor.execute(command);
        };
        CompletableFuture<ByteBuffer> read = dataset.async(counting).readBand(1);

        assertEquals(16 * 8 * 2, read.get(5, TimeUnit.SECONDS).remaining());
        assertEquals(1, dispatched.get());
    }

    @Test
    void testOperations() throws Exception {
        assertEquals(RasterDataType.UINT16, async.bandType(1).get(5, TimeUnit.SECONDS));
        assertEquals(Optional.of("Point"), async.metadataItem("AREA_OR_POINT", "").get(5, TimeUnit.SECONDS));
        assertEquals(List.of(""), async.metadataDomains().get(5, TimeUnit.SECONDS));
        assertEquals(Optional.of(Map.of("AREA_OR_POINT", "Point")), async.metadata("").get(5, TimeUnit.SECONDS));
        assertEquals(List.of("Elevation"), async.bandDescriptions().get(5, TimeUnit.SECONDS));
        assertThat(async.noDataValue(1).get(5, TimeUnit.SECONDS)).isEmpty();
        assertEquals(8, async.readWindow(1, RasterWindow.of(0, 0, 2, 2)).get(5, TimeUnit.SECONDS).remaining());
    }

    @Test
    void testOverloads() throws Exception {
        assertEquals(Optional.of("Point"), async.metadataItem("AREA_OR_POINT").get(5, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), async.metadataItem("NONEXISTENT_KEY").get(5, TimeUnit.SECONDS));
        assertEquals(Optional.of(List.of("AREA_OR_POINT=Point")), async.metadataDomain("").get(5, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), async.metadataDomain("NO_SUCH_DOMAIN").get(5, TimeUnit.SECONDS));
        assertEquals("Elevation", async.bandDescription(1).get(5, TimeUnit.SECONDS));

        ByteBuffer expected = dataset.readWindow(1, 3, 2, 4, 2);
        assertEquals(expected, async.readWindow(1, 3, 2, 4, 2).get(5, TimeUnit.SECONDS));
    }

    @Test
    void testReadIntoTarget() throws Exception {
        ByteBuffer target = ByteBuffer.allocate(64).order(ByteOrder.nativeOrder());
        target.position(4);

        int written = async.readWindow(1, RasterWindow.of(1, 1, 2, 3), target).get(5, TimeUnit.SECONDS);

        assertEquals(2 * 3 * 2, written);
        assertEquals(4 + written, target.position());
        target.flip().position(4);
        assertEquals(dataset.readWindow(1, 1, 1, 2, 3), target);
    }

    @Test
    void testFailuresCompleteExceptionally() {
        CompletableFuture<RasterDataType> future = async.bandType(3);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOfSatisfying(
                        RasterException.class,
                        e -> assertThat(e.kind()).isEqualTo(RasterErrorKind.INVALID_BAND_INDEX));
    }

    @Test
    void testMissingSpatialReferenceCompletesExceptionally() {
        assertThatThrownBy(() -> async.spatialRefWkt().get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(RasterException.class);
    }

    @Test
    void testRejectedExecution() {
        executor.shutdown();
        CompletableFuture<?> future = async.geoTransform();

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCauseInstanceOf(RejectedExecutionException.class);
    }
}
