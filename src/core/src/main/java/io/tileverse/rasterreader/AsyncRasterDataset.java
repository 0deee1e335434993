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

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Asynchronous view of a {@link RasterDataset}, dispatching every blocking operation to an executor.
 * <p>
 * Failures complete the returned future exceptionally with the same {@link RasterException} the synchronous call
 * would have thrown. The snapshotted accessors are answered synchronously, since they never block. Operations
 * issued through this view share the guard of the underlying dataset, so they are serialized with any other
 * operation on it.
 *
 * <pre>{@code
 * AsyncRasterDataset async = dataset.async(blockingExecutor);
 * async.readWindow(1, RasterWindow.of(0, 0, 256, 256)).thenAccept(this::render);
 * }</pre>
 */
public final class AsyncRasterDataset {

    private final RasterDataset dataset;

    private final Executor executor;

    AsyncRasterDataset(RasterDataset dataset, Executor executor) {
        this.dataset = requireNonNull(dataset, "dataset");
        this.executor = requireNonNull(executor, "executor");
    }

    /**
     * @return the underlying synchronous dataset
     */
    public RasterDataset dataset() {
        return dataset;
    }

    public int bandCount() {
        return dataset.bandCount();
    }

    public RasterSize rasterSize() {
        return dataset.rasterSize();
    }

    public String driverName() {
        return dataset.driverName();
    }

    public CompletableFuture<RasterDataType> bandType(int band) {
        return submit(() -> dataset.bandType(band));
    }

    public CompletableFuture<ByteBuffer> readBand(int band) {
        return submit(() -> dataset.readBand(band));
    }

    public CompletableFuture<ByteBuffer> readWindow(int band, int x, int y, int width, int height) {
        return submit(() -> dataset.readWindow(band, x, y, width, height));
    }

    public CompletableFuture<ByteBuffer> readWindow(int band, RasterWindow window) {
        return submit(() -> dataset.readWindow(band, window));
    }

    /**
     * Reads into {@code target} on the executor. The caller must not touch the buffer until the future completes.
     *
     * @return the number of bytes written
     * @see RasterDataset#readWindow(int, RasterWindow, ByteBuffer)
     */
    public CompletableFuture<Integer> readWindow(int band, RasterWindow window, ByteBuffer target) {
        return submit(() -> dataset.readWindow(band, window, target));
    }

    public CompletableFuture<OptionalDouble> noDataValue(int band) {
        return submit(() -> dataset.noDataValue(band));
    }

    public CompletableFuture<GeoTransform> geoTransform() {
        return submit(dataset::geoTransform);
    }

    public CompletableFuture<String> spatialRefWkt() {
        return submit(dataset::spatialRefWkt);
    }

    public CompletableFuture<String> spatialRefProj4() {
        return submit(dataset::spatialRefProj4);
    }

    public CompletableFuture<Optional<String>> metadataItem(String key) {
        return submit(() -> dataset.metadataItem(key));
    }

    public CompletableFuture<Optional<String>> metadataItem(String key, String domain) {
        return submit(() -> dataset.metadataItem(key, domain));
    }

    public CompletableFuture<List<String>> metadataDomains() {
        return submit(dataset::metadataDomains);
    }

    public CompletableFuture<Optional<List<String>>> metadataDomain(String domain) {
        return submit(() -> dataset.metadataDomain(domain));
    }

    public CompletableFuture<Optional<Map<String, String>>> metadata(String domain) {
        return submit(() -> dataset.metadata(domain));
    }

    public CompletableFuture<String> bandDescription(int band) {
        return submit(() -> dataset.bandDescription(band));
    }

    public CompletableFuture<List<String>> bandDescriptions() {
        return submit(dataset::bandDescriptions);
    }

    private <T> CompletableFuture<T> submit(RasterCall<T> call) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(call.call());
                } catch (RasterException | RuntimeException e) {
                    future.completeExceptionally(e);
                } catch (Error e) {
                    future.completeExceptionally(e);
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @FunctionalInterface
    private interface RasterCall<T> {
        T call() throws RasterException;
    }
}
