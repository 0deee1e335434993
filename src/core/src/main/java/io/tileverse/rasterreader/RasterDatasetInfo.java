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

import java.nio.file.Path;

/**
 * Summary of an opened dataset, snapshotted at open time.
 *
 * @param path canonical path of the dataset
 * @param driverName short name of the native driver, e.g. {@code GTiff}
 * @param bandCount number of bands
 * @param rasterSize raster extent in pixels
 */
public record RasterDatasetInfo(Path path, String driverName, int bandCount, RasterSize rasterSize) {}
