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
 * GDAL backed raster provider.
 * <p>
 * Requires the GDAL native library and its JNI bindings ({@code libgdalalljni}) on the library path. When they're
 * missing the provider reports itself unavailable. Set {@code IO_TILEVERSE_RASTERREADER_GDAL=false} to disable it.
 */
package io.tileverse.rasterreader.gdal;
