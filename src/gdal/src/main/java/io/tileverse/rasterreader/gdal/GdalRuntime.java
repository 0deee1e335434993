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

import static java.util.Objects.requireNonNull;

import io.tileverse.rasterreader.RasterErrorKind;
import io.tileverse.rasterreader.RasterException;
import lombok.extern.slf4j.Slf4j;
import org.gdal.gdal.gdal;

/**
 * Process-wide GDAL bootstrap.
 * <p>
 * Loads the GDAL JNI library and registers all drivers exactly once, the first time any method of this class is
 * called. GDAL's default error handler prints to stderr; a quiet handler is installed instead, errors are collected
 * through {@code CPLGetLastErrorNo()}/{@code CPLGetLastErrorMsg()} and reported as {@link RasterException}s.
 * <p>
 * If the native library can't be loaded, {@link #isAvailable()} returns {@code false} and the GDAL provider is
 * reported as unavailable, rather than failing provider discovery.
 */
@Slf4j
public final class GdalRuntime {

    private GdalRuntime() {
        // utility class
    }

    private static class Holder {
        static final boolean AVAILABLE = initialize();
    }

    private static boolean initialize() {
        try {
            gdal.AllRegister();
            // process-wide, pushed handlers only apply to the calling thread
            gdal.SetErrorHandler("CPLQuietErrorHandler");
            log.debug(
                    "GDAL {} initialized with {} drivers", gdal.VersionInfo("RELEASE_NAME"), gdal.GetDriverCount());
            return true;
        } catch (UnsatisfiedLinkError | NoClassDefFoundError | ExceptionInInitializerError e) {
            log.info("GDAL native library is not available, the GDAL raster provider is disabled: {}", e.toString());
            return false;
        }
    }

    /**
     * @return {@code true} if the GDAL native library is loaded and its drivers are registered
     */
    public static boolean isAvailable() {
        return Holder.AVAILABLE;
    }

    /**
     * @throws RasterException {@link RasterErrorKind#IO_FAILURE} if GDAL is not available
     */
    static void ensureInitialized() throws RasterException {
        if (!isAvailable()) {
            throw new RasterException(RasterErrorKind.IO_FAILURE, "GDAL native library is not available");
        }
    }

    /**
     * @return the GDAL release name, e.g. {@code 3.8.0}
     * @throws RasterException if GDAL is not available
     */
    public static String version() throws RasterException {
        ensureInitialized();
        return gdal.VersionInfo("RELEASE_NAME");
    }

    /**
     * Sets a process-wide GDAL configuration option, like {@code GDAL_CACHEMAX} or
     * {@code GDAL_DISABLE_READDIR_ON_OPEN}. It affects every dataset opened afterwards.
     *
     * @param key the option name
     * @param value the option value, {@code null} to unset it
     * @throws RasterException if GDAL is not available
     */
    public static void setConfigOption(String key, String value) throws RasterException {
        requireNonNull(key, "key");
        ensureInitialized();
        log.debug("Setting GDAL config option {}={}", key, value);
        gdal.SetConfigOption(key, value);
    }

    /**
     * @param key the option name
     * @return the current value of a GDAL configuration option, or {@code null} if unset
     * @throws RasterException if GDAL is not available
     */
    public static String getConfigOption(String key) throws RasterException {
        requireNonNull(key, "key");
        ensureInitialized();
        return gdal.GetConfigOption(key);
    }
}
