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

import io.tileverse.rasterreader.RasterErrorKind;
import io.tileverse.rasterreader.RasterException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.gdal.gdal.gdal;

/**
 * Translates GDAL's last-error state ({@code CPLE_*} numbers and messages) into {@link RasterException}s.
 * <p>
 * The CPL error numbers are spelled out because {@code gdalconstConstants} is initialized through JNI.
 */
final class GdalErrors {

    static final int CPLE_OPEN_FAILED = 4;
    static final int CPLE_ILLEGAL_ARG = 5;

    private GdalErrors() {
        // utility class
    }

    /**
     * Clears GDAL's last-error state before a native call, so that a stale error isn't attributed to it.
     */
    static void reset() {
        gdal.ErrorReset();
    }

    /**
     * @return the failure of the last native open of {@code path}
     */
    static RasterException lastOpenFailure(Path path) {
        return openFailure(path, gdal.GetLastErrorNo(), gdal.GetLastErrorMsg());
    }

    /**
     * @return the failure of the last native read, or other native query, described by {@code context}
     */
    static RasterException lastReadFailure(String context) {
        return readFailure(context, gdal.GetLastErrorNo(), gdal.GetLastErrorMsg());
    }

    /**
     * A missing or unreadable file is {@link RasterErrorKind#NOT_FOUND} whatever GDAL reports. A file no driver
     * recognizes is {@link RasterErrorKind#UNSUPPORTED_FORMAT}.
     */
    static RasterException openFailure(Path path, int errorNo, String errorMsg) {
        final String message = message("Failed to open " + path, errorNo, errorMsg);
        final String lower = errorMsg == null ? "" : errorMsg.toLowerCase(Locale.ROOT);
        RasterErrorKind kind;
        if (!Files.exists(path) || !Files.isReadable(path) || lower.contains("no such file or directory")) {
            kind = RasterErrorKind.NOT_FOUND;
        } else if (lower.contains("not recognized as") || lower.contains("supported file format")) {
            kind = RasterErrorKind.UNSUPPORTED_FORMAT;
        } else if (errorNo == CPLE_OPEN_FAILED && lower.isBlank()) {
            // existing readable file, rejected silently by every driver
            kind = RasterErrorKind.UNSUPPORTED_FORMAT;
        } else {
            kind = RasterErrorKind.IO_FAILURE;
        }
        return new RasterException(kind, message);
    }

    static RasterException readFailure(String context, int errorNo, String errorMsg) {
        final String lower = errorMsg == null ? "" : errorMsg.toLowerCase(Locale.ROOT);
        RasterErrorKind kind = errorNo == CPLE_ILLEGAL_ARG || lower.contains("access window out of range")
                ? RasterErrorKind.WINDOW_OUT_OF_BOUNDS
                : RasterErrorKind.IO_FAILURE;
        return new RasterException(kind, message(context, errorNo, errorMsg));
    }

    static String message(String context, int errorNo, String errorMsg) {
        if (errorMsg == null || errorMsg.isBlank()) {
            return "%s: CPLE %d".formatted(context, errorNo);
        }
        return "%s: %s".formatted(context, errorMsg.strip());
    }
}
