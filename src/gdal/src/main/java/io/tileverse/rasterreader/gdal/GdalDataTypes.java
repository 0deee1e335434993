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

import io.tileverse.rasterreader.RasterDataType;

/**
 * Maps GDAL {@code GDALDataType} codes to {@link RasterDataType}.
 * <p>
 * The codes are the stable values of the GDAL C enum. They're spelled out instead of read from
 * {@code gdalconstConstants}, whose fields are initialized through JNI.
 */
final class GdalDataTypes {

    static final int GDT_BYTE = 1;
    static final int GDT_UINT16 = 2;
    static final int GDT_INT16 = 3;
    static final int GDT_UINT32 = 4;
    static final int GDT_INT32 = 5;
    static final int GDT_FLOAT32 = 6;
    static final int GDT_FLOAT64 = 7;

    private GdalDataTypes() {
        // utility class
    }

    /**
     * Complex, signed 8-bit, 64-bit integer and half float types have no portable counterpart and map to
     * {@link RasterDataType#UNKNOWN}.
     */
    static RasterDataType toRasterDataType(int gdalType) {
        return switch (gdalType) {
            case GDT_BYTE -> RasterDataType.UINT8;
            case GDT_UINT16 -> RasterDataType.UINT16;
            case GDT_INT16 -> RasterDataType.INT16;
            case GDT_UINT32 -> RasterDataType.UINT32;
            case GDT_INT32 -> RasterDataType.INT32;
            case GDT_FLOAT32 -> RasterDataType.FLOAT32;
            case GDT_FLOAT64 -> RasterDataType.FLOAT64;
            default -> RasterDataType.UNKNOWN;
        };
    }
}
