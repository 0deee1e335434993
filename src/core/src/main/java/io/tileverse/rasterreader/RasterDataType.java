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

/**
 * Portable pixel datatype of a raster band.
 * <p>
 * Native datatypes without a counterpart here (complex types, 64-bit integers, ...) are reported as
 * {@link #UNKNOWN}, whose byte width is undefined and can't be used to size a read.
 */
public enum RasterDataType {
    UINT8(1),
    INT16(2),
    UINT16(2),
    INT32(4),
    UINT32(4),
    FLOAT32(4),
    FLOAT64(8),
    UNKNOWN(-1);

    private final int byteWidth;

    RasterDataType(int byteWidth) {
        this.byteWidth = byteWidth;
    }

    /**
     * @return {@code true} if this datatype has a fixed byte width
     */
    public boolean isSized() {
        return byteWidth > 0;
    }

    /**
     * Returns the number of bytes a single pixel of this datatype occupies.
     *
     * @return the byte width
     * @throws UnsupportedOperationException for {@link #UNKNOWN}
     */
    public int byteWidth() {
        if (!isSized()) {
            throw new UnsupportedOperationException(name() + " has no fixed byte width");
        }
        return byteWidth;
    }
}
