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

import io.tileverse.rasterreader.spi.RasterHandle;
import java.io.IOException;

/**
 * Resolves the portable {@link RasterDataType} of a band.
 * <p>
 * The band index is validated before the handle is queried. The native type code is mapped by the handle
 * implementation; codes it doesn't recognize come back as {@link RasterDataType#UNKNOWN}, as does a {@code null}
 * answer, so a new native type never turns into an error.
 */
final class BandTypeResolver {

    private final int bandCount;

    BandTypeResolver(int bandCount) {
        this.bandCount = bandCount;
    }

    RasterDataType resolve(RasterHandle handle, int band) throws IOException {
        BandIndex.check(band, bandCount);
        RasterDataType type = handle.dataType(band);
        return type == null ? RasterDataType.UNKNOWN : type;
    }
}
