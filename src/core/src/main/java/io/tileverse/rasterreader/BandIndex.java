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
 * Validation of 1-based band indices.
 */
final class BandIndex {

    private BandIndex() {
        // utility class
    }

    /**
     * @param band the 1-based band index to check
     * @param bandCount the number of bands of the dataset
     * @throws RasterException {@link RasterErrorKind#INVALID_BAND_INDEX} if {@code band} is not in
     *     {@code 1..bandCount}
     */
    static void check(int band, int bandCount) throws RasterException {
        if (band < 1 || band > bandCount) {
            throw RasterException.invalidBand(band, bandCount);
        }
    }
}
