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
 * Converts the native 6-element affine coefficient array into a {@link GeoTransform}.
 * <p>
 * Nothing is cached, the coefficients are fetched from the handle on every call.
 */
final class GeoTransformTranslator {

    private GeoTransformTranslator() {
        // utility class
    }

    static GeoTransform read(RasterHandle handle) throws IOException {
        return translate(handle.geoTransform());
    }

    static GeoTransform translate(double[] coefficients) throws RasterException {
        if (coefficients == null || coefficients.length != GeoTransform.COEFFICIENT_COUNT) {
            String got = coefficients == null ? "none" : String.valueOf(coefficients.length);
            throw new RasterException(
                    RasterErrorKind.MALFORMED_TRANSFORM,
                    "Expected %d geo transform coefficients, got %s".formatted(GeoTransform.COEFFICIENT_COUNT, got));
        }
        return new GeoTransform(
                coefficients[0], coefficients[1], coefficients[2], coefficients[3], coefficients[4], coefficients[5]);
    }
}
