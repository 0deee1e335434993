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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.tileverse.rasterreader.GeoTransform.GeoPoint;
import org.junit.jupiter.api.Test;

class GeoTransformTest {

    private final GeoTransform utm = new GeoTransform(440720.0, 60.0, 0.0, 3751320.0, 0.0, -60.0);

    @Test
    void testToGeo() {
        assertEquals(new GeoPoint(440720.0, 3751320.0), utm.toGeo(0, 0));
        assertEquals(new GeoPoint(440750.0, 3751290.0), utm.toGeo(0.5, 0.5));
        assertEquals(new GeoPoint(447920.0, 3744360.0), utm.toGeo(120, 116));
    }

    @Test
    void testCornerPixels() {
        assertEquals(new GeoPoint(440720.0, 3751320.0), utm.toGeo(0, 0));
        assertEquals(new GeoPoint(447920.0, 3751320.0), utm.toGeo(120, 0));
        assertEquals(new GeoPoint(440720.0, 3744360.0), utm.toGeo(0, 116));
        assertEquals(new GeoPoint(447920.0, 3744360.0), utm.toGeo(120, 116));
    }

    @Test
    void testRotatedToGeo() {
        GeoTransform rotated = new GeoTransform(100, 2, 0.5, 200, 0.25, -2);
        assertThat(rotated.isNorthUp()).isFalse();
        assertEquals(new GeoPoint(100 + 10 * 2 + 4 * 0.5, 200 + 10 * 0.25 + 4 * -2), rotated.toGeo(10, 4));
    }

    @Test
    void testDefaultTransformIsIdentity() throws RasterException {
        GeoTransform identity = GeoTransformTranslator.translate(new double[] {0, 1, 0, 0, 0, 1});
        assertThat(identity.isNorthUp()).isTrue();
        assertEquals(new GeoPoint(3, 7), identity.toGeo(3, 7));
    }

    @Test
    void testTranslatePreservesCoefficientOrder() throws RasterException {
        double[] coefficients = {1, 2, 3, 4, 5, 6};
        GeoTransform transform = GeoTransformTranslator.translate(coefficients);
        assertEquals(new GeoTransform(1, 2, 3, 4, 5, 6), transform);
        assertArrayEquals(coefficients, transform.toArray());
    }

    @Test
    void testTranslateRejectsWrongArity() {
        assertThatThrownBy(() -> GeoTransformTranslator.translate(new double[7]))
                .isInstanceOfSatisfying(
                        RasterException.class,
                        e -> assertThat(e.kind()).isEqualTo(RasterErrorKind.MALFORMED_TRANSFORM))
                .hasMessageContaining("got 7");
        assertThatThrownBy(() -> GeoTransformTranslator.translate(new double[0]))
                .isInstanceOf(RasterException.class);
        assertThatThrownBy(() -> GeoTransformTranslator.translate(null))
                .isInstanceOf(RasterException.class)
                .hasMessageContaining("got none");
    }

    @Test
    void testNonFiniteCoefficientsPassThrough() throws RasterException {
        GeoTransform transform = GeoTransformTranslator.translate(new double[] {Double.NaN, 1, 0, 0, 0, 1});
        assertThat(transform.originX()).isNaN();
    }
}
