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
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

import io.tileverse.rasterreader.spi.RasterHandle;
import io.tileverse.rasterreader.spi.SpatialReferenceFormat;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Handles that answer {@code null} instead of an empty result.
 */
@ExtendWith(MockitoExtension.class)
class MetadataAccessorTest {

    @Mock
    private RasterHandle handle;

    @Test
    void testNullItemIsAbsent() throws IOException {
        when(handle.metadataItem("AREA_OR_POINT", "")).thenReturn(null);

        Optional<String> item = MetadataAccessor.item(handle, "AREA_OR_POINT", "");
        assertThat(item).isNotNull().isEmpty();
    }

    @Test
    void testNullItemInListedDomain() throws IOException {
        when(handle.metadataDomains()).thenReturn(List.of("IMAGE_STRUCTURE"));
        when(handle.metadataItem("COMPRESSION", "IMAGE_STRUCTURE")).thenReturn(null);

        assertEquals(Optional.empty(), MetadataAccessor.item(handle, "COMPRESSION", "IMAGE_STRUCTURE"));
    }

    @Test
    void testNullSpatialReferenceIsMissing() throws IOException {
        when(handle.spatialReference(SpatialReferenceFormat.WKT)).thenReturn(null);
        when(handle.getSourceIdentifier()).thenReturn("plain.tif");

        assertThatThrownBy(() -> MetadataAccessor.spatialReference(handle, SpatialReferenceFormat.WKT))
                .isInstanceOfSatisfying(
                        RasterException.class,
                        e -> assertThat(e.kind()).isEqualTo(RasterErrorKind.NO_SPATIAL_REFERENCE))
                .hasMessageContaining("plain.tif");
    }

    @Test
    void testNullDescriptionIsEmpty() throws IOException {
        when(handle.description(2)).thenReturn(null);

        assertEquals("", MetadataAccessor.description(handle, 2, 3));
    }
}
