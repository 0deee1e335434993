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

import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

import io.tileverse.rasterreader.spi.RasterHandle;
import io.tileverse.rasterreader.spi.SpatialReferenceFormat;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Metadata domain, spatial reference and band description accessors.
 * <p>
 * The default domain, named by the empty string, always exists. Any other domain exists only if the handle lists
 * it. An unset key is an empty result while a missing domain is an error for {@link #item} and an empty result for
 * {@link #domain}; a missing projection is an error.
 */
final class MetadataAccessor {

    static final String DEFAULT_DOMAIN = "";

    private MetadataAccessor() {
        // utility class
    }

    static Optional<String> item(RasterHandle handle, String key, String domain) throws IOException {
        requireNonNull(key, "key");
        requireNonNull(domain, "domain");
        if (!exists(handle, domain)) {
            throw new RasterException(
                    RasterErrorKind.NO_SUCH_DOMAIN,
                    "Metadata domain '%s' does not exist in %s".formatted(domain, handle.getSourceIdentifier()));
        }
        return requireNonNullElse(handle.metadataItem(key, domain), Optional.empty());
    }

    static List<String> domains(RasterHandle handle) throws IOException {
        Set<String> domains = new LinkedHashSet<>();
        List<String> nativeDomains = handle.metadataDomains();
        if (nativeDomains != null) {
            nativeDomains.stream().filter(Objects::nonNull).forEach(domains::add);
        }
        if (!domains.contains(DEFAULT_DOMAIN) && hasEntries(handle.metadata(DEFAULT_DOMAIN))) {
            List<String> withDefault = new ArrayList<>(domains.size() + 1);
            withDefault.add(DEFAULT_DOMAIN);
            withDefault.addAll(domains);
            return List.copyOf(withDefault);
        }
        return List.copyOf(domains);
    }

    static Optional<List<String>> domain(RasterHandle handle, String domain) throws IOException {
        requireNonNull(domain, "domain");
        if (!exists(handle, domain)) {
            return Optional.empty();
        }
        List<String> entries = handle.metadata(domain);
        return Optional.of(entries == null ? List.of() : List.copyOf(entries));
    }

    /**
     * Splits {@code Key=Value} entries on their first {@code =}, keeping their order. Entries without a separator
     * map to an empty value.
     */
    static Map<String, String> toMap(List<String> entries) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String entry : entries) {
            int sep = entry.indexOf('=');
            if (sep < 0) {
                map.put(entry, "");
            } else {
                map.put(entry.substring(0, sep), entry.substring(sep + 1));
            }
        }
        return map;
    }

    static String spatialReference(RasterHandle handle, SpatialReferenceFormat format) throws IOException {
        return requireNonNullElse(handle.spatialReference(format), Optional.<String>empty())
                .filter(srs -> !srs.isBlank())
                .orElseThrow(() -> new RasterException(
                        RasterErrorKind.NO_SPATIAL_REFERENCE,
                        "%s has no spatial reference".formatted(handle.getSourceIdentifier())));
    }

    static String description(RasterHandle handle, int band, int bandCount) throws IOException {
        BandIndex.check(band, bandCount);
        String description = handle.description(band);
        return description == null ? "" : description;
    }

    /**
     * Reads descriptions of bands {@code 1..bandCount} in order, stopping at the first failure.
     */
    static List<String> descriptions(RasterHandle handle, int bandCount) throws IOException {
        List<String> descriptions = new ArrayList<>(bandCount);
        for (int band = 1; band <= bandCount; band++) {
            descriptions.add(description(handle, band, bandCount));
        }
        return List.copyOf(descriptions);
    }

    private static boolean hasEntries(List<String> entries) {
        return entries != null && !entries.isEmpty();
    }

    private static boolean exists(RasterHandle handle, String domain) throws IOException {
        if (DEFAULT_DOMAIN.equals(domain)) {
            return true;
        }
        List<String> domains = handle.metadataDomains();
        return domains != null && domains.contains(domain);
    }
}
