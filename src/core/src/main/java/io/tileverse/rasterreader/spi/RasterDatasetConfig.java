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
package io.tileverse.rasterreader.spi;

import static java.util.Objects.requireNonNull;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration used to open a {@link io.tileverse.rasterreader.RasterDataset}.
 * <p>
 * Besides the dataset path, it can force a given {@link RasterHandleProvider} and pass driver-specific open
 * options and a restricted list of drivers down to the native library.
 *
 * <pre>{@code
 * RasterDatasetConfig config = new RasterDatasetConfig()
 *     .path("~/data/dem.tif")
 *     .allowedDrivers("GTiff")
 *     .openOption("NUM_THREADS", "1");
 * try (RasterDataset dataset = RasterDataset.open(config)) {
 *     ...
 * }
 * }</pre>
 */
public class RasterDatasetConfig {

    /**
     * The key used in {@link Properties} to specify the dataset path.
     */
    public static final String PATH_KEY = "io.tileverse.rasterreader.path";

    /**
     * The key used in {@link Properties} to force a {@link RasterHandleProvider} by id.
     */
    public static final String PROVIDER_ID_KEY = "io.tileverse.rasterreader.provider";

    /**
     * The key used in {@link Properties} for comma separated {@code KEY=VALUE} driver open options.
     */
    public static final String OPEN_OPTIONS_KEY = "io.tileverse.rasterreader.open-options";

    /**
     * The key used in {@link Properties} for comma separated driver short names.
     */
    public static final String ALLOWED_DRIVERS_KEY = "io.tileverse.rasterreader.allowed-drivers";

    private Path path;

    private String providerId;

    private final List<String> openOptions = new ArrayList<>();

    private final List<String> allowedDrivers = new ArrayList<>();

    /**
     * Creates a new, empty {@code RasterDatasetConfig}.
     */
    public RasterDatasetConfig() {
        // Default constructor
    }

    /**
     * @return the canonical dataset path, or {@code null} if not set
     */
    public Path path() {
        return path;
    }

    /**
     * Sets the dataset path. The path is made absolute and normalized.
     *
     * @param path the dataset path
     * @return this config
     */
    public RasterDatasetConfig path(Path path) {
        this.path = canonicalize(requireNonNull(path, "path can't be null"));
        return this;
    }

    /**
     * Sets the dataset path from a string. A leading {@code ~} is expanded to the user home directory, and the path
     * is made absolute and normalized.
     *
     * @param path the dataset path
     * @return this config
     * @throws java.nio.file.InvalidPathException if the string can't be converted to a path
     */
    public RasterDatasetConfig path(String path) {
        return path(expand(requireNonNull(path, "path can't be null")));
    }

    /**
     * @return the forced provider id, or empty if the provider is to be selected automatically
     */
    public Optional<String> providerId() {
        return Optional.ofNullable(providerId);
    }

    /**
     * @param providerId the id of the provider to force, {@code null} to select it automatically
     * @return this config
     */
    public RasterDatasetConfig providerId(String providerId) {
        this.providerId = providerId;
        return this;
    }

    /**
     * @return the driver open options as {@code KEY=VALUE} strings, in insertion order
     */
    public List<String> openOptions() {
        return List.copyOf(openOptions);
    }

    /**
     * Adds a driver open option.
     *
     * @param key the option name
     * @param value the option value
     * @return this config
     */
    public RasterDatasetConfig openOption(String key, String value) {
        requireNonNull(key, "key");
        requireNonNull(value, "value");
        if (key.isBlank() || key.indexOf('=') >= 0) {
            throw new IllegalArgumentException("Invalid open option name: '" + key + "'");
        }
        openOptions.add(key + "=" + value);
        return this;
    }

    /**
     * @return the short names of the drivers allowed to open the dataset, empty meaning all drivers
     */
    public List<String> allowedDrivers() {
        return List.copyOf(allowedDrivers);
    }

    /**
     * Restricts the drivers the native library probes when opening the dataset.
     *
     * @param driverNames driver short names, e.g. {@code GTiff}
     * @return this config
     */
    public RasterDatasetConfig allowedDrivers(String... driverNames) {
        Arrays.stream(driverNames)
                .map(name -> requireNonNull(name, "driver name").strip())
                .filter(name -> !name.isEmpty())
                .forEach(allowedDrivers::add);
        return this;
    }

    /**
     * Converts this config into a {@link Properties} object.
     *
     * @return the properties
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        if (path != null) {
            properties.setProperty(PATH_KEY, path.toString());
        }
        if (providerId != null) {
            properties.setProperty(PROVIDER_ID_KEY, providerId);
        }
        if (!openOptions.isEmpty()) {
            properties.setProperty(OPEN_OPTIONS_KEY, String.join(",", openOptions));
        }
        if (!allowedDrivers.isEmpty()) {
            properties.setProperty(ALLOWED_DRIVERS_KEY, String.join(",", allowedDrivers));
        }
        return properties;
    }

    /**
     * Creates a {@code RasterDatasetConfig} from a {@link Properties} object, which must contain {@link #PATH_KEY}.
     *
     * @param properties the properties
     * @return a new config
     * @throws NullPointerException if properties or the path are {@code null}
     * @throws IllegalArgumentException if an open option is not of the form {@code KEY=VALUE}
     */
    public static RasterDatasetConfig fromProperties(Properties properties) {
        requireNonNull(properties);
        String path = requireNonNull(properties.getProperty(PATH_KEY), "Properties must include " + PATH_KEY);

        RasterDatasetConfig config = new RasterDatasetConfig().path(path);
        config.providerId(properties.getProperty(PROVIDER_ID_KEY));

        for (String option : split(properties.getProperty(OPEN_OPTIONS_KEY))) {
            int sep = option.indexOf('=');
            if (sep < 1) {
                throw new IllegalArgumentException("Open option must be of the form KEY=VALUE: '" + option + "'");
            }
            config.openOption(option.substring(0, sep), option.substring(sep + 1));
        }
        config.allowedDrivers(split(properties.getProperty(ALLOWED_DRIVERS_KEY)));
        return config;
    }

    private static String[] split(String value) {
        if (value == null || value.isBlank()) {
            return new String[0];
        }
        return Arrays.stream(value.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    static Path expand(String path) {
        if (path.equals("~") || path.startsWith("~/") || path.startsWith("~" + File.separator)) {
            String home = System.getProperty("user.home");
            return path.length() == 1 ? Paths.get(home) : Paths.get(home, path.substring(2));
        }
        return Paths.get(path);
    }

    static Path canonicalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    @Override
    public String toString() {
        return "RasterDatasetConfig[path=%s, providerId=%s, openOptions=%s, allowedDrivers=%s]"
                .formatted(path, providerId, openOptions, allowedDrivers);
    }
}
