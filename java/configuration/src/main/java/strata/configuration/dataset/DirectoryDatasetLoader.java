/*
 * Copyright 2022-2025 Crown Copyright
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package strata.configuration.dataset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import strata.query.router.Dataset;
import strata.query.router.DatasetLoader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads every dataset configuration document in a directory and its subdirectories. Reads files ending in
 * <code>.yaml</code> or <code>.yml</code>, in order of their paths.
 */
public class DirectoryDatasetLoader implements DatasetLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryDatasetLoader.class);

    private final Path directory;
    private final DatasetFactory factory;

    public DirectoryDatasetLoader(Path directory, DatasetFactory factory) {
        this.directory = directory;
        this.factory = factory;
    }

    @Override
    public List<Dataset> loadAll() {
        List<Dataset> datasets = new ArrayList<>();
        for (Path path : listDocuments()) {
            LOGGER.debug("Loading dataset configuration from {}", path);
            datasets.add(factory.create(readDocument(path)));
        }
        return datasets;
    }

    private List<Path> listDocuments() {
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> {
                        String fileName = path.getFileName().toString();
                        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed listing dataset configuration in " + directory, e);
        }
    }

    private static DatasetConfigurationYaml readDocument(Path path) {
        try {
            return DatasetConfigurationYaml.readPath(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading dataset configuration from " + path, e);
        }
    }
}
