package io.stagechain.hdf5;


/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */



import io.jhdf.HdfFile;
import io.stagechain.pipeline.data.Dataset;
import io.stagechain.pipeline.data.Preview;
import io.stagechain.pipeline.stage.Loader;
import io.stagechain.pipeline.stage.PipelineContext;
import io.stagechain.pipeline.storage.ArrayBlock;
import io.stagechain.pipeline.storage.InMemoryStorageBackend;
import io.stagechain.pipeline.storage.StorageBackend;
import io.stagechain.pipeline.storage.StorageHandle;
import io.stagechain.pipeline.utils.SHARED;
import io.stagechain.slicing.PatternDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// Creates input datasets from datasets in HDF5 files, as described by a YAML document with
/// one entry per input dataset:
///
/// ```yaml
/// tomo:
///   data:
///     path: /entry1/tomo_entry/data/data
///   image_key:
///     path: /entry1/tomo_entry/instrument/detector/image_key
///     dimension: 0
///   preview: ["0:100", ":", ":"]
///   patterns:
///     PROJECTION: {core: [1, 2], slice: [0]}
///     SINOGRAM: {core: [0, 2], slice: [1]}
/// ```
///
/// `data.file` names a different file than the loader's data file. An entry with an
/// `image_key` is a raw dataset; `kind: raw` without one is an error.
public class Hdf5Loader implements Loader {
  private static final Logger logger = LogManager.getLogger(Hdf5Loader.class);

  public static final String DATA = "data";
  public static final String FILE = "file";
  public static final String PATH = "path";
  public static final String KIND = "kind";
  public static final String IMAGE_KEY = "image_key";
  public static final String DIMENSION = "dimension";
  public static final String PREVIEW = "preview";
  public static final String PATTERNS = "patterns";

  private final String name;
  private final Path dataFile;
  private final Map<String, Map<?, ?>> entries;

  public Hdf5Loader(String name, Path dataFile, Map<?, ?> description) {
    this.name = name;
    this.dataFile = dataFile;
    this.entries = new LinkedHashMap<>();
    description.forEach((dataset, entry) -> {
      if (!(entry instanceof Map<?, ?>)) {
        throw new IllegalArgumentException("Description of dataset '" + dataset + "' is not a map: " + entry);
      }
      entries.put(dataset.toString(), (Map<?, ?>) entry);
    });
  }

  public static Hdf5Loader fromYaml(String name, Path dataFile, String yaml) {
    Object description = SHARED.yamlLoader.loadFromString(yaml);
    if (description instanceof Map<?, ?>) {
      return new Hdf5Loader(name, dataFile, (Map<?, ?>) description);
    }
    throw new RuntimeException("invalid dataset description format:" + yaml);
  }

  public static Hdf5Loader load(Path descriptionFile, Path dataFile) throws IOException {
    String loaderName = Hdf5OutputNaming.baseName(descriptionFile.toString());
    return fromYaml(loaderName, dataFile, Files.readString(descriptionFile));
  }

  @Override
  public String name() {
    return name;
  }

  public List<String> datasetNames() {
    return List.copyOf(entries.keySet());
  }

  @Override
  public void load(PipelineContext context) {
    entries.forEach((dataset, entry) -> loadEntry(context, dataset, entry));
  }

  private void loadEntry(PipelineContext context, String datasetName, Map<?, ?> entry) {
    Map<?, ?> data = section(datasetName, entry, DATA);
    Path file = data.containsKey(FILE) ? Path.of(data.get(FILE).toString()) : dataFile;
    String path = required(datasetName, data, PATH);

    int[] shape;
    String dtype;
    try (HdfFile hdfFile = new HdfFile(file)) {
      shape = hdfFile.getDatasetByPath(path).getDimensions();
      dtype = Hdf5Arrays.dtypeOf(hdfFile.getDatasetByPath(path).getDataType().getJavaType());
    }
    Dataset input = context.createInput(datasetName, shape, dtype);

    Object patterns = entry.get(PATTERNS);
    if (!(patterns instanceof Map<?, ?>) || ((Map<?, ?>) patterns).isEmpty()) {
      throw new IllegalArgumentException("No patterns given for dataset '" + datasetName + "'");
    }
    ((Map<?, ?>) patterns).forEach((patternName, dims) ->
        input.addPattern(PatternDescriptor.fromData(patternName.toString(), dims)));

    if (entry.containsKey(IMAGE_KEY)) {
      Map<?, ?> imageKey = section(datasetName, entry, IMAGE_KEY);
      int dimension = imageKey.containsKey(DIMENSION) ? Integer.parseInt(imageKey.get(DIMENSION).toString()) : 0;
      input.setImageKey(dimension, readKeys(file, required(datasetName, imageKey, PATH)));
    } else if ("raw".equalsIgnoreCase(String.valueOf(entry.get(KIND)))) {
      throw new IllegalArgumentException("Raw dataset '" + datasetName + "' needs an " + IMAGE_KEY + " section");
    }

    Object preview = entry.get(PREVIEW);
    if (preview instanceof List<?>) {
      List<String> selection = ((List<?>) preview).stream().map(Object::toString).collect(Collectors.toList());
      input.setPreview(Preview.parse(selection, shape));
    }

    input.attachStorage(register(context.storage(), datasetName, file, path, shape));
    logger.info("loaded {} from {}:{} as {} with patterns {}", datasetName, file, path, input.kind(),
        input.patterns().keySet());
  }

  private static StorageHandle register(StorageBackend storage, String datasetName, Path file, String path, int[] shape) {
    if (storage instanceof Hdf5StorageBackend) {
      return ((Hdf5StorageBackend) storage).registerSource(datasetName, file, path);
    }
    if (storage instanceof InMemoryStorageBackend) {
      try (HdfFile hdfFile = new HdfFile(file)) {
        double[] values = Hdf5Arrays.flatten(hdfFile.getDatasetByPath(path).getData());
        return ((InMemoryStorageBackend) storage).register(datasetName, new ArrayBlock(shape, values), "float64");
      }
    }
    throw new IllegalStateException("Cannot load HDF5 data into " + storage.getClass().getSimpleName());
  }

  private static int[] readKeys(Path file, String path) {
    try (HdfFile hdfFile = new HdfFile(file)) {
      double[] keys = Hdf5Arrays.flatten(hdfFile.getDatasetByPath(path).getData());
      int[] ints = new int[keys.length];
      for (int i = 0; i < keys.length; i++) {
        ints[i] = (int) keys[i];
      }
      return ints;
    }
  }

  private static Map<?, ?> section(String datasetName, Map<?, ?> entry, String key) {
    Object section = entry.get(key);
    if (!(section instanceof Map<?, ?>)) {
      throw new IllegalArgumentException("No " + key + " section given for dataset '" + datasetName + "'");
    }
    return (Map<?, ?>) section;
  }

  private static String required(String datasetName, Map<?, ?> section, String key) {
    Object value = section.get(key);
    if (value == null) {
      throw new IllegalArgumentException("No " + key + " given for dataset '" + datasetName + "'");
    }
    return value.toString();
  }
}
