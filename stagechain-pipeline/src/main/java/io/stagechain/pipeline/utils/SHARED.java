package io.stagechain.pipeline.utils;


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



import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.common.FlowStyle;

public class SHARED {
  public final static Gson gson = new GsonBuilder().setPrettyPrinting().create();
  private final static LoadSettings loadSettings = LoadSettings.builder().setLabel("stagechain").build();
  public final static Load yamlLoader = new Load(loadSettings);
  private final static DumpSettings dumpSettings =
      DumpSettings.builder().setDefaultFlowStyle(FlowStyle.BLOCK).build();
  public final static Dump yamlDumper = new Dump(dumpSettings);
}
