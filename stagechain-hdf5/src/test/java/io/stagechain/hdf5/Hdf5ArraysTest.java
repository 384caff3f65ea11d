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



import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class Hdf5ArraysTest {

  @Test
  public void testFlattenNestedInts() {
    int[][][] data = {{{1, 2}, {3, 4}}, {{5, 6}, {7, 8}}};

    assertThat(Hdf5Arrays.flatten(data)).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
    assertThat(Hdf5Arrays.flatten(new float[]{0.5f, 1.5f})).containsExactly(0.5, 1.5);
    assertThat(Hdf5Arrays.flatten(3L)).containsExactly(3);
  }

  @Test
  public void testNest() {
    Object nested = Hdf5Arrays.nest(new double[]{0, 1, 2, 3, 4, 5}, new int[]{2, 3});

    assertThat(nested).isInstanceOf(double[][].class);
    assertThat(((double[][]) nested)[1]).containsExactly(3, 4, 5);
    assertThatThrownBy(() -> Hdf5Arrays.nest(new double[5], new int[]{2, 3}))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testDtypeNames() {
    assertThat(Hdf5Arrays.dtypeOf(double[][].class)).isEqualTo("float64");
    assertThat(Hdf5Arrays.dtypeOf(float.class)).isEqualTo("float32");
    assertThat(Hdf5Arrays.dtypeOf(short[].class)).isEqualTo("int16");
  }
}
