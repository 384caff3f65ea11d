package io.stagechain.pipeline.storage;


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



import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;
import java.util.function.IntToDoubleFunction;

/// A dense block of values with a shape, stored flat in row-major order.
///
/// Blocks carry the data exchanged between the storage backend and stages: a read returns
/// the block a {@link io.stagechain.slicing.SliceTuple} selects, a stage returns blocks of
/// the same shape for its outputs.
public final class ArrayBlock {
  private final int[] shape;
  private final double[] data;

  public ArrayBlock(int[] shape, double[] data) {
    long size = SliceAddressing.elementCount(shape);
    if (size != data.length) {
      throw new IllegalArgumentException(
          "Block of shape " + Arrays.toString(shape) + " needs " + size + " values, got " + data.length);
    }
    this.shape = shape.clone();
    this.data = data;
  }

  /// @param shape the block shape
  /// @return a block of zeros
  public static ArrayBlock zeros(int... shape) {
    return new ArrayBlock(shape, new double[Math.toIntExact(SliceAddressing.elementCount(shape))]);
  }

  /// @param shape the block shape
  /// @param values computes the value at each flat offset
  /// @return a new block
  public static ArrayBlock generate(int[] shape, IntToDoubleFunction values) {
    double[] data = new double[Math.toIntExact(SliceAddressing.elementCount(shape))];
    for (int i = 0; i < data.length; i++) {
      data[i] = values.applyAsDouble(i);
    }
    return new ArrayBlock(shape, data);
  }

  public int[] shape() {
    return shape.clone();
  }

  public int rank() {
    return shape.length;
  }

  /// The backing array. Changes are visible through this block.
  public double[] data() {
    return data;
  }

  public int size() {
    return data.length;
  }

  public double get(int... index) {
    return data[offset(index)];
  }

  public void set(double value, int... index) {
    data[offset(index)] = value;
  }

  /// @return a block sharing this block's values under another shape of the same size
  public ArrayBlock reshape(int... newShape) {
    return new ArrayBlock(newShape, data);
  }

  /// @return a block with every value transformed, this block unchanged
  public ArrayBlock map(DoubleUnaryOperator op) {
    double[] mapped = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      mapped[i] = op.applyAsDouble(data[i]);
    }
    return new ArrayBlock(shape, mapped);
  }

  private int offset(int[] index) {
    if (index.length != shape.length) {
      throw new IllegalArgumentException(
          "Index " + Arrays.toString(index) + " does not match shape " + Arrays.toString(shape));
    }
    int offset = 0;
    for (int dim = 0; dim < shape.length; dim++) {
      if (index[dim] < 0 || index[dim] >= shape[dim]) {
        throw new IndexOutOfBoundsException(
            "Index " + Arrays.toString(index) + " is outside shape " + Arrays.toString(shape));
      }
      offset = offset * shape[dim] + index[dim];
    }
    return offset;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ArrayBlock that = (ArrayBlock) o;
    return Arrays.equals(shape, that.shape) && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "ArrayBlock" + Arrays.toString(shape);
  }
}
