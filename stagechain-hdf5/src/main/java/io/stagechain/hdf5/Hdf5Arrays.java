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



import io.stagechain.pipeline.storage.SliceAddressing;

import java.lang.reflect.Array;
import java.util.Arrays;

/// Conversions between the nested primitive arrays jHDF reads and writes and flat
/// row-major `double[]`s.
final class Hdf5Arrays {

  private Hdf5Arrays() {
  }

  /// @param data a number or a nested array of any primitive numeric type
  /// @return the values in row-major order
  static double[] flatten(Object data) {
    if (data instanceof Number) {
      return new double[]{((Number) data).doubleValue()};
    }
    if (data == null || !data.getClass().isArray()) {
      throw new IllegalArgumentException("Not numeric array data: " + data);
    }
    double[] values = new double[countLeaves(data)];
    fill(data, values, 0);
    return values;
  }

  private static int countLeaves(Object array) {
    int length = Array.getLength(array);
    if (array.getClass().getComponentType().isPrimitive()) {
      return length;
    }
    int count = 0;
    for (int i = 0; i < length; i++) {
      count += countLeaves(Array.get(array, i));
    }
    return count;
  }

  private static int fill(Object array, double[] values, int position) {
    int length = Array.getLength(array);
    if (array.getClass().getComponentType().isPrimitive()) {
      for (int i = 0; i < length; i++) {
        values[position++] = Array.getDouble(array, i);
      }
      return position;
    }
    for (int i = 0; i < length; i++) {
      position = fill(Array.get(array, i), values, position);
    }
    return position;
  }

  /// @param values row-major values
  /// @param shape the extents, whose product is the number of values
  /// @return a nested `double` array of the given shape
  static Object nest(double[] values, int[] shape) {
    if (shape.length == 0) {
      throw new IllegalArgumentException("Cannot nest values into a scalar shape");
    }
    if (SliceAddressing.elementCount(shape) != values.length) {
      throw new IllegalArgumentException(values.length + " values do not fit shape " + Arrays.toString(shape));
    }
    Object nested = Array.newInstance(double.class, shape);
    place(nested, values, 0);
    return nested;
  }

  private static int place(Object array, double[] values, int position) {
    int length = Array.getLength(array);
    if (array instanceof double[]) {
      double[] row = (double[]) array;
      System.arraycopy(values, position, row, 0, length);
      return position + length;
    }
    for (int i = 0; i < length; i++) {
      position = place(Array.get(array, i), values, position);
    }
    return position;
  }

  /// @param javaType the type jHDF reports for a dataset, possibly an array type
  /// @return the element type name used for dataset descriptions
  static String dtypeOf(Class<?> javaType) {
    Class<?> type = javaType;
    while (type.isArray()) {
      type = type.getComponentType();
    }
    if (type == double.class || type == Double.class) {
      return "float64";
    } else if (type == float.class || type == Float.class) {
      return "float32";
    } else if (type == long.class || type == Long.class) {
      return "int64";
    } else if (type == int.class || type == Integer.class) {
      return "int32";
    } else if (type == short.class || type == Short.class) {
      return "int16";
    } else if (type == byte.class || type == Byte.class) {
      return "int8";
    }
    return type.getSimpleName();
  }
}
