/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rawscan.core.scan.result;

import java.io.Serializable;
import java.util.Arrays;

import com.google.common.primitives.UnsignedBytes;

/**
 * Wraps the dimension key of a raw result row so it can be used as a map key, for
 * example to group rows on the dimension key. The layout of the bytes belongs to the
 * scan engine.
 */
public class ByteArrayWrapper implements Comparable<ByteArrayWrapper>, Serializable {

  private static final long serialVersionUID = -2567891234501223451L;

  private final byte[] dictionaryKey;

  public ByteArrayWrapper(byte[] dictionaryKey) {
    this.dictionaryKey = dictionaryKey;
  }

  public byte[] getDictionaryKey() {
    return dictionaryKey;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(dictionaryKey);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ByteArrayWrapper)) {
      return false;
    }
    return Arrays.equals(dictionaryKey, ((ByteArrayWrapper) other).dictionaryKey);
  }

  /**
   * Compares keys byte by byte as unsigned values
   */
  @Override
  public int compareTo(ByteArrayWrapper other) {
    return UnsignedBytes.lexicographicalComparator().compare(dictionaryKey, other.dictionaryKey);
  }
}
