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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Key layout for tests: every dimension value as a length prefixed UTF-8 string, length
 * -1 for null. Counts the keys it decodes.
 */
public class StringKeyCodec implements DimensionKeyDecoder {

  private int decodeCount;

  public static ByteArrayWrapper encode(String... values) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    try {
      for (String value : values) {
        if (value == null) {
          out.writeInt(-1);
        } else {
          byte[] data = value.getBytes(StandardCharsets.UTF_8);
          out.writeInt(data.length);
          out.write(data);
        }
      }
      out.flush();
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
    return new ByteArrayWrapper(bytes.toByteArray());
  }

  @Override
  public Object[] decode(ByteArrayWrapper key, QuerySchemaInfo querySchemaInfo) {
    decodeCount++;
    Object[] values = new Object[querySchemaInfo.getDimensionCount()];
    DataInputStream in = new DataInputStream(new ByteArrayInputStream(key.getDictionaryKey()));
    try {
      for (int i = 0; i < values.length; i++) {
        int length = in.readInt();
        if (length >= 0) {
          byte[] data = new byte[length];
          in.readFully(data);
          values[i] = new String(data, StandardCharsets.UTF_8);
        }
      }
    } catch (IOException e) {
      throw new IllegalStateException("malformed key", e);
    }
    return values;
  }

  public int getDecodeCount() {
    return decodeCount;
  }
}
