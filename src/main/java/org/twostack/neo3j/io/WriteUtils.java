
/*
 * Copyright 2021 Stephan M. February
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.twostack.neo3j.io;

import org.twostack.neo3j.VarInt;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class WriteUtils {

    private ByteArrayOutputStream bos = new ByteArrayOutputStream();

    public void writeBytes(byte[] bytes) {
        bos.write(bytes, 0, bytes.length);
    }

    public void writeBytes(byte[] bytes, int length) {
        bos.write(bytes, 0, length);
    }

    public void writeByte(int val) {
        bos.write(0xFF & val);
    }

    public void writeBoolean(boolean val) {
        bos.write(val ? 1 : 0);
    }

    /** Write 2 bytes to the output stream as unsigned 16-bit integer in little endian format. */
    public void writeUint16LE(int val) {
        bos.write((int) (0xFF & val));
        bos.write((int) (0xFF & (val >> 8)));
    }

    /** Write 4 bytes to the output stream as unsigned 32-bit integer in little endian format. */
    public void writeUint32LE(long val) {
        bos.write((int) (0xFF & val));
        bos.write((int) (0xFF & (val >> 8)));
        bos.write((int) (0xFF & (val >> 16)));
        bos.write((int) (0xFF & (val >> 24)));
    }

    /** Write 8 bytes to the output stream as signed 64-bit integer in little endian format. */
    public void writeInt64LE(long val) {
        bos.write((int) (0xFF & val));
        bos.write((int) (0xFF & (val >> 8)));
        bos.write((int) (0xFF & (val >> 16)));
        bos.write((int) (0xFF & (val >> 24)));
        bos.write((int) (0xFF & (val >> 32)));
        bos.write((int) (0xFF & (val >> 40)));
        bos.write((int) (0xFF & (val >> 48)));
        bos.write((int) (0xFF & (val >> 56)));
    }

    public void writeVarInt(long val) {
        if (val < 0) {
            throw new IllegalArgumentException("Var-int values cannot be negative: " + val);
        }
        writeBytes(new VarInt(val).encode());
    }

    public void writeVarBytes(byte[] bytes) {
        writeVarInt(bytes.length);
        writeBytes(bytes);
    }

    public void writeVarString(String value) {
        writeVarBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes the UTF-8 bytes of {@code value} right-padded with zeros to exactly {@code length} bytes.
     *
     * @throws IllegalArgumentException if the encoded string is longer than {@code length}
     */
    public void writeFixedString(String value, int length) {
        byte[] bytes = value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > length) {
            throw new IllegalArgumentException("String of " + bytes.length
                    + " bytes is longer than the fixed length of " + length);
        }
        byte[] padded = new byte[length];
        System.arraycopy(bytes, 0, padded, 0, bytes.length);
        writeBytes(padded);
    }

    public void writeSerializableFixed(NeoSerializable value) {
        value.serialize(this);
    }

    /** Writes a var-int count followed by each item. */
    public void writeSerializableVariable(List<? extends NeoSerializable> values) {
        writeVarInt(values.size());
        for (NeoSerializable value : values) {
            value.serialize(this);
        }
    }

    public int size() {
        return bos.size();
    }

    public byte[] getBytes() {
        return bos.toByteArray();
    }
}
