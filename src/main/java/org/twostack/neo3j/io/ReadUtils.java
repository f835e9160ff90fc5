
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

import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.VarInt;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.script.OpCode;

import java.math.BigInteger;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Cursor over a byte array. Every read is bounds-checked; reading past the end fails with
 * {@link ProtocolException.OutOfBounds} and leaves the cursor where it was.
 */
public class ReadUtils {

    public static final int MAX_SIZE = 0x02000000; // 32MB

    private byte[] payload;
    private int cursor;
    private int marker;

    public ReadUtils(byte[] payload) {
        this.payload = payload;
        cursor = 0;
        marker = 0;
    }

    /** Functional decoder for one element of a serialized list. */
    public interface ElementReader<T> {
        T read(ReadUtils reader);
    }

    public int readUint16() throws ProtocolException {
        checkReadLength(2);
        int u = Utils.readUint16(payload, cursor);
        cursor += 2;
        return u;
    }

    public long readUint32() throws ProtocolException {
        checkReadLength(4);
        long u = Utils.readUint32(payload, cursor);
        cursor += 4;
        return u;
    }

    public long readInt64() throws ProtocolException {
        checkReadLength(8);
        long u = Utils.readInt64(payload, cursor);
        cursor += 8;
        return u;
    }

    public boolean readBoolean() throws ProtocolException {
        byte b = readByte();
        if (b == 0) return false;
        if (b == 1) return true;
        throw new ProtocolException("Invalid boolean byte: " + b);
    }

    public long readVarInt() throws ProtocolException {
        return readVarInt(Long.MAX_VALUE);
    }

    /**
     * Reads a var-int and checks it against an upper bound.
     */
    public long readVarInt(long max) throws ProtocolException {
        checkReadLength(1);
        int first = payload[cursor] & 0xFF;
        int size = first < 0xFD ? 1 : first == 0xFD ? 3 : first == 0xFE ? 5 : 9;
        checkReadLength(size);
        VarInt varint = new VarInt(payload, cursor);
        if (varint.value < 0 || varint.value > max) {
            throw new ProtocolException("Var-int value " + Long.toUnsignedString(varint.value)
                    + " exceeds the maximum of " + max);
        }
        cursor += varint.getOriginalSizeInBytes();
        return varint.value;
    }

    private void checkReadLength(int length) throws ProtocolException {
        if (length < 0 || length > MAX_SIZE || cursor + length > payload.length) {
            throw new ProtocolException.OutOfBounds("Cannot read " + length + " bytes at position " + cursor
                    + ", only " + (payload.length - cursor) + " remaining");
        }
    }

    public byte[] readBytes(int length) throws ProtocolException {
        checkReadLength(length);
        byte[] b = new byte[length];
        System.arraycopy(payload, cursor, b, 0, length);
        cursor += length;
        return b;
    }

    public byte readByte() throws ProtocolException {
        checkReadLength(1);
        return payload[cursor++];
    }

    public int readUnsignedByte() throws ProtocolException {
        return readByte() & 0xFF;
    }

    public byte[] readVarBytes() throws ProtocolException {
        return readVarBytes(MAX_SIZE);
    }

    public byte[] readVarBytes(int max) throws ProtocolException {
        long length = readVarInt(max);
        return readBytes((int) length);
    }

    public String readVarString() throws ProtocolException {
        byte[] bytes = readVarBytes();
        return bytes.length == 0 ? "" : decodeUtf8(bytes);
    }

    /**
     * Reads a string that was written padded to a fixed width. Trailing zero bytes are stripped.
     */
    public String readFixedString(int length) throws ProtocolException {
        byte[] bytes = readBytes(length);
        int end = bytes.length;
        while (end > 0 && bytes[end - 1] == 0) {
            end--;
        }
        byte[] trimmed = new byte[end];
        System.arraycopy(bytes, 0, trimmed, 0, end);
        return decodeUtf8(trimmed);
    }

    /**
     * Reads a 33 byte compressed EC point, checking its prefix byte.
     */
    public byte[] readEncodedECPoint() throws ProtocolException {
        checkReadLength(NeoConstants.PUBLIC_KEY_SIZE_COMPRESSED);
        byte prefix = payload[cursor];
        if (prefix != 0x02 && prefix != 0x03) {
            throw new ProtocolException("Invalid compressed EC point prefix: " + prefix);
        }
        return readBytes(NeoConstants.PUBLIC_KEY_SIZE_COMPRESSED);
    }

    /**
     * Reads the data of a PUSHDATA1, PUSHDATA2 or PUSHDATA4 instruction.
     */
    public byte[] readPushData() throws ProtocolException {
        int opcode = readUnsignedByte();
        int length;
        if (opcode == OpCode.PUSHDATA1.getCode()) {
            length = readUnsignedByte();
        } else if (opcode == OpCode.PUSHDATA2.getCode()) {
            length = readUint16();
        } else if (opcode == OpCode.PUSHDATA4.getCode()) {
            long l = readUint32();
            if (l > MAX_SIZE) {
                throw new ProtocolException.OutOfBounds("Push data length too large: " + l);
            }
            length = (int) l;
        } else {
            throw new ProtocolException("Expected a PUSHDATA opcode but found 0x" + Integer.toHexString(opcode));
        }
        return readBytes(length);
    }

    public String readPushString() throws ProtocolException {
        return decodeUtf8(readPushData());
    }

    /**
     * Reads an integer pushed by PUSHM1, PUSH0..PUSH16 or one of the PUSHINT opcodes.
     */
    public BigInteger readPushInteger() throws ProtocolException {
        int opcode = readUnsignedByte();
        if (opcode >= OpCode.PUSHM1.getCode() && opcode <= OpCode.PUSH16.getCode()) {
            return BigInteger.valueOf(opcode - OpCode.PUSH0.getCode());
        }

        int count;
        if (opcode == OpCode.PUSHINT8.getCode()) {
            count = 1;
        } else if (opcode == OpCode.PUSHINT16.getCode()) {
            count = 2;
        } else if (opcode == OpCode.PUSHINT32.getCode()) {
            count = 4;
        } else if (opcode == OpCode.PUSHINT64.getCode()) {
            count = 8;
        } else if (opcode == OpCode.PUSHINT128.getCode()) {
            count = 16;
        } else if (opcode == OpCode.PUSHINT256.getCode()) {
            count = 32;
        } else {
            throw new ProtocolException("Expected an integer push opcode but found 0x" + Integer.toHexString(opcode));
        }
        // little-endian two's complement
        return new BigInteger(Utils.reverseBytes(readBytes(count)));
    }

    /**
     * Reads a var-int count followed by that many elements.
     */
    public <T> List<T> readSerializableList(ElementReader<T> elementReader, int maxCount) throws ProtocolException {
        int count = (int) readVarInt(maxCount);
        List<T> list = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            list.add(elementReader.read(this));
        }
        return list;
    }

    /** Remembers the current position so that {@link #reset()} can return to it. */
    public void mark() {
        marker = cursor;
    }

    /** Moves the cursor back to the last {@link #mark()}, or to the start if none was set. */
    public void reset() {
        cursor = marker;
    }

    public int getPosition() {
        return cursor;
    }

    public int available() {
        return payload.length - cursor;
    }

    public boolean hasMoreBytes() {
        return cursor < payload.length;
    }

    private static String decodeUtf8(byte[] bytes) throws ProtocolException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new ProtocolException("Invalid UTF-8 string", ex);
        }
    }
}
