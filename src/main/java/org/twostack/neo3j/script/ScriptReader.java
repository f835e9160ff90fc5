
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
package org.twostack.neo3j.script;

import org.twostack.neo3j.Utils;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.io.ReadUtils;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Disassembles NeoVM scripts into instructions.
 */
public class ScriptReader {

    /**
     * Splits a script into its instructions.
     *
     * @throws ProtocolException if the script holds an unknown opcode or an operand runs past the end
     */
    public static List<Instruction> readInstructions(byte[] script) throws ProtocolException {
        ReadUtils reader = new ReadUtils(script);
        List<Instruction> instructions = new ArrayList<>();
        while (reader.hasMoreBytes()) {
            int position = reader.getPosition();
            int code = reader.readUnsignedByte();
            OpCode opCode = OpCode.get(code);
            if (opCode == null) {
                throw new ProtocolException("Unknown opcode 0x" + Integer.toHexString(code) + " at position " + position);
            }
            instructions.add(new Instruction(position, opCode, readOperand(reader, opCode)));
        }
        return Collections.unmodifiableList(instructions);
    }

    private static byte[] readOperand(ReadUtils reader, OpCode opCode) {
        OpCode.OperandSize operandSize = opCode.getOperandSize();
        if (operandSize == null) {
            return new byte[0];
        }
        if (operandSize.prefixSize() == 0) {
            return reader.readBytes(operandSize.size());
        }
        long length;
        switch (operandSize.prefixSize()) {
            case 1:
                length = reader.readUnsignedByte();
                break;
            case 2:
                length = reader.readUint16();
                break;
            default:
                length = reader.readUint32();
        }
        if (length > reader.available()) {
            throw new ProtocolException.OutOfBounds(opCode + " declares " + length + " bytes but only "
                    + reader.available() + " remain");
        }
        return reader.readBytes((int) length);
    }

    /**
     * Renders the script one instruction per line, e.g. {@code PUSHDATA1 02b3...} followed by
     * {@code SYSCALL System.Crypto.CheckSig}.
     */
    public static String convertToOpCodeString(byte[] script) throws ProtocolException {
        StringBuilder sb = new StringBuilder();
        for (Instruction instruction : readInstructions(script)) {
            sb.append(instruction).append('\n');
        }
        return sb.toString();
    }

    /** One decoded instruction. Push-data operands hold only the data, without the length prefix. */
    public static class Instruction {
        private final int position;
        private final OpCode opCode;
        private final byte[] operand;

        Instruction(int position, OpCode opCode, byte[] operand) {
            this.position = position;
            this.opCode = opCode;
            this.operand = operand;
        }

        public int getPosition() {
            return position;
        }

        public OpCode getOpCode() {
            return opCode;
        }

        public byte[] getOperand() {
            return operand.clone();
        }

        /** The interop service called by a SYSCALL instruction, or null. */
        @Nullable
        public InteropService getInteropService() {
            return opCode == OpCode.SYSCALL ? InteropService.fromHash(operand) : null;
        }

        @Override
        public String toString() {
            InteropService service = getInteropService();
            if (service != null) {
                return opCode + " " + service.getName();
            }
            return operand.length == 0 ? opCode.toString() : opCode + " " + Utils.HEX.encode(operand);
        }
    }
}
