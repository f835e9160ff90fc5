package org.twostack.neo3j.script;

import org.junit.Test;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.utils.TestKeys;

import java.util.List;

import static org.junit.Assert.*;

public class ScriptReaderTest {

    @Test
    public void readsVerificationScript() {
        List<ScriptReader.Instruction> instructions = ScriptReader.readInstructions(
                Utils.HEX.decode(TestKeys.VSCRIPT_1));

        assertEquals(2, instructions.size());
        assertEquals(OpCode.PUSHDATA1, instructions.get(0).getOpCode());
        assertEquals(TestKeys.PUB_1, Utils.HEX.encode(instructions.get(0).getOperand()));
        assertEquals(OpCode.SYSCALL, instructions.get(1).getOpCode());
        assertEquals(35, instructions.get(1).getPosition());
        assertSame(InteropService.SYSTEM_CRYPTO_CHECKSIG, instructions.get(1).getInteropService());
    }

    @Test
    public void rendersOneInstructionPerLine() {
        String rendered = ScriptReader.convertToOpCodeString(Utils.HEX.decode(TestKeys.VSCRIPT_1));

        assertEquals("PUSHDATA1 " + TestKeys.PUB_1 + "\n" + "SYSCALL System.Crypto.CheckSig\n", rendered);
    }

    @Test
    public void rendersFixedOperandsAndPlainOpcodes() {
        String rendered = ScriptReader.convertToOpCodeString(Utils.HEX.decode("0011" + "2204" + "40"));

        assertEquals("PUSHINT8 11\nJMP 04\nRET\n", rendered);
    }

    @Test
    public void unknownOpcodeFails() {
        // 0x06 is not assigned
        assertThrows(ProtocolException.class, () -> ScriptReader.readInstructions(Utils.HEX.decode("1106")));
    }

    @Test
    public void operandPastEndFails() {
        assertThrows(ProtocolException.OutOfBounds.class,
                () -> ScriptReader.readInstructions(Utils.HEX.decode("0c05aabb")));
        assertThrows(ProtocolException.OutOfBounds.class,
                () -> ScriptReader.readInstructions(Utils.HEX.decode("0201")));
    }
}
