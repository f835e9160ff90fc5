package org.twostack.neo3j;

import org.junit.Test;
import org.twostack.neo3j.address.Base58;
import org.twostack.neo3j.exception.AddressFormatException;
import org.twostack.neo3j.utils.TestKeys;

import static org.junit.Assert.*;

public class AddressTest {

    @Test
    public void addressFromPublicKey() {
        assertEquals(TestKeys.ADDRESS_1, Address.fromPublicKey(TestKeys.publicKey(TestKeys.PUB_1)));
        assertEquals(TestKeys.ADDRESS_2, Address.fromPublicKey(TestKeys.publicKey(TestKeys.PUB_2)));
    }

    @Test
    public void scriptHashIsHashOfVerificationScript() {
        Hash160 hash = Hash160.fromPublicKey(TestKeys.publicKey(TestKeys.PUB_1));

        assertEquals(TestKeys.HASH_1, hash.toString());
        assertEquals(hash, Hash160.fromScript(Utils.HEX.decode(TestKeys.VSCRIPT_1)));
    }

    @Test
    public void addressToScriptHashAndBack() {
        Hash160 hash = Address.toScriptHash(TestKeys.ADDRESS_1);

        assertEquals(new Hash160(TestKeys.HASH_1), hash);
        assertEquals(TestKeys.ADDRESS_1, hash.toAddress());
    }

    @Test
    public void scriptHashIsLittleEndianOnTheWire() {
        Hash160 hash = new Hash160("0x" + TestKeys.HASH_1);

        assertEquals("0d165c9899c38bbf5991c5e47b04937258caec69", Utils.HEX.encode(hash.serialize()));
        assertEquals(TestKeys.HASH_1, Utils.HEX.encode(hash.toArray()));
    }

    @Test
    public void rejectsBadAddresses() {
        assertFalse(Address.isValid("NM7Aky765FG8NhhwtxjXRx7jEL1cnw7PBQ"));
        assertFalse(Address.isValid("NM7Aky765FG8NhhwtxjXRx7jEL1cnw7PB0"));
        assertTrue(Address.isValid(TestKeys.ADDRESS_1));

        // correct checksum, wrong version byte
        byte[] payload = new byte[21];
        payload[0] = 0x17;
        String legacy = Base58.encodeChecked(payload);
        assertThrows(AddressFormatException.InvalidPrefix.class, () -> Address.toScriptHash(legacy));
    }

    @Test
    public void contractHashOfDeployedContract() {
        Hash160 sender = new Hash160(TestKeys.HASH_1);

        Hash160 first = Hash160.fromContract(sender, 1234L, "Token");
        Hash160 second = Hash160.fromContract(sender, 1234L, "Token2");

        assertNotEquals(first, second);
        assertEquals(first, Hash160.fromContract(sender, 1234L, "Token"));
    }
}
