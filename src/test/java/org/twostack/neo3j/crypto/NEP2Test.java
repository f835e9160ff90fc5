package org.twostack.neo3j.crypto;

import org.junit.Test;
import org.twostack.neo3j.PrivateKey;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.address.Base58;
import org.twostack.neo3j.exception.NEP2Exception;
import org.twostack.neo3j.utils.TestKeys;

import java.util.Arrays;

import static org.junit.Assert.*;

public class NEP2Test {

    // cheap parameters keep the tests fast
    private static final ScryptParams LIGHT = new ScryptParams(256, 1, 1);

    private static final String NEP2_1_STANDARD = "6PYM7jHL4GmS8Aw2iEFpuaHTCUKjhT4mwVqdoozGU6sUE25BjV4ePXDdLz";
    private static final String NEP2_1_LIGHT = "6PYM7jHL3uwhP8uuHP9fMGMfJxfyQbanUZPQEh1772iyb7vRnUkbkZmdRT";
    private static final String NEP2_2_LIGHT = "6PYKg2RyHA1FoLKsQpKdEfJVHaXmemnntuvFw8SB9pVdkU7tEyYjKs3wkj";

    @Test
    public void encryptsWithStandardParameters() {
        String nep2 = NEP2.encrypt("neo", TestKeys.privateKey(TestKeys.PRIV_1));

        assertEquals(NEP2_1_STANDARD, nep2);
    }

    @Test
    public void encryptsWithCustomParameters() {
        assertEquals(NEP2_1_LIGHT, NEP2.encrypt("neo", TestKeys.privateKey(TestKeys.PRIV_1), LIGHT));
    }

    @Test
    public void decryptsToOriginalKey() throws NEP2Exception {
        PrivateKey key = NEP2.decrypt("neo", NEP2_1_LIGHT, LIGHT);

        assertEquals(TestKeys.PRIV_1, Utils.HEX.encode(key.getBytes()));
    }

    @Test
    public void passwordIsNormalizedBeforeUse() throws NEP2Exception {
        assertEquals(NEP2_2_LIGHT, NEP2.encrypt("pässwörd", TestKeys.privateKey(TestKeys.PRIV_2), LIGHT));

        // decomposed umlauts normalize to the same password
        String decomposed = "pa\u0308sswo\u0308rd";
        PrivateKey key = NEP2.decrypt(decomposed, NEP2_2_LIGHT, LIGHT);
        assertEquals(TestKeys.PRIV_2, Utils.HEX.encode(key.getBytes()));
    }

    @Test
    public void wrongPasswordIsDetected() {
        assertThrows(NEP2Exception.InvalidPassphrase.class, () -> NEP2.decrypt("oen", NEP2_1_LIGHT, LIGHT));
    }

    @Test
    public void wrongParametersAreDetected() {
        assertThrows(NEP2Exception.InvalidPassphrase.class,
                () -> NEP2.decrypt("neo", NEP2_1_LIGHT, new ScryptParams(512, 1, 1)));
    }

    @Test
    public void malformedStringsAreRejected() {
        assertThrows(NEP2Exception.InvalidFormat.class, () -> NEP2.decrypt("neo", "not base58 0OIl", LIGHT));

        // checksum broken by the last character
        String broken = NEP2_1_LIGHT.substring(0, NEP2_1_LIGHT.length() - 1) + "S";
        assertThrows(NEP2Exception.InvalidFormat.class, () -> NEP2.decrypt("neo", broken, LIGHT));

        String tooShort = Base58.encodeChecked(new byte[20]);
        assertThrows(NEP2Exception.InvalidFormat.class, () -> NEP2.decrypt("neo", tooShort, LIGHT));
    }

    @Test
    public void wrongPrefixIsRejected() {
        byte[] data = Base58.decodeChecked(NEP2_1_LIGHT);
        byte[] changed = Arrays.copyOf(data, data.length);
        changed[2] = (byte) 0xC0;

        String nep2 = Base58.encodeChecked(changed);

        assertThrows(NEP2Exception.InvalidFormat.class, () -> NEP2.decrypt("neo", nep2, LIGHT));
    }

    @Test
    public void encryptedKeyHasFixedLayout() {
        byte[] data = Base58.decodeChecked(NEP2_1_LIGHT);

        assertEquals(39, data.length);
        assertEquals("0142e0", Utils.HEX.encode(Arrays.copyOf(data, 3)));
    }

    @Test
    public void scryptParametersAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new ScryptParams(1000, 8, 8));
        assertThrows(IllegalArgumentException.class, () -> new ScryptParams(1, 8, 8));
        assertThrows(IllegalArgumentException.class, () -> new ScryptParams(16384, 0, 8));
        assertThrows(IllegalArgumentException.class, () -> new ScryptParams(16384, 8, 0));
        assertEquals(ScryptParams.STANDARD, new ScryptParams(16384, 8, 8));
    }
}
