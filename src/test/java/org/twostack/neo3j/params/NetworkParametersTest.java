package org.twostack.neo3j.params;

import at.favre.lib.bytes.Bytes;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class NetworkParametersTest {

    @Test
    public void magicBytesAreLittleEndian() {
        assertThat(Bytes.wrap(NetworkParameters.getNetworkMagicBytes(NetworkParameters.MAGIC_MAIN)).encodeHex(),
                is("4e454f33"));
        assertThat(Bytes.wrap(NetworkParameters.getNetworkMagicBytes(NetworkParameters.MAGIC_TEST)).encodeHex(),
                is("4e335435"));
        assertThat(Bytes.wrap(NetworkParameters.getNetworkMagicBytes(NetworkParameters.MAGIC_PRIVATE)).encodeHex(),
                is("01030000"));
    }

    @Test
    public void networkTypeFromMagic() {
        assertThat(NetworkParameters.getNetworkType(860833102L), is(NetworkType.MAIN));
        assertThat(NetworkParameters.getNetworkType(894710606L), is(NetworkType.TEST));
        assertThat(NetworkParameters.getNetworkType(769L), is(NetworkType.PRIVATE));
        assertThat(NetworkParameters.getNetworkType(1234L), is(NetworkType.PRIVATE));
    }

    @Test
    public void magicFromNetworkType() {
        assertThat(NetworkParameters.getNetworkMagic(NetworkType.MAIN), is(NetworkParameters.MAGIC_MAIN));
        assertThat(NetworkParameters.getNetworkMagic(NetworkType.TEST), is(NetworkParameters.MAGIC_TEST));
        assertThat(NetworkParameters.getNetworkMagic(NetworkType.PRIVATE), is(NetworkParameters.MAGIC_PRIVATE));
    }
}
