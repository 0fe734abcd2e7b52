package work.pollochang.hash.image.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlockhashConfigTest {

    @Test
    void testDefaults() {
        BlockhashConfig config = BlockhashConfig.defaults();
        assertFalse(config.quick());
        assertEquals(16, config.bits());
        assertNull(config.size());
        assertEquals(Interpolation.NEAREST, config.interpolation());
        assertEquals(64, config.hashLength());
    }

    @Test
    void testInterpolationCodes() {
        assertEquals(Interpolation.NEAREST, Interpolation.fromCode(1));
        assertEquals(Interpolation.BILINEAR, Interpolation.fromCode(2));
        assertEquals(Interpolation.BICUBIC, Interpolation.fromCode(3));
        assertEquals(Interpolation.ANTIALIAS, Interpolation.fromCode(4));
    }

    @Test
    void testInterpolationOutOfRange_ShouldThrow() {
        assertThrows(InvalidConfigurationException.class, () -> Interpolation.fromCode(0));
        assertThrows(InvalidConfigurationException.class, () -> Interpolation.fromCode(5));
    }

    /**
     * bits 的平方不能被 4 整除時直接拒絕，不產生不完整的雜湊
     */
    @Test
    void testOddBits_ShouldFailFast() {
        assertThrows(InvalidConfigurationException.class, () -> BlockhashConfig.defaults().withBits(3));
        assertThrows(InvalidConfigurationException.class, () -> BlockhashConfig.defaults().withBits(1));
        assertThrows(InvalidConfigurationException.class, () -> BlockhashConfig.defaults().withBits(0));
        assertEquals(9, BlockhashConfig.defaults().withBits(6).hashLength());
    }

    /**
     * 過大的 bits 平方會溢位成 0，必須在建立時拒絕
     */
    @Test
    void testBitsAboveLimit_ShouldBeRejected() {
        assertThrows(InvalidConfigurationException.class, () -> BlockhashConfig.defaults().withBits(65536));
        assertThrows(InvalidConfigurationException.class, () -> BlockhashConfig.defaults().withBits(BlockhashConfig.MAX_BITS + 2));
        assertEquals(BlockhashConfig.MAX_BITS * BlockhashConfig.MAX_BITS / 4,
                BlockhashConfig.defaults().withBits(BlockhashConfig.MAX_BITS).hashLength());
    }

    @Test
    void testImageSizeParsing() {
        assertEquals(new ImageSize(256, 128), ImageSize.parse("256x128"));
        assertEquals(new ImageSize(8, 8), ImageSize.parse(" 8X8 "));
        assertThrows(InvalidConfigurationException.class, () -> ImageSize.parse("256"));
        assertThrows(InvalidConfigurationException.class, () -> ImageSize.parse("0x10"));
        assertThrows(InvalidConfigurationException.class, () -> ImageSize.parse("99999999999x1"));
    }

    @Test
    void testFingerprint_ShouldReflectHashAffectingParams() {
        BlockhashConfig base = BlockhashConfig.defaults();
        assertEquals("bits=16;quick=false;size=none;interpolation=1", base.fingerprint());
        assertNotEquals(base.fingerprint(), base.withQuick(true).fingerprint());
        assertEquals(base.fingerprint(), base.withDebug(true).fingerprint());
        assertEquals("bits=16;quick=false;size=32x32;interpolation=3",
                base.withSize(new ImageSize(32, 32), Interpolation.BICUBIC).fingerprint());
    }
}
