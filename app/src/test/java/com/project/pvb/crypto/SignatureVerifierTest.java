package com.project.pvb.crypto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Device signature schemes")
class SignatureVerifierTest {

    private static final byte[] MESSAGE = HashingUtils.sha256("frame-0001".getBytes(StandardCharsets.UTF_8));

    @Nested
    @DisplayName("secp256k1")
    class Secp256k1 {

        private final SignatureVerifier verifier = SignatureScheme.SECP256K1.verifier();

        @Test
        void acceptsSignatureFromRegisteredKey() {
            Secp256k1DeviceSigner signer = Secp256k1DeviceSigner.generate();
            byte[] signature = signer.sign(MESSAGE);

            assertEquals(65, signature.length);
            assertEquals(64, signer.publicKey().length);
            assertTrue(verifier.verify(MESSAGE, signature, signer.publicKey()));
        }

        @Test
        void acceptsUncompressedPrefixedKey() {
            Secp256k1DeviceSigner signer = Secp256k1DeviceSigner.generate();
            byte[] prefixed = new byte[65];
            prefixed[0] = 0x04;
            System.arraycopy(signer.publicKey(), 0, prefixed, 1, 64);

            assertTrue(verifier.verify(MESSAGE, signer.sign(MESSAGE), prefixed));
        }

        @Test
        void acceptsZeroBasedRecoveryId() {
            Secp256k1DeviceSigner signer = Secp256k1DeviceSigner.generate();
            byte[] signature = signer.sign(MESSAGE);
            signature[64] = (byte) (signature[64] - 27);

            assertTrue(verifier.verify(MESSAGE, signature, signer.publicKey()));
        }

        @Test
        void rejectsOtherKeyTamperingAndMalformedInput() {
            Secp256k1DeviceSigner signer = Secp256k1DeviceSigner.generate();
            Secp256k1DeviceSigner other = Secp256k1DeviceSigner.generate();
            byte[] signature = signer.sign(MESSAGE);

            assertFalse(verifier.verify(MESSAGE, signature, other.publicKey()));

            byte[] tampered = signature.clone();
            tampered[10] ^= 0x01;
            assertFalse(verifier.verify(MESSAGE, tampered, signer.publicKey()));

            byte[] otherMessage = MESSAGE.clone();
            otherMessage[0] ^= 0x01;
            assertFalse(verifier.verify(otherMessage, signature, signer.publicKey()));

            assertFalse(verifier.verify(MESSAGE, new byte[65], signer.publicKey()));
            assertFalse(verifier.verify(MESSAGE, new byte[]{1, 2, 3}, signer.publicKey()));
            assertFalse(verifier.verify(MESSAGE, signature, new byte[33]));
            assertFalse(verifier.verify(MESSAGE, signature, null));
            assertFalse(verifier.verify(new byte[5], signature, signer.publicKey()));
        }

        @Test
        void signerRestoredFromPrivateKeyHasSameIdentity() {
            Secp256k1DeviceSigner signer = Secp256k1DeviceSigner.generate();
            Secp256k1DeviceSigner restored = Secp256k1DeviceSigner.fromPrivateKey(signer.privateKey().toString(16));

            assertArrayEquals(signer.publicKey(), restored.publicKey());
            assertTrue(verifier.verify(MESSAGE, restored.sign(MESSAGE), signer.publicKey()));
        }
    }

    @Nested
    @DisplayName("Ed25519")
    class Ed25519 {

        private final SignatureVerifier verifier = SignatureScheme.ED25519.verifier();

        @Test
        void acceptsSignatureFromRegisteredKey() {
            Ed25519DeviceSigner signer = Ed25519DeviceSigner.generate();
            byte[] signature = signer.sign(MESSAGE);

            assertEquals(64, signature.length);
            assertEquals(32, signer.publicKey().length);
            assertTrue(verifier.verify(MESSAGE, signature, signer.publicKey()));
        }

        @Test
        void seedIsDeterministic() {
            byte[] seed = new byte[32];
            seed[0] = 7;
            assertArrayEquals(Ed25519DeviceSigner.fromSeed(seed).publicKey(),
                    Ed25519DeviceSigner.fromSeed(seed).publicKey());
        }

        @Test
        void rejectsOtherKeyAndTampering() {
            Ed25519DeviceSigner signer = Ed25519DeviceSigner.generate();
            byte[] signature = signer.sign(MESSAGE);

            assertFalse(verifier.verify(MESSAGE, signature, Ed25519DeviceSigner.generate().publicKey()));

            byte[] tampered = signature.clone();
            tampered[0] ^= 0x01;
            assertFalse(verifier.verify(MESSAGE, tampered, signer.publicKey()));
            assertFalse(verifier.verify(MESSAGE, new byte[]{1}, signer.publicKey()));
            assertFalse(verifier.verify(MESSAGE, signature, new byte[64]));
            assertFalse(verifier.verify(null, signature, signer.publicKey()));
        }
    }

    @Test
    void schemeParsing() {
        assertEquals(SignatureScheme.SECP256K1, SignatureScheme.fromEnv(null, SignatureScheme.SECP256K1));
        assertEquals(SignatureScheme.ED25519, SignatureScheme.fromEnv(" Ed25519 ", SignatureScheme.SECP256K1));
        assertEquals(SignatureScheme.SECP256K1, SignatureScheme.fromEnv("secp256k1", SignatureScheme.ED25519));
        assertThrows(IllegalArgumentException.class, () -> SignatureScheme.fromEnv("rsa", SignatureScheme.SECP256K1));
    }

    @Test
    void schemeSignersMatchTheirScheme() {
        for (SignatureScheme scheme : SignatureScheme.values()) {
            DeviceSigner signer = scheme.generateSigner();
            assertEquals(scheme, signer.scheme());
            assertTrue(scheme.verifier().verify(MESSAGE, signer.sign(MESSAGE), signer.publicKey()));
        }
    }

    @Test
    void hexHelpers() {
        assertEquals("0x00ff10", HashingUtils.toHex(new byte[]{0, (byte) 0xff, 0x10}));
        assertArrayEquals(new byte[]{0, (byte) 0xff}, HashingUtils.fromHex("0x00FF"));
        assertArrayEquals(new byte[]{0x12}, HashingUtils.fromHex("12"));
        assertTrue(HashingUtils.isHex("0x" + "ab".repeat(32), 32));
        assertFalse(HashingUtils.isHex("ab".repeat(31), 32));
        assertFalse(HashingUtils.isHex("zz".repeat(32), 32));
        assertEquals(
                "0xe3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                HashingUtils.toHex(HashingUtils.sha256(new byte[0])));
    }
}
