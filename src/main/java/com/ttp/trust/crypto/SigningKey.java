package com.ttp.trust.crypto;

import com.ttp.trust.api.SignatureAlgorithm;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Private key material for one of the supported algorithms. Used on the
 * issuing side of the signed-record contract (producers, fixtures, tests).
 * The engine itself never signs.
 */
public final class SigningKey {
    public static final int SEED_LENGTH = 32;

    private final SignatureAlgorithm algorithm;
    private final Ed25519PrivateKeyParameters edKey;
    private final ECPrivateKeyParameters ecKey;
    private final byte[] publicKey;

    private SigningKey(SignatureAlgorithm algorithm, Ed25519PrivateKeyParameters edKey,
            ECPrivateKeyParameters ecKey, byte[] publicKey) {
        this.algorithm = algorithm;
        this.edKey = edKey;
        this.ecKey = ecKey;
        this.publicKey = publicKey;
    }

    /**
     * Derives a key deterministically from a 32-byte seed.
     * For secp256k1 the seed is reduced into the valid scalar range.
     */
    public static SigningKey fromSeed(SignatureAlgorithm algorithm, byte[] seed) {
        if (seed == null || seed.length != SEED_LENGTH)
            throw new IllegalArgumentException("Seed must be " + SEED_LENGTH + " bytes");
        return switch (algorithm) {
            case ED25519 -> {
                Ed25519PrivateKeyParameters priv = new Ed25519PrivateKeyParameters(seed, 0);
                yield new SigningKey(algorithm, priv, null, priv.generatePublicKey().getEncoded());
            }
            case SECP256K1 -> {
                BigInteger n = Secp256k1.DOMAIN.getN();
                BigInteger d = new BigInteger(1, seed).mod(n.subtract(BigInteger.ONE)).add(BigInteger.ONE);
                byte[] pub = new FixedPointCombMultiplier()
                        .multiply(Secp256k1.DOMAIN.getG(), d)
                        .normalize()
                        .getEncoded(true);
                yield new SigningKey(algorithm, null, new ECPrivateKeyParameters(d, Secp256k1.DOMAIN), pub);
            }
        };
    }

    public static SigningKey fromSeedHex(SignatureAlgorithm algorithm, String seedHex) {
        return fromSeed(algorithm, Hex.decode(seedHex));
    }

    public static SigningKey generate(SignatureAlgorithm algorithm, SecureRandom random) {
        byte[] seed = new byte[SEED_LENGTH];
        random.nextBytes(seed);
        return fromSeed(algorithm, seed);
    }

    public SignatureAlgorithm algorithm() {
        return algorithm;
    }

    public byte[] publicKey() {
        return publicKey.clone();
    }

    public String publicKeyBase64() {
        return Base64.getEncoder().encodeToString(publicKey);
    }

    /**
     * Signs raw message bytes. secp256k1 signatures are deterministic
     * (RFC 6979), low-S normalized and returned as 64-byte {@code r||s}.
     */
    public byte[] sign(byte[] message) {
        return switch (algorithm) {
            case ED25519 -> {
                Ed25519Signer signer = new Ed25519Signer();
                signer.init(true, edKey);
                signer.update(message, 0, message.length);
                yield signer.generateSignature();
            }
            case SECP256K1 -> {
                ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
                signer.init(true, ecKey);
                BigInteger[] rs = signer.generateSignature(SignatureVerifier.sha256(message));
                BigInteger s = rs[1];
                if (s.compareTo(Secp256k1.HALF_N) > 0)
                    s = Secp256k1.DOMAIN.getN().subtract(s);
                byte[] out = new byte[Secp256k1.SIGNATURE_LENGTH];
                System.arraycopy(BigIntegers.asUnsignedByteArray(Secp256k1.SCALAR_LENGTH, rs[0]), 0, out, 0,
                        Secp256k1.SCALAR_LENGTH);
                System.arraycopy(BigIntegers.asUnsignedByteArray(Secp256k1.SCALAR_LENGTH, s), 0, out,
                        Secp256k1.SCALAR_LENGTH, Secp256k1.SCALAR_LENGTH);
                yield out;
            }
        };
    }
}
