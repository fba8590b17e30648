package com.ttp.trust.crypto;

import com.ttp.trust.api.Signature;
import com.ttp.trust.api.SignedRecord;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;

/**
 * Stateless, fail-closed signature check.
 *
 * <p>
 * A signature is valid only if all of the following hold:
 * <ol>
 * <li>The key declared in the signature equals the signer's registered key
 * (supplied by the storage layer, never taken from the record).</li>
 * <li>Key and signature decode and have the lengths the algorithm
 * requires.</li>
 * <li>The cryptographic check passes. For secp256k1, only low-S signatures
 * are accepted.</li>
 * </ol>
 * Any other outcome, including exceptions from the crypto library, yields
 * {@code false}. Nothing is thrown to the caller.
 */
public final class SignatureVerifier {
    private static final Logger log = LogManager.getLogger(SignatureVerifier.class);

    public static final int ED25519_KEY_LENGTH = Ed25519PublicKeyParameters.KEY_SIZE;
    public static final int ED25519_SIGNATURE_LENGTH = Ed25519PublicKeyParameters.KEY_SIZE * 2;

    /**
     * Verifies a record against its signer's registered key.
     */
    public boolean verify(SignedRecord record, String registeredKey) {
        if (record.signature() == null)
            return false;
        byte[] canonical;
        try {
            canonical = CanonicalEncoder.encode(record);
        } catch (IllegalArgumentException e) {
            log.debug("Record cannot be canonicalized: {}", record, e);
            return false;
        }
        return verify(canonical, record.signature(), registeredKey);
    }

    /**
     * Verifies {@code signature} over {@code message}.
     *
     * @param message       canonical payload bytes
     * @param signature     the record's signature block
     * @param registeredKey the signer's registered public key, base64
     * @return true only for a valid signature bound to the registered key
     */
    public boolean verify(byte[] message, Signature signature, String registeredKey) {
        if (message == null || signature == null || registeredKey == null)
            return false;
        try {
            byte[] registered = Base64.getDecoder().decode(registeredKey);
            byte[] declared = Base64.getDecoder().decode(signature.publicKey());
            if (!MessageDigest.isEqual(registered, declared)) {
                log.debug("Declared key does not match registered key");
                return false;
            }
            byte[] sig = Base64.getDecoder().decode(signature.signature());
            return switch (signature.algorithm()) {
                case ED25519 -> verifyEd25519(registered, message, sig);
                case SECP256K1 -> verifySecp256k1(registered, message, sig);
            };
        } catch (RuntimeException e) {
            // Malformed base64, off-curve points and library failures all land here.
            log.debug("Signature rejected: {}", e.toString());
            return false;
        }
    }

    private static boolean verifyEd25519(byte[] publicKey, byte[] message, byte[] sig) {
        if (publicKey.length != ED25519_KEY_LENGTH || sig.length != ED25519_SIGNATURE_LENGTH)
            return false;
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(sig);
    }

    private static boolean verifySecp256k1(byte[] publicKey, byte[] message, byte[] sig) {
        if (sig.length != Secp256k1.SIGNATURE_LENGTH)
            return false;
        if (publicKey.length != 33 && publicKey.length != 65)
            return false;
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(sig, 0, Secp256k1.SCALAR_LENGTH));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(sig, Secp256k1.SCALAR_LENGTH, Secp256k1.SIGNATURE_LENGTH));
        BigInteger n = Secp256k1.DOMAIN.getN();
        if (r.signum() <= 0 || r.compareTo(n) >= 0 || s.signum() <= 0 || s.compareTo(Secp256k1.HALF_N) > 0)
            return false;

        ECPoint q = Secp256k1.DOMAIN.getCurve().decodePoint(publicKey);
        ECDSASigner verifier = new ECDSASigner();
        verifier.init(false, new ECPublicKeyParameters(q, Secp256k1.DOMAIN));
        return verifier.verifySignature(sha256(message), r, s);
    }

    static byte[] sha256(byte[] message) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(message, 0, message.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
