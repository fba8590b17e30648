package com.ttp.trust.crypto;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;

import java.math.BigInteger;

/** Shared secp256k1 curve constants. */
final class Secp256k1 {
    static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECDomainParameters DOMAIN = new ECDomainParameters(
            PARAMS.getCurve(), PARAMS.getG(), PARAMS.getN(), PARAMS.getH());
    static final BigInteger HALF_N = PARAMS.getN().shiftRight(1);

    static final int SIGNATURE_LENGTH = 64;
    static final int SCALAR_LENGTH = 32;

    private Secp256k1() {
    }
}
