package com.piscanner.signing;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;

final class RsaKeys {
    private RsaKeys() {
    }

    /**
     * Decodes a base64 DER PKCS#8 RSA private key. PEM armour lines and embedded whitespace are tolerated.
     */
    static PrivateKey loadPrivateKey(String encoded) {
        StringBuilder body = new StringBuilder();
        for (String line : encoded.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.startsWith("-----")) {
                body.append(trimmed);
            }
        }
        try {
            byte[] der = Base64.getMimeDecoder().decode(body.toString());
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new SigningException("Failed to load RSA private key", e);
        }
    }
}
