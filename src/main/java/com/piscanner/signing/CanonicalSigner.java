package com.piscanner.signing;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.piscanner.payload.PlaceholderSubstitutor;
import com.piscanner.payload.TextSlot;
import com.piscanner.runtime.AppConfig;

/**
 * Builds signed request bodies. The canonical string is the payload's top-level fields sorted by code
 * point, without the {@code sign} field and without empty values, joined as {@code key=value&key=value}.
 * It is signed with RSA PKCS#1 v1.5 over SHA-256 and the base64 signature replaces {@code {sign_input}}.
 */
public class CanonicalSigner {
    private static final Logger log = LoggerFactory.getLogger(CanonicalSigner.class);
    static final String SIGNATURE_FIELD = "sign";
    private static final String ALGORITHM = "SHA256withRSA";
    private static final Comparator<String> CODE_POINT_ORDER = CanonicalSigner::compareCodePoints;

    private final boolean enabled;
    private final PrivateKey privateKey;

    public CanonicalSigner(boolean enabled, String privateKeyBase64) {
        this.enabled = enabled;
        if (!enabled) {
            this.privateKey = null;
            return;
        }
        if (privateKeyBase64 == null || privateKeyBase64.isBlank()) {
            throw new SigningException("RSA private key is required when signing is enabled");
        }
        this.privateKey = RsaKeys.loadPrivateKey(privateKeyBase64);
    }

    public static CanonicalSigner fromConfig(AppConfig.ApiAgentConfig config) {
        return new CanonicalSigner(config.isSign(), config.getRsaPrivateKey());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String canonicalize(ObjectNode payload) {
        List<String> keys = new ArrayList<>();
        Iterator<String> names = payload.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!SIGNATURE_FIELD.equals(name)) {
                keys.add(name);
            }
        }
        keys.sort(CODE_POINT_ORDER);

        StringBuilder canonical = new StringBuilder();
        for (String key : keys) {
            String value = stringify(payload.get(key));
            if (value.isEmpty()) {
                continue;
            }
            if (canonical.length() > 0) {
                canonical.append('&');
            }
            canonical.append(key).append('=').append(value);
        }
        return canonical.toString();
    }

    /**
     * Signs {@code canonical}. Returns an empty string, after logging, when signing is disabled or the
     * signature cannot be produced, so the request can still be sent unsigned.
     */
    public String sign(String canonical) {
        if (!enabled || privateKey == null) {
            log.warn("Signing is disabled or private key is not available");
            return "";
        }
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(canonical.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signature.sign());
        } catch (GeneralSecurityException e) {
            log.error("Signing failed for canonical content: {}", canonical, e);
            return "";
        }
    }

    /**
     * Produces a request body from {@code template}: user input is substituted first, the result is
     * canonicalized and signed, then the signature is substituted. Only leaves that held
     * {@code {sign_input}} in the template receive the signature, so user input is never rewritten. The
     * template is not modified.
     */
    public ObjectNode buildSignedRequest(ObjectNode template, String userInput) {
        ObjectNode payload = template.deepCopy();
        List<TextSlot> signatureSlots = PlaceholderSubstitutor.slotsContaining(payload, PlaceholderSubstitutor.SIGN_INPUT);
        String input = userInput == null ? PlaceholderSubstitutor.USER_INPUT : userInput;
        PlaceholderSubstitutor.substitute(payload, PlaceholderSubstitutor.USER_INPUT, input);

        String signature = sign(canonicalize(payload));
        for (TextSlot slot : signatureSlots) {
            slot.replace(fillSignatureSlot(slot.value(), input, signature));
        }
        log.debug("Signature generated length={}", signature.length());
        return payload;
    }

    /**
     * Fills one template leaf with both values at once, so neither replacement is scanned for the other
     * placeholder.
     */
    static String fillSignatureSlot(String templateValue, String userInput, String signature) {
        String[] parts = templateValue.split(Pattern.quote(PlaceholderSubstitutor.SIGN_INPUT), -1);
        StringBuilder filled = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                filled.append(signature);
            }
            filled.append(parts[i].replace(PlaceholderSubstitutor.USER_INPUT, userInput));
        }
        return filled.toString();
    }

    private static String stringify(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "";
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? "true" : "false";
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    static int compareCodePoints(String left, String right) {
        int i = 0;
        int j = 0;
        while (i < left.length() && j < right.length()) {
            int a = left.codePointAt(i);
            int b = right.codePointAt(j);
            if (a != b) {
                return Integer.compare(a, b);
            }
            i += Character.charCount(a);
            j += Character.charCount(b);
        }
        return Integer.compare(left.length() - i, right.length() - j);
    }
}
