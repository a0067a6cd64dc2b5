package au.org.ala.renditions.delivery;

import au.org.ala.renditions.spec.InvalidSpecException;
import au.org.ala.renditions.spec.RenditionSpec;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.apache.commons.lang3.StringUtils;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signs and verifies {@link PendingToken}s as URL-safe strings of the form {@code <payload>.<signature>},
 * where the signature is an HMAC-SHA256 of the payload. Tokens carry no server-side state.
 */
public class PendingTokenCodec {

    private static final String SOURCE = "src";
    private static final String SCALE = "scale";
    private static final String SPEC = "spec";

    private final byte[] secret;

    public PendingTokenCodec(String secret) {
        if (StringUtils.isEmpty(secret)) {
            throw new IllegalArgumentException("A token secret is required");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    public String encode(PendingToken token) {
        Map<String, String> claims = new LinkedHashMap<>();
        claims.put(SOURCE, token.getSourcePath().toString());
        claims.put(SCALE, Double.toString(token.getOutputScale()));
        claims.put(SPEC, token.getSpec().canonical());

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : claims.entrySet()) {
            if (sb.length() > 0) sb.append('&');
            sb.append(e.getKey()).append('=').append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        String payload = Base64.encodeBase64URLSafeString(sb.toString().getBytes(StandardCharsets.UTF_8));
        return payload + "." + sign(payload);
    }

    /**
     * @throws InvalidTokenException if the signature does not match or the payload is malformed
     */
    public PendingToken decode(String token) {
        if (token == null) {
            throw new InvalidTokenException("Missing token");
        }
        int dot = token.lastIndexOf('.');
        if (dot < 1 || dot == token.length() - 1) {
            throw new InvalidTokenException("Malformed token");
        }
        String payload = token.substring(0, dot);
        String signature = token.substring(dot + 1);
        if (!MessageDigest.isEqual(sign(payload).getBytes(StandardCharsets.US_ASCII),
                signature.getBytes(StandardCharsets.US_ASCII))) {
            throw new InvalidTokenException("Bad signature");
        }

        Map<String, String> claims = new LinkedHashMap<>();
        String data = new String(Base64.decodeBase64(payload), StandardCharsets.UTF_8);
        for (String kv : data.split("&")) {
            int i = kv.indexOf('=');
            if (i < 0) continue;
            claims.put(kv.substring(0, i), URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8));
        }
        String source = claims.get(SOURCE);
        String scale = claims.get(SCALE);
        if (source == null || scale == null || !claims.containsKey(SPEC)) {
            throw new InvalidTokenException("Incomplete token");
        }
        try {
            return new PendingToken(Paths.get(source), Double.parseDouble(scale), RenditionSpec.parse(claims.get(SPEC)));
        } catch (NumberFormatException | InvalidPathException | InvalidSpecException e) {
            throw new InvalidTokenException("Invalid token payload", e);
        }
    }

    private String sign(String payload) {
        return Base64.encodeBase64URLSafeString(
                new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret).hmac(payload));
    }
}
