package au.org.ala.renditions.delivery;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * A framework neutral HTTP response produced by {@link AsyncRenditionHandler}, for the web layer to copy onto
 * its own response type.
 */
public final class AsyncResponse {

    public static final int FOUND = 302;
    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;

    private final int status;
    private final Map<String, String> headers;
    private final byte[] body;
    private final String contentType;

    private AsyncResponse(int status, Map<String, String> headers, byte[] body, String contentType) {
        this.status = status;
        this.headers = ImmutableMap.copyOf(headers);
        this.body = body;
        this.contentType = contentType;
    }

    public static AsyncResponse redirect(String location) {
        return new AsyncResponse(FOUND, ImmutableMap.of("Location", location), new byte[0], null);
    }

    public static AsyncResponse image(byte[] body, String contentType, Map<String, String> headers) {
        return new AsyncResponse(OK, headers, body, contentType);
    }

    public static AsyncResponse error(int status, String message) {
        return new AsyncResponse(status, ImmutableMap.of(), message.getBytes(StandardCharsets.UTF_8),
                "text/plain; charset=utf-8");
    }

    public int getStatus() {
        return status;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Optional<String> getHeader(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public boolean isRedirect() {
        return status == FOUND;
    }

    public byte[] getBody() {
        return body;
    }

    public String getContentType() {
        return contentType;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("status", status)
                .add("headers", headers)
                .add("contentType", contentType)
                .add("bodyLength", body.length)
                .toString();
    }
}
