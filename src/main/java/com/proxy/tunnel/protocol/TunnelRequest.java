package com.proxy.tunnel.protocol;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.springframework.util.MultiValueMap;

import java.io.InputStream;

/**
 * A parsed HTTP request head, plus its body stream when it declared one.
 */
@Getter
@Builder
@ToString(exclude = "body")
public class TunnelRequest {

    @NonNull private final String method;
    /** The request-target. For CONNECT this is the authority ({@code host:port}) to tunnel to. */
    @NonNull private final String target;
    @NonNull private final String protocol;
    @NonNull @Builder.Default private final MultiValueMap<String, String> headers = HttpConstants.newHeaders();
    /** Remaining request body, {@code null} when the request has none. */
    private final InputStream body;

    /**
     * The tunnel destination. Taken from the request-target, never from the {@code Host}
     * header, which intermediaries may rewrite independently of the target.
     */
    public String getAuthority() {
        return target;
    }

    public boolean isConnect() {
        return HttpConstants.METHOD_CONNECT.equals(method);
    }
}
