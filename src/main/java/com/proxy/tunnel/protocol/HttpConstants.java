package com.proxy.tunnel.protocol;

import org.springframework.util.CollectionUtils;
import org.springframework.util.LinkedCaseInsensitiveMap;
import org.springframework.util.MultiValueMap;

import java.util.List;
import java.util.Locale;

public final class HttpConstants {

    public static final String HTTP_1_1 = "HTTP/1.1";
    public static final String METHOD_CONNECT = "CONNECT";

    public static final int STATUS_OK = 200;
    public static final int STATUS_BAD_REQUEST = 400;
    public static final int STATUS_METHOD_NOT_ALLOWED = 405;
    public static final int STATUS_BAD_GATEWAY = 502;

    public static final String HEADER_ALLOW = "Allow";
    public static final String HEADER_CONNECTION = "Connection";
    public static final String HEADER_CONTENT_LENGTH = "Content-Length";
    public static final String HEADER_CONTENT_TYPE = "Content-Type";
    public static final String HEADER_KEEP_ALIVE = "Keep-Alive";
    public static final String HEADER_TRANSFER_ENCODING = "Transfer-Encoding";

    public static final String CRLF = "\r\n";

    private HttpConstants() {}

    /**
     * An empty header multimap with case-insensitive names that keeps insertion order.
     */
    public static MultiValueMap<String, String> newHeaders() {
        return CollectionUtils.toMultiValueMap(new LinkedCaseInsensitiveMap<List<String>>(8, Locale.ENGLISH));
    }

    public static String reasonPhrase(int statusCode) {
        return switch (statusCode) {
            case 200 -> "OK";
            case 400 -> "Bad Request";
            case 403 -> "Forbidden";
            case 405 -> "Method Not Allowed";
            case 407 -> "Proxy Authentication Required";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "Unknown Status";
        };
    }
}
