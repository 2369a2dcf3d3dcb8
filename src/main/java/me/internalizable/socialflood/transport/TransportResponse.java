package me.internalizable.socialflood.transport;

import org.springframework.http.HttpHeaders;

/**
 * A fully buffered upstream response.
 */
public record TransportResponse(int status, HttpHeaders headers, String body) {

    public TransportResponse {
        headers = headers != null ? HttpHeaders.readOnlyHttpHeaders(headers) : HttpHeaders.EMPTY;
        body = body != null ? body : "";
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
