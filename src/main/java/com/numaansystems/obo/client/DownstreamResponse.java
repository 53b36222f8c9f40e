package com.numaansystems.obo.client;

import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Status and body of a finished outbound call, read inside the response
 * handler so the connection is released before the body is interpreted.
 *
 * @param status HTTP status code
 * @param body response body as text, empty when there was none
 */
public record DownstreamResponse(int status, String body) {

    public static DownstreamResponse read(ClassicHttpResponse response) throws IOException, ParseException {
        HttpEntity entity = response.getEntity();
        String body = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";
        return new DownstreamResponse(response.getCode(), body);
    }

    public boolean isOk() {
        return status == 200;
    }
}
