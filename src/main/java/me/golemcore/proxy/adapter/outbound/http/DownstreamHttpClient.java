package me.golemcore.proxy.adapter.outbound.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Forwards relayed HTTP requests to downstream MCP servers over the shared
 * {@link OkHttpClient}.
 *
 * <p>
 * Response bodies are buffered up to a caller-supplied limit; a larger body
 * fails the exchange with an {@link IOException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DownstreamHttpClient {

    public static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient okHttpClient;

    public DownstreamResponse exchange(String method, HttpUrl url, Map<String, String> headers, byte[] body,
            int maxBodySize) throws IOException {
        Request.Builder requestBuilder = new Request.Builder().url(url);
        headers.forEach(requestBuilder::header);

        String contentType = headers.get("Content-Type");
        MediaType mediaType = contentType != null ? MediaType.parse(contentType) : JSON;
        boolean hasBody = body != null && body.length > 0;
        if ("POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method)) {
            requestBuilder.method(method, RequestBody.create(hasBody ? body : new byte[0], mediaType));
        } else {
            requestBuilder.method(method, hasBody ? RequestBody.create(body, mediaType) : null);
        }

        log.debug("[HttpRelay] {} {}", method, url);
        try (Response response = okHttpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody responseBody = response.body();
            byte[] bytes = responseBody != null ? readLimited(responseBody, maxBodySize) : new byte[0];
            MediaType responseType = responseBody != null ? responseBody.contentType() : null;
            log.debug("[HttpRelay] {} {} -> {} ({} bytes)", method, url, response.code(), bytes.length);
            return DownstreamResponse.builder()
                    .status(response.code())
                    .contentType(responseType != null ? responseType.toString() : response.header("Content-Type"))
                    .sessionId(response.header(SESSION_HEADER))
                    .body(bytes)
                    .build();
        }
    }

    private static byte[] readLimited(ResponseBody body, int maxBodySize) throws IOException {
        try (InputStream in = body.byteStream()) {
            byte[] bytes = in.readNBytes(maxBodySize + 1);
            if (bytes.length > maxBodySize) {
                throw new IOException("downstream response exceeds " + maxBodySize + " bytes");
            }
            return bytes;
        }
    }
}
