/*******************************************************************************
 * Copyright (c) 2024 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 *******************************************************************************/


package org.eclipse.hubsdk.client.auth;

import java.net.HttpURLConnection;
import java.net.URI;
import java.util.Base64;
import java.util.Objects;

import org.eclipse.hubsdk.client.ServerErrorException;
import org.eclipse.hubsdk.client.util.StatusCodeMapper;
import org.eclipse.hubsdk.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.core.net.SocketAddress;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;

/**
 * A client for the signing endpoint of an edge runtime's workload API.
 * <p>
 * The workload API creates HMAC-SHA256 digests using a module's key without
 * exposing the key to the module.
 */
public class WorkloadApiClient {

    /**
     * The version of the workload API used by this client.
     */
    public static final String API_VERSION = "2018-06-28";
    static final String FIELD_KEY_ID = "keyId";
    static final String FIELD_ALGORITHM = "algo";
    static final String FIELD_DATA = "data";
    static final String FIELD_DIGEST = "digest";

    private static final Logger LOG = LoggerFactory.getLogger(WorkloadApiClient.class);
    private static final String DEFAULT_KEY_ID = "primary";
    private static final String DEFAULT_ALGORITHM = "HMACSHA256";

    private final WebClient client;
    private final SocketAddress serverAddress;
    private final boolean domainSocket;
    private final String host;
    private final int port;

    /**
     * Creates a new client.
     *
     * @param client The web client to send requests with.
     * @param workloadUri The URI of the workload API, either {@code unix://<socket path>}
     *                    or {@code http://<host>[:<port>]}.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if the URI is not supported.
     */
    public WorkloadApiClient(final WebClient client, final String workloadUri) {
        this.client = Objects.requireNonNull(client);
        Objects.requireNonNull(workloadUri);
        final URI uri = URI.create(workloadUri);
        if ("unix".equals(uri.getScheme())) {
            this.domainSocket = true;
            this.host = "localhost";
            this.port = 80;
            this.serverAddress = SocketAddress.domainSocketAddress(uri.getPath());
        } else if ("http".equals(uri.getScheme()) && uri.getHost() != null) {
            this.domainSocket = false;
            this.host = uri.getHost();
            this.port = uri.getPort() == -1 ? 80 : uri.getPort();
            this.serverAddress = SocketAddress.inetSocketAddress(port, host);
        } else {
            throw new IllegalArgumentException(String.format("unsupported workload URI [%s]", workloadUri));
        }
    }

    /**
     * Gets the request URI of the signing resource of a module.
     *
     * @param moduleId The module identifier.
     * @param generationId The module's generation identifier.
     * @return The request URI.
     */
    static String signRequestUri(final String moduleId, final String generationId) {
        return String.format("/modules/%s/genid/%s/sign?api-version=%s",
                Strings.encodeUriComponentStrict(moduleId),
                Strings.encodeUriComponentStrict(generationId),
                Strings.encodeUriComponentStrict(API_VERSION));
    }

    /**
     * Requests a digest of data.
     *
     * @param moduleId The identifier of the module whose key should be used.
     * @param generationId The module's generation identifier.
     * @param data The data to sign.
     * @return A future indicating the outcome. The future will be completed with the raw digest
     *         or failed with a {@link org.eclipse.hubsdk.client.ServiceInvocationException} if the
     *         workload API returns an error.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public Future<byte[]> sign(final String moduleId, final String generationId, final byte[] data) {

        Objects.requireNonNull(moduleId);
        Objects.requireNonNull(generationId);
        Objects.requireNonNull(data);

        final String requestUri = signRequestUri(moduleId, generationId);
        final JsonObject body = new JsonObject()
                .put(FIELD_KEY_ID, DEFAULT_KEY_ID)
                .put(FIELD_ALGORITHM, DEFAULT_ALGORITHM)
                .put(FIELD_DATA, Base64.getEncoder().encodeToString(data));

        final HttpRequest<Buffer> request = domainSocket
                ? client.request(HttpMethod.POST, serverAddress, requestUri)
                : client.request(HttpMethod.POST, serverAddress, port, host, requestUri);

        LOG.debug("requesting signature from workload API [module: {}, URI: {}]", moduleId, requestUri);
        return request.sendJsonObject(body).compose(this::extractDigest);
    }

    private Future<byte[]> extractDigest(final HttpResponse<Buffer> response) {
        final int status = response.statusCode();
        if (!StatusCodeMapper.isSuccessful(status)) {
            LOG.debug("workload API returned error [status: {}]", status);
            if (status >= 400 && status < 600) {
                return Future.failedFuture(StatusCodeMapper.from(status, response.bodyAsString()));
            }
            return Future.failedFuture(new ServerErrorException(
                    HttpURLConnection.HTTP_INTERNAL_ERROR,
                    String.format("unexpected response status from workload API [%d]", status)));
        }
        try {
            final JsonObject body = response.bodyAsJsonObject();
            final String digest = body == null ? null : body.getString(FIELD_DIGEST);
            if (digest == null) {
                return Future.failedFuture(new ServerErrorException(
                        HttpURLConnection.HTTP_INTERNAL_ERROR, "workload API response contains no digest"));
            }
            return Future.succeededFuture(Base64.getDecoder().decode(digest));
        } catch (final DecodeException | ClassCastException | IllegalArgumentException e) {
            return Future.failedFuture(new ServerErrorException(
                    HttpURLConnection.HTTP_INTERNAL_ERROR, "malformed workload API response", e));
        }
    }
}
