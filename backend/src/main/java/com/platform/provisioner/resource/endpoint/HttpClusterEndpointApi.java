package com.platform.provisioner.resource.endpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.provisioner.config.ProvisionerProperties;
import com.platform.provisioner.error.ErrorCode;
import com.platform.provisioner.error.OperationCancelledException;
import com.platform.provisioner.error.RemoteOperationException;
import com.platform.provisioner.lookup.RemoteOperation;
import com.platform.provisioner.observability.MetricsRegistry;
import com.platform.provisioner.resource.endpoint.ClusterEndpointModels.CreateEndpointRequest;
import com.platform.provisioner.resource.endpoint.ClusterEndpointModels.EndpointListResponse;
import com.platform.provisioner.resource.endpoint.ClusterEndpointModels.EndpointResponse;
import com.platform.provisioner.resource.endpoint.ClusterEndpointModels.ErrorEnvelope;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * JSON over HTTP client for the cluster endpoint control plane.
 * <p>
 * Transient failures (I/O errors, 429, 5xx) are retried through the shared {@link Retry};
 * everything else is returned to the caller as a {@link RemoteOperationException}
 * carrying the remote error code.
 */
@Slf4j
public class HttpClusterEndpointApi implements ClusterEndpointApi {

    private static final String PATH = "/cluster-endpoints";
    private static final Set<Integer> DELETE_ACCEPTED = Set.of(200, 202, 204);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Retry retry;
    private final MetricsRegistry metricsRegistry;
    private final String baseUrl;
    private final Duration readTimeout;

    public HttpClusterEndpointApi(
            HttpClient httpClient,
            ObjectMapper objectMapper,
            Retry retry,
            MetricsRegistry metricsRegistry,
            ProvisionerProperties.Remote remote) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.retry = retry;
        this.metricsRegistry = metricsRegistry;
        this.baseUrl = stripTrailingSlash(remote.getBaseUrl());
        this.readTimeout = Duration.ofMillis(remote.getReadTimeoutMs());
    }

    @Override
    public ClusterEndpoint createEndpoint(ClusterEndpointSpec spec) {
        String body = toJson(RemoteOperation.CREATE, CreateEndpointRequest.from(spec));

        HttpRequest request = requestBuilder(PATH)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response = call(RemoteOperation.CREATE, request, Set.of(200, 201));
        ClusterEndpoint created = fromJson(RemoteOperation.CREATE, response.body(), EndpointResponse.class).getEndpoint();
        if (created == null) {
            throw RemoteOperationException.invalidResponse(RemoteOperation.CREATE.wireName(),
                new IllegalStateException("response carries no endpoint"));
        }
        if (isBlank(created.clusterIdentifier()) || isBlank(created.endpointIdentifier())) {
            throw RemoteOperationException.invalidResponse(RemoteOperation.CREATE.wireName(),
                new IllegalStateException("response endpoint is missing its cluster or endpoint identifier"));
        }

        log.info("Control plane accepted endpoint {} on cluster {} (status: {})",
            created.endpointIdentifier(), created.clusterIdentifier(), created.status());
        return created;
    }

    @Override
    public ClusterEndpoint modifyEndpoint(String endpointIdentifier, ClusterEndpointChanges changes) {
        String body = toJson(RemoteOperation.MODIFY, changes);

        HttpRequest request = requestBuilder(PATH + "/" + encode(endpointIdentifier))
            .header("Content-Type", "application/json")
            .method("PATCH", HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response = call(RemoteOperation.MODIFY, request, Set.of(200));
        return fromJson(RemoteOperation.MODIFY, response.body(), EndpointResponse.class).getEndpoint();
    }

    @Override
    public void deleteEndpoint(String endpointIdentifier) {
        HttpRequest request = requestBuilder(PATH + "/" + encode(endpointIdentifier))
            .DELETE()
            .build();

        call(RemoteOperation.DELETE, request, DELETE_ACCEPTED);
        log.info("Control plane accepted deletion of endpoint {}", endpointIdentifier);
    }

    @Override
    public List<ClusterEndpoint> describeEndpoints(String clusterIdentifier, String endpointIdentifier) {
        String query = "?clusterIdentifier=" + encode(clusterIdentifier)
            + "&endpointIdentifier=" + encode(endpointIdentifier);

        HttpRequest request = requestBuilder(PATH + query)
            .GET()
            .build();

        HttpResponse<String> response = call(RemoteOperation.DESCRIBE, request, Set.of(200));
        // a successful describe without a body means nothing matched
        if (isBlank(response.body())) {
            return List.of();
        }
        EndpointListResponse list = readNullable(RemoteOperation.DESCRIBE, response.body(), EndpointListResponse.class);
        return list != null && list.getEndpoints() != null ? list.getEndpoints() : List.of();
    }

    // ==================== Transport ====================

    private HttpResponse<String> call(RemoteOperation operation, HttpRequest request, Set<Integer> accepted) {
        return retry.executeSupplier(() -> send(operation, request, accepted));
    }

    private HttpResponse<String> send(RemoteOperation operation, HttpRequest request, Set<Integer> accepted) {
        long start = System.currentTimeMillis();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("{} {} failed: {}", request.method(), request.uri(), e.getMessage());
            metricsRegistry.recordRemoteCall(ClusterEndpointResource.KIND, operation.wireName(), 0,
                System.currentTimeMillis() - start);
            throw RemoteOperationException.transport(operation.wireName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(request.uri().getPath(), e);
        }

        metricsRegistry.recordRemoteCall(ClusterEndpointResource.KIND, operation.wireName(),
            response.statusCode(), System.currentTimeMillis() - start);

        if (accepted.contains(response.statusCode())) {
            log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
            return response;
        }
        throw toRemoteFailure(operation, response);
    }

    private RemoteOperationException toRemoteFailure(RemoteOperation operation, HttpResponse<String> response) {
        String code = null;
        String message = response.body();
        try {
            ErrorEnvelope envelope = objectMapper.readValue(response.body(), ErrorEnvelope.class);
            if (envelope != null && envelope.getError() != null) {
                code = envelope.getError().getCode();
                message = envelope.getError().getMessage();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body for {} is not an error envelope: {}", operation.wireName(), e.getOriginalMessage());
        }

        RemoteOperationException failure =
            RemoteOperationException.fromResponse(operation.wireName(), response.statusCode(), code, message);
        log.debug("{} rejected: {}", operation.wireName(), failure.getMessage());
        return failure;
    }

    private HttpRequest.Builder requestBuilder(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .header("Accept", "application/json")
            .timeout(readTimeout);
    }

    // ==================== JSON ====================

    private String toJson(RemoteOperation operation, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RemoteOperationException(ErrorCode.SERIALIZATION_ERROR, operation.wireName(), null, -1, false,
                String.format("%s request could not be serialized: %s", operation.wireName(), e.getOriginalMessage()), e);
        }
    }

    private <T> T fromJson(RemoteOperation operation, String body, Class<T> type) {
        T value = isBlank(body) ? null : readNullable(operation, body, type);
        if (value == null) {
            throw RemoteOperationException.invalidResponse(operation.wireName(),
                new IllegalStateException("empty response body"));
        }
        return value;
    }

    private <T> T readNullable(RemoteOperation operation, String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw RemoteOperationException.invalidResponse(operation.wireName(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
