package com.eyelevel.bordereaux.common.apiclient;

import com.eyelevel.bordereaux.common.apiclient.authentication.Authentication;
import com.eyelevel.bordereaux.common.apiclient.model.ApiRequest;
import com.eyelevel.bordereaux.common.apiclient.model.ApiResponse;
import com.eyelevel.bordereaux.common.apiclient.model.HeaderConfig;
import com.eyelevel.bordereaux.exception.apiclient.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Base class for blocking calls to external HTTP services over {@link WebClient}. Subclasses supply the
 * client, the {@link Authentication} and the {@link HeaderConfig}; every failure surfaces as an
 * {@link ApiException} subtype chosen by status code.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;

    /**
     * Upper bound for a whole exchange. Subclasses override it to apply their configured timeout.
     */
    protected Duration timeout() {
        return DEFAULT_TIMEOUT;
    }

    /**
     * Sends the request and blocks for the response.
     *
     * @throws ApiException if the call fails, times out or returns a non-2xx status
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse).timeout(timeout())
                                                     .onErrorMap(this::mapException).block();
            log.debug("Received response with status {}", apiResponse == null ? null : apiResponse.getStatusCode());
            return apiResponse;
        } catch (ApiException e) {
            log.warn("API call to {} failed: {}", apiRequest.getPath(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.warn("API call to {} failed: {}", apiRequest.getPath(), e.getMessage());
            throw mapException(e);
        }
    }

    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            String responseBody = webClientError.getResponseBodyAsString();
            int statusCode = webClientError.getStatusCode().value();
            log.warn("Remote service answered {} with body {}", statusCode, responseBody);
            return createException(responseBody, statusCode);
        }
        if (error instanceof WebClientRequestException || error instanceof ConnectException ||
            error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());
        }
        if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out after " + timeout());
        }
        if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));
            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    /**
     * Authentication first, then the configured static headers, then per-request headers.
     */
    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());

        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }

        Optional.ofNullable(apiRequest.getHeaders()).ifPresent(headers -> headers.forEach(requestBodySpec::header));
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        Instant timestamp = Instant.now();
        HttpHeaders headers = response.headers().asHttpHeaders();
        int statusCode = response.statusCode().value();

        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(byte[].class)
                           .defaultIfEmpty(new byte[0])
                           .map(data -> ApiResponse.builder().data(data).acceptType(headers.getContentType())
                                                   .headers(headers).statusCode(statusCode).timestamp(timestamp)
                                                   .build())
                           .onErrorMap(error -> new ApiException("Error processing response: " + error.getMessage(),
                                                                 statusCode));
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    private ApiException createException(String body, int statusCode) {
        return switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 401 -> new UnauthorizedException(body);
            case 403 -> new ForbiddenException(body);
            case 404 -> new NotFoundException(body);
            case 409 -> new ConflictException(body);
            case 429 -> new TooManyRequestsException(body);
            case 500 -> new InternalServerException(body);
            case 502 -> new BadGatewayException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
    }
}
