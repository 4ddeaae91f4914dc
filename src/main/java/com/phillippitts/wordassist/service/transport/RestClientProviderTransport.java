package com.phillippitts.wordassist.service.transport;

import com.phillippitts.wordassist.service.provider.PreparedRequest;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link ProviderTransport} backed by Spring's {@link RestClient}.
 *
 * <p>Uses {@code exchange} so that error statuses reach the executor's error parser instead of
 * being converted to {@code RestClientResponseException}. A URL the client cannot use is reported
 * as an {@link IOException} like any other transport failure.
 */
@Component
public class RestClientProviderTransport implements ProviderTransport {

    private final RestClient restClient;

    public RestClientProviderTransport(RestClient providerRestClient) {
        this.restClient = Objects.requireNonNull(providerRestClient);
    }

    @Override
    public TransportResponse send(PreparedRequest request) throws IOException {
        try {
            return restClient.method(HttpMethod.valueOf(request.method()))
                    .uri(URI.create(request.url()))
                    .headers(h -> request.headers().forEach(h::set))
                    .body(request.body())
                    .exchange((req, res) -> new TransportResponse(
                            res.getStatusCode().value(),
                            res.getStatusText(),
                            new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8)));
        } catch (RestClientException | IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
}
