package com.querylab.search.backend;

import com.querylab.search.backend.dto.BackendSearchRequest;
import com.querylab.search.backend.dto.BackendSearchResponse;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class SearchBackendGateway {
    private final RestTemplate restTemplate;
    private final SearchBackendProperties properties;

    public SearchBackendGateway(
        @Qualifier("searchBackendRestTemplate") RestTemplate restTemplate,
        SearchBackendProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public BackendSearchResponse search(BackendSearchRequest request, String traceId, String requestId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (traceId != null) {
            headers.add("x-trace-id", traceId);
        }
        if (requestId != null) {
            headers.add("x-request-id", requestId);
        }

        HttpEntity<BackendSearchRequest> entity = new HttpEntity<>(request, headers);

        try {
            ResponseEntity<BackendSearchResponse> response = restTemplate.exchange(
                buildUrl("/search"),
                HttpMethod.POST,
                entity,
                BackendSearchResponse.class
            );
            BackendSearchResponse body = response.getBody();
            if (body == null) {
                throw new SearchBackendUnavailableException("Search backend returned an empty body");
            }
            return body;
        } catch (ResourceAccessException e) {
            throw new SearchBackendUnavailableException("Search backend unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new SearchBackendUnavailableException("Search backend error: " + e.getStatusCode(), e);
        }
    }

    public int getMaxFetchSize() {
        return properties.getMaxFetchSize();
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
