package com.cleanbear.assignment.repository;

import com.cleanbear.assignment.dto.KakaoDirectionsResponse;
import com.cleanbear.assignment.model.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Calls the Kakao Mobility car directions endpoint. Failures propagate to the caller,
 * which owns the retry and fallback policy.
 */
@Repository
public class KakaoDirectionsClient {

    private static final Logger logger = LoggerFactory.getLogger(KakaoDirectionsClient.class);

    private final RestTemplate restTemplate;
    private final String directionsUrl;
    private final String apiKey;

    public KakaoDirectionsClient(RestTemplate restTemplate,
                                 @Value("${kakao.directions-url}") String directionsUrl,
                                 @Value("${kakao.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.directionsUrl = directionsUrl;
        this.apiKey = apiKey;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Driving time in seconds for the recommended route.
     *
     * @throws IllegalStateException when the API answers without a usable route
     * @throws org.springframework.web.client.RestClientException on transport or HTTP errors
     */
    public long fetchDurationSeconds(Coordinate origin, Coordinate destination) {
        URI uri = UriComponentsBuilder.fromHttpUrl(directionsUrl)
                .queryParam("origin", origin.getLng() + "," + origin.getLat())
                .queryParam("destination", destination.getLng() + "," + destination.getLat())
                .queryParam("priority", "RECOMMEND")
                .queryParam("alternatives", "false")
                .queryParam("road_details", "false")
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "KakaoAK " + apiKey);

        logger.debug("Requesting directions {} -> {}", origin, destination);
        KakaoDirectionsResponse response = restTemplate.exchange(
                uri, HttpMethod.GET, new HttpEntity<>(headers), KakaoDirectionsResponse.class).getBody();

        List<KakaoDirectionsResponse.Route> routes = response != null ? response.getRoutes() : null;
        if (routes == null || routes.isEmpty()) {
            throw new IllegalStateException("Directions response has no routes");
        }

        KakaoDirectionsResponse.Route route = routes.get(0);
        if (route.getResultCode() != null && route.getResultCode() != 0) {
            throw new IllegalStateException("Directions lookup failed with code "
                    + route.getResultCode() + ": " + route.getResultMsg());
        }
        if (route.getSummary() == null) {
            throw new IllegalStateException("Directions route has no summary");
        }
        return route.getSummary().getDuration();
    }
}
