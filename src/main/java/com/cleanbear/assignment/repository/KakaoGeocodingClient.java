package com.cleanbear.assignment.repository;

import com.cleanbear.assignment.dto.KakaoAddressSearchResponse;
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
import java.util.Optional;

/**
 * Address to coordinate lookup through the Kakao Local address search.
 */
@Repository
public class KakaoGeocodingClient {

    private static final Logger logger = LoggerFactory.getLogger(KakaoGeocodingClient.class);

    private final RestTemplate restTemplate;
    private final String addressSearchUrl;
    private final String apiKey;

    public KakaoGeocodingClient(RestTemplate restTemplate,
                                @Value("${kakao.address-search-url}") String addressSearchUrl,
                                @Value("${kakao.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.addressSearchUrl = addressSearchUrl;
        this.apiKey = apiKey;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * First match for the address, or empty when Kakao knows no such address.
     *
     * @throws org.springframework.web.client.RestClientException on transport or HTTP errors
     */
    public Optional<Coordinate> geocode(String address) {
        URI uri = UriComponentsBuilder.fromHttpUrl(addressSearchUrl)
                .queryParam("query", address)
                .encode()
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "KakaoAK " + apiKey);

        KakaoAddressSearchResponse response = restTemplate.exchange(
                uri, HttpMethod.GET, new HttpEntity<>(headers), KakaoAddressSearchResponse.class).getBody();

        if (response == null || response.getDocuments() == null || response.getDocuments().isEmpty()) {
            logger.debug("No geocoding match for '{}'", address);
            return Optional.empty();
        }

        KakaoAddressSearchResponse.Document first = response.getDocuments().get(0);
        try {
            return Optional.of(new Coordinate(Double.parseDouble(first.getY()), Double.parseDouble(first.getX())));
        } catch (NumberFormatException | NullPointerException e) {
            logger.warn("Geocoding match for '{}' has unusable coordinates x={}, y={}",
                    address, first.getX(), first.getY());
            return Optional.empty();
        }
    }
}
