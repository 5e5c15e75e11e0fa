package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.Coordinate;
import com.cleanbear.assignment.model.LocationInput;
import com.cleanbear.assignment.repository.KakaoGeocodingClient;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LocationResolverTest {

    private static final String SEARCH_URL = "https://dapi.kakao.com/v2/local/search/address.json";

    private final RestTemplate restTemplate = new RestTemplate();
    private final MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();

    private LocationResolver resolver(String apiKey) {
        return new LocationResolver(new KakaoGeocodingClient(restTemplate, SEARCH_URL, apiKey));
    }

    @Test
    void testCoordinatesNeedNoLookup() {
        Optional<Coordinate> resolved = resolver("key").resolve(LocationInput.of(37.5, 127.0, "무시되는 주소"));

        assertEquals(Optional.of(new Coordinate(37.5, 127.0)), resolved);
        server.verify();
    }

    @Test
    void testAddressGeocodedOnceThenCached() {
        server.expect(ExpectedCount.once(), requestTo(startsWith(SEARCH_URL)))
                .andExpect(header("Authorization", "KakaoAK key"))
                .andRespond(withSuccess("{\"documents\":[{\"address_name\":\"서울 강남구 테헤란로 152\","
                        + "\"x\":\"127.0363\",\"y\":\"37.5000\"}]}", MediaType.APPLICATION_JSON));
        LocationResolver resolver = resolver("key");

        Optional<Coordinate> first = resolver.resolve(LocationInput.of(null, null, "서울 강남구 테헤란로 152"));
        Optional<Coordinate> second = resolver.resolve(LocationInput.of(null, null, "서울 강남구 테헤란로 152"));

        assertEquals(Optional.of(new Coordinate(37.5, 127.0363)), first);
        assertEquals(first, second);
        server.verify();
    }

    @Test
    void testUnknownAddressIsEmpty() {
        server.expect(requestTo(startsWith(SEARCH_URL)))
                .andRespond(withSuccess("{\"documents\":[]}", MediaType.APPLICATION_JSON));

        assertTrue(resolver("key").resolve(LocationInput.of(null, null, "없는 주소")).isEmpty());
    }

    @Test
    void testLookupFailureIsEmpty() {
        server.expect(requestTo(startsWith(SEARCH_URL))).andRespond(withServerError());

        assertTrue(resolver("key").resolve(LocationInput.of(null, null, "서울 중구")).isEmpty());
    }

    @Test
    void testNoKeyMeansNoLookup() {
        assertTrue(resolver("").resolve(LocationInput.of(null, null, "서울 중구")).isEmpty());
        assertTrue(resolver("").resolve(LocationInput.none()).isEmpty());
        server.verify();
    }
}
