package com.driveplot.service.google;

import com.driveplot.core.model.Coordinate;
import com.driveplot.core.model.Place;
import com.driveplot.service.support.FixtureUtils;
import com.driveplot.service.support.GoogleStub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GoogleGeocoderTest {
    private static final String PATH = "/maps/api/geocode/json";

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build();
    private GoogleStub stub;

    @AfterEach
    void tearDown() {
        if (stub != null) {
            stub.close();
        }
    }

    @Test
    void returnsAtMostFiveCandidatesWithCoordinates() throws Exception {
        stub = GoogleStub.start().respondJson(PATH, 200, FixtureUtils.read("fixtures/google/geocode-ok.json"));
        GoogleGeocoder geocoder = new GoogleGeocoder(httpClient, stub.config());

        List<Place> places = geocoder.resolve("Springfield & co");

        assertEquals(5, places.size());
        assertEquals("Springfield, IL, USA", places.get(0).formattedAddress());
        assertEquals(new Coordinate(39.7817213, -89.6501481), places.get(0).location());
        assertEquals("place-il", places.get(0).placeId());
        assertEquals("Springfield, MO, USA", places.get(2).formattedAddress());
        assertEquals("Springfield, OH, USA", places.get(4).formattedAddress());
        assertNull(places.get(4).placeId());
        assertEquals("Springfield & co", places.get(0).query());

        String query = stub.queries().get(0);
        // form encoding sends spaces as '+', which the decoded query keeps
        assertTrue(query.contains("address=Springfield+&+co"), query);
        assertTrue(query.contains("key=test-key"), query);
    }

    @Test
    void zeroResultsIsAnEmptyList() throws Exception {
        stub = GoogleStub.start().respondJson(PATH, 200, FixtureUtils.read("fixtures/google/geocode-zero.json"));

        assertTrue(new GoogleGeocoder(httpClient, stub.config()).resolve("nowhere at all").isEmpty());
    }

    @Test
    void otherStatusesFail() throws Exception {
        stub = GoogleStub.start().respondJson(PATH, 200, FixtureUtils.read("fixtures/google/geocode-over-limit.json"));
        GoogleGeocoder geocoder = new GoogleGeocoder(httpClient, stub.config());

        GoogleMapsException ex = assertThrows(GoogleMapsException.class, () -> geocoder.resolve("Springfield"));
        assertEquals("Geocoding failed: OVER_QUERY_LIMIT", ex.getMessage());
    }

    @Test
    void invalidJsonFails() throws Exception {
        stub = GoogleStub.start().respondJson(PATH, 200, "<html>not json</html>");
        GoogleGeocoder geocoder = new GoogleGeocoder(httpClient, stub.config());

        GoogleMapsException ex = assertThrows(GoogleMapsException.class, () -> geocoder.resolve("Springfield"));
        assertEquals("Geocoding response was not valid JSON", ex.getMessage());
    }
}
