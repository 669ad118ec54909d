package com.spreadsheet.engine.controllers;

import com.spreadsheet.engine.EngineApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = EngineApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private RestTemplate restTemplate;
    private HttpHeaders cellHeaders;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        cellHeaders = new HttpHeaders();
        cellHeaders.setContentType(MediaType.TEXT_PLAIN);
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private long createSheet(String cellsJson) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> request = new HttpEntity<>("{\"cells\": " + cellsJson + "}", headers);
        ResponseEntity<Long> response = restTemplate.postForEntity(url("/sheet"), request, Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> setCell(long sheetId, String address, String rawValue) {
        HttpEntity<String> request = new HttpEntity<>(rawValue, cellHeaders);
        ResponseEntity<Map> response = restTemplate.exchange(
                url("/sheet/" + sheetId + "/cell/" + address), HttpMethod.PUT, request, Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody();
    }

    /**
     * Creates a sheet with cells, edits one and checks the recalculated values.
     */
    @Test
    void testCreateSheetAndRecalculate() {
        long sheetId = createSheet("{\"A1\": \"5\", \"A2\": \"10\", \"A3\": \"=SUM(A1:A2)\"}");

        ResponseEntity<Map> getResponse = restTemplate.getForEntity(url("/sheet/" + sheetId), Map.class);
        assertEquals(HttpStatus.OK, getResponse.getStatusCode());
        assertEquals("15", getResponse.getBody().get("A3"));

        Map<String, String> changes = setCell(sheetId, "A1", "20");
        assertEquals("20", changes.get("A1"));
        assertEquals("30", changes.get("A3"));
    }

    /**
     * Cycles are values, not HTTP errors.
     */
    @Test
    void testCircularReferenceIsAValue() {
        ResponseEntity<Long> createResponse = restTemplate.postForEntity(url("/sheet"), null, Long.class);
        long sheetId = createResponse.getBody();

        Map<String, String> changes = setCell(sheetId, "A1", "=A1+1");
        assertEquals("#CIRCULAR!", changes.get("A1"));

        ResponseEntity<Map> cellResponse = restTemplate.getForEntity(url("/sheet/" + sheetId + "/cell/A1"), Map.class);
        assertEquals("#CIRCULAR!", cellResponse.getBody().get("error"));
        assertEquals("formula", cellResponse.getBody().get("valueType"));
        assertFalse(cellResponse.getBody().containsKey("value"));
    }

    @Test
    void testInvalidAddressIsBadRequest() {
        long sheetId = createSheet("{}");
        try {
            setCell(sheetId, "1A", "5");
            fail("Should have rejected the malformed address!");
        } catch (HttpClientErrorException e) {
            assertEquals(400, e.getStatusCode().value());
            assertTrue(e.getResponseBodyAsString().contains("INVALID_ADDRESS"));
        }
    }

    @Test
    void testMissingSheetAndCell() {
        try {
            restTemplate.getForEntity(url("/sheet/987654321"), Map.class);
            fail("Should have thrown for an unknown sheet!");
        } catch (HttpClientErrorException e) {
            assertEquals(404, e.getStatusCode().value());
            assertTrue(e.getResponseBodyAsString().contains("SHEET_NOT_FOUND"));
        }

        long sheetId = createSheet("{}");
        try {
            restTemplate.getForEntity(url("/sheet/" + sheetId + "/cell/B7"), Map.class);
            fail("Should have thrown for an empty cell!");
        } catch (HttpClientErrorException e) {
            assertEquals(404, e.getStatusCode().value());
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetDependencyGraphs() {
        long sheetId = createSheet("{\"A1\": \"1\", \"A2\": \"2\", \"A3\": \"=SUM(A1:A2)\", \"B1\": \"=A3*2\"}");

        ResponseEntity<Map> forward = restTemplate.getForEntity(
                url("/sheet/" + sheetId + "/forwardDependencies"), Map.class);
        Map<String, List<String>> forwardGraph = forward.getBody();
        assertEquals(Arrays.asList("A1", "A2"), forwardGraph.get("A3"));
        assertEquals(Arrays.asList("A3"), forwardGraph.get("B1"));

        ResponseEntity<Map> reverse = restTemplate.getForEntity(
                url("/sheet/" + sheetId + "/reverseDependencies"), Map.class);
        Map<String, List<String>> reverseGraph = reverse.getBody();
        assertEquals(Arrays.asList("A3"), reverseGraph.get("A1"));
        assertEquals(Arrays.asList("B1"), reverseGraph.get("A3"));

        ResponseEntity<List> affected = restTemplate.getForEntity(
                url("/sheet/" + sheetId + "/cell/A1/affected"), List.class);
        assertEquals(Arrays.asList("A3", "B1"), affected.getBody());
    }

    /**
     * The test profile caps ranges at 500 cells.
     */
    @Test
    void testRangeLimitFromConfiguration() {
        long sheetId = createSheet("{}");
        assertEquals("#ERROR!", setCell(sheetId, "B1", "=SUM(A1:A1000)").get("B1"));
        assertEquals("0", setCell(sheetId, "B2", "=SUM(A1:A500)").get("B2"));
    }

    @Test
    void testLookupDataAndEvaluate() {
        long sheetId = createSheet("{\"A1\": \"=BID(\\\"NVDA\\\")\"}");
        assertEquals("Pricing NVDA...",
                restTemplate.getForEntity(url("/sheet/" + sheetId), Map.class).getBody().get("A1"));

        restTemplate.exchange(url("/lookup/BID/NVDA"), HttpMethod.PUT,
                new HttpEntity<>("$880.08", cellHeaders), Void.class);

        ResponseEntity<Map> evaluated = restTemplate.postForEntity(
                url("/sheet/" + sheetId + "/evaluate"), null, Map.class);
        assertEquals("$880.08", evaluated.getBody().get("A1"));
    }

    @Test
    void testClearAndBulkUpdate() {
        long sheetId = createSheet("{\"A1\": \"5\", \"B1\": \"=A1+1\"}");

        ResponseEntity<Map> cleared = restTemplate.exchange(
                url("/sheet/" + sheetId + "/cell/A1"), HttpMethod.DELETE, null, Map.class);
        assertEquals("", cleared.getBody().get("A1"));
        assertEquals("1", cleared.getBody().get("B1"));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Map> updated = restTemplate.exchange(url("/sheet/" + sheetId + "/cells"), HttpMethod.PUT,
                new HttpEntity<>("{\"A1\": \"9\", \"C1\": \"=B1*2\"}", headers), Map.class);
        assertEquals("9", updated.getBody().get("A1"));
        assertEquals("10", updated.getBody().get("B1"));
        assertEquals("20", updated.getBody().get("C1"));
    }
}
