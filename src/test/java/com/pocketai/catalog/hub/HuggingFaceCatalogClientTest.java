package com.pocketai.catalog.hub;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.pocketai.catalog.config.SyncSettings;

class HuggingFaceCatalogClientTest {

    private static final String BASE = "https://hub.test";

    private HttpClient httpClient;
    private HuggingFaceCatalogClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        SyncSettings settings = new SyncSettings(Map.of(
                "HF_API_BASE_URL", BASE,
                "HF_API_TOKEN", "hf_token",
                "HF_SYNC_PAGE_SIZE", "2"));
        client = new HuggingFaceCatalogClient(settings, httpClient);
    }

    @Test
    void listItems_followsNextLinks_andSkipsPrivateModels() throws Exception {
        HttpResponse<String> first = response(200,
                "[{\"id\":\"org/a\"},{\"id\":\"org/secret\",\"private\":true}]",
                "<" + BASE + "/api/models?cursor=p2>; rel=\"next\"");
        HttpResponse<String> second = response(200, "[{\"id\":\"org/b\"},{\"id\":\"org/c\"}]", null);
        doReturn(first, second).when(httpClient).send(any(HttpRequest.class), any());

        List<HubModelDescriptor> models = client.listItems("tflite", 10);

        assertEquals(List.of("org/a", "org/b", "org/c"), models.stream().map(HubModelDescriptor::getExternalId).toList());

        ArgumentCaptor<HttpRequest> requests = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(2)).send(requests.capture(), any());
        HttpRequest firstRequest = requests.getAllValues().get(0);
        assertEquals(URI.create(BASE + "/api/models?filter=tflite&limit=2&full=true&cardData=true"), firstRequest.uri());
        assertEquals("Bearer hf_token", firstRequest.headers().firstValue("Authorization").orElse(null));
        assertEquals(URI.create(BASE + "/api/models?cursor=p2"), requests.getAllValues().get(1).uri());
    }

    @Test
    void listItems_stopsAtLimit() throws Exception {
        HttpResponse<String> first = response(200, "[{\"id\":\"org/a\"},{\"id\":\"org/b\"}]",
                "<" + BASE + "/api/models?cursor=p2>; rel=\"next\"");
        doReturn(first).when(httpClient).send(any(HttpRequest.class), any());

        List<HubModelDescriptor> models = client.listItems("tflite", 1);

        assertEquals(1, models.size());
        verify(httpClient, times(1)).send(any(HttpRequest.class), any());
    }

    @Test
    void listItems_mapsRateLimit() throws Exception {
        HttpResponse<String> limited = response(429, "slow down", null);
        doReturn(limited).when(httpClient).send(any(HttpRequest.class), any());

        CatalogUnavailableException ex = assertThrows(CatalogUnavailableException.class,
                () -> client.listItems("tflite", 10));
        assertEquals(CatalogUnavailableException.Reason.RATE_LIMITED, ex.getReason());
    }

    @Test
    void listItems_mapsServerError() throws Exception {
        HttpResponse<String> error = response(500, "boom", null);
        doReturn(error).when(httpClient).send(any(HttpRequest.class), any());

        CatalogUnavailableException ex = assertThrows(CatalogUnavailableException.class,
                () -> client.listItems("tflite", 10));
        assertEquals(CatalogUnavailableException.Reason.REJECTED, ex.getReason());
        assertTrue(ex.getMessage().contains("500"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void listItems_rejectsNonJsonBodies() throws Exception {
        HttpResponse<String> html = mock(HttpResponse.class);
        doReturn(200).when(html).statusCode();
        doReturn("<html></html>").when(html).body();
        doReturn(HttpHeaders.of(Map.of("Content-Type", List.of("text/html")), (a, b) -> true)).when(html).headers();
        doReturn(html).when(httpClient).send(any(HttpRequest.class), any());

        CatalogUnavailableException ex = assertThrows(CatalogUnavailableException.class,
                () -> client.listItems("tflite", 10));
        assertEquals(CatalogUnavailableException.Reason.REJECTED, ex.getReason());
    }

    @Test
    void listItems_rejectsMalformedJson() throws Exception {
        HttpResponse<String> broken = response(200, "[{\"id\":", null);
        doReturn(broken).when(httpClient).send(any(HttpRequest.class), any());

        CatalogUnavailableException ex = assertThrows(CatalogUnavailableException.class,
                () -> client.listItems("tflite", 10));
        assertEquals(CatalogUnavailableException.Reason.REJECTED, ex.getReason());
    }

    @Test
    void listItems_mapsTransportFailures() throws Exception {
        doThrow(new IOException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());
        CatalogUnavailableException io = assertThrows(CatalogUnavailableException.class,
                () -> client.listItems("tflite", 10));
        assertEquals(CatalogUnavailableException.Reason.UNREACHABLE, io.getReason());

        doThrow(new HttpTimeoutException("timed out")).when(httpClient).send(any(HttpRequest.class), any());
        CatalogUnavailableException timeout = assertThrows(CatalogUnavailableException.class,
                () -> client.listItems("tflite", 10));
        assertEquals(CatalogUnavailableException.Reason.UNREACHABLE, timeout.getReason());
    }

    @Test
    void nextPageUri_returnsNull_withoutNextRel() throws Exception {
        HttpResponse<String> prevOnly = response(200, "[]", "<" + BASE + "/api/models?cursor=p0>; rel=\"prev\"");

        assertNull(HuggingFaceCatalogClient.nextPageUri(prevOnly, URI.create(BASE + "/api/models")));
    }

    @Test
    void listItems_resolvesRelativeNextLinks_againstCurrentPage() throws Exception {
        HttpResponse<String> first = response(200, "[{\"id\":\"org/a\"}]", "</api/models?cursor=p2>; rel=\"next\"");
        HttpResponse<String> second = response(200, "[{\"id\":\"org/b\"}]", null);
        doReturn(first, second).when(httpClient).send(any(HttpRequest.class), any());

        List<HubModelDescriptor> models = client.listItems("tflite", 10);

        assertEquals(2, models.size());
        ArgumentCaptor<HttpRequest> requests = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(2)).send(requests.capture(), any());
        assertEquals(URI.create(BASE + "/api/models?cursor=p2"), requests.getAllValues().get(1).uri());
    }

    @Test
    void listItems_rejectsMalformedNextLink() throws Exception {
        HttpResponse<String> first = response(200, "[{\"id\":\"org/a\"}]", "<http://bad host/page 2>; rel=\"next\"");
        doReturn(first).when(httpClient).send(any(HttpRequest.class), any());

        CatalogUnavailableException ex = assertThrows(CatalogUnavailableException.class,
                () -> client.listItems("tflite", 10));
        assertEquals(CatalogUnavailableException.Reason.REJECTED, ex.getReason());
        verify(httpClient, times(1)).send(any(HttpRequest.class), any());
    }

    @Test
    void listItems_rejectsNonHttpNextLink() throws Exception {
        HttpResponse<String> first = response(200, "[{\"id\":\"org/a\"}]", "<ftp://hub.test/page2>; rel=\"next\"");
        doReturn(first).when(httpClient).send(any(HttpRequest.class), any());

        CatalogUnavailableException ex = assertThrows(CatalogUnavailableException.class,
                () -> client.listItems("tflite", 10));
        assertEquals(CatalogUnavailableException.Reason.REJECTED, ex.getReason());
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body, String link) {
        HttpResponse<String> response = mock(HttpResponse.class);
        Map<String, List<String>> headers = new HashMap<>();
        headers.put("Content-Type", List.of("application/json; charset=utf-8"));
        if (link != null) {
            headers.put("Link", List.of(link));
        }
        doReturn(status).when(response).statusCode();
        doReturn(body).when(response).body();
        doReturn(HttpHeaders.of(headers, (a, b) -> true)).when(response).headers();
        return response;
    }
}
