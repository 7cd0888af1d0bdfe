package com.refinery.orchestrator.collaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP client for the file-source service that hands out original documents.
 *
 *   GET {base-url}/files/{fileId}/content  →  text/plain body
 */
@Component
public class HttpFileSource implements FileSource {

    private static final Logger log = LoggerFactory.getLogger(HttpFileSource.class);

    private final HttpClient http;
    private final String     baseUrl;
    private final Duration   timeout;

    public HttpFileSource(@Value("${refinery.file-source.base-url}") String baseUrl,
                          @Value("${refinery.file-source.timeout:60s}") Duration timeout) {
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String fetchOriginal(String fileId) {
        log.info("Fetching original content of file {}", fileId);
        String path = "/files/" + URLEncoder.encode(fileId, StandardCharsets.UTF_8) + "/content";
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Accept", "text/plain")
                    .GET()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new FileSourceException(
                        "fetchOriginal failed for " + fileId + ": HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (FileSourceException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FileSourceException("fetchOriginal interrupted for " + fileId, e);
        } catch (Exception e) {
            throw new FileSourceException("fetchOriginal failed for " + fileId, e);
        }
    }
}
