package com.adlanda.knowledgesync.watcher;

import com.adlanda.knowledgesync.config.SyncProperties;
import com.adlanda.knowledgesync.exception.SourceUnavailableException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Drive v3 REST client.
 *
 * Rate limits, server errors and I/O timeouts are retried with exponential backoff;
 * authorization failures surface immediately as {@link SourceUnavailableException}.
 */
public class GoogleDriveRestClient implements DriveClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleDriveRestClient.class);

    static final String LIST_FIELDS =
            "nextPageToken,files(id,name,mimeType,headRevisionId,version,size,modifiedTime)";

    private final RestClient restClient;
    private final DriveCredentials credentials;
    private final int maxRetries;
    private final Duration retryBackoff;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FileListResponse(List<DriveFile> files, String nextPageToken) {}

    @FunctionalInterface
    private interface DriveCall<T> {
        T execute();
    }

    public GoogleDriveRestClient(RestClient.Builder builder, DriveCredentials credentials, SyncProperties.Remote remote) {
        this.restClient = builder.baseUrl(remote.getApiBaseUrl()).build();
        this.credentials = credentials;
        this.maxRetries = remote.getMaxRetries();
        this.retryBackoff = remote.getRetryBackoff();
    }

    @Override
    public List<DriveFile> listChildren(String folderId) throws IOException {
        List<DriveFile> files = new ArrayList<>();
        String pageToken = null;

        do {
            String token = pageToken;
            FileListResponse page = withRetry("list folder " + folderId, () -> restClient.get()
                    .uri(uri -> {
                        uri.path("/files")
                                .queryParam("q", "'" + folderId + "' in parents and trashed = false")
                                .queryParam("fields", LIST_FIELDS)
                                .queryParam("pageSize", 1000)
                                .queryParam("supportsAllDrives", true)
                                .queryParam("includeItemsFromAllDrives", true);
                        if (token != null) {
                            uri.queryParam("pageToken", token);
                        }
                        return uri.build();
                    })
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + credentials.accessToken())
                    .retrieve()
                    .body(FileListResponse.class));

            if (page == null) {
                break;
            }
            if (page.files() != null) {
                files.addAll(page.files());
            }
            pageToken = page.nextPageToken();
        } while (pageToken != null && !pageToken.isBlank());

        return files;
    }

    @Override
    public byte[] download(String fileId, String mimeType) throws IOException {
        boolean export = DriveFile.GOOGLE_DOC.equals(mimeType)
                || DriveFile.GOOGLE_SHEET.equals(mimeType)
                || DriveFile.GOOGLE_SLIDES.equals(mimeType);

        byte[] body = withRetry("download " + fileId, () -> restClient.get()
                .uri(uri -> export
                        ? uri.path("/files/{id}/export").queryParam("mimeType", DriveFile.contentTypeFor(mimeType)).build(fileId)
                        : uri.path("/files/{id}").queryParam("alt", "media").queryParam("supportsAllDrives", true).build(fileId))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + credentials.accessToken())
                .retrieve()
                .body(byte[].class));

        return body != null ? body : new byte[0];
    }

    private <T> T withRetry(String operation, DriveCall<T> call) throws IOException {
        int attempt = 0;
        while (true) {
            try {
                return call.execute();
            } catch (HttpClientErrorException e) {
                if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)) {
                    throw new SourceUnavailableException("Drive rejected credentials during " + operation, e);
                }
                if (!e.getStatusCode().isSameCodeAs(HttpStatus.TOO_MANY_REQUESTS) || attempt >= maxRetries) {
                    throw new IOException(operation + " failed: " + e.getStatusCode(), e);
                }
            } catch (HttpServerErrorException | ResourceAccessException e) {
                if (attempt >= maxRetries) {
                    throw new IOException(operation + " failed after " + (attempt + 1) + " attempts: " + e.getMessage(), e);
                }
            }

            Duration delay = retryBackoff.multipliedBy(1L << attempt);
            attempt++;
            log.warn("Transient Drive error during {}, retry {}/{} in {} ms",
                    operation, attempt, maxRetries, delay.toMillis());
            sleep(delay);
        }
    }

    private static void sleep(Duration delay) throws IOException {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting to retry", e);
        }
    }
}
