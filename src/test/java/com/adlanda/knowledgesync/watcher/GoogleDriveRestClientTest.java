package com.adlanda.knowledgesync.watcher;

import com.adlanda.knowledgesync.config.SyncProperties;
import com.adlanda.knowledgesync.exception.SourceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleDriveRestClientTest {

    private static final String BASE_URL = "https://drive.test/v3";

    private MockRestServiceServer server;
    private GoogleDriveRestClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();

        DriveCredentials credentials = mock(DriveCredentials.class);
        when(credentials.accessToken()).thenReturn("token-123");

        SyncProperties.Remote remote = new SyncProperties.Remote();
        remote.setApiBaseUrl(BASE_URL);
        remote.setMaxRetries(2);
        remote.setRetryBackoff(Duration.ofMillis(1));

        client = new GoogleDriveRestClient(builder, credentials, remote);
    }

    @Test
    void listChildren_followsPageTokens() throws IOException {
        // Setup
        server.expect(requestTo(startsWith(BASE_URL + "/files")))
                .andExpect(header("Authorization", "Bearer token-123"))
                .andRespond(withSuccess("""
                        {"files":[{"id":"1","name":"a.txt","mimeType":"text/plain","headRevisionId":"r1","size":"12"},
                                  {"id":"2","name":"b.txt","mimeType":"text/plain","headRevisionId":"r2","size":"5"}],
                         "nextPageToken":"p2"}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE_URL + "/files")))
                .andExpect(queryParam("pageToken", "p2"))
                .andRespond(withSuccess("""
                        {"files":[{"id":"3","name":"c.txt","mimeType":"text/plain","headRevisionId":"r3","size":"1"}]}
                        """, MediaType.APPLICATION_JSON));

        // Execute
        List<DriveFile> files = client.listChildren("folder-1");

        // Verify
        assertThat(files).extracting(DriveFile::id).containsExactly("1", "2", "3");
        assertThat(files.get(0).size()).isEqualTo(12L);
        server.verify();
    }

    @Test
    void listChildren_serverError_isRetried() throws IOException {
        // Setup
        server.expect(requestTo(startsWith(BASE_URL + "/files"))).andRespond(withServerError());
        server.expect(requestTo(startsWith(BASE_URL + "/files")))
                .andRespond(withSuccess("{\"files\":[]}", MediaType.APPLICATION_JSON));

        // Execute
        List<DriveFile> files = client.listChildren("folder-1");

        // Verify
        assertThat(files).isEmpty();
        server.verify();
    }

    @Test
    void listChildren_serverErrorsExhaustRetries_throwsIOException() {
        // Setup
        server.expect(requestTo(startsWith(BASE_URL + "/files"))).andRespond(withServerError());
        server.expect(requestTo(startsWith(BASE_URL + "/files"))).andRespond(withServerError());
        server.expect(requestTo(startsWith(BASE_URL + "/files"))).andRespond(withServerError());

        // Execute & Verify
        assertThatThrownBy(() -> client.listChildren("folder-1")).isInstanceOf(IOException.class);
        server.verify();
    }

    @Test
    void listChildren_unauthorized_throwsSourceUnavailable() {
        // Setup
        server.expect(requestTo(startsWith(BASE_URL + "/files"))).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        // Execute & Verify
        assertThatThrownBy(() -> client.listChildren("folder-1")).isInstanceOf(SourceUnavailableException.class);
    }

    @Test
    void download_nativeDocument_usesExportEndpoint() throws IOException {
        // Setup
        server.expect(requestTo(containsString("/files/doc-1/export")))
                .andExpect(queryParam("mimeType", "text/plain"))
                .andRespond(withSuccess("exported text", MediaType.TEXT_PLAIN));

        // Execute
        byte[] body = client.download("doc-1", DriveFile.GOOGLE_DOC);

        // Verify
        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("exported text");
        server.verify();
    }

    @Test
    void download_binaryFile_usesMediaEndpoint() throws IOException {
        // Setup
        server.expect(requestTo(containsString("/files/file-1?alt=media")))
                .andRespond(withSuccess("raw bytes", MediaType.APPLICATION_OCTET_STREAM));

        // Execute
        byte[] body = client.download("file-1", "text/plain");

        // Verify
        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("raw bytes");
    }

    @Test
    void download_notFound_throwsIOException() {
        // Setup
        server.expect(requestTo(containsString("/files/missing"))).andRespond(withStatus(HttpStatus.NOT_FOUND));

        // Execute & Verify
        assertThatThrownBy(() -> client.download("missing", "text/plain")).isInstanceOf(IOException.class);
    }
}
