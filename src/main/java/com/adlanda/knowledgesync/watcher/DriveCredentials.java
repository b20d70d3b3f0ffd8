package com.adlanda.knowledgesync.watcher;

import com.adlanda.knowledgesync.config.SyncProperties;
import com.adlanda.knowledgesync.exception.SourceUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves Drive access tokens.
 *
 * The service-credential blob is tried first, then the token file. Whichever first yields
 * an access token is kept for the life of the process; callers only ever see a bearer token.
 */
public class DriveCredentials {

    private static final Logger log = LoggerFactory.getLogger(DriveCredentials.class);

    static final List<String> SCOPES = List.of("https://www.googleapis.com/auth/drive.readonly");

    /**
     * Turns credential JSON into Google credentials.
     */
    @FunctionalInterface
    interface CredentialsLoader {
        GoogleCredentials load(InputStream json) throws IOException;
    }

    private final SyncProperties.Remote remote;
    private final ObjectMapper objectMapper;
    private final CredentialsLoader loader;

    private GoogleCredentials credentials;
    private String activeSource;

    public DriveCredentials(SyncProperties.Remote remote, ObjectMapper objectMapper) {
        this(remote, objectMapper, json -> GoogleCredentials.fromStream(json).createScoped(SCOPES));
    }

    DriveCredentials(SyncProperties.Remote remote, ObjectMapper objectMapper, CredentialsLoader loader) {
        this.remote = remote;
        this.objectMapper = objectMapper;
        this.loader = loader;
    }

    /**
     * Returns a valid bearer token, refreshing it when it is about to expire.
     *
     * @throws SourceUnavailableException if no credential source yields a token
     */
    public synchronized String accessToken() {
        if (credentials == null) {
            resolve();
        }
        try {
            credentials.refreshIfExpired();
            AccessToken token = credentials.getAccessToken();
            if (token == null) {
                throw new SourceUnavailableException("Drive credentials from " + activeSource + " produced no access token");
            }
            return token.getTokenValue();
        } catch (IOException e) {
            throw new SourceUnavailableException("Drive token refresh failed for " + activeSource, e);
        }
    }

    /**
     * Name of the credential source in use, or null before the first token request.
     */
    public synchronized String activeSource() {
        return activeSource;
    }

    private void resolve() {
        List<String> failures = new ArrayList<>();

        if (remote.hasServiceCredentials()) {
            byte[] json = remote.getServiceCredentials().getBytes(StandardCharsets.UTF_8);
            if (tryAuthenticate("service credentials", json, failures)) {
                return;
            }
        }

        if (remote.hasTokenFile()) {
            try {
                byte[] json = normalizeTokenFile(Files.readAllBytes(Path.of(remote.getTokenFile())));
                if (tryAuthenticate("token file " + remote.getTokenFile(), json, failures)) {
                    return;
                }
            } catch (IOException e) {
                failures.add("token file " + remote.getTokenFile() + ": " + e.getMessage());
            }
        }

        if (failures.isEmpty()) {
            failures.add("no service credentials or token file configured");
        }
        throw new SourceUnavailableException("Drive authentication failed: " + String.join("; ", failures));
    }

    private boolean tryAuthenticate(String source, byte[] json, List<String> failures) {
        try (InputStream in = new ByteArrayInputStream(json)) {
            GoogleCredentials candidate = loader.load(in);
            candidate.refresh();
            credentials = candidate;
            activeSource = source;
            log.info("Authenticated to Drive using {}", source);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Drive authentication with {} failed: {}", source, e.getMessage());
            failures.add(source + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Token files written by interactive authorization tools often omit the credential type.
     */
    private byte[] normalizeTokenFile(byte[] json) throws IOException {
        ObjectNode node = (ObjectNode) objectMapper.readTree(json);
        if (!node.has("type")) {
            node.put("type", "authorized_user");
        }
        return objectMapper.writeValueAsBytes(node);
    }
}
