package com.leanfinance.services.onboardings.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.exception.ExternalApiException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Google Drive v3 client for client folders on the shared drive.
 */
@Component
@Slf4j
public class GoogleDriveClient {

    private static final String SERVICE = "Google Drive";
    static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";

    private final WebClient webClient;
    private final GoogleTokenService tokenService;

    public GoogleDriveClient(@Qualifier("driveWebClient") WebClient webClient,
                             GoogleTokenService tokenService) {
        this.webClient = webClient;
        this.tokenService = tokenService;
    }

    /** Id of the non-trashed folder called {@code name} directly under {@code parentId}. */
    public Optional<String> findFolder(String name, String parentId) {
        String query = "name = '" + escape(name) + "'"
                + " and '" + escape(parentId) + "' in parents"
                + " and mimeType = '" + FOLDER_MIME_TYPE + "'"
                + " and trashed = false";
        try {
            FileList result = webClient.get()
                    .uri(uri -> uri
                            .path("/files")
                            .queryParam("q", "{q}")
                            .queryParam("fields", "{fields}")
                            .queryParam("includeItemsFromAllDrives", "true")
                            .queryParam("supportsAllDrives", "true")
                            .queryParam("corpora", "allDrives")
                            .build(query, "files(id, name)"))
                    .headers(h -> h.setBearerAuth(tokenService.getAccessToken()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, "Folder search"))
                    .bodyToMono(FileList.class)
                    .block();

            if (result == null || result.getFiles().isEmpty()) {
                return Optional.empty();
            }
            String folderId = result.getFiles().get(0).getId();
            log.debug("Drive folder found: name={}, folderId={}", name, folderId);
            return Optional.of(folderId);
        } catch (WebClientException ex) {
            throw ApiErrors.map(SERVICE, "Folder search", ex);
        }
    }

    public String createFolder(String name, String parentId) {
        Map<String, Object> metadata = Map.of(
                "name", name,
                "mimeType", FOLDER_MIME_TYPE,
                "parents", List.of(parentId));
        try {
            DriveFile created = webClient.post()
                    .uri(uri -> uri
                            .path("/files")
                            .queryParam("supportsAllDrives", "true")
                            .queryParam("fields", "{fields}")
                            .build("id, name"))
                    .headers(h -> h.setBearerAuth(tokenService.getAccessToken()))
                    .bodyValue(metadata)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, ApiErrors.onError(SERVICE, "Folder creation"))
                    .bodyToMono(DriveFile.class)
                    .block();

            if (created == null || created.getId() == null) {
                throw new ExternalApiException(SERVICE, "Folder creation returned no id for '" + name + "'");
            }
            log.info("Drive folder created: name={}, folderId={}, parentId={}", name, created.getId(), parentId);
            return created.getId();
        } catch (WebClientException ex) {
            throw ApiErrors.map(SERVICE, "Folder creation", ex);
        }
    }

    public String findOrCreateFolder(String name, String parentId) {
        return findFolder(name, parentId).orElseGet(() -> createFolder(name, parentId));
    }

    public static String folderUrl(String folderId) {
        return String.format(OnboardingConstants.DRIVE_FOLDER_URL, folderId);
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class FileList {
        private List<DriveFile> files = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DriveFile {
        private String id;
        private String name;
    }
}
