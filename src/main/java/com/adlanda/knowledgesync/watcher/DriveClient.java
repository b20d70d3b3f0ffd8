package com.adlanda.knowledgesync.watcher;

import java.io.IOException;
import java.util.List;

/**
 * Remote-listing API client.
 */
public interface DriveClient {

    /**
     * Lists the non-trashed direct children of a folder, following all result pages.
     *
     * @throws IOException if the folder cannot be listed after retries
     */
    List<DriveFile> listChildren(String folderId) throws IOException;

    /**
     * Downloads a file's content, exporting native Google files to text.
     */
    byte[] download(String fileId, String mimeType) throws IOException;
}
