package com.adlanda.knowledgesync.service;

import com.adlanda.knowledgesync.config.SyncProperties;
import com.adlanda.knowledgesync.entity.SourceDocument;
import com.adlanda.knowledgesync.exception.DocumentProcessingException;
import com.adlanda.knowledgesync.exception.UnsupportedContentException;
import com.adlanda.knowledgesync.model.RawContent;
import com.adlanda.knowledgesync.model.SourceItem;
import com.adlanda.knowledgesync.model.StoredChunk;
import com.adlanda.knowledgesync.repository.ChunkStore;
import com.adlanda.knowledgesync.repository.SourceDocumentRepository;
import com.adlanda.knowledgesync.watcher.DriveFile;
import com.adlanda.knowledgesync.watcher.SourceWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts source items into embedded chunks and reconciles the chunk store.
 *
 * Processing an item replaces all of its chunks, so repeating it with unchanged
 * content leaves the store exactly as it was.
 */
@Service
public class DocumentProcessor {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);

    private final SourceWatcher sourceWatcher;
    private final ContentExtractor contentExtractor;
    private final EmbeddingService embeddingService;
    private final ChunkStore chunkStore;
    private final SourceDocumentRepository documentRepository;
    private final FileHashService fileHashService;
    private final ApplicationEventPublisher eventPublisher;
    private final int maxTokens;

    public DocumentProcessor(SourceWatcher sourceWatcher,
                             ContentExtractor contentExtractor,
                             EmbeddingService embeddingService,
                             ChunkStore chunkStore,
                             SourceDocumentRepository documentRepository,
                             FileHashService fileHashService,
                             ApplicationEventPublisher eventPublisher,
                             SyncProperties properties) {
        this.sourceWatcher = sourceWatcher;
        this.contentExtractor = contentExtractor;
        this.embeddingService = embeddingService;
        this.chunkStore = chunkStore;
        this.documentRepository = documentRepository;
        this.fileHashService = fileHashService;
        this.eventPublisher = eventPublisher;
        this.maxTokens = properties.getMaxTokens();
    }

    /**
     * Fetches, chunks, embeds and stores one added or modified item.
     *
     * @return number of chunks now stored for the item
     * @throws UnsupportedContentException if the item's type cannot be turned into text
     * @throws DocumentProcessingException if fetching, embedding or storing fails
     */
    public int process(SourceItem item) throws UnsupportedContentException, DocumentProcessingException {
        // Reject before downloading; native drive files are judged by their export type
        String contentType = DriveFile.contentTypeFor(item.mimeType());
        if (!contentExtractor.supports(contentType)) {
            throw new UnsupportedContentException(item.id(), contentType);
        }

        RawContent raw;
        try {
            raw = sourceWatcher.fetch(item);
        } catch (IOException e) {
            throw new DocumentProcessingException(item.id(), "Failed to fetch " + item.path() + ": " + e.getMessage(), e);
        }

        String text = contentExtractor.extract(item.id(), raw);
        String contentHash = fileHashService.computeHash(raw.bytes());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", item.name());
        metadata.put("path", item.path());
        metadata.put("mimeType", raw.mimeType());
        metadata.put("contentHash", contentHash);

        List<StoredChunk> chunks = chunkContent(text, item.id(), metadata);

        try {
            List<StoredChunk> embedded = embeddingService.embedChunks(chunks);
            chunkStore.replace(item.id(), embedded);
            saveDocument(item, raw.mimeType(), contentHash, text, embedded.size());
        } catch (RuntimeException e) {
            throw new DocumentProcessingException(item.id(), "Failed to store " + item.path() + ": " + e.getMessage(), e);
        }

        log.info("Processed {} ({} chunks)", item.path(), chunks.size());
        eventPublisher.publishEvent(new DocumentIngestedEvent(item.id(), chunks.size()));
        return chunks.size();
    }

    /**
     * Deletes every chunk and the document record of a removed item, then publishes
     * {@link DocumentRemovedEvent} so derived data goes with it.
     *
     * @throws DocumentProcessingException if the store or a removal listener fails
     */
    public void remove(String itemId) throws DocumentProcessingException {
        try {
            int deleted = chunkStore.deleteBySourceItem(itemId);
            documentRepository.deleteById(itemId);
            eventPublisher.publishEvent(new DocumentRemovedEvent(itemId));
            log.info("Removed {} ({} chunks deleted)", itemId, deleted);
        } catch (RuntimeException e) {
            throw new DocumentProcessingException(itemId, "Failed to remove " + itemId + ": " + e.getMessage(), e);
        }
    }

    private void saveDocument(SourceItem item, String mimeType, String contentHash, String text, int chunkCount) {
        SourceDocument document = documentRepository.findById(item.id())
                .orElseGet(() -> new SourceDocument(item.id()));
        document.setTitle(item.name());
        document.setPath(item.path());
        document.setMimeType(mimeType);
        document.setContentHash(contentHash);
        document.setContent(text);
        document.setChunkCount(chunkCount);
        documentRepository.save(document);
    }

    /**
     * Splits content into chunks using paragraph-based splitting.
     *
     * Paragraphs (blank-line separated) are packed into chunks of at most
     * {@code maxTokens}, estimated at ~4 characters per token. A paragraph longer
     * than a whole chunk is cut at the last whitespace before the limit.
     */
    List<StoredChunk> chunkContent(String content, String sourceItemId, Map<String, Object> metadata) {
        List<StoredChunk> chunks = new ArrayList<>();
        int maxChars = maxTokens * 4;

        StringBuilder currentChunk = new StringBuilder();

        for (String paragraph : content.split("\n\n+")) {
            String trimmed = paragraph.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            for (String piece : splitOversized(trimmed, maxChars)) {
                if (currentChunk.length() > 0 && currentChunk.length() + 2 + piece.length() > maxChars) {
                    chunks.add(StoredChunk.withoutEmbedding(
                            sourceItemId, chunks.size(), currentChunk.toString().trim(), metadata));
                    currentChunk = new StringBuilder();
                }

                if (currentChunk.length() > 0) {
                    currentChunk.append("\n\n");
                }
                currentChunk.append(piece);
            }
        }

        // Don't forget the last chunk
        if (currentChunk.length() > 0) {
            chunks.add(StoredChunk.withoutEmbedding(
                    sourceItemId, chunks.size(), currentChunk.toString().trim(), metadata));
        }

        return chunks;
    }

    private static List<String> splitOversized(String paragraph, int maxChars) {
        if (paragraph.length() <= maxChars) {
            return List.of(paragraph);
        }
        List<String> pieces = new ArrayList<>();
        String rest = paragraph;
        while (rest.length() > maxChars) {
            int cut = rest.lastIndexOf(' ', maxChars);
            if (cut <= 0) {
                cut = maxChars;
            }
            pieces.add(rest.substring(0, cut).trim());
            rest = rest.substring(cut).trim();
        }
        if (!rest.isEmpty()) {
            pieces.add(rest);
        }
        return pieces;
    }
}
