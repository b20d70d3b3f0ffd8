package com.adlanda.knowledgesync.service;

import com.adlanda.knowledgesync.model.StoredChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for generating vector embeddings from text.
 *
 * Uses Spring AI's EmbeddingModel to call OpenAI's embedding API.
 * Rate limits and timeouts are retried by Spring AI's own retry template.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;

    public EmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    /**
     * Generates an embedding vector for the given text.
     *
     * @param text The text to embed
     * @return A list of doubles representing the embedding vector
     */
    public List<Double> embed(String text) {
        EmbeddingResponse response = embeddingModel.embedForResponse(List.of(text));
        float[] embedding = response.getResult().getOutput();
        return toDoubleList(embedding);
    }

    /**
     * Adds embeddings to a list of chunks, one call per chunk.
     *
     * @param chunks Chunks without embeddings
     * @return Chunks with embeddings added, in the same order
     */
    public List<StoredChunk> embedChunks(List<StoredChunk> chunks) {
        if (chunks.isEmpty()) {
            return List.of();
        }

        List<StoredChunk> embeddedChunks = chunks.stream()
                .map(chunk -> chunk.withEmbedding(embed(chunk.content())))
                .toList();

        log.debug("Generated {} embeddings for {}", embeddedChunks.size(), chunks.get(0).sourceItemId());
        return embeddedChunks;
    }

    private List<Double> toDoubleList(float[] floats) {
        Double[] doubles = new Double[floats.length];
        for (int i = 0; i < floats.length; i++) {
            doubles[i] = (double) floats[i];
        }
        return List.of(doubles);
    }
}
