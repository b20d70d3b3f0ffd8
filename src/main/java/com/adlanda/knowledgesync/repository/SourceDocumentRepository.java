package com.adlanda.knowledgesync.repository;

import com.adlanda.knowledgesync.entity.SourceDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ingested documents.
 */
@Repository
public interface SourceDocumentRepository extends JpaRepository<SourceDocument, String> {

    /**
     * Ids of documents that have never been queued for insight generation.
     */
    @Query("SELECT d.id FROM SourceDocument d WHERE NOT EXISTS " +
            "(SELECT t.id FROM QueueTask t WHERE t.documentId = d.id) ORDER BY d.ingestedAt")
    List<String> findIdsWithoutQueueTask();
}
