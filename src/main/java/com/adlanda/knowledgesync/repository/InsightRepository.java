package com.adlanda.knowledgesync.repository;

import com.adlanda.knowledgesync.entity.Insight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Repository
public interface InsightRepository extends JpaRepository<Insight, UUID> {

    List<Insight> findBySourceDocumentId(String sourceDocumentId);

    /**
     * Removes the insights of a document before a re-run writes its new set.
     */
    @Transactional
    @Modifying
    @Query("DELETE FROM Insight i WHERE i.sourceDocumentId = :sourceDocumentId")
    int deleteBySourceDocumentId(String sourceDocumentId);
}
