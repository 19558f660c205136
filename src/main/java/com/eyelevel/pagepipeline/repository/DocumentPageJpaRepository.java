package com.eyelevel.pagepipeline.repository;

import com.eyelevel.pagepipeline.model.DocumentPage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link DocumentPage} entity.
 */
@Repository
public interface DocumentPageJpaRepository extends JpaRepository<DocumentPage, Long> {

    Optional<DocumentPage> findByDocumentIdAndPageNumber(Long documentId, Integer pageNumber);

    List<DocumentPage> findAllByDocumentIdOrderByPageNumberAsc(Long documentId);

    @Modifying
    @Query("delete from DocumentPage p where p.document.id = :documentId")
    int deleteAllByDocumentId(@Param("documentId") Long documentId);
}
