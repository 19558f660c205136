package com.eyelevel.pagepipeline.repository;

import com.eyelevel.pagepipeline.model.Document;
import com.eyelevel.pagepipeline.model.ProcessingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the {@link Document} entity.
 */
@Repository
public interface DocumentJpaRepository extends JpaRepository<Document, Long> {

    @Query("select d.id from Document d where d.processingStatus = :status order by d.id")
    List<Long> findIdsByProcessingStatus(@Param("status") ProcessingStatus status);

    @Query("select d.id from Document d order by d.id")
    List<Long> findAllIds();
}
