package com.example.mediacatalog_backend.repository;

import com.example.mediacatalog_backend.model.Flow;
import com.example.mediacatalog_backend.util.ContentFormat;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FlowRepository extends JpaRepository<Flow, UUID> {
    /**
     * Row lock on the flow; every segment mutation for a flow takes it first, so mutations on the
     * same flow run one after another while other flows proceed in parallel.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from Flow f where f.id = :id")
    Optional<Flow> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
       select f from Flow f
       where (:sourceId is null or f.sourceId = :sourceId)
         and (:format is null or f.format = :format)
         and (:codec is null or f.codec = :codec)
         and (:label is null or f.label = :label)
       order by f.createdAt, f.id
    """)
    Page<Flow> search(@Param("sourceId") UUID sourceId,
                      @Param("format") ContentFormat format,
                      @Param("codec") String codec,
                      @Param("label") String label,
                      Pageable pageable);

    List<Flow> findBySourceId(UUID sourceId);

    /** Flows with a non-empty collection; an empty collection is stored as null. */
    @Query("select f from Flow f where f.flowCollection is not null and f.id <> :excluded")
    List<Flow> findCollectionsExcept(@Param("excluded") UUID excluded);
}
