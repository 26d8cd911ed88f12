package com.example.mediacatalog_backend.repository;

import com.example.mediacatalog_backend.model.DeletionRequest;
import com.example.mediacatalog_backend.util.DeletionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface DeletionRequestRepository extends JpaRepository<DeletionRequest, UUID> {
    /** Pending requests, and processing ones whose lease has run out (crashed or stalled worker). */
    @Query("""
       select d.id from DeletionRequest d
       where d.status = com.example.mediacatalog_backend.util.DeletionStatus.PENDING
          or (d.status = com.example.mediacatalog_backend.util.DeletionStatus.PROCESSING
              and (d.leaseExpiresAt is null or d.leaseExpiresAt < :now))
       order by d.createdAt
    """)
    List<UUID> findClaimable(@Param("now") Instant now, Pageable pageable);

    /**
     * Conditional claim. Succeeds (returns 1) only if the request is still claimable, so two
     * workers racing for the same id cannot both win.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update DeletionRequest d
          set d.status = com.example.mediacatalog_backend.util.DeletionStatus.PROCESSING,
              d.leaseOwner = :owner,
              d.leaseExpiresAt = :expiresAt,
              d.updatedAt = :now,
              d.version = d.version + 1
        where d.id = :id
          and (d.status = com.example.mediacatalog_backend.util.DeletionStatus.PENDING
               or (d.status = com.example.mediacatalog_backend.util.DeletionStatus.PROCESSING
                   and (d.leaseExpiresAt is null or d.leaseExpiresAt < :now or d.leaseOwner = :owner)))
    """)
    int tryAcquireLease(@Param("id") UUID id,
                        @Param("owner") String owner,
                        @Param("now") Instant now,
                        @Param("expiresAt") Instant expiresAt);

    /** Ends a request nobody has claimed yet; returns 0 once a worker took it. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update DeletionRequest d
          set d.status = com.example.mediacatalog_backend.util.DeletionStatus.ERROR,
              d.errorReason = :reason,
              d.updatedAt = :now,
              d.version = d.version + 1
        where d.id = :id
          and d.status = com.example.mediacatalog_backend.util.DeletionStatus.PENDING
    """)
    int cancelPending(@Param("id") UUID id, @Param("reason") String reason, @Param("now") Instant now);

    /** Flags a processing request; the worker stops at its next batch boundary. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update DeletionRequest d
          set d.cancelRequested = true,
              d.updatedAt = :now,
              d.version = d.version + 1
        where d.id = :id
          and d.status = com.example.mediacatalog_backend.util.DeletionStatus.PROCESSING
    """)
    int flagCancel(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update DeletionRequest d
          set d.leaseOwner = null,
              d.leaseExpiresAt = null,
              d.version = d.version + 1
        where d.leaseOwner = :owner
          and d.status = com.example.mediacatalog_backend.util.DeletionStatus.PROCESSING
    """)
    int releaseLeases(@Param("owner") String owner);

    /** Expires every processing lease, making interrupted requests claimable again. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update DeletionRequest d
          set d.leaseOwner = null,
              d.leaseExpiresAt = null,
              d.version = d.version + 1
        where d.status = com.example.mediacatalog_backend.util.DeletionStatus.PROCESSING
    """)
    int releaseAllLeases();

    @Query("""
       select d from DeletionRequest d
       where (:flowId is null or d.flowId = :flowId)
         and (:status is null or d.status = :status)
       order by d.createdAt, d.id
    """)
    Page<DeletionRequest> search(@Param("flowId") UUID flowId,
                                 @Param("status") DeletionStatus status,
                                 Pageable pageable);
}
