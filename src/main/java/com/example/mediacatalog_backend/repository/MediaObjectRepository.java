package com.example.mediacatalog_backend.repository;

import com.example.mediacatalog_backend.model.MediaObject;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface MediaObjectRepository extends JpaRepository<MediaObject, String> {
    /**
     * Row lock taken by reference changes and by the reaper, so an object cannot gain a reference
     * while its bytes are being reclaimed.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from MediaObject o where o.objectId = :objectId")
    Optional<MediaObject> findByIdForUpdate(@Param("objectId") String objectId);

    @Query("""
       select o.objectId from MediaObject o
       where o.unreferencedSince is not null
         and o.unreferencedSince < :cutoff
       order by o.unreferencedSince
    """)
    List<String> findUnreferencedBefore(@Param("cutoff") Instant cutoff, Pageable pageable);
}
