package com.example.mediacatalog_backend.repository;

import com.example.mediacatalog_backend.model.CatalogEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface CatalogEventRepository extends JpaRepository<CatalogEvent, Long> {
    @Query("select e from CatalogEvent e where e.fannedOut = false order by e.id")
    List<CatalogEvent> findNotFannedOut(Pageable pageable);

    @Query("select max(e.id) from CatalogEvent e where e.fannedOut = true")
    Long findMaxFannedOutId();
}
