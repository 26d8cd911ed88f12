package com.example.mediacatalog_backend.repository;

import com.example.mediacatalog_backend.model.Source;
import com.example.mediacatalog_backend.util.ContentFormat;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.UUID;

public interface SourceRepository extends JpaRepository<Source, UUID> {
    @Query("""
       select s from Source s
       where (:format is null or s.format = :format)
         and (:label is null or s.label = :label)
       order by s.createdAt, s.id
    """)
    Page<Source> search(@Param("format") ContentFormat format, @Param("label") String label, Pageable pageable);
}
