package com.example.mediacatalog_backend.repository;

import com.example.mediacatalog_backend.model.FlowSegment;
import com.example.mediacatalog_backend.timerange.TimeRange;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface FlowSegmentRepository extends JpaRepository<FlowSegment, UUID> {
    /**
     * Coarse, second-granular overlap scan in start order, resuming strictly after the start
     * (afterSec, afterNanos, afterRank). Callers apply the exact overlap test on the result.
     */
    @Query("""
       select s from FlowSegment s
       where s.flow.id = :flowId
         and s.endSec >= :fromSec
         and s.startSec <= :toSec
         and (s.startSec > :afterSec
              or (s.startSec = :afterSec and s.startNanos > :afterNanos)
              or (s.startSec = :afterSec and s.startNanos = :afterNanos and s.startRank > :afterRank))
       order by s.startSec, s.startNanos, s.startRank
    """)
    List<FlowSegment> scanFrom(@Param("flowId") UUID flowId,
                               @Param("fromSec") long fromSec,
                               @Param("toSec") long toSec,
                               @Param("afterSec") long afterSec,
                               @Param("afterNanos") int afterNanos,
                               @Param("afterRank") int afterRank,
                               Pageable pageable);

    @Query("""
       select s from FlowSegment s
       where s.flow.id = :flowId
         and s.endSec >= :fromSec
         and s.startSec <= :toSec
       order by s.startSec, s.startNanos, s.startRank
    """)
    List<FlowSegment> findCandidates(@Param("flowId") UUID flowId,
                                     @Param("fromSec") long fromSec,
                                     @Param("toSec") long toSec);

    @Query("select s.timerange from FlowSegment s where s.flow.id = :flowId")
    List<TimeRange> findTimerangesByFlowId(@Param("flowId") UUID flowId);

    @Query("select case when count(s) > 0 then true else false end from FlowSegment s where s.flow.id = :flowId and s.objectId = :objectId")
    boolean existsByFlowIdAndObjectId(@Param("flowId") UUID flowId, @Param("objectId") String objectId);

    @Query("select distinct s.objectId from FlowSegment s where s.flow.id = :flowId")
    List<String> findObjectIdsByFlowId(@Param("flowId") UUID flowId);

    @Query("select count(s) from FlowSegment s where s.flow.id = :flowId")
    long countByFlowId(@Param("flowId") UUID flowId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from FlowSegment s where s.flow.id = :flowId")
    int deleteAllByFlowId(@Param("flowId") UUID flowId);
}
