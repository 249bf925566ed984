package com.openforge.aacsecurity.repository;

import com.openforge.aacsecurity.audit.AuditEventType;
import com.openforge.aacsecurity.audit.AuditSeverity;
import com.openforge.aacsecurity.domain.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findByEventTypeOrderByIdAsc(AuditEventType eventType);

    /**
     * Forensic search; every filter is optional.
     */
    @Query("""
            select a from AuditLog a
            where (:eventType is null or a.eventType = :eventType)
              and (:severity  is null or a.severity  = :severity)
              and (:username  is null or a.username  = :username)
            order by a.timestamp desc, a.id desc
            """)
    Page<AuditLog> search(@Param("eventType") AuditEventType eventType,
                          @Param("severity") AuditSeverity severity,
                          @Param("username") String username,
                          Pageable pageable);
}
