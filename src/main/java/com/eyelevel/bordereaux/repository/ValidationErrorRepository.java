package com.eyelevel.bordereaux.repository;

import com.eyelevel.bordereaux.model.ValidationError;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ValidationErrorRepository extends JpaRepository<ValidationError, Long> {

    Page<ValidationError> findByFile_IdOrderByRowIndexAscIdAsc(Long fileId, Pageable pageable);

    long countByFile_Id(Long fileId);

    /**
     * @return rows of {@code [Severity, Long]}
     */
    @Query(name = "ValidationError.countBySeverity")
    List<Object[]> countBySeverity(@Param("fileId") Long fileId);

    @Modifying
    @Query(name = "ValidationError.deleteByFileId")
    int deleteByFileId(@Param("fileId") Long fileId);
}
