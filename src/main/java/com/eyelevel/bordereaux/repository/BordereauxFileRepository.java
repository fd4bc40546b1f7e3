package com.eyelevel.bordereaux.repository;

import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for {@link BordereauxFile}.
 * JPQL queries are defined in META-INF/bordereaux-orm.xml.
 * <p>
 * Every status-changing method is a conditional update that returns the number of rows it touched: {@code 1}
 * means this caller won, {@code 0} means the file was no longer in the expected status.
 */
@Repository
public interface BordereauxFileRepository extends JpaRepository<BordereauxFile, Long>,
        JpaSpecificationExecutor<BordereauxFile> {

    @Transactional(readOnly = true)
    Optional<BordereauxFile> findByContentHash(String contentHash);

    @Query(name = "BordereauxFile.findIdsByStatus")
    List<Long> findIdsByStatus(@Param("status") FileStatus status);

    @Transactional(readOnly = true)
    List<BordereauxFile> findByStatusInAndUpdatedAtBefore(Collection<FileStatus> statuses, LocalDateTime threshold);

    @Modifying(clearAutomatically = true)
    @Query(name = "BordereauxFile.updateStatusIfExpected")
    int updateStatusIfExpected(@Param("id") Long id, @Param("newStatus") FileStatus newStatus,
                               @Param("expectedStatus") FileStatus expectedStatus, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query(name = "BordereauxFile.failIfInStatus")
    int failIfInStatus(@Param("id") Long id, @Param("expectedStatus") FileStatus expectedStatus,
                       @Param("failedStatus") FileStatus failedStatus, @Param("errorMessage") String errorMessage,
                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query(name = "BordereauxFile.completeRun")
    int completeRun(@Param("id") Long id, @Param("expectedStatus") FileStatus expectedStatus,
                    @Param("newStatus") FileStatus newStatus, @Param("totalRows") int totalRows,
                    @Param("validRows") int validRows, @Param("errorRows") int errorRows,
                    @Param("templateId") String templateId, @Param("errorMessage") String errorMessage,
                    @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query(name = "BordereauxFile.resetForReprocess")
    int resetForReprocess(@Param("id") Long id, @Param("expectedStatus") FileStatus expectedStatus,
                          @Param("receivedStatus") FileStatus receivedStatus, @Param("now") LocalDateTime now);
}
