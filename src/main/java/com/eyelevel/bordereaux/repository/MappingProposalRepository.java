package com.eyelevel.bordereaux.repository;

import com.eyelevel.bordereaux.model.MappingProposal;
import com.eyelevel.bordereaux.model.ReviewStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface MappingProposalRepository extends JpaRepository<MappingProposal, Long> {

    Page<MappingProposal> findByReviewStatus(ReviewStatus reviewStatus, Pageable pageable);

    List<MappingProposal> findByFile_IdOrderByCreatedAtDesc(Long fileId);

    @Modifying(clearAutomatically = true)
    @Query(name = "MappingProposal.reviewIfPending")
    int reviewIfPending(@Param("id") Long id, @Param("newStatus") ReviewStatus newStatus,
                        @Param("templateId") String templateId, @Param("pendingStatus") ReviewStatus pendingStatus,
                        @Param("now") LocalDateTime now);
}
