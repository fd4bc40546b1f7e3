package com.eyelevel.bordereaux.repository;

import com.eyelevel.bordereaux.model.BordereauxRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface BordereauxRowRepository extends JpaRepository<BordereauxRow, Long> {

    @Modifying
    @Query(name = "BordereauxRow.deleteByFileId")
    int deleteByFileId(@Param("fileId") Long fileId);

    @Query(name = "BordereauxRow.countByFileId")
    long countByFileId(@Param("fileId") Long fileId);
}
