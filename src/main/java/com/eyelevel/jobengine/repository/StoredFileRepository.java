package com.eyelevel.jobengine.repository;

import com.eyelevel.jobengine.model.FileStatus;
import com.eyelevel.jobengine.model.StoredFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface StoredFileRepository extends JpaRepository<StoredFile, String> {

    @Modifying
    @Transactional
    @Query("UPDATE StoredFile f SET f.status = :status, f.updatedAt = :now WHERE f.id = :id")
    int updateStatus(@Param("id") String id, @Param("status") FileStatus status, @Param("now") Instant now);
}
