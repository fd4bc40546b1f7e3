package com.eyelevel.bordereaux.repository;

import com.eyelevel.bordereaux.model.FileType;
import com.eyelevel.bordereaux.model.Template;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TemplateRepository extends JpaRepository<Template, String> {

    List<Template> findByActiveTrueOrderByTemplateIdAsc();

    List<Template> findByActiveTrueAndFileTypeOrderByTemplateIdAsc(FileType fileType);
}
