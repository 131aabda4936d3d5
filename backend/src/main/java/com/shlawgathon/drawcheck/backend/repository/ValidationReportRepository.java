package com.shlawgathon.drawcheck.backend.repository;

import com.shlawgathon.drawcheck.backend.model.ReportStatus;
import com.shlawgathon.drawcheck.backend.model.ValidationReport;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ValidationReportRepository extends MongoRepository<ValidationReport, String> {

    Page<ValidationReport> findAllByOrderByStartedAtDesc(Pageable pageable);

    List<ValidationReport> findByStatus(ReportStatus status);

    List<ValidationReport> findByStatusIn(List<ReportStatus> statuses);
}
