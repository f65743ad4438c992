package com.schoolrecords.backend.modules.report.presentation;

import java.time.LocalDate;

import com.schoolrecords.backend.modules.report.application.ReportService;
import com.schoolrecords.backend.modules.report.domain.AttendanceSummary;
import com.schoolrecords.backend.modules.report.domain.ReportCard;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/students/{studentCode}")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @Operation(
            summary = "Report card",
            description = "Graded courses of one term with total credits and credit-weighted GPA. Unknown students get an empty card."
    )
    @GetMapping("/report-card")
    public ResponseEntity<ReportCard> getReportCard(
            @PathVariable("studentCode") String studentCode,
            @RequestParam("semester") String semester,
            @RequestParam("academicYear") String academicYear
    ) {
        return ResponseEntity.ok(reportService.buildReportCard(studentCode, semester, academicYear));
    }

    @GetMapping("/attendance-summary")
    public ResponseEntity<AttendanceSummary> getAttendanceSummary(
            @PathVariable("studentCode") String studentCode,
            @RequestParam("course") String courseCode,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(reportService.buildAttendanceSummary(studentCode, courseCode, from, to));
    }
}
