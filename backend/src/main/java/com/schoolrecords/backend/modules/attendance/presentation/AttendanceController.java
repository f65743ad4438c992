package com.schoolrecords.backend.modules.attendance.presentation;

import java.time.LocalDate;
import java.util.List;

import com.schoolrecords.backend.global.security.SecurityUtils;
import com.schoolrecords.backend.modules.attendance.application.AttendanceService;
import com.schoolrecords.backend.modules.attendance.application.AttendanceService.AttendanceEntry;
import com.schoolrecords.backend.modules.attendance.application.AttendanceService.MarkResult;
import com.schoolrecords.backend.modules.attendance.domain.UpsertOutcome;
import com.schoolrecords.backend.modules.attendance.presentation.dto.AttendanceRecordResponse;
import com.schoolrecords.backend.modules.attendance.presentation.dto.MarkAttendanceRequest;
import com.schoolrecords.backend.modules.attendance.presentation.dto.MarkAttendanceResponse;
import com.schoolrecords.backend.modules.attendance.presentation.dto.MarkAttendanceResponse.MarkedEntryResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AttendanceController {

    private final AttendanceService attendanceService;

    public AttendanceController(AttendanceService attendanceService) {
        this.attendanceService = attendanceService;
    }

    @Operation(
            summary = "Mark attendance",
            description = """
                    Upserts one attendance row per entry for the course and date. Entries are applied in order; \
                    an unknown student stops the batch with 404 `STUDENT_NOT_FOUND` and earlier entries stay applied.
                    """
    )
    @PostMapping("/courses/{courseCode}/attendance")
    public ResponseEntity<MarkAttendanceResponse> markAttendance(
            @PathVariable("courseCode") String courseCode,
            @Valid @RequestBody MarkAttendanceRequest request
    ) {
        List<AttendanceEntry> entries = request.entries().stream()
                .map(entry -> new AttendanceEntry(entry.studentCode(), entry.status(), entry.remark()))
                .toList();
        MarkResult result = attendanceService.markAttendance(
                SecurityUtils.getCurrentCapabilities(),
                courseCode,
                request.date(),
                entries
        );
        return ResponseEntity.ok(toResponse(result));
    }

    @GetMapping("/students/{studentCode}/attendance")
    public ResponseEntity<List<AttendanceRecordResponse>> getAttendance(
            @PathVariable("studentCode") String studentCode,
            @RequestParam("course") String courseCode,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(attendanceService.getAttendance(studentCode, courseCode, from, to));
    }

    private MarkAttendanceResponse toResponse(MarkResult result) {
        List<MarkedEntryResponse> entries = result.entries().stream()
                .map(entry -> new MarkedEntryResponse(
                        entry.studentCode(),
                        entry.status().name(),
                        entry.outcome().name()))
                .toList();
        return new MarkAttendanceResponse(
                result.courseCode(),
                result.date(),
                (int) result.count(UpsertOutcome.INSERTED),
                (int) result.count(UpsertOutcome.UPDATED),
                entries
        );
    }
}
