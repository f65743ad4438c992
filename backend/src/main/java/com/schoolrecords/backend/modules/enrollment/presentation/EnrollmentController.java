package com.schoolrecords.backend.modules.enrollment.presentation;

import java.util.List;
import java.util.UUID;

import com.schoolrecords.backend.global.security.SecurityUtils;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentService;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentService.EnrollCommand;
import com.schoolrecords.backend.modules.enrollment.presentation.dto.EnrollRequest;
import com.schoolrecords.backend.modules.enrollment.presentation.dto.EnrollmentResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EnrollmentController {

    private final EnrollmentService enrollmentService;

    public EnrollmentController(EnrollmentService enrollmentService) {
        this.enrollmentService = enrollmentService;
    }

    @Operation(summary = "Enroll student", description = "Enrolls a student in a course for one semester and academic year.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Enrollment created"),
            @ApiResponse(responseCode = "404", description = "`STUDENT_NOT_FOUND` or `COURSE_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "`DUPLICATE_ENROLLMENT` for the same term")
    })
    @PostMapping("/enrollments")
    public ResponseEntity<EnrollmentResponse> enroll(@Valid @RequestBody EnrollRequest request) {
        EnrollCommand command = new EnrollCommand(
                request.studentCode(),
                request.courseCode(),
                request.semester(),
                request.academicYear()
        );
        EnrollmentResponse response = enrollmentService.enroll(SecurityUtils.getCurrentCapabilities(), command);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/students/{studentCode}/enrollments")
    public ResponseEntity<List<EnrollmentResponse>> listEnrollments(
            @PathVariable("studentCode") String studentCode,
            @RequestParam(name = "semester", required = false) String semester,
            @RequestParam(name = "academicYear", required = false) String academicYear
    ) {
        return ResponseEntity.ok(enrollmentService.listEnrollments(studentCode, semester, academicYear));
    }

    @DeleteMapping("/enrollments/{enrollmentId}")
    public ResponseEntity<Void> withdraw(@PathVariable("enrollmentId") UUID enrollmentId) {
        enrollmentService.withdraw(SecurityUtils.getCurrentCapabilities(), enrollmentId);
        return ResponseEntity.noContent().build();
    }
}
