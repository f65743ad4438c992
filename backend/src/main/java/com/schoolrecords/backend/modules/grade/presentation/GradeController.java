package com.schoolrecords.backend.modules.grade.presentation;

import java.util.UUID;

import com.schoolrecords.backend.global.security.SecurityUtils;
import com.schoolrecords.backend.modules.grade.application.GradeService;
import com.schoolrecords.backend.modules.grade.presentation.dto.GradeResponse;
import com.schoolrecords.backend.modules.grade.presentation.dto.RecordGradeRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/enrollments/{enrollmentId}/grade")
public class GradeController {

    private final GradeService gradeService;

    public GradeController(GradeService gradeService) {
        this.gradeService = gradeService;
    }

    @Operation(
            summary = "Record grade",
            description = "Creates or replaces the grade of an enrollment. The letter is derived from the marks."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Grade stored"),
            @ApiResponse(responseCode = "422", description = "`INVALID_SCORE` when marks are outside [0, 100]")
    })
    @PutMapping
    public ResponseEntity<GradeResponse> recordGrade(
            @PathVariable("enrollmentId") UUID enrollmentId,
            @Valid @RequestBody RecordGradeRequest request
    ) {
        return ResponseEntity.ok(gradeService.recordGrade(
                SecurityUtils.getCurrentCapabilities(),
                enrollmentId,
                request.marks(),
                request.remark()
        ));
    }

    @GetMapping
    public ResponseEntity<GradeResponse> getGrade(@PathVariable("enrollmentId") UUID enrollmentId) {
        return ResponseEntity.ok(gradeService.getGrade(enrollmentId));
    }
}
