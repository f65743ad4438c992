package com.schoolrecords.backend.modules.student.presentation;

import java.util.List;

import com.schoolrecords.backend.global.security.SecurityUtils;
import com.schoolrecords.backend.modules.student.application.StudentService;
import com.schoolrecords.backend.modules.student.application.StudentService.RegisterStudentCommand;
import com.schoolrecords.backend.modules.student.presentation.dto.RegisterStudentRequest;
import com.schoolrecords.backend.modules.student.presentation.dto.StudentResponse;

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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/students")
public class StudentController {

    private final StudentService studentService;

    public StudentController(StudentService studentService) {
        this.studentService = studentService;
    }

    @Operation(
            summary = "Register student",
            description = """
                    Creates a student and allocates the next `STU<year><seq>` code for the enrollment year. \
                    When allocation keeps conflicting, 409 `ALLOCATION_CONFLICT` is returned with `Retry-After`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Student registered"),
            @ApiResponse(responseCode = "409", description = "Code allocation conflict, retry later")
    })
    @PostMapping
    public ResponseEntity<StudentResponse> registerStudent(@Valid @RequestBody RegisterStudentRequest request) {
        RegisterStudentCommand command = new RegisterStudentCommand(
                request.firstName(),
                request.lastName(),
                request.dateOfBirth(),
                request.gender(),
                request.email(),
                request.phone(),
                request.address(),
                request.photoReference(),
                request.enrollmentDate()
        );
        StudentResponse response = studentService.registerStudent(SecurityUtils.getCurrentCapabilities(), command);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<StudentResponse>> listStudents() {
        return ResponseEntity.ok(studentService.listStudents());
    }

    @GetMapping("/{studentCode}")
    public ResponseEntity<StudentResponse> getStudent(@PathVariable("studentCode") String studentCode) {
        return ResponseEntity.ok(studentService.getStudent(studentCode));
    }

    @Operation(summary = "Delete student", description = "Removes the student with enrollments, grades, attendance and notifications.")
    @DeleteMapping("/{studentCode}")
    public ResponseEntity<Void> deleteStudent(@PathVariable("studentCode") String studentCode) {
        studentService.deleteStudent(SecurityUtils.getCurrentCapabilities(), studentCode);
        return ResponseEntity.noContent().build();
    }
}
