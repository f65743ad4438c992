package com.schoolrecords.backend.modules.course.presentation;

import java.util.List;

import com.schoolrecords.backend.global.security.SecurityUtils;
import com.schoolrecords.backend.modules.course.application.CourseService;
import com.schoolrecords.backend.modules.course.application.CourseService.CreateCourseCommand;
import com.schoolrecords.backend.modules.course.presentation.dto.CourseResponse;
import com.schoolrecords.backend.modules.course.presentation.dto.CreateCourseRequest;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/courses")
public class CourseController {

    private final CourseService courseService;

    public CourseController(CourseService courseService) {
        this.courseService = courseService;
    }

    @PostMapping
    public ResponseEntity<CourseResponse> createCourse(@Valid @RequestBody CreateCourseRequest request) {
        CreateCourseCommand command = new CreateCourseCommand(
                request.code(),
                request.name(),
                request.creditHours(),
                request.department()
        );
        CourseResponse response = courseService.createCourse(SecurityUtils.getCurrentCapabilities(), command);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<CourseResponse>> listCourses(
            @RequestParam(name = "department", required = false) String department
    ) {
        return ResponseEntity.ok(courseService.listCourses(department));
    }

    @GetMapping("/{courseCode}")
    public ResponseEntity<CourseResponse> getCourse(@PathVariable("courseCode") String courseCode) {
        return ResponseEntity.ok(courseService.getCourse(courseCode));
    }

    @DeleteMapping("/{courseCode}")
    public ResponseEntity<Void> deleteCourse(@PathVariable("courseCode") String courseCode) {
        courseService.deleteCourse(SecurityUtils.getCurrentCapabilities(), courseCode);
        return ResponseEntity.noContent().build();
    }
}
