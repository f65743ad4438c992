package com.schoolrecords.backend.modules.report;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schoolrecords.backend.global.security.JwtTokenService;
import com.schoolrecords.backend.support.AbstractPostgresIntegrationTest;
import com.schoolrecords.backend.support.RecordsFixtures;
import com.schoolrecords.backend.support.TestTokens;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class GradeReportIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtTokenService jwtTokenService;

    private String adminToken;
    private String teacherToken;
    private String student;
    private UUID mathEnrollment;
    private UUID physicsEnrollment;

    @BeforeEach
    void setUp() throws Exception {
        adminToken = TestTokens.admin(jwtTokenService);
        RecordsFixtures fixtures = new RecordsFixtures(mockMvc, objectMapper, adminToken);
        teacherToken = TestTokens.teacher(jwtTokenService);
        student = fixtures.registerStudent("Ada", "2024-09-01");
        fixtures.createCourse("MTH101", 3);
        fixtures.createCourse("PHY101", 4);
        fixtures.createCourse("ART101", 2);
        mathEnrollment = fixtures.enroll(student, "MTH101", "Fall", "2024-2025");
        physicsEnrollment = fixtures.enroll(student, "PHY101", "Fall", "2024-2025");
        fixtures.enroll(student, "ART101", "Fall", "2024-2025");
    }

    @Test
    void reportCardWeightsGradedCoursesByCredits() throws Exception {
        recordGrade(mathEnrollment, "91").andExpect(status().isOk())
                .andExpect(jsonPath("$.letterGrade").value("A"));
        recordGrade(physicsEnrollment, "74.5").andExpect(status().isOk())
                .andExpect(jsonPath("$.letterGrade").value("C"));

        mockMvc.perform(get("/students/{code}/report-card", student)
                        .header("Authorization", teacherToken)
                        .param("semester", "Fall")
                        .param("academicYear", "2024-2025"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries.length()").value(2))
                .andExpect(jsonPath("$.totalCredits").value(7))
                .andExpect(jsonPath("$.gpa").value(2.86));
    }

    @Test
    void recordingAgainReplacesTheGrade() throws Exception {
        recordGrade(mathEnrollment, "55").andExpect(status().isOk());
        recordGrade(mathEnrollment, "82.25").andExpect(status().isOk());

        mockMvc.perform(get("/enrollments/{id}/grade", mathEnrollment).header("Authorization", teacherToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.marks").value(82.25))
                .andExpect(jsonPath("$.letterGrade").value("B"));
    }

    @Test
    void invalidMarksAreRejected() throws Exception {
        recordGrade(mathEnrollment, "100.5")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_SCORE"));
        recordGrade(mathEnrollment, "88.125")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_SCORE"));
        recordGrade(UUID.randomUUID(), "80")
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ENROLLMENT_NOT_FOUND"));
    }

    @Test
    void gradePostsANotificationToTheStudent() throws Exception {
        recordGrade(mathEnrollment, "91").andExpect(status().isOk());

        mockMvc.perform(get("/students/{code}/notifications", student).header("Authorization", teacherToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unreadCount").value(1))
                .andExpect(jsonPath("$.items[0].kindCode").value("GRADE_POSTED"));

        mockMvc.perform(patch("/students/{code}/notifications/read-all", student).header("Authorization", adminToken))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/students/{code}/notifications", student)
                        .header("Authorization", teacherToken)
                        .param("state", "unread"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unreadCount").value(0))
                .andExpect(jsonPath("$.items.length()").value(0));
    }

    @Test
    void onlyRecordManagersMayMarkReadOrClearNotifications() throws Exception {
        recordGrade(mathEnrollment, "91").andExpect(status().isOk());

        for (String token : new String[] {TestTokens.viewer(jwtTokenService), teacherToken}) {
            mockMvc.perform(patch("/students/{code}/notifications/read-all", student).header("Authorization", token))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code").value("CAPABILITY_REQUIRED"));
            mockMvc.perform(delete("/students/{code}/notifications", student).header("Authorization", token))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code").value("CAPABILITY_REQUIRED"));
        }

        mockMvc.perform(get("/students/{code}/notifications", student).header("Authorization", teacherToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unreadCount").value(1))
                .andExpect(jsonPath("$.items.length()").value(1));

        mockMvc.perform(delete("/students/{code}/notifications", student).header("Authorization", adminToken))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/students/{code}/notifications", student).header("Authorization", teacherToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(0));
    }

    @Test
    void paddedTermLabelsFindTheSameReportCard() throws Exception {
        recordGrade(mathEnrollment, "91").andExpect(status().isOk());

        mockMvc.perform(get("/students/{code}/report-card", student)
                        .header("Authorization", teacherToken)
                        .param("semester", "Fall ")
                        .param("academicYear", " 2024-2025"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.semester").value("Fall"))
                .andExpect(jsonPath("$.entries.length()").value(1))
                .andExpect(jsonPath("$.gpa").value(4.0));
    }

    @Test
    void unknownStudentGetsAnEmptyReportCard() throws Exception {
        mockMvc.perform(get("/students/STU19990001/report-card")
                        .header("Authorization", teacherToken)
                        .param("semester", "Fall")
                        .param("academicYear", "2024-2025"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCredits").value(0))
                .andExpect(jsonPath("$.gpa").value(0.0));
    }

    @Test
    void viewerCannotRecordGrades() throws Exception {
        mockMvc.perform(put("/enrollments/{id}/grade", mathEnrollment)
                        .header("Authorization", TestTokens.viewer(jwtTokenService))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"marks\": 80}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("CAPABILITY_REQUIRED"));
    }

    private ResultActions recordGrade(UUID enrollmentId, String marks) throws Exception {
        return mockMvc.perform(put("/enrollments/{id}/grade", enrollmentId)
                .header("Authorization", teacherToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"marks\": %s, \"remark\": \"term exam\"}".formatted(marks)));
    }
}
