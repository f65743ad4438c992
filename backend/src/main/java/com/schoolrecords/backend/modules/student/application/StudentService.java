package com.schoolrecords.backend.modules.student.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import com.schoolrecords.backend.global.error.ProblemException;
import com.schoolrecords.backend.global.error.RetryableProblemException;
import com.schoolrecords.backend.global.security.AcademicCapability;
import com.schoolrecords.backend.global.security.Capabilities;
import com.schoolrecords.backend.modules.audit.application.AuditLogService;
import com.schoolrecords.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentCascade;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentCascade.CascadeResult;
import com.schoolrecords.backend.modules.student.domain.Gender;
import com.schoolrecords.backend.modules.student.domain.Student;
import com.schoolrecords.backend.modules.student.domain.StudentCodeFormatter;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.schoolrecords.backend.modules.student.presentation.dto.StudentDtoMapper;
import com.schoolrecords.backend.modules.student.presentation.dto.StudentResponse;

@Service
@Transactional
public class StudentService {

    private static final Logger log = LoggerFactory.getLogger(StudentService.class);

    static final int MAX_ALLOCATION_ATTEMPTS = 3;
    private static final int ALLOCATION_RETRY_AFTER_SECONDS = 1;
    private static final String STUDENT_CODE_CONSTRAINT = "uq_student_code";

    private final StudentRepository studentRepository;
    private final StudentIdAllocator studentIdAllocator;
    private final EnrollmentCascade enrollmentCascade;
    private final AuditLogService auditLogService;
    private final TransactionTemplate registrationTransaction;
    private final Clock clock;

    public StudentService(
            StudentRepository studentRepository,
            StudentIdAllocator studentIdAllocator,
            EnrollmentCascade enrollmentCascade,
            AuditLogService auditLogService,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.studentRepository = studentRepository;
        this.studentIdAllocator = studentIdAllocator;
        this.enrollmentCascade = enrollmentCascade;
        this.auditLogService = auditLogService;
        this.registrationTransaction = new TransactionTemplate(transactionManager);
        this.registrationTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Registers a student under a freshly allocated code. Every attempt runs in
     * its own transaction; lock failures and code collisions are retried a
     * bounded number of times before {@code ALLOCATION_CONFLICT} is surfaced.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public StudentResponse registerStudent(Capabilities capabilities, RegisterStudentCommand command) {
        capabilities.require(AcademicCapability.MANAGE_RECORDS);
        LocalDate enrollmentDate = command.enrollmentDate() != null ? command.enrollmentDate() : LocalDate.now(clock);
        validate(command, enrollmentDate);

        RuntimeException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_ALLOCATION_ATTEMPTS; attempt++) {
            try {
                return registrationTransaction.execute(status -> createStudent(command, enrollmentDate));
            } catch (PessimisticLockingFailureException ex) {
                lastConflict = ex;
            } catch (DataIntegrityViolationException ex) {
                if (!isStudentCodeViolation(ex)) {
                    throw ex;
                }
                lastConflict = ex;
            }
            log.debug("Student code allocation for {} conflicted on attempt {}", enrollmentDate.getYear(), attempt);
        }
        throw new RetryableProblemException(HttpStatus.CONFLICT, "ALLOCATION_CONFLICT",
                "could not allocate a student code for enrollment year " + enrollmentDate.getYear(),
                ALLOCATION_RETRY_AFTER_SECONDS, lastConflict);
    }

    @Transactional(readOnly = true)
    public StudentResponse getStudent(String studentCode) {
        return StudentDtoMapper.toResponse(loadStudent(studentCode));
    }

    @Transactional(readOnly = true)
    public List<StudentResponse> listStudents() {
        return studentRepository.findAllByOrderByStudentCodeAsc().stream()
                .map(StudentDtoMapper::toResponse)
                .toList();
    }

    public void deleteStudent(Capabilities capabilities, String studentCode) {
        capabilities.require(AcademicCapability.MANAGE_RECORDS);
        Student student = loadStudent(studentCode);
        CascadeResult result = enrollmentCascade.removeStudent(student);
        auditLogService.record(new AuditLogCommand(
                "STUDENT_DELETED",
                AuditLogService.RESOURCE_STUDENT,
                student.getStudentCode(),
                result.toDetail()
        ));
    }

    private StudentResponse createStudent(RegisterStudentCommand command, LocalDate enrollmentDate) {
        String studentCode = studentIdAllocator.allocateStudentId(enrollmentDate.getYear());

        Student student = new Student(studentCode, enrollmentDate);
        student.setFirstName(command.firstName().trim());
        student.setLastName(command.lastName().trim());
        student.setDateOfBirth(command.dateOfBirth());
        student.setGender(command.gender());
        student.setEmail(trimToNull(command.email()));
        student.setPhone(trimToNull(command.phone()));
        student.setAddress(trimToNull(command.address()));
        student.setPhotoReference(trimToNull(command.photoReference()));

        Student saved = studentRepository.saveAndFlush(student);
        auditLogService.record(new AuditLogCommand(
                "STUDENT_REGISTERED",
                AuditLogService.RESOURCE_STUDENT,
                studentCode,
                Map.of("enrollmentDate", enrollmentDate.toString())
        ));
        return StudentDtoMapper.toResponse(saved);
    }

    private void validate(RegisterStudentCommand command, LocalDate enrollmentDate) {
        if (!StringUtils.hasText(command.firstName()) || !StringUtils.hasText(command.lastName())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "first and last name are required");
        }
        if (command.dateOfBirth() == null || command.gender() == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "dateOfBirth and gender are required");
        }
        int year = enrollmentDate.getYear();
        if (year < StudentCodeFormatter.MIN_YEAR || year > StudentCodeFormatter.MAX_YEAR) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                    "enrollment year must have four digits: " + year);
        }
    }

    private Student loadStudent(String studentCode) {
        return studentRepository.findByStudentCode(studentCode)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "STUDENT_NOT_FOUND",
                        "student " + studentCode + " does not exist"));
    }

    private boolean isStudentCodeViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(STUDENT_CODE_CONSTRAINT);
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    public record RegisterStudentCommand(
            String firstName,
            String lastName,
            LocalDate dateOfBirth,
            Gender gender,
            String email,
            String phone,
            String address,
            String photoReference,
            LocalDate enrollmentDate
    ) {
    }
}
