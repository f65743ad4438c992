package com.schoolrecords.backend.modules.student.application;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.schoolrecords.backend.modules.student.domain.StudentCodeFormatter;
import com.schoolrecords.backend.modules.student.domain.StudentIdSequence;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentIdSequenceRepository;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentRepository;

/**
 * Hands out {@code STU<year><seq>} codes. Must run inside the transaction that
 * persists the student: the year row stays locked until that transaction ends,
 * so two registrations for the same year can never read the same maximum.
 */
@Component
public class StudentIdAllocator {

    private final StudentIdSequenceRepository sequenceRepository;
    private final StudentRepository studentRepository;

    public StudentIdAllocator(StudentIdSequenceRepository sequenceRepository, StudentRepository studentRepository) {
        this.sequenceRepository = sequenceRepository;
        this.studentRepository = studentRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String allocateStudentId(int year) {
        String prefix = StudentCodeFormatter.prefixFor(year);

        sequenceRepository.insertIfAbsent(year);
        StudentIdSequence sequence = sequenceRepository.findByYearForUpdate(year)
                .orElseThrow(() -> new IllegalStateException("student_id_sequence row missing for " + year));

        int highest = 0;
        for (String code : studentRepository.findStudentCodesByPrefix(prefix)) {
            highest = Math.max(highest, StudentCodeFormatter.sequenceOf(code, year));
        }

        int next = highest + 1;
        sequence.setLastNumber(next);
        sequenceRepository.save(sequence);
        return StudentCodeFormatter.toStudentCode(year, next);
    }
}
