package com.openforge.aacsecurity.authz;

import com.openforge.aacsecurity.repository.StudentTeacherRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StudentTeacherRelationshipLookup implements RelationshipLookup {

    private final StudentTeacherRepository repository;

    @Override
    public boolean hasAnyAssignments(Long teacherId) {
        return repository.existsByTeacherId(teacherId);
    }

    @Override
    public boolean isAssigned(Long teacherId, Long studentId) {
        return repository.existsByTeacherIdAndStudentId(teacherId, studentId);
    }
}
