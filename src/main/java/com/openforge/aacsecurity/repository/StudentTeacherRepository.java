package com.openforge.aacsecurity.repository;

import com.openforge.aacsecurity.domain.StudentTeacher;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface StudentTeacherRepository extends JpaRepository<StudentTeacher, Long> {

    boolean existsByTeacherId(Long teacherId);

    boolean existsByTeacherIdAndStudentId(Long teacherId, Long studentId);

    @Transactional
    long deleteByTeacherIdAndStudentId(Long teacherId, Long studentId);

    /** Drops every link that mentions the user, on either side. */
    @Transactional
    long deleteByTeacherIdOrStudentId(Long teacherId, Long studentId);
}
