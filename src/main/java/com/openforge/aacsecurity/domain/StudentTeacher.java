package com.openforge.aacsecurity.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Relationship record: a teacher is assigned to a student and may act on
 * the student's profile and preferences.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "student_teachers",
        uniqueConstraints = @UniqueConstraint(columnNames = {"teacher_id", "student_id"}))
public class StudentTeacher extends BaseEntity {

    @Column(name = "teacher_id", nullable = false)
    private Long teacherId;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    public StudentTeacher(Long teacherId, Long studentId) {
        this.teacherId = teacherId;
        this.studentId = studentId;
    }
}
