package com.openforge.aacsecurity.repository;

import com.openforge.aacsecurity.domain.User;
import com.openforge.aacsecurity.domain.UserRole;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    Optional<User> findByUsername(String username);

    Page<User> findByRole(UserRole role, Pageable pageable);

    /**
     * Students linked to a teacher through student_teachers.
     */
    @Query("""
            select u from User u
            where u.role = com.openforge.aacsecurity.domain.UserRole.STUDENT
              and u.id in (select st.studentId from StudentTeacher st where st.teacherId = :teacherId)
            """)
    Page<User> findAssignedStudents(@Param("teacherId") Long teacherId, Pageable pageable);
}
