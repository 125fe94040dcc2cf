package com.verticx.finance.school;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StudentRepository extends JpaRepository<Student, Long> {
    List<Student> findByBranchId(Long branchId);

    List<Student> findByClassIdOrderByRollNoAsc(Long classId);

    long countByClassId(Long classId);
}
