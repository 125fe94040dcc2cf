package com.verticx.finance.school;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SchoolClassRepository extends JpaRepository<SchoolClass, Long> {
    List<SchoolClass> findByBranchIdOrderByGradeLevelAscSectionAsc(Long branchId);
}
