package com.verticx.finance.security;

import com.verticx.finance.common.exception.BusinessRuleException;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.user.Role;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Tenant checks applied by controllers once the caller's role has been authorised.
 */
@Component
public class BranchAccessGuard {

    public void requireBranch(AuthenticatedPrincipal principal, Long branchId) {
        if (principal.isAdmin()) {
            return;
        }
        if (principal.branchId() == null || !principal.branchId().equals(branchId)) {
            throw new BusinessRuleException(ErrorCode.ACCESS_DENIED,
                    "User " + principal.username() + " may not access branch " + branchId);
        }
    }

    /**
     * Students and parents only see their own (or their child's) records; staff are scoped by branch.
     */
    public void requireStudentAccess(AuthenticatedPrincipal principal, Long studentId, Long studentBranchId) {
        if (principal.role() == Role.STUDENT || principal.role() == Role.PARENT) {
            if (!Objects.equals(principal.studentId(), studentId)) {
                throw new BusinessRuleException(ErrorCode.ACCESS_DENIED,
                        "User " + principal.username() + " may not access student " + studentId);
            }
            return;
        }
        requireBranch(principal, studentBranchId);
    }
}
