package com.verticx.finance.fee;

import com.verticx.finance.fee.dto.PaymentReceiptDto;
import com.verticx.finance.school.SchoolClassRepository;
import com.verticx.finance.school.Student;
import com.verticx.finance.school.StudentRepository;
import com.verticx.finance.security.AuthenticatedPrincipal;
import com.verticx.finance.security.BranchAccessGuard;
import com.verticx.finance.security.JwtService;
import com.verticx.finance.security.SecurityConfig;
import com.verticx.finance.user.Role;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FeeController.class)
@Import({SecurityConfig.class, BranchAccessGuard.class})
class FeeControllerTest {

    private static final String PAYMENT = "{\"amount\": %s, \"transactionId\": \"TXN-1\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JwtService jwtService;
    @MockBean
    private FeeLedgerService feeLedgerService;
    @MockBean
    private FeeReportService feeReportService;
    @MockBean
    private FeeTemplateService feeTemplateService;
    @MockBean
    private StudentRepository studentRepository;
    @MockBean
    private SchoolClassRepository schoolClassRepository;

    private static RequestPostProcessor as(Role role, Long branchId, Long studentId) {
        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(1L, role.name().toLowerCase(), role,
                branchId, studentId, null);
        return authentication(new UsernamePasswordAuthenticationToken(principal, null,
                List.of(new SimpleGrantedAuthority(role.authority()))));
    }

    private void studentInBranch(Long studentId, Long branchId) {
        Student student = new Student();
        student.setId(studentId);
        student.setBranchId(branchId);
        when(studentRepository.findById(studentId)).thenReturn(Optional.of(student));
    }

    @Test
    void registrarRecordsPayment() throws Exception {
        studentInBranch(5L, 1L);
        when(feeLedgerService.recordPayment(eq(5L), any(BigDecimal.class), eq("TXN-1"), any()))
                .thenReturn(PaymentReceiptDto.builder()
                        .studentId(5L)
                        .transactionId("TXN-1")
                        .amount(new BigDecimal("1500"))
                        .paidDate(LocalDate.of(2024, 6, 1))
                        .build());

        mockMvc.perform(post("/api/fees/students/5/payments")
                        .with(as(Role.REGISTRAR, 1L, null))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(PAYMENT, "1500")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.transactionId").value("TXN-1"));
    }

    @Test
    void teacherCannotRecordPayment() throws Exception {
        mockMvc.perform(post("/api/fees/students/5/payments")
                        .with(as(Role.TEACHER, 1L, null))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(PAYMENT, "1500")))
                .andExpect(status().isForbidden());
        verify(feeLedgerService, never()).recordPayment(any(), any(), any(), any());
    }

    @Test
    void registrarOfAnotherBranchIsRejected() throws Exception {
        studentInBranch(5L, 2L);

        mockMvc.perform(post("/api/fees/students/5/payments")
                        .with(as(Role.REGISTRAR, 1L, null))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(PAYMENT, "1500")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("C003"));
    }

    @Test
    void nonPositiveAmountIsInvalid() throws Exception {
        mockMvc.perform(post("/api/fees/students/5/payments")
                        .with(as(Role.REGISTRAR, 1L, null))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(PAYMENT, "-10")))
                .andExpect(status().isBadRequest());
    }

    @Test
    void studentSeesOnlyOwnStatement() throws Exception {
        studentInBranch(6L, 1L);

        mockMvc.perform(get("/api/fees/students/6/statement").with(as(Role.STUDENT, 1L, 5L)))
                .andExpect(status().isForbidden());
    }

    @Test
    void anonymousRequestIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/fees/students/5/statement"))
                .andExpect(status().isUnauthorized());
    }
}
