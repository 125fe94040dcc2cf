package com.verticx.finance.config;

import com.verticx.finance.calendar.AcademicSession;
import com.verticx.finance.calendar.AcademicSessionRepository;
import com.verticx.finance.fee.FeeRecord;
import com.verticx.finance.fee.FeeRecordRepository;
import com.verticx.finance.fee.FeeTemplate;
import com.verticx.finance.fee.FeeTemplateRepository;
import com.verticx.finance.fee.MonthlyFee;
import com.verticx.finance.payroll.StaffMember;
import com.verticx.finance.payroll.StaffMemberRepository;
import com.verticx.finance.school.SchoolClass;
import com.verticx.finance.school.SchoolClassRepository;
import com.verticx.finance.school.Student;
import com.verticx.finance.school.StudentRepository;
import com.verticx.finance.user.AppUser;
import com.verticx.finance.user.AppUserRepository;
import com.verticx.finance.user.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Month;
import java.time.OffsetDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Demo data for a single branch. Runs only with {@code app.seed.enabled=true} and only on an empty
 * database.
 */
@Configuration
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true")
public class DataSeeder {

    private static final Logger logger = LoggerFactory.getLogger(DataSeeder.class);

    private static final long BRANCH_ID = 1L;
    private static final String SESSION_LABEL = "2024-2025";
    private static final String[] STUDENT_NAMES = {
            "Aarav Sharma", "Diya Patel", "Vivaan Gupta", "Ananya Iyer", "Kabir Singh", "Meera Nair"
    };

    @Bean
    CommandLineRunner seed(AppUserRepository users,
                           AcademicSessionRepository sessions,
                           FeeTemplateRepository templates,
                           SchoolClassRepository classes,
                           StudentRepository students,
                           FeeRecordRepository feeRecords,
                           StaffMemberRepository staff,
                           PasswordEncoder encoder,
                           TransactionTemplate transactionTemplate) {
        return args -> transactionTemplate.executeWithoutResult(status -> {
            if (users.findByUsername("admin").isPresent()) {
                logger.info("Seed data already present, skipping");
                return;
            }
            logger.info("Seeding demo data for branch {}", BRANCH_ID);

            AcademicSession session = new AcademicSession();
            session.setBranchId(BRANCH_ID);
            session.setLabel(SESSION_LABEL);
            session.setStartDate(LocalDate.of(2024, Month.APRIL, 1));
            sessions.save(session);

            FeeTemplate grade5 = templates.save(template("Grade 5 Annual", 5, new BigDecimal("60000"), true));
            FeeTemplate grade6 = templates.save(template("Grade 6 Annual", 6, new BigDecimal("66000"), false));

            SchoolClass class5A = classes.save(schoolClass(5, "A", grade5.getId()));
            classes.save(schoolClass(6, "A", grade6.getId()));

            List<Student> seeded = new ArrayList<>();
            for (int i = 0; i < STUDENT_NAMES.length; i++) {
                Student student = new Student();
                student.setBranchId(BRANCH_ID);
                student.setName(STUDENT_NAMES[i]);
                student.setRollNo(i + 1);
                student.setGradeLevel(5);
                student.setClassId(class5A.getId());
                student.setGuardianPhone(String.format("98450%05d", i + 1));
                student.setCurrentSession(SESSION_LABEL);
                seeded.add(students.save(student));

                FeeRecord record = new FeeRecord();
                record.setStudentId(student.getId());
                record.setTotalAmount(grade5.getAmount());
                // Every other student has paid the first quarter.
                record.setPaidAmount(i % 2 == 0 ? new BigDecimal("15000") : BigDecimal.ZERO);
                record.setDueDate(LocalDate.of(2024, Month.MAY, 10));
                record.setUpdatedAt(OffsetDateTime.now());
                feeRecords.save(record);
            }

            StaffMember teacher = staff.save(staffMember("Rohan Mehta", StaffMember.Role.TEACHER, new BigDecimal("30000")));
            staff.save(staffMember("Kavya Rao", StaffMember.Role.REGISTRAR, new BigDecimal("25000")));
            staff.save(staffMember("Ishaan Das", StaffMember.Role.LIBRARIAN, null));
            StaffMember principal = staff.save(staffMember("Nisha Verma", StaffMember.Role.PRINCIPAL, new BigDecimal("80000")));

            users.save(user("admin", "Platform Admin", Role.ADMIN, null, null, null, encoder));
            users.save(user("principal", principal.getName(), Role.PRINCIPAL, BRANCH_ID, null, principal.getId(), encoder));
            users.save(user("registrar", "Kavya Rao", Role.REGISTRAR, BRANCH_ID, null, null, encoder));
            users.save(user("teacher", teacher.getName(), Role.TEACHER, BRANCH_ID, null, teacher.getId(), encoder));
            users.save(user("student", seeded.get(0).getName(), Role.STUDENT, BRANCH_ID, seeded.get(0).getId(), null, encoder));
            users.save(user("parent", "Parent of " + seeded.get(0).getName(), Role.PARENT, BRANCH_ID, seeded.get(0).getId(), null, encoder));

            logger.info("Seeded {} students, {} staff members and 6 users", seeded.size(), staff.count());
        });
    }

    private static FeeTemplate template(String name, int gradeLevel, BigDecimal amount, boolean withBreakdown) {
        FeeTemplate template = new FeeTemplate();
        template.setBranchId(BRANCH_ID);
        template.setName(name);
        template.setGradeLevel(gradeLevel);
        template.setAmount(amount);
        template.setCreatedAt(OffsetDateTime.now());
        if (withBreakdown) {
            BigDecimal monthly = amount.divide(BigDecimal.valueOf(12));
            List<MonthlyFee> breakdown = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                Month month = Month.APRIL.plus(i);
                List<MonthlyFee.FeeComponent> components = List.of(
                        new MonthlyFee.FeeComponent("Tuition", monthly.subtract(new BigDecimal("500"))),
                        new MonthlyFee.FeeComponent("Transport", new BigDecimal("500")));
                breakdown.add(new MonthlyFee(month.getDisplayName(TextStyle.FULL, Locale.ENGLISH), monthly,
                        new ArrayList<>(components)));
            }
            template.setMonthlyBreakdown(breakdown);
        }
        return template;
    }

    private static SchoolClass schoolClass(int gradeLevel, String section, Long templateId) {
        SchoolClass schoolClass = new SchoolClass();
        schoolClass.setBranchId(BRANCH_ID);
        schoolClass.setGradeLevel(gradeLevel);
        schoolClass.setSection(section);
        schoolClass.setFeeTemplateId(templateId);
        return schoolClass;
    }

    private static StaffMember staffMember(String name, StaffMember.Role role, BigDecimal salary) {
        StaffMember member = new StaffMember();
        member.setBranchId(BRANCH_ID);
        member.setName(name);
        member.setRole(role);
        member.setSalary(salary);
        return member;
    }

    private static AppUser user(String username, String fullName, Role role, Long branchId, Long studentId,
                                Long staffId, PasswordEncoder encoder) {
        AppUser user = new AppUser();
        user.setUsername(username);
        user.setPasswordHash(encoder.encode("password"));
        user.setFullName(fullName);
        user.setRole(role);
        user.setBranchId(branchId);
        user.setStudentId(studentId);
        user.setStaffId(staffId);
        return user;
    }
}
