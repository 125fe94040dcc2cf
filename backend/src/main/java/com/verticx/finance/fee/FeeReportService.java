package com.verticx.finance.fee;

import com.verticx.finance.calendar.AcademicCalendarResolver;
import com.verticx.finance.calendar.AcademicSessionService;
import com.verticx.finance.calendar.SessionMonth;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.common.exception.ResourceNotFoundException;
import com.verticx.finance.fee.dto.ClassFeeSummaryDto;
import com.verticx.finance.fee.dto.DefaulterDto;
import com.verticx.finance.fee.dto.MonthlyCollectionDto;
import com.verticx.finance.school.SchoolClass;
import com.verticx.finance.school.SchoolClassRepository;
import com.verticx.finance.school.Student;
import com.verticx.finance.school.StudentRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Branch- and class-level fee aggregates for registrar and principal dashboards.
 */
@Service
@Transactional(readOnly = true)
public class FeeReportService {

    private final FeeRecordRepository feeRecordRepository;
    private final FeeTemplateRepository feeTemplateRepository;
    private final StudentRepository studentRepository;
    private final SchoolClassRepository schoolClassRepository;
    private final AcademicSessionService academicSessionService;
    private final AcademicCalendarResolver calendarResolver;
    private final FeeTemplateAllocator feeTemplateAllocator;
    private final PaymentLedgerReducer paymentLedgerReducer;

    public FeeReportService(FeeRecordRepository feeRecordRepository,
                            FeeTemplateRepository feeTemplateRepository,
                            StudentRepository studentRepository,
                            SchoolClassRepository schoolClassRepository,
                            AcademicSessionService academicSessionService,
                            AcademicCalendarResolver calendarResolver,
                            FeeTemplateAllocator feeTemplateAllocator,
                            PaymentLedgerReducer paymentLedgerReducer) {
        this.feeRecordRepository = feeRecordRepository;
        this.feeTemplateRepository = feeTemplateRepository;
        this.studentRepository = studentRepository;
        this.schoolClassRepository = schoolClassRepository;
        this.academicSessionService = academicSessionService;
        this.calendarResolver = calendarResolver;
        this.feeTemplateAllocator = feeTemplateAllocator;
        this.paymentLedgerReducer = paymentLedgerReducer;
    }

    public List<ClassFeeSummaryDto> getClassFeeSummaries(Long branchId) {
        List<Student> students = studentRepository.findByBranchId(branchId);
        Map<Long, FeeRecord> records = recordsByStudent(students);
        Map<Long, List<Student>> byClass = students.stream()
                .filter(s -> s.getClassId() != null)
                .collect(Collectors.groupingBy(Student::getClassId));

        return schoolClassRepository.findByBranchIdOrderByGradeLevelAscSectionAsc(branchId).stream()
                .map(c -> {
                    List<Student> roster = byClass.getOrDefault(c.getId(), List.of());
                    List<FeeRecord> defaulters = roster.stream()
                            .map(s -> records.get(s.getId()))
                            .filter(r -> r != null && r.outstanding().signum() > 0)
                            .toList();
                    BigDecimal pending = defaulters.stream()
                            .map(FeeRecord::outstanding)
                            .reduce(BigDecimal.ZERO, BigDecimal::add);
                    return new ClassFeeSummaryDto(c.getId(), c.displayName(), roster.size(), defaulters.size(), pending);
                })
                .toList();
    }

    public List<DefaulterDto> getDefaultersForClass(Long classId) {
        if (!schoolClassRepository.existsById(classId)) {
            throw new ResourceNotFoundException("SchoolClass", classId, ErrorCode.CLASS_NOT_FOUND);
        }
        Map<Long, Student> roster = studentRepository.findByClassIdOrderByRollNoAsc(classId).stream()
                .collect(Collectors.toMap(Student::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        if (roster.isEmpty()) {
            return List.of();
        }
        Map<Long, FeeRecord> defaulters = feeRecordRepository.findDefaulters(roster.keySet()).stream()
                .collect(Collectors.toMap(FeeRecord::getStudentId, Function.identity()));
        return roster.values().stream()
                .filter(s -> defaulters.containsKey(s.getId()))
                .map(s -> new DefaulterDto(s.getId(), s.getName(), s.getRollNo(),
                        defaulters.get(s.getId()).outstanding(), s.getGuardianPhone()))
                .toList();
    }

    /**
     * Paid and pending totals for every session month elapsed as of {@code today}. Students whose class
     * has no monthly breakdown are left out.
     */
    public List<MonthlyCollectionDto> getMonthlyCollectionOverview(Long branchId, LocalDate today) {
        LocalDate sessionStart = academicSessionService.startDateFor(branchId, today);
        List<SessionMonth> months = calendarResolver.monthsDueSoFar(sessionStart, today);
        Map<String, BigDecimal> due = new LinkedHashMap<>();
        Map<String, BigDecimal> paid = new LinkedHashMap<>();
        months.forEach(m -> {
            due.put(m.shortLabel(), BigDecimal.ZERO);
            paid.put(m.shortLabel(), BigDecimal.ZERO);
        });

        List<Student> students = studentRepository.findByBranchId(branchId);
        Map<Long, FeeRecord> records = recordsByStudent(students);
        Map<Long, Optional<Map<String, BigDecimal>>> duesByClass = new LinkedHashMap<>();

        for (Student student : students) {
            if (student.getClassId() == null) {
                continue;
            }
            Optional<Map<String, BigDecimal>> dues = duesByClass.computeIfAbsent(student.getClassId(),
                    classId -> feeTemplateAllocator.allocate(templateOf(classId), months));
            if (dues.isEmpty()) {
                continue;
            }
            dues.get().forEach((month, amount) -> due.merge(month, amount, BigDecimal::add));

            FeeRecord record = records.get(student.getId());
            if (record == null) {
                continue;
            }
            LedgerAllocation allocation = paymentLedgerReducer.reduce(record.getPaidAmount(),
                    record.getPreviousSessionDues(), months, dues.get());
            for (int i = 0; i < months.size(); i++) {
                paid.merge(months.get(i).shortLabel(), allocation.monthlyDues().get(i).paid(), BigDecimal::add);
            }
        }

        return months.stream()
                .map(m -> new MonthlyCollectionDto(m.shortLabel(), m.year(), paid.get(m.shortLabel()),
                        due.get(m.shortLabel()).subtract(paid.get(m.shortLabel())).max(BigDecimal.ZERO)))
                .toList();
    }

    private Map<Long, FeeRecord> recordsByStudent(List<Student> students) {
        List<Long> ids = students.stream().map(Student::getId).toList();
        if (ids.isEmpty()) {
            return Map.of();
        }
        return feeRecordRepository.findByStudentIdIn(ids).stream()
                .collect(Collectors.toMap(FeeRecord::getStudentId, Function.identity()));
    }

    private FeeTemplate templateOf(Long classId) {
        return schoolClassRepository.findById(classId)
                .map(SchoolClass::getFeeTemplateId)
                .flatMap(feeTemplateRepository::findById)
                .orElse(null);
    }
}
