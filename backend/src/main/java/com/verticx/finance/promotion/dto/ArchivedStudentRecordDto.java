package com.verticx.finance.promotion.dto;

import com.verticx.finance.promotion.ArchivedStudentRecord;

import java.time.OffsetDateTime;
import java.util.List;

public record ArchivedStudentRecordDto(Long id,
                                       Long studentId,
                                       String name,
                                       String academicSession,
                                       String finalClass,
                                       List<ArchivedStudentRecord.GradeSnapshot> grades,
                                       List<ArchivedStudentRecord.AttendanceSnapshot> attendance,
                                       OffsetDateTime archivedAt) {

    public static ArchivedStudentRecordDto from(ArchivedStudentRecord record) {
        return new ArchivedStudentRecordDto(record.getId(), record.getStudentId(), record.getName(),
                record.getAcademicSession(), record.getFinalClass(), record.getGrades(), record.getAttendance(),
                record.getArchivedAt());
    }
}
