package com.verticx.finance.fee;

import com.verticx.finance.common.exception.BusinessRuleException;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.common.exception.ResourceNotFoundException;
import com.verticx.finance.fee.dto.FeeTemplateDto;
import com.verticx.finance.fee.dto.FeeTemplateRequest;
import com.verticx.finance.school.SchoolClass;
import com.verticx.finance.school.SchoolClassRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

@Service
public class FeeTemplateService {

    private static final Logger logger = LoggerFactory.getLogger(FeeTemplateService.class);

    private final FeeTemplateRepository feeTemplateRepository;
    private final SchoolClassRepository schoolClassRepository;

    public FeeTemplateService(FeeTemplateRepository feeTemplateRepository, SchoolClassRepository schoolClassRepository) {
        this.feeTemplateRepository = feeTemplateRepository;
        this.schoolClassRepository = schoolClassRepository;
    }

    @Transactional
    public FeeTemplateDto createTemplate(FeeTemplateRequest request) {
        FeeTemplate template = new FeeTemplate();
        template.setBranchId(request.branchId());
        template.setName(request.name());
        template.setGradeLevel(request.gradeLevel());
        template.setAmount(request.amount());
        template.setMonthlyBreakdown(request.monthlyBreakdown());
        template.setCreatedAt(OffsetDateTime.now());
        FeeTemplate saved = feeTemplateRepository.save(template);
        logger.info("Created fee template {} for branch {} grade {}", saved.getId(), saved.getBranchId(),
                saved.getGradeLevel());
        return FeeTemplateDto.from(saved);
    }

    @Transactional(readOnly = true)
    public List<FeeTemplateDto> getTemplates(Long branchId) {
        return feeTemplateRepository.findByBranchIdOrderByGradeLevelAsc(branchId).stream()
                .map(FeeTemplateDto::from)
                .toList();
    }

    @Transactional
    public void assignTemplateToClass(Long classId, Long templateId) {
        SchoolClass schoolClass = schoolClassRepository.findById(classId)
                .orElseThrow(() -> new ResourceNotFoundException("SchoolClass", classId, ErrorCode.CLASS_NOT_FOUND));
        FeeTemplate template = feeTemplateRepository.findById(templateId)
                .orElseThrow(() -> new ResourceNotFoundException("FeeTemplate", templateId));
        if (!template.getBranchId().equals(schoolClass.getBranchId())) {
            throw new BusinessRuleException(ErrorCode.TEMPLATE_BRANCH_MISMATCH);
        }
        schoolClass.setFeeTemplateId(templateId);
        schoolClassRepository.save(schoolClass);
    }
}
