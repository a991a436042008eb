package com.gdin.radiology.report.store;

import com.gdin.radiology.report.models.SummaryResult;
import com.gdin.radiology.report.models.ValidationResult;

import java.util.Optional;

/**
 * 报告持久化契约，可替换为数据库实现
 */
public interface ReportStore {

    /**
     * 保存新报告，忽略 record 中的 id，返回分配的 id
     */
    Long save(ReportRecord record);

    Optional<ReportRecord> findById(Long id);

    /**
     * @return 报告不存在时返回 false
     */
    boolean attachValidation(Long id, ValidationResult validation);

    /**
     * @return 报告不存在时返回 false
     */
    boolean attachSummary(Long id, SummaryResult summary);
}
