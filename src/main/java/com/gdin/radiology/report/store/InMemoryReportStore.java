package com.gdin.radiology.report.store;

import com.gdin.radiology.report.models.SummaryResult;
import com.gdin.radiology.report.models.ValidationResult;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 简单的内存实现，线程安全。
 */
@Component
public class InMemoryReportStore implements ReportStore {
    private final Map<Long, ReportRecord> reports = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Long save(ReportRecord record) {
        Long id = sequence.incrementAndGet();
        reports.put(id, record.toBuilder()
                .id(id)
                .createdAt(record.getCreatedAt() == null ? LocalDateTime.now() : record.getCreatedAt())
                .build());
        return id;
    }

    @Override
    public Optional<ReportRecord> findById(Long id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(reports.get(id));
    }

    @Override
    public boolean attachValidation(Long id, ValidationResult validation) {
        if (id == null) return false;
        return reports.computeIfPresent(id, (k, r) -> r.toBuilder().validation(validation).build()) != null;
    }

    @Override
    public boolean attachSummary(Long id, SummaryResult summary) {
        if (id == null) return false;
        return reports.computeIfPresent(id, (k, r) -> r.toBuilder().summary(summary).build()) != null;
    }
}
