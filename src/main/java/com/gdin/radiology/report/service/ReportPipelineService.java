package com.gdin.radiology.report.service;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.catalog.TemplateSelector;
import com.gdin.radiology.report.config.properties.RagProperties;
import com.gdin.radiology.report.config.properties.ReportProperties;
import com.gdin.radiology.report.exception.RadiologyReportException;
import com.gdin.radiology.report.exception.ReportNotFoundException;
import com.gdin.radiology.report.generation.ReportGenerator;
import com.gdin.radiology.report.generation.ReportHighlighter;
import com.gdin.radiology.report.models.CriticalFindingsResult;
import com.gdin.radiology.report.models.GenerationResult;
import com.gdin.radiology.report.models.ReportAnalysis;
import com.gdin.radiology.report.models.ReportMeta;
import com.gdin.radiology.report.models.SimilarCase;
import com.gdin.radiology.report.models.SummaryResult;
import com.gdin.radiology.report.models.Template;
import com.gdin.radiology.report.models.ValidationResult;
import com.gdin.radiology.report.notification.CriticalFindingNotifier;
import com.gdin.radiology.report.rag.SimilarCaseRetriever;
import com.gdin.radiology.report.req.GenerateReportReq;
import com.gdin.radiology.report.safety.ConsistencyValidator;
import com.gdin.radiology.report.safety.CriticalFindingsDetector;
import com.gdin.radiology.report.store.ReportRecord;
import com.gdin.radiology.report.store.ReportStore;
import com.gdin.radiology.report.summary.ReportSummaryService;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * 报告生成主流程：
 * 元数据补全 -> 缓存 -> 模板选择 -> 相似病例检索 -> 生成 -> 危急值检测 -> 要点提取 -> 存档 -> 通知 -> 缓存
 * <p>
 * 存档、通知、缓存失败只记录日志，不影响返回结果
 */
@Service
@Slf4j
public class ReportPipelineService {
    static final DateTimeFormatter STUDY_DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    static final String NO_REFERRER = "—";
    static final String NO_PATIENT_NAME = "[Name not provided]";
    static final String NO_ACCESSION = "N/A";
    private static final List<String> TITLE_MODALITIES = List.of("CT", "MRI", "X-RAY", "ULTRASOUND", "PET");

    @Resource
    private TemplateSelector templateSelector;
    @Resource
    private SimilarCaseRetriever similarCaseRetriever;
    @Resource
    private ReportGenerator reportGenerator;
    @Resource
    private CriticalFindingsDetector criticalFindingsDetector;
    @Resource
    private ReportHighlighter reportHighlighter;
    @Resource
    private ConsistencyValidator consistencyValidator;
    @Resource
    private ReportSummaryService reportSummaryService;
    @Resource
    private CriticalFindingNotifier criticalFindingNotifier;
    @Resource
    private ReportStore reportStore;
    @Resource
    private GenerationCache generationCache;
    @Resource
    private ReportProperties reportProperties;
    @Resource
    private RagProperties ragProperties;
    @Resource
    @Qualifier("analysisExecutor")
    private ExecutorService analysisExecutor;

    public GenerationResult generate(GenerateReportReq req) {
        if (req == null || StrUtil.isBlank(req.getInput())) {
            throw new RadiologyReportException("Clinical indication must not be empty");
        }
        String indication = req.getInput().strip();
        String templateId = StrUtil.blankToDefault(req.getTemplateId(), TemplateSelector.AUTO);
        ReportMeta meta = withDefaults(req.getMeta(), indication);
        // 通知只认请求中真实提供的转诊医生、患者与检查号
        ReportMeta provided = req.getMeta() == null ? new ReportMeta() : req.getMeta();
        ReportMeta notificationMeta = meta.toBuilder()
                .referrer(provided.getReferrer())
                .patientName(provided.getPatientName())
                .accession(provided.getAccession())
                .build();

        GenerationResult cached = generationCache.get(indication, templateId, req.getMeta()).orElse(null);
        if (cached != null) {
            log.info("Generation cache hit for template {}", templateId);
            return cached;
        }

        Template template = templateSelector.resolve(templateId, indication);
        log.info("Generating report with template {} ({})", template.getId(), template.getTitle());

        List<SimilarCase> similarCases = List.of();
        if (!Boolean.FALSE.equals(req.getUseRag()) && TemplateSelector.AUTO.equalsIgnoreCase(templateId)) {
            similarCases = similarCaseRetriever.search(indication, ragProperties.getDefaultLimit(), template.getCategory());
            log.info("Retrieved {} similar cases", similarCases.size());
        }

        String report = reportGenerator.generate(indication, template, meta, similarCases);
        CriticalFindingsResult critical = criticalFindingsDetector.detect(report, indication);
        List<String> highlights = reportHighlighter.extract(report);

        Long reportId = persist(template, meta, indication, report, similarCases, highlights, critical);
        notifyReferrer(critical, notificationMeta, report, reportId);

        GenerationResult result = GenerationResult.builder()
                .report(report)
                .templateId(template.getId())
                .templateTitle(template.getTitle())
                .highlights(highlights)
                .similarCases(similarCases)
                .reportId(reportId)
                .criticalFindings(CollectionUtil.isEmpty(critical.getFindings()) ? null : critical)
                .build();
        generationCache.put(indication, templateId, req.getMeta(), result);
        return result;
    }

    /**
     * 校验已存档报告并回写校验结果
     */
    public ValidationResult validateReport(Long reportId, String language) {
        ReportRecord record = reportStore.findById(reportId).orElseThrow(() -> new ReportNotFoundException(reportId));
        ValidationResult validation = consistencyValidator.validate(record.getGeneratedReport(), language);
        if (!reportStore.attachValidation(reportId, validation)) {
            log.warn("Could not attach validation to report {}", reportId);
        }
        return validation;
    }

    /**
     * 为已存档报告生成摘要，language 为空时自动检测
     */
    public SummaryResult summarizeReport(Long reportId, String language) {
        ReportRecord record = reportStore.findById(reportId).orElseThrow(() -> new ReportNotFoundException(reportId));
        SummaryResult summary = reportSummaryService.generateSummary(record.getGeneratedReport(), record.getIndication(),
                ReportSummaryService.DEFAULT_MAX_LENGTH, language);
        if (!reportStore.attachSummary(reportId, summary)) {
            log.warn("Could not attach summary to report {}", reportId);
        }
        return summary;
    }

    /**
     * 对任意报告文本并行执行危急值检测与一致性校验
     */
    public ReportAnalysis analyze(String reportText, String indication, String language) {
        CompletableFuture<CriticalFindingsResult> detection =
                CompletableFuture.supplyAsync(() -> criticalFindingsDetector.detect(reportText, indication), analysisExecutor);
        CompletableFuture<ValidationResult> validation =
                CompletableFuture.supplyAsync(() -> consistencyValidator.validate(reportText, language), analysisExecutor);
        try {
            return new ReportAnalysis(detection.join(), validation.join());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
            throw new RadiologyReportException("Report analysis failed: " + e.getMessage(), e);
        }
    }

    /**
     * 补全骨架占位符所需的全部元数据，医生与医院取配置默认值，检查时间取当前时间
     */
    ReportMeta withDefaults(ReportMeta meta, String indication) {
        ReportMeta source = meta == null ? new ReportMeta() : meta;
        return source.toBuilder()
                .doctorName(StrUtil.blankToDefault(source.getDoctorName(), reportProperties.getDefaultDoctorName()))
                .hospitalName(StrUtil.blankToDefault(source.getHospitalName(), reportProperties.getDefaultHospitalName()))
                .studyDatetime(StrUtil.blankToDefault(source.getStudyDatetime(), LocalDateTime.now().format(STUDY_DATETIME_FORMAT)))
                .referrer(StrUtil.blankToDefault(source.getReferrer(), NO_REFERRER))
                .patientName(StrUtil.blankToDefault(source.getPatientName(), NO_PATIENT_NAME))
                .accession(StrUtil.blankToDefault(source.getAccession(), NO_ACCESSION))
                .indication(StrUtil.blankToDefault(source.getIndication(), indication))
                .build();
    }

    static String modalityOf(Template template) {
        if (StrUtil.isNotBlank(template.getCategory())) return template.getCategory();
        String title = StrUtil.nullToEmpty(template.getTitle()).toUpperCase(Locale.ROOT);
        return TITLE_MODALITIES.stream().filter(title::contains).findFirst().orElse(null);
    }

    private Long persist(Template template, ReportMeta meta, String indication, String report,
                         List<SimilarCase> similarCases, List<String> highlights, CriticalFindingsResult critical) {
        ReportRecord record = ReportRecord.builder()
                .templateId(template.getId())
                .templateTitle(template.getTitle())
                .patientName(meta.getPatientName())
                .accession(meta.getAccession())
                .doctorName(meta.getDoctorName())
                .hospitalName(meta.getHospitalName())
                .referrer(meta.getReferrer())
                .indication(indication)
                .generatedReport(report)
                .studyDatetime(meta.getStudyDatetime())
                .modality(modalityOf(template))
                .similarCasesUsed(similarCases)
                .highlights(highlights)
                .criticalFindings(critical)
                .createdAt(LocalDateTime.now())
                .build();
        try {
            Long id = reportStore.save(record);
            log.info("Report saved with id {}", id);
            return id;
        } catch (RuntimeException e) {
            log.error("Failed to save report: {}", e.getMessage(), e);
            return null;
        }
    }

    private void notifyReferrer(CriticalFindingsResult critical, ReportMeta meta, String report, Long reportId) {
        try {
            criticalFindingNotifier.notifyIfRequired(critical, meta, report, reportId)
                    .ifPresent(n -> log.info("Critical finding notification {} sent to {} (delivered={})",
                            n.getNotificationId(), n.getRecipient(), n.isDelivered()));
        } catch (RuntimeException e) {
            log.error("Failed to notify referrer for report {}: {}", reportId, e.getMessage(), e);
        }
    }
}
