package com.gdin.radiology.report.config;

import com.gdin.radiology.report.config.properties.ReportProperties;
import jakarta.annotation.Resource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipelineConfig {
    @Resource
    private ReportProperties reportProperties;

    /**
     * 报告分析线程池：危急值检测与一致性校验并行
     */
    @Bean(name = "analysisExecutor", destroyMethod = "shutdown")
    public ExecutorService analysisExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, reportProperties.getAnalysisPoolSize()));
    }
}
