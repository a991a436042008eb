package com.gdin.radiology.report.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "gdin.radiology.report")
@Component
public class ReportProperties implements Serializable {
    private String defaultDoctorName = "Dr. John Doe";
    private String defaultHospitalName = "General Hospital";
    private String templateResource = "classpath:templates/radiology-templates.json";

    private Boolean cacheEnabled = true;
    private Duration cacheTtl = Duration.ofHours(1);

    // 危急值检测与一致性校验并行执行的线程数
    private Integer analysisPoolSize = 4;
}
