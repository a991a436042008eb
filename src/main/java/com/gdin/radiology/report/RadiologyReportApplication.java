package com.gdin.radiology.report;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RadiologyReportApplication {
    public static void main(String[] args) {
        SpringApplication.run(RadiologyReportApplication.class, args);
    }
}
