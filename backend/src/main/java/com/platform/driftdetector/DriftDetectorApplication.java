package com.platform.driftdetector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * IaC Drift Detector Application
 * 
 * Compares declared infrastructure (templates, plans) with observed live state and reports
 * every difference, classified by severity and compliance category.
 * 
 * Features:
 * - Terraform, CloudFormation, Kubernetes and generic record dialects
 * - Table-driven equivalence rules (defaults, sets, case, numeric tolerance)
 * - Table-driven severity classification
 * - Deterministic, timestamp-free reports
 */
@SpringBootApplication
public class DriftDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftDetectorApplication.class, args);
    }
}
