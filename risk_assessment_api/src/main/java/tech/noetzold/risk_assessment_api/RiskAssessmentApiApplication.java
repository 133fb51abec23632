package tech.noetzold.risk_assessment_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RiskAssessmentApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskAssessmentApiApplication.class, args);
    }
}
