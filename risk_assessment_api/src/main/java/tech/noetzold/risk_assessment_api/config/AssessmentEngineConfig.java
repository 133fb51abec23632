package tech.noetzold.risk_assessment_api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.risk_assessment_api.domain.CardiovascularDomains;
import tech.noetzold.risk_assessment_api.domain.ConditionDomains;
import tech.noetzold.risk_assessment_api.domain.DiseaseDomains;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.domain.LifestyleDomains;
import tech.noetzold.risk_assessment_api.domain.SpecializedDomains;
import tech.noetzold.risk_assessment_api.repository.DomainRepository;
import tech.noetzold.risk_assessment_api.repository.impl.InMemoryDomainRepository;
import tech.noetzold.risk_assessment_api.service.scoring.FallbackEstimator;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class AssessmentEngineConfig {

    @Value("${assessment.fallback.samples:1000}")
    private int fallbackSamples;

    @Value("${assessment.fallback.seed:42}")
    private long fallbackSeed;

    @Value("${assessment.fallback.iterations:300}")
    private int fallbackIterations;

    @Bean
    public FallbackEstimator fallbackEstimator() {
        return new FallbackEstimator(fallbackSamples, fallbackSeed, fallbackIterations);
    }

    @Bean
    public DomainRepository domainRepository() {
        return new InMemoryDomainRepository(allDomains());
    }

    public static List<DomainDefinition> allDomains() {
        List<DomainDefinition> domains = new ArrayList<>();
        domains.addAll(CardiovascularDomains.all());
        domains.addAll(DiseaseDomains.all());
        domains.addAll(ConditionDomains.all());
        domains.addAll(LifestyleDomains.all());
        domains.addAll(SpecializedDomains.all());
        return domains;
    }
}
