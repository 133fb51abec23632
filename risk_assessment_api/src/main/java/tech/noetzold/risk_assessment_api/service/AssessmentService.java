package tech.noetzold.risk_assessment_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.exception.UnknownDomainException;
import tech.noetzold.risk_assessment_api.model.AssessmentResult;
import tech.noetzold.risk_assessment_api.model.DetailedAnalysis;
import tech.noetzold.risk_assessment_api.model.DomainSchema;
import tech.noetzold.risk_assessment_api.model.DomainSummary;
import tech.noetzold.risk_assessment_api.repository.DomainRepository;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AssessmentService {

    private final DomainRepository domainRepository;
    private final AssessmentPipeline pipeline;

    public List<DomainSummary> listDomains() {
        return domainRepository.findAll().stream()
                .map(d -> new DomainSummary(d.getName(), d.getDisplayName(), d.getDescription(), d.getSchema().types()))
                .toList();
    }

    public DomainSchema getSchema(String domainName) {
        DomainDefinition domain = resolve(domainName);
        return new DomainSchema(domain.getName(), domain.getDisplayName(), domain.getDescription(),
                domain.getSchema().types(), domain.getSchema().descriptions(), domain.supportsFactorAnalysis());
    }

    public AssessmentResult assess(String domainName, Map<String, Object> record, boolean includeAnalysis) {
        DomainDefinition domain = resolve(domainName);
        log.info("Assessing {} (fields={}, includeAnalysis={})",
                domain.getName(), record == null ? 0 : record.size(), includeAnalysis);
        AssessmentResult result = pipeline.run(domain, record, includeAnalysis);
        log.info("Assessment {} -> {} ({})", domain.getName(), result.risk_level().label(),
                String.format("%.3f", result.risk_score()));
        return result;
    }

    public DetailedAnalysis analyze(String domainName, Map<String, Object> record) {
        DomainDefinition domain = resolve(domainName);
        log.info("Analyzing {}", domain.getName());
        return pipeline.analyze(domain, record);
    }

    private DomainDefinition resolve(String domainName) {
        return domainRepository.findByName(domainName)
                .orElseThrow(() -> new UnknownDomainException(domainName, domainRepository.names()));
    }
}
