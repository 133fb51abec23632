package tech.noetzold.risk_assessment_api.repository;

import tech.noetzold.risk_assessment_api.domain.DomainDefinition;

import java.util.List;
import java.util.Optional;

public interface DomainRepository {
    Optional<DomainDefinition> findByName(String name);

    List<DomainDefinition> findAll();

    List<String> names();
}
