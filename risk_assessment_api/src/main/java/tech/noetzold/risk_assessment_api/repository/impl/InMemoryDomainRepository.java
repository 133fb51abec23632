package tech.noetzold.risk_assessment_api.repository.impl;

import lombok.extern.slf4j.Slf4j;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.repository.DomainRepository;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class InMemoryDomainRepository implements DomainRepository {

    private final Map<String, DomainDefinition> domains;

    public InMemoryDomainRepository(Collection<DomainDefinition> definitions) {
        Map<String, DomainDefinition> byName = new LinkedHashMap<>();
        for (DomainDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.getName(), definition) != null) {
                throw new IllegalStateException("Domain '" + definition.getName() + "' is registered twice");
            }
        }
        this.domains = Collections.unmodifiableMap(byName);
        log.info("Loaded {} risk predictors: {}", domains.size(), domains.keySet());
    }

    @Override
    public Optional<DomainDefinition> findByName(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(domains.get(name));
    }

    @Override
    public List<DomainDefinition> findAll() {
        return List.copyOf(domains.values());
    }

    @Override
    public List<String> names() {
        return List.copyOf(domains.keySet());
    }
}
