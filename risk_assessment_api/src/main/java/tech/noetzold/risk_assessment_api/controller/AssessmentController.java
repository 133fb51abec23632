package tech.noetzold.risk_assessment_api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.risk_assessment_api.config.RiskAssessmentInfo;
import tech.noetzold.risk_assessment_api.exception.UnknownDomainException;
import tech.noetzold.risk_assessment_api.model.*;
import tech.noetzold.risk_assessment_api.service.AssessmentService;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Assessment")
public class AssessmentController {

    private final AssessmentService assessmentService;

    @GetMapping("/")
    public Map<String, Object> root() {
        List<DomainSummary> domains = assessmentService.listDomains();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Welcome to the " + RiskAssessmentInfo.SERVICE_NAME);
        body.put("version", RiskAssessmentInfo.VERSION);
        body.put("available_predictors", domains.stream().map(DomainSummary::predictor_type).toList());
        body.put("total_predictors", domains.size());
        return body;
    }

    @GetMapping("/predictors")
    @Operation(summary = "List every assessment domain with its required fields")
    public Map<String, DomainSummary> predictors() {
        Map<String, DomainSummary> byName = new LinkedHashMap<>();
        assessmentService.listDomains().forEach(d -> byName.put(d.predictor_type(), d));
        return byName;
    }

    @GetMapping("/predictor/{type}/fields")
    @Operation(summary = "Input schema of one domain")
    public ResponseEntity<?> fields(@PathVariable("type") String type) {
        try {
            return ResponseEntity.ok(assessmentService.getSchema(type));
        } catch (UnknownDomainException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorHandler.body(e.code(), "Predictor '" + type + "' not found", null));
        }
    }

    @PostMapping("/predict")
    @Operation(summary = "Assess a record against one domain")
    public PredictionResponse predict(@Valid @RequestBody PredictRequest req) {
        AssessmentResult result = assessmentService.assess(req.predictor_type(), req.data(), req.includeAnalysis());
        return PredictionResponse.fromResult(result, Instant.now());
    }

    @PostMapping("/analyze")
    @Operation(summary = "Domain-specific factor analysis without scoring")
    public AnalysisResponse analyze(@Valid @RequestBody AnalyzeRequest req) {
        DetailedAnalysis analysis = assessmentService.analyze(req.predictor_type(), req.data());
        return new AnalysisResponse(req.predictor_type(), analysis, Instant.now().toString());
    }

    @GetMapping("/health")
    @Tag(name = "Health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now().toString());
        body.put("predictors_loaded", assessmentService.listDomains().size());
        return body;
    }
}
