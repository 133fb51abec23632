package tech.noetzold.risk_assessment_api.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import tech.noetzold.risk_assessment_api.exception.AnalysisUnsupportedException;
import tech.noetzold.risk_assessment_api.exception.MissingFieldException;
import tech.noetzold.risk_assessment_api.exception.ScoringConfigurationException;
import tech.noetzold.risk_assessment_api.exception.UnknownDomainException;
import tech.noetzold.risk_assessment_api.model.AssessmentResult;
import tech.noetzold.risk_assessment_api.model.DomainSummary;
import tech.noetzold.risk_assessment_api.model.RiskLevel;
import tech.noetzold.risk_assessment_api.service.AssessmentService;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AssessmentController.class)
class AssessmentControllerTest {

    @Autowired MockMvc mvc;
    @MockBean AssessmentService service;

    private static final List<String> DOMAINS = List.of("heart_disease", "sepsis");

    private static AssessmentResult result() {
        return new AssessmentResult("heart_disease", 0.72, RiskLevel.HIGH, 0.66, List.of(),
                List.of("Seek immediate consultation with a healthcare professional"), null,
                "Based on the provided health information", null, null);
    }

    @Test
    void rootListsPredictors() throws Exception {
        when(service.listDomains()).thenReturn(List.of(
                new DomainSummary("heart_disease", "Heart Disease Risk Predictor", "", Map.of("age", "int")),
                new DomainSummary("sepsis", "Sepsis Risk Predictor", "", Map.of("heart_rate", "int"))));

        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_predictors").value(2))
                .andExpect(jsonPath("$.available_predictors[0]").value("heart_disease"));

        mvc.perform(get("/predictors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sepsis.required_fields.heart_rate").value("int"));
    }

    @Test
    void unknownPredictorFieldsIsNotFound() throws Exception {
        when(service.getSchema("nope")).thenThrow(new UnknownDomainException("nope", DOMAINS));

        mvc.perform(get("/predictor/nope/fields"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_DOMAIN"))
                .andExpect(jsonPath("$.message").value("Predictor 'nope' not found"));
    }

    @Test
    void predictReturnsResultWithTimestampAndDefaultsToAnalysis() throws Exception {
        when(service.assess(eq("heart_disease"), any(), anyBoolean())).thenReturn(result());

        mvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"predictor_type\":\"heart_disease\",\"data\":{\"age\":70}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.risk_level").value("High"))
                .andExpect(jsonPath("$.risk_score").value(0.72))
                .andExpect(jsonPath("$.timestamp").exists())
                .andExpect(jsonPath("$.analysis_error").doesNotExist());

        verify(service).assess("heart_disease", Map.of("age", 70), true);
    }

    @Test
    void inputErrorsAreBadRequests() throws Exception {
        when(service.assess(eq("heart_disease"), any(), anyBoolean())).thenThrow(new MissingFieldException("diabetes"));
        when(service.assess(eq("nope"), any(), anyBoolean())).thenThrow(new UnknownDomainException("nope", DOMAINS));

        mvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"predictor_type\":\"heart_disease\",\"data\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_FIELD"))
                .andExpect(jsonPath("$.field").value("diabetes"));

        mvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"predictor_type\":\"nope\",\"data\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_DOMAIN"));
    }

    @Test
    void blankPredictorTypeFailsValidation() throws Exception {
        mvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"predictor_type\":\"\",\"data\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.field").value("predictor_type"));

        mvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON).content("not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void analyzeUnsupportedDomainIsBadRequest() throws Exception {
        when(service.analyze(eq("parkinson"), any())).thenThrow(new AnalysisUnsupportedException("parkinson"));

        mvc.perform(post("/analyze").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"predictor_type\":\"parkinson\",\"data\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ANALYSIS_UNSUPPORTED"));
    }

    @Test
    void configurationDefectIsServerError() throws Exception {
        when(service.assess(eq("heart_disease"), any(), anyBoolean()))
                .thenThrow(new ScoringConfigurationException("Scoring strategy 'formula' produced NaN"));

        mvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"predictor_type\":\"heart_disease\",\"data\":{}}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("SCORING_CONFIGURATION"));
    }

    @Test
    void healthReportsLoadedPredictors() throws Exception {
        when(service.listDomains()).thenReturn(List.of());

        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.predictors_loaded").value(0));
    }
}
