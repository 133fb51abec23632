package tech.noetzold.risk_assessment_api.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import tech.noetzold.risk_assessment_api.exception.AnalysisUnsupportedException;
import tech.noetzold.risk_assessment_api.exception.AssessmentException;
import tech.noetzold.risk_assessment_api.exception.MissingFieldException;
import tech.noetzold.risk_assessment_api.exception.ScoringConfigurationException;
import tech.noetzold.risk_assessment_api.exception.TypeCoercionException;
import tech.noetzold.risk_assessment_api.exception.UnknownDomainException;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler({MissingFieldException.class, TypeCoercionException.class,
            UnknownDomainException.class, AnalysisUnsupportedException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInput(AssessmentException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return body(ex.code(), ex.getMessage(), ex.field());
    }

    @ExceptionHandler(ScoringConfigurationException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleConfiguration(ScoringConfigurationException ex) {
        log.error("Scoring configuration defect: {}", ex.getMessage(), ex);
        return body(ex.code(), ex.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidBody(MethodArgumentNotValidException ex) {
        String field = ex.getBindingResult().getFieldError() != null
                ? ex.getBindingResult().getFieldError().getField()
                : null;
        return body("INVALID_REQUEST", "Request body failed validation", field);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException ex) {
        return body("INVALID_REQUEST", "Request body is not valid JSON", null);
    }

    static Map<String, Object> body(String code, String message, String field) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        if (field != null) {
            body.put("field", field);
        }
        return body;
    }
}
