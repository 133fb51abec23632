package tech.noetzold.risk_assessment_api.domain.analysis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClinicalAnalysisHelpersTest {

    @Test
    void bloodPressureCategories() {
        assertThat(HypertensionAnalysis.category(115, 75)).isEqualTo("Normal");
        assertThat(HypertensionAnalysis.category(125, 75)).isEqualTo("Elevated");
        assertThat(HypertensionAnalysis.category(135, 85)).isEqualTo("Stage 1 Hypertension");
        assertThat(HypertensionAnalysis.category(118, 95)).isEqualTo("Stage 2 Hypertension");
    }

    @Test
    void bandPicksStrictlyAboveThresholds() {
        assertThat(ClinicalAnalysis.band(45, 45, 65, "low", "moderate", "high")).isEqualTo("low");
        assertThat(ClinicalAnalysis.band(46, 45, 65, "low", "moderate", "high")).isEqualTo("moderate");
        assertThat(ClinicalAnalysis.band(66, 45, 65, "low", "moderate", "high")).isEqualTo("high");
    }

    @Test
    void bmiCategories() {
        assertThat(ObesityAnalysis.bmiCategory(18.4)).isEqualTo("Underweight");
        assertThat(ObesityAnalysis.bmiCategory(24.9)).isEqualTo("Normal");
        assertThat(ObesityAnalysis.bmiCategory(25)).isEqualTo("Overweight");
        assertThat(ObesityAnalysis.bmiCategory(30)).isEqualTo("Obese");
    }

    @Test
    void sleepAdequacy() {
        assertThat(MentalHealthAnalysis.sleepAdequacy(5.5)).isEqualTo("Insufficient");
        assertThat(MentalHealthAnalysis.sleepAdequacy(6.5)).isEqualTo("Adequate");
        assertThat(MentalHealthAnalysis.sleepAdequacy(7.5)).isEqualTo("Optimal");
        assertThat(MentalHealthAnalysis.sleepAdequacy(10)).isEqualTo("Excessive");
    }
}
