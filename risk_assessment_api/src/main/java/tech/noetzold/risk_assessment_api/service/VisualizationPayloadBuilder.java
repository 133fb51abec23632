package tech.noetzold.risk_assessment_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.risk_assessment_api.domain.RadarAxis;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.model.TypedRecord;
import tech.noetzold.risk_assessment_api.model.VisualizationPayload;
import tech.noetzold.risk_assessment_api.model.VisualizationPayload.FactorBars;
import tech.noetzold.risk_assessment_api.model.VisualizationPayload.Gauge;
import tech.noetzold.risk_assessment_api.model.VisualizationPayload.GaugeBand;
import tech.noetzold.risk_assessment_api.model.VisualizationPayload.PopulationComparison;
import tech.noetzold.risk_assessment_api.model.VisualizationPayload.Radar;

import java.util.ArrayList;
import java.util.List;

@Component
public class VisualizationPayloadBuilder {

    public static final int CHARTED_FACTORS = 8;
    public static final double POPULATION_AVERAGE = 35.0;

    static final List<GaugeBand> GAUGE_BANDS = List.of(
            new GaugeBand(0, 20, "#22c55e", "Low Risk"),
            new GaugeBand(20, 40, "#84cc16", "Mild Risk"),
            new GaugeBand(40, 60, "#eab308", "Moderate Risk"),
            new GaugeBand(60, 80, "#f97316", "High Risk"),
            new GaugeBand(80, 100, "#ef4444", "Very High Risk"));

    private static final List<String> AGE_FIELDS = List.of("age", "maternal_age");

    public VisualizationPayload build(double score,
                                      List<ContributingFactor> factors,
                                      TypedRecord typed,
                                      List<RadarAxis> radarAxes) {
        return new VisualizationPayload(
                new Gauge(score * 100.0, GAUGE_BANDS),
                factorBars(factors),
                radar(typed, radarAxes),
                populationComparison(typed, score));
    }

    private FactorBars factorBars(List<ContributingFactor> factors) {
        List<String> labels = new ArrayList<>();
        List<Double> data = new ArrayList<>();
        List<String> colors = new ArrayList<>();
        factors.stream().limit(CHARTED_FACTORS).forEach(f -> {
            labels.add(f.factor());
            data.add(Math.min(100.0, f.contribution_score() * 100.0));
            colors.add(f.severity().color());
        });
        return new FactorBars(labels, data, colors);
    }

    private Radar radar(TypedRecord typed, List<RadarAxis> axes) {
        List<String> labels = new ArrayList<>();
        List<Double> data = new ArrayList<>();
        List<Double> normalRanges = new ArrayList<>();
        if (axes.isEmpty()) {
            // one axis per field from its normalized reading
            for (FieldSpec spec : typed.schema().fields()) {
                double normalized = spec.normalize(typed.get(spec.name()));
                labels.add(spec.name());
                data.add(Math.max(0.0, Math.min(100.0, normalized * 100.0)));
                normalRanges.add(50.0);
            }
        } else {
            for (RadarAxis axis : axes) {
                labels.add(axis.label());
                data.add(axis.valueFor(typed));
                normalRanges.add(axis.normalRange());
            }
        }
        return new Radar(labels, data, normalRanges, "radar");
    }

    // Age-group average follows a fixed reference curve so repeated calls stay identical.
    private PopulationComparison populationComparison(TypedRecord typed, double score) {
        for (String field : AGE_FIELDS) {
            if (typed.schema().contains(field)) {
                int age = (int) typed.number(field);
                int decade = (age / 10) * 10;
                double groupAverage = Math.max(10.0, Math.min(90.0, (age - 20) * 1.5));
                return new PopulationComparison(score * 100.0, groupAverage, POPULATION_AVERAGE,
                        decade + "-" + (decade + 9));
            }
        }
        return new PopulationComparison(score * 100.0, null, POPULATION_AVERAGE, null);
    }
}
