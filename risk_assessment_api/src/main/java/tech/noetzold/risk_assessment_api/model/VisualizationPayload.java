package tech.noetzold.risk_assessment_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public record VisualizationPayload(
        Gauge risk_gauge,
        FactorBars risk_factors_chart,
        Radar health_metrics,
        PopulationComparison comparison_data
) {

    public record Gauge(double value, List<GaugeBand> ranges) {
        public Gauge {
            ranges = List.copyOf(ranges);
        }
    }

    public record GaugeBand(int from, int to, String color, String label) {}

    public record FactorBars(List<String> labels, List<Double> data, List<String> colors) {
        public FactorBars {
            labels = List.copyOf(labels);
            data = List.copyOf(data);
            colors = List.copyOf(colors);
        }
    }

    public record Radar(List<String> labels, List<Double> data, List<Double> normal_ranges, String chart_type) {
        public Radar {
            labels = List.copyOf(labels);
            data = List.copyOf(data);
            normal_ranges = List.copyOf(normal_ranges);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PopulationComparison(
            double user_risk,
            Double age_group_average,
            double population_average,
            String age_group
    ) {}
}
