package com.example.tomograph.algorithm;

public class DegenerateMetricException extends TomographyException {

    public DegenerateMetricException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "DegenerateMetric";
    }
}
