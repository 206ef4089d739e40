package com.example.tomograph.dto;

public record ExperimentPoint(int value, double rmse) {
}
