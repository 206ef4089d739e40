package com.example.tomograph.dto;

public record RmseResponse(double rmse) {
}
