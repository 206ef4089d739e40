package com.example.tomograph.algorithm;

// x indexes canvas rows, y indexes columns
public record Ray(int emitterX, int emitterY, int detectorX, int detectorY) {
}
