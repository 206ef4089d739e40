package com.example.tomograph.algorithm;

public record RayPath(int[] xs, int[] ys) {

    public int length() {
        return xs.length;
    }

    public int x(int i) {
        return xs[i];
    }

    public int y(int i) {
        return ys[i];
    }
}
