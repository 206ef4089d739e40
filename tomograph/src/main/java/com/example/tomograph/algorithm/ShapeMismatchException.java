package com.example.tomograph.algorithm;

public class ShapeMismatchException extends TomographyException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "ShapeMismatch";
    }
}
