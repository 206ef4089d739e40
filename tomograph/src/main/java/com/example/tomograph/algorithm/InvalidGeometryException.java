package com.example.tomograph.algorithm;

public class InvalidGeometryException extends TomographyException {

    public InvalidGeometryException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "InvalidGeometry";
    }
}
