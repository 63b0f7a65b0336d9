package com.example.geotagger.model;

public final class Coordinates {

    private Coordinates() {
    }

    public static boolean isValidLatitude(double lat) {
        return lat >= -90 && lat <= 90;
    }

    public static boolean isValidLongitude(double lon) {
        return lon >= -180 && lon <= 180;
    }

    public static boolean isValid(double lat, double lon) {
        return isValidLatitude(lat) && isValidLongitude(lon);
    }
}
