package com.cleanbear.assignment.model;

/**
 * A location as the caller supplied it: either a coordinate pair or a free-form
 * address that still has to be geocoded. A coordinate wins when both are present.
 */
public final class LocationInput {

    public enum Kind { COORDINATE, ADDRESS, NONE }

    private static final LocationInput NONE = new LocationInput(Kind.NONE, null, null);

    private final Kind kind;
    private final Coordinate coordinate;
    private final String address;

    private LocationInput(Kind kind, Coordinate coordinate, String address) {
        this.kind = kind;
        this.coordinate = coordinate;
        this.address = address;
    }

    public static LocationInput of(Double lat, Double lng, String address) {
        if (lat != null && lng != null) {
            return new LocationInput(Kind.COORDINATE, new Coordinate(lat, lng), address);
        }
        if (address != null && !address.isBlank()) {
            return new LocationInput(Kind.ADDRESS, null, address.trim());
        }
        return NONE;
    }

    public static LocationInput none() {
        return NONE;
    }

    public Kind getKind() { return kind; }
    public Coordinate getCoordinate() { return coordinate; }
    public String getAddress() { return address; }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }
}
