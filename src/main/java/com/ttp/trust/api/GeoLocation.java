package com.ttp.trust.api;

public record GeoLocation(double latitude, double longitude) {
}
