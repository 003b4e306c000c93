package com.onthegomap.geojts.examples;

/** Properties of an animal sighting. */
public record Animal(String name, int age) {}
