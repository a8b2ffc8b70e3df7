package com.cymonides.grid.model;

public record TagRef(String id, String name, String color) {
}
