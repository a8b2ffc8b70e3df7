package com.cymonides.grid.model;

public record TagResult(String tagId, String tagLabel, int count) {
}
