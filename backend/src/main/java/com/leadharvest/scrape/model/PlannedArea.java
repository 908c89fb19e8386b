package com.leadharvest.scrape.model;

public record PlannedArea(int position, Area area, int pageBudget) {
}
