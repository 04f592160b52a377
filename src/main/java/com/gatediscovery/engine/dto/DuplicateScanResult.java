package com.gatediscovery.engine.dto;

public record DuplicateScanResult(int pairsCompared, int suggestionsEmitted, int mergesApplied) {
}
