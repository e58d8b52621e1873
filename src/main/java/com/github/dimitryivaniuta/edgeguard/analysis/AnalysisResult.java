package com.github.dimitryivaniuta.edgeguard.analysis;

public record AnalysisResult(String text, boolean cacheHit) {

    public String cacheStatus() {
        return cacheHit ? "HIT" : "MISS";
    }
}
