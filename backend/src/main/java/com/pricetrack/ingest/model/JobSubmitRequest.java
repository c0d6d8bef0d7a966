package com.pricetrack.ingest.model;

public record JobSubmitRequest(String webCode) {
}
