package com.netcourier.docqa.model;

import java.util.List;

public record BackendsResponse(List<BackendDescriptor> generation, String vectorIndex, String embeddingModel) {

    public record BackendDescriptor(String name, String kind, String model, boolean configured) {}
}
