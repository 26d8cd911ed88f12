package com.example.mediacatalog_backend.dto.web;

import java.util.List;
import java.util.Map;

public record ServiceInfoResponse(String name, String description, String version, String mediaStoreType,
                                  List<String> eventStreamMechanisms, List<String> eventTypes,
                                  Map<String, Boolean> capabilities) {
}
